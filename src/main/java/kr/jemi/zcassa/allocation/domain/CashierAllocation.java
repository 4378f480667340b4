package kr.jemi.zcassa.allocation.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcassa.common.validation.SelfValidating;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 캐셔 한 명이 한 이벤트(선택적으로 한 섹터)에 대해 발권할 수 있는 쿼터.
 * 항상 {@code 0 <= quotaUsed <= quotaQuantity} 를 만족한다.
 */
public class CashierAllocation implements SelfValidating {

    private final long id;
    private final long companyId;
    private final long eventId;
    private final long cashierId;
    private final Long sectorId;
    @Min(0)
    private int quotaQuantity;
    @Min(0)
    private int quotaUsed;
    private boolean active;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;

    public CashierAllocation(long id, long companyId, long eventId, long cashierId, Long sectorId,
                             int quotaQuantity, int quotaUsed, boolean active,
                             LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.companyId = companyId;
        this.eventId = eventId;
        this.cashierId = cashierId;
        this.sectorId = sectorId;
        this.quotaQuantity = quotaQuantity;
        this.quotaUsed = quotaUsed;
        this.active = active;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        validateSelf();
        if (quotaUsed > quotaQuantity) {
            throw new IllegalArgumentException(
                    "사용량이 쿼터를 초과할 수 없습니다: " + quotaUsed + " > " + quotaQuantity);
        }
    }

    public static CashierAllocation grant(long id, long companyId, long eventId, long cashierId,
                                          Long sectorId, int quotaQuantity) {
        LocalDateTime now = LocalDateTime.now();
        return new CashierAllocation(id, companyId, eventId, cashierId, sectorId,
                quotaQuantity, 0, true, now, now);
    }

    public boolean authorizesSector(long requestedSectorId) {
        return sectorId == null || sectorId == requestedSectorId;
    }

    public boolean isSectorRestricted() {
        return sectorId != null;
    }

    public int quotaRemaining() {
        return quotaQuantity - quotaUsed;
    }

    public boolean hasRemainingQuota() {
        return quotaUsed < quotaQuantity;
    }

    public boolean canResizeTo(int newQuota) {
        return newQuota >= quotaUsed;
    }

    public void resize(int newQuota) {
        if (!canResizeTo(newQuota)) {
            throw new IllegalStateException(
                    "쿼터는 사용량보다 작을 수 없습니다: " + newQuota + " < " + quotaUsed);
        }
        this.quotaQuantity = newQuota;
        touch();
    }

    public void consumeUnit() {
        if (!active || !hasRemainingQuota()) {
            throw new IllegalStateException(
                    "쿼터를 사용할 수 없습니다: active=" + active + ", used=" + quotaUsed + "/" + quotaQuantity);
        }
        this.quotaUsed++;
        touch();
    }

    /**
     * 사용량을 1 줄인다. 이미 0이면 반영하지 않고 false를 반환한다.
     */
    public boolean releaseUnit() {
        if (quotaUsed == 0) {
            return false;
        }
        this.quotaUsed--;
        touch();
        return true;
    }

    public void changeActive(boolean active) {
        this.active = active;
        touch();
    }

    public boolean isRevocable() {
        return quotaUsed == 0;
    }

    private void touch() {
        this.updatedAt = LocalDateTime.now();
    }

    public long getId() {
        return id;
    }

    public long getCompanyId() {
        return companyId;
    }

    public long getEventId() {
        return eventId;
    }

    public long getCashierId() {
        return cashierId;
    }

    public Long getSectorId() {
        return sectorId;
    }

    public int getQuotaQuantity() {
        return quotaQuantity;
    }

    public int getQuotaUsed() {
        return quotaUsed;
    }

    public boolean isActive() {
        return active;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CashierAllocation that)) return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
