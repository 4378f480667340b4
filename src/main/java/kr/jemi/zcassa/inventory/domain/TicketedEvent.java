package kr.jemi.zcassa.inventory.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import kr.jemi.zcassa.common.validation.SelfValidating;

import java.time.LocalDateTime;

public class TicketedEvent implements SelfValidating {

    private final long id;
    private final long companyId;
    @NotBlank
    private final String eventCode;
    @Min(0)
    private int ticketsSold;
    @Min(0)
    private int ticketsCancelled;
    @Min(0)
    private long totalRevenue;
    private LocalDateTime updatedAt;

    public TicketedEvent(long id, long companyId, String eventCode, int ticketsSold,
                         int ticketsCancelled, long totalRevenue, LocalDateTime updatedAt) {
        this.id = id;
        this.companyId = companyId;
        this.eventCode = eventCode;
        this.ticketsSold = ticketsSold;
        this.ticketsCancelled = ticketsCancelled;
        this.totalRevenue = totalRevenue;
        this.updatedAt = updatedAt;
        validateSelf();
    }

    public static TicketedEvent open(long id, long companyId, String eventCode) {
        return new TicketedEvent(id, companyId, eventCode, 0, 0, 0L, LocalDateTime.now());
    }

    public int nextProgressiveNumber() {
        return ticketsSold + 1;
    }

    /**
     * 발권 반영. ticketsSold는 발급된 진행번호의 최댓값이므로 줄어들지 않는다.
     */
    public void recordIssued(int progressiveNumber, long price) {
        if (price < 0) {
            throw new IllegalArgumentException("가격은 음수일 수 없습니다: " + price);
        }
        this.ticketsSold = Math.max(ticketsSold, progressiveNumber);
        this.totalRevenue += price;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 취소 반영. 매출은 0 아래로 내려가지 않으며, 바닥에 걸리면 true를 반환한다.
     */
    public boolean recordCancelled(long price) {
        this.ticketsCancelled++;
        this.updatedAt = LocalDateTime.now();
        if (totalRevenue < price) {
            this.totalRevenue = 0;
            return true;
        }
        this.totalRevenue -= price;
        return false;
    }

    public long getId() {
        return id;
    }

    public long getCompanyId() {
        return companyId;
    }

    public String getEventCode() {
        return eventCode;
    }

    public int getTicketsSold() {
        return ticketsSold;
    }

    public int getTicketsCancelled() {
        return ticketsCancelled;
    }

    public long getTotalRevenue() {
        return totalRevenue;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
