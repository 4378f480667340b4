package kr.jemi.zcassa.seal.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcassa.common.validation.SelfValidating;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 장치에서 발급받은 봉인 한 건. 장치 값은 불변이고, 티켓에는 최대 한 번만 연결된다.
 */
public class FiscalSeal implements SelfValidating {

    private final long id;
    private final long counter;
    @NotBlank
    private final String sealCode;
    private final String serialNumber;
    private final String mac;
    @NotNull
    private final LocalDateTime sealedAt;
    @Min(0)
    private final long priceMinorUnits;
    @NotNull
    private final SealPurpose purpose;
    private Long ticketId;
    private final long requestedBy;
    @NotNull
    private final LocalDateTime createdAt;

    public FiscalSeal(long id, long counter, String sealCode, String serialNumber, String mac,
                      LocalDateTime sealedAt, long priceMinorUnits, SealPurpose purpose, Long ticketId,
                      long requestedBy, LocalDateTime createdAt) {
        this.id = id;
        this.counter = counter;
        this.sealCode = sealCode;
        this.serialNumber = serialNumber;
        this.mac = mac;
        this.sealedAt = sealedAt;
        this.priceMinorUnits = priceMinorUnits;
        this.purpose = purpose;
        this.ticketId = ticketId;
        this.requestedBy = requestedBy;
        this.createdAt = createdAt;
        validateSelf();
    }

    public static FiscalSeal record(long id, DeviceSeal deviceSeal, long priceMinorUnits,
                                    SealPurpose purpose, long requestedBy) {
        return new FiscalSeal(id, deviceSeal.counter(), deviceSeal.sealCode(), deviceSeal.serialNumber(),
                deviceSeal.mac(), deviceSeal.sealedAt(), priceMinorUnits, purpose, null,
                requestedBy, LocalDateTime.now());
    }

    public void bindTo(long ticketId) {
        if (this.ticketId != null && this.ticketId != ticketId) {
            throw new IllegalStateException(
                    "봉인 " + sealCode + " 은 이미 티켓 " + this.ticketId + " 에 연결되어 있습니다");
        }
        this.ticketId = ticketId;
    }

    public boolean isBound() {
        return ticketId != null;
    }

    public long getId() {
        return id;
    }

    public long getCounter() {
        return counter;
    }

    public String getSealCode() {
        return sealCode;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public String getMac() {
        return mac;
    }

    public LocalDateTime getSealedAt() {
        return sealedAt;
    }

    public long getPriceMinorUnits() {
        return priceMinorUnits;
    }

    public SealPurpose getPurpose() {
        return purpose;
    }

    public Long getTicketId() {
        return ticketId;
    }

    public long getRequestedBy() {
        return requestedBy;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FiscalSeal that)) return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
