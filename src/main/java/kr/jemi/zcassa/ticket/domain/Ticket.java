package kr.jemi.zcassa.ticket.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.validation.SelfValidating;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;

public class Ticket implements SelfValidating {

    private final long id;
    private final long eventId;
    private final long sectorId;
    private final Long allocationId;
    @NotBlank
    private final String ticketCode;
    @Min(1)
    private final int progressiveNumber;
    @NotNull
    private final TicketType ticketType;
    @Min(0)
    private final long priceMinorUnits;
    @NotNull
    private final PaymentMethod paymentMethod;
    private final Participant participant;
    @NotNull
    private TicketStatus status;
    private final long issuedBy;
    private final SealStamp seal;
    @NotNull
    private final LocalDateTime issuedAt;
    private LocalDateTime cancelledAt;
    private Long cancelledBy;
    private CancellationReason cancellationReason;
    private String cancellationNote;
    private Long cancellationSealId;

    public Ticket(long id, long eventId, long sectorId, Long allocationId, String ticketCode,
                  int progressiveNumber, TicketType ticketType, long priceMinorUnits,
                  PaymentMethod paymentMethod, Participant participant, TicketStatus status,
                  long issuedBy, SealStamp seal, LocalDateTime issuedAt,
                  LocalDateTime cancelledAt, Long cancelledBy, CancellationReason cancellationReason,
                  String cancellationNote, Long cancellationSealId) {
        this.id = id;
        this.eventId = eventId;
        this.sectorId = sectorId;
        this.allocationId = allocationId;
        this.ticketCode = ticketCode;
        this.progressiveNumber = progressiveNumber;
        this.ticketType = ticketType;
        this.priceMinorUnits = priceMinorUnits;
        this.paymentMethod = paymentMethod;
        this.participant = participant;
        this.status = status;
        this.issuedBy = issuedBy;
        this.seal = seal;
        this.issuedAt = issuedAt;
        this.cancelledAt = cancelledAt;
        this.cancelledBy = cancelledBy;
        this.cancellationReason = cancellationReason;
        this.cancellationNote = cancellationNote;
        this.cancellationSealId = cancellationSealId;
        validateSelf();
    }

    /**
     * 진행번호가 정해진 시점에 ACTIVE 티켓을 만든다. 봉인은 관리자 우회 발권에서만 비어 있다.
     */
    public static Ticket issue(long id, EventSnapshot event, long sectorId, Long allocationId,
                               int progressiveNumber, TicketType ticketType, long priceMinorUnits,
                               PaymentMethod paymentMethod, Participant participant,
                               long issuedBy, SealStamp seal) {
        return new Ticket(id, event.eventId(), sectorId, allocationId,
                ticketCode(event.eventCode(), id, seal), progressiveNumber, ticketType, priceMinorUnits,
                paymentMethod, participant, TicketStatus.ACTIVE, issuedBy, seal, LocalDateTime.now(),
                null, null, null, null, null);
    }

    static String ticketCode(String eventCode, long id, SealStamp seal) {
        String code = eventCode + "-" + Long.toString(id, 36).toUpperCase(Locale.ROOT);
        return seal != null ? code + "-" + seal.counter() : code;
    }

    /**
     * 발권한 본인 또는 매니저 이상만 취소할 수 있다.
     */
    public boolean canBeCancelledBy(Actor actor) {
        return actor.isManagerTier() || issuedBy == actor.actorId();
    }

    public boolean isActive() {
        return status == TicketStatus.ACTIVE;
    }

    public void cancel(long cancelledBy, CancellationReason reason, String note,
                       Long cancellationSealId, LocalDateTime cancelledAt) {
        if (status != TicketStatus.ACTIVE) {
            throw new IllegalStateException("ACTIVE 상태에서만 취소할 수 있습니다. 현재: " + status);
        }
        this.status = TicketStatus.CANCELLED;
        this.cancelledBy = cancelledBy;
        this.cancellationReason = reason;
        this.cancellationNote = note;
        this.cancellationSealId = cancellationSealId;
        this.cancelledAt = cancelledAt;
    }

    public long getId() {
        return id;
    }

    public long getEventId() {
        return eventId;
    }

    public long getSectorId() {
        return sectorId;
    }

    public Long getAllocationId() {
        return allocationId;
    }

    public String getTicketCode() {
        return ticketCode;
    }

    public int getProgressiveNumber() {
        return progressiveNumber;
    }

    public TicketType getTicketType() {
        return ticketType;
    }

    public long getPriceMinorUnits() {
        return priceMinorUnits;
    }

    public PaymentMethod getPaymentMethod() {
        return paymentMethod;
    }

    public Participant getParticipant() {
        return participant;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public long getIssuedBy() {
        return issuedBy;
    }

    public SealStamp getSeal() {
        return seal;
    }

    public LocalDateTime getIssuedAt() {
        return issuedAt;
    }

    public LocalDateTime getCancelledAt() {
        return cancelledAt;
    }

    public Long getCancelledBy() {
        return cancelledBy;
    }

    public CancellationReason getCancellationReason() {
        return cancellationReason;
    }

    public String getCancellationNote() {
        return cancellationNote;
    }

    public Long getCancellationSealId() {
        return cancellationSealId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ticket that)) return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
