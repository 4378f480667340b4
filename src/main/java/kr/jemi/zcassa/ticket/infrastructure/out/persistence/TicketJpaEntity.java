package kr.jemi.zcassa.ticket.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import kr.jemi.zcassa.ticket.domain.CancellationReason;
import kr.jemi.zcassa.ticket.domain.Participant;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import kr.jemi.zcassa.ticket.domain.TicketType;

import java.time.LocalDateTime;

@Entity
@Table(name = "tickets",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_ticket_event_progressive", columnNames = {"eventId", "progressiveNumber"}),
                @UniqueConstraint(name = "uk_ticket_code", columnNames = "ticketCode")
        },
        indexes = @Index(name = "idx_ticket_sector_status", columnList = "sectorId, status"))
public class TicketJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private long eventId;

    @Column(nullable = false)
    private long sectorId;

    private Long allocationId;

    @Column(nullable = false, length = 80)
    private String ticketCode;

    @Column(nullable = false)
    private int progressiveNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TicketType ticketType;

    @Column(nullable = false)
    private long priceMinorUnits;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    private String participantFirstName;

    private String participantLastName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TicketStatus status;

    @Column(nullable = false)
    private long issuedBy;

    private Long fiscalSealId;

    @Column(length = 16)
    private String fiscalSealCode;

    private Long fiscalSealCounter;

    @Column(nullable = false)
    private LocalDateTime issuedAt;

    private LocalDateTime cancelledAt;

    private Long cancelledBy;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private CancellationReason cancellationReason;

    @Column(length = 500)
    private String cancellationNote;

    private Long cancellationSealId;

    protected TicketJpaEntity() {}

    public static TicketJpaEntity fromDomain(Ticket ticket) {
        TicketJpaEntity entity = new TicketJpaEntity();
        entity.id = ticket.getId();
        entity.eventId = ticket.getEventId();
        entity.sectorId = ticket.getSectorId();
        entity.allocationId = ticket.getAllocationId();
        entity.ticketCode = ticket.getTicketCode();
        entity.progressiveNumber = ticket.getProgressiveNumber();
        entity.ticketType = ticket.getTicketType();
        entity.priceMinorUnits = ticket.getPriceMinorUnits();
        entity.paymentMethod = ticket.getPaymentMethod();
        if (ticket.getParticipant() != null) {
            entity.participantFirstName = ticket.getParticipant().firstName();
            entity.participantLastName = ticket.getParticipant().lastName();
        }
        entity.status = ticket.getStatus();
        entity.issuedBy = ticket.getIssuedBy();
        if (ticket.getSeal() != null) {
            entity.fiscalSealId = ticket.getSeal().sealId();
            entity.fiscalSealCode = ticket.getSeal().sealCode();
            entity.fiscalSealCounter = ticket.getSeal().counter();
        }
        entity.issuedAt = ticket.getIssuedAt();
        entity.cancelledAt = ticket.getCancelledAt();
        entity.cancelledBy = ticket.getCancelledBy();
        entity.cancellationReason = ticket.getCancellationReason();
        entity.cancellationNote = ticket.getCancellationNote();
        entity.cancellationSealId = ticket.getCancellationSealId();
        return entity;
    }

    public Ticket toDomain() {
        SealStamp seal = fiscalSealId != null
                ? new SealStamp(fiscalSealId, fiscalSealCode, fiscalSealCounter)
                : null;
        return new Ticket(id, eventId, sectorId, allocationId, ticketCode, progressiveNumber, ticketType,
                priceMinorUnits, paymentMethod, Participant.ofNullable(participantFirstName, participantLastName),
                status, issuedBy, seal, issuedAt, cancelledAt, cancelledBy, cancellationReason,
                cancellationNote, cancellationSealId);
    }
}
