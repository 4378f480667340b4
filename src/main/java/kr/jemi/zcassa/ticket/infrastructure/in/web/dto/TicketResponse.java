package kr.jemi.zcassa.ticket.infrastructure.in.web.dto;

import kr.jemi.zcassa.ticket.domain.Ticket;

import java.time.LocalDateTime;

public record TicketResponse(long id, String ticketCode, long eventId, long sectorId, int progressiveNumber,
                             String ticketType, long priceMinorUnits, String paymentMethod, String status,
                             String participantFirstName, String participantLastName,
                             String fiscalSealCode, Long fiscalSealCounter, long issuedBy, LocalDateTime issuedAt,
                             LocalDateTime cancelledAt, String cancellationReasonCode) {

    public static TicketResponse from(Ticket ticket) {
        return new TicketResponse(ticket.getId(), ticket.getTicketCode(), ticket.getEventId(), ticket.getSectorId(),
                ticket.getProgressiveNumber(), ticket.getTicketType().name(), ticket.getPriceMinorUnits(),
                ticket.getPaymentMethod().name(), ticket.getStatus().name(),
                ticket.getParticipant() != null ? ticket.getParticipant().firstName() : null,
                ticket.getParticipant() != null ? ticket.getParticipant().lastName() : null,
                ticket.getSeal() != null ? ticket.getSeal().sealCode() : null,
                ticket.getSeal() != null ? ticket.getSeal().counter() : null,
                ticket.getIssuedBy(), ticket.getIssuedAt(), ticket.getCancelledAt(),
                ticket.getCancellationReason() != null ? ticket.getCancellationReason().code() : null);
    }
}
