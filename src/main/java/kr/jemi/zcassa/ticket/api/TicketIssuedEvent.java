package kr.jemi.zcassa.ticket.api;

public record TicketIssuedEvent(long actorId, long ticketId, String ticketCode, long eventId,
                                int progressiveNumber, long priceMinorUnits, String sealCode) {
}
