package kr.jemi.zcassa.ticket.api;

public record TicketCancelledEvent(long actorId, long ticketId, String ticketCode, long eventId,
                                   String reasonCode, String note, boolean fiscallyRegistered) {
}
