package kr.jemi.zcassa.ticket.api;

public record TicketCancellationFailedEvent(long actorId, long ticketId, String errorCode, String message) {
}
