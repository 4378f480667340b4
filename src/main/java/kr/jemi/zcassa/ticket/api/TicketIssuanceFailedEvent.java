package kr.jemi.zcassa.ticket.api;

public record TicketIssuanceFailedEvent(long actorId, long eventId, String errorCode, String message) {
}
