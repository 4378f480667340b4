package kr.jemi.zcassa.ticket.api;

public record TicketRangeCancelledEvent(long actorId, long eventId, int fromNumber, int toNumber,
                                        int cancelledCount, int errorCount) {
}
