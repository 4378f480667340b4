package kr.jemi.zcassa.ticket.domain;

public record EventSnapshot(long eventId, long companyId, String eventCode) {
}
