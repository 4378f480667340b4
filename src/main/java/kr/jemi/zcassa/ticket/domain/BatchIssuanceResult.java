package kr.jemi.zcassa.ticket.domain;

import kr.jemi.zcassa.common.exception.ErrorCode;

import java.util.List;

/**
 * 일괄 발권 결과. 첫 실패에서 멈추며, 그 전에 발권된 티켓은 그대로 유효하다.
 */
public record BatchIssuanceResult(int requestedCount, List<Ticket> tickets, ErrorCode errorCode, String message) {

    public BatchIssuanceResult {
        tickets = List.copyOf(tickets);
    }

    public static BatchIssuanceResult completed(int requestedCount, List<Ticket> tickets) {
        return new BatchIssuanceResult(requestedCount, tickets, null, null);
    }

    public static BatchIssuanceResult stopped(int requestedCount, List<Ticket> tickets, IssuanceResult failure) {
        return new BatchIssuanceResult(requestedCount, tickets, failure.errorCode(), failure.message());
    }

    public int emittedCount() {
        return tickets.size();
    }

    public boolean isComplete() {
        return errorCode == null;
    }

    public boolean isPartial() {
        return errorCode != null && !tickets.isEmpty();
    }

    public boolean isFailure() {
        return errorCode != null && tickets.isEmpty();
    }
}
