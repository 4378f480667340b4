package kr.jemi.zcassa.ticket.domain;

import kr.jemi.zcassa.common.exception.ErrorCode;

import java.util.List;

public record RangeCancellationResult(int cancelledCount, int totalInRange, List<Failure> errors) {

    public RangeCancellationResult {
        errors = List.copyOf(errors);
    }

    public record Failure(long ticketId, String ticketCode, ErrorCode errorCode, String message) {
    }
}
