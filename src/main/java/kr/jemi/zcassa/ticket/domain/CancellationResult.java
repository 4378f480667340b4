package kr.jemi.zcassa.ticket.domain;

import kr.jemi.zcassa.common.exception.ErrorCode;

public record CancellationResult(Ticket ticket, ErrorCode errorCode, String message) {

    public static CancellationResult success(Ticket ticket) {
        return new CancellationResult(ticket, null, null);
    }

    public static CancellationResult failure(ErrorCode errorCode) {
        return new CancellationResult(null, errorCode, errorCode.getMessage());
    }

    public static CancellationResult failure(ErrorCode errorCode, String message) {
        return new CancellationResult(null, errorCode, message);
    }

    public boolean isSuccess() {
        return ticket != null;
    }
}
