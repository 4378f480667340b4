package kr.jemi.zcassa.ticket.domain;

import kr.jemi.zcassa.common.exception.ErrorCode;

/**
 * 티켓 한 장 발권의 결과. 실패는 예외가 아닌 값으로 전달된다.
 */
public record IssuanceResult(Ticket ticket, ErrorCode errorCode, String message) {

    public static IssuanceResult success(Ticket ticket) {
        return new IssuanceResult(ticket, null, null);
    }

    public static IssuanceResult failure(ErrorCode errorCode) {
        return new IssuanceResult(null, errorCode, errorCode.getMessage());
    }

    public static IssuanceResult failure(ErrorCode errorCode, String message) {
        return new IssuanceResult(null, errorCode, message);
    }

    public boolean isSuccess() {
        return ticket != null;
    }
}
