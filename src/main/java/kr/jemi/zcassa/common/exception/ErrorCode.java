package kr.jemi.zcassa.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    // 할당(쿼터)
    ALLOCATION_NOT_FOUND(403, "해당 이벤트에 대한 발권 할당이 없습니다"),
    ALLOCATION_EXISTS(409, "이미 해당 캐셔/이벤트에 대한 할당이 존재합니다"),
    QUOTA_BELOW_USED(400, "쿼터는 이미 발권된 수량보다 작을 수 없습니다"),
    QUOTA_IN_USE(409, "발권 이력이 있는 할당은 삭제할 수 없습니다. 비활성화하세요"),
    QUOTA_EXCEEDED(409, "발권 쿼터가 소진되었습니다"),
    SECTOR_NOT_ALLOWED(403, "할당된 섹터가 아닙니다"),

    // 이벤트/섹터
    EVENT_NOT_FOUND(404, "이벤트를 찾을 수 없습니다"),
    SECTOR_NOT_FOUND(404, "섹터를 찾을 수 없습니다"),
    NO_SEATS_AVAILABLE(409, "잔여 좌석이 없습니다"),

    // 봉인 장치
    SEAL_ERROR(503, "봉인 장치에서 봉인을 발급받지 못했습니다"),
    BRIDGE_NOT_CONNECTED(503, "봉인 장치 브리지가 연결되어 있지 않습니다"),
    CARD_NOT_READY(503, "봉인 카드가 준비되지 않았습니다"),

    // 티켓
    TICKET_NOT_FOUND(404, "티켓을 찾을 수 없습니다"),
    ALREADY_CANCELLED(409, "이미 취소된 티켓입니다"),
    TICKET_NOT_CANCELLABLE(409, "취소할 수 없는 상태의 티켓입니다"),
    INVALID_REASON_CODE(400, "유효하지 않은 취소 사유 코드입니다"),

    UNAUTHORIZED(403, "권한이 없습니다"),
    INVALID_REQUEST(400, "잘못된 요청입니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public boolean isSealFailure() {
        return this == SEAL_ERROR || this == BRIDGE_NOT_CONNECTED || this == CARD_NOT_READY;
    }
}
