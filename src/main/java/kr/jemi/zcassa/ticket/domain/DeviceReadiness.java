package kr.jemi.zcassa.ticket.domain;

import kr.jemi.zcassa.common.exception.ErrorCode;

/**
 * 봉인 장치로 봉인을 받을 수 있는 상태인지. 준비되지 않았으면 원인 코드를 가진다.
 */
public record DeviceReadiness(ErrorCode errorCode, String message) {

    private static final DeviceReadiness READY = new DeviceReadiness(null, null);

    public static DeviceReadiness ready() {
        return READY;
    }

    public static DeviceReadiness notReady(ErrorCode errorCode, String message) {
        return new DeviceReadiness(errorCode, message != null ? message : errorCode.getMessage());
    }

    public boolean isReady() {
        return errorCode == null;
    }
}
