package kr.jemi.zcassa.seal.api;

import kr.jemi.zcassa.common.exception.ErrorCode;

public enum SealFailure {
    BRIDGE_NOT_CONNECTED(ErrorCode.BRIDGE_NOT_CONNECTED),
    CARD_NOT_READY(ErrorCode.CARD_NOT_READY),
    DEVICE_BUSY(ErrorCode.SEAL_ERROR),
    DEVICE_ERROR(ErrorCode.SEAL_ERROR);

    private final ErrorCode errorCode;

    SealFailure(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
