package kr.jemi.zcassa.seal.infrastructure.in.web.dto;

import kr.jemi.zcassa.seal.domain.DeviceStatus;

import java.time.LocalDateTime;

public record BridgeStatusResponse(boolean connected, boolean cardInserted, boolean cardReady,
                                   boolean readyForSeal, String cardError, String serialNumber,
                                   LocalDateTime reportedAt) {

    public static BridgeStatusResponse from(DeviceStatus status) {
        return new BridgeStatusResponse(status.connected(), status.cardInserted(), status.cardReady(),
                status.readyForSeal(), status.cardError(), status.serialNumber(), status.reportedAt());
    }
}
