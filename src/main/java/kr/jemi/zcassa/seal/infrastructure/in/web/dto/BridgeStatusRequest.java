package kr.jemi.zcassa.seal.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotNull;
import kr.jemi.zcassa.seal.domain.DeviceStatus;

import java.time.LocalDateTime;

public record BridgeStatusRequest(
        @NotNull Boolean connected,
        @NotNull Boolean cardInserted,
        @NotNull Boolean cardReady,
        String cardError,
        String serialNumber) {

    public DeviceStatus toDomain() {
        return new DeviceStatus(connected, cardInserted, cardReady, cardError, serialNumber, LocalDateTime.now());
    }
}
