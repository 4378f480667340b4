package kr.jemi.zcassa.seal.infrastructure.out.bridge.dto;

import java.time.LocalDateTime;

public record BridgeSealResponse(boolean success, String sealCode, String serialNumber, Long counter,
                                 String mac, LocalDateTime sealedAt, String errorCode, String error) {
}
