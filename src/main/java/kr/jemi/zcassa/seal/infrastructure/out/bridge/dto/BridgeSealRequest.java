package kr.jemi.zcassa.seal.infrastructure.out.bridge.dto;

public record BridgeSealRequest(long priceMinorUnits) {
}
