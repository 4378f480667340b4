package kr.jemi.zcassa.seal.domain;

import java.time.LocalDateTime;

/**
 * 장치가 돌려준 원본 봉인 값.
 */
public record DeviceSeal(long counter, String sealCode, String serialNumber, String mac, LocalDateTime sealedAt) {

    public DeviceSeal {
        if (sealCode == null || sealCode.isBlank()) {
            throw new IllegalArgumentException("봉인 코드가 비어 있습니다");
        }
    }
}
