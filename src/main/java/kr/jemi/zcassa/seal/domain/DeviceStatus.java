package kr.jemi.zcassa.seal.domain;

import java.time.LocalDateTime;

/**
 * 브리지가 마지막으로 보고한 봉인 장치 상태. 보고가 끊기면 캐시에서 만료된다.
 */
public record DeviceStatus(boolean connected, boolean cardInserted, boolean cardReady,
                           String cardError, String serialNumber, LocalDateTime reportedAt) {

    public static DeviceStatus disconnected() {
        return new DeviceStatus(false, false, false, null, null, null);
    }

    public boolean readyForSeal() {
        return connected && cardInserted && cardReady;
    }
}
