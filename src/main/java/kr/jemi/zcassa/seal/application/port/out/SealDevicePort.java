package kr.jemi.zcassa.seal.application.port.out;

import kr.jemi.zcassa.seal.domain.DeviceSeal;

public interface SealDevicePort {

    /**
     * @throws kr.jemi.zcassa.seal.api.SealException 장치 오류, 시간 초과
     */
    DeviceSeal seal(long priceMinorUnits);
}
