package kr.jemi.zcassa.seal.application.port.in;

import kr.jemi.zcassa.seal.domain.DeviceStatus;

public interface ReportDeviceStatusUseCase {

    void report(DeviceStatus status);

    DeviceStatus current();
}
