package kr.jemi.zcassa.seal.application.port.out;

import kr.jemi.zcassa.seal.domain.DeviceStatus;

import java.util.Optional;

public interface DeviceStatusPort {

    void save(DeviceStatus status, long ttlSeconds);

    Optional<DeviceStatus> find();
}
