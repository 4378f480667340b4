package kr.jemi.zcassa.seal.application.port.out;

import java.util.Optional;

public interface DeviceLockPort {

    /**
     * 장치 락을 최대 waitMillis 동안 기다려 획득한다. 성공하면 해제에 쓸 소유 토큰을 돌려준다.
     */
    Optional<String> acquire(long waitMillis, long leaseMillis);

    void release(String ownerToken);
}
