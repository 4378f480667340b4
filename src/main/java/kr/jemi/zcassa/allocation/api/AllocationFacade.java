package kr.jemi.zcassa.allocation.api;

import java.util.Optional;

public interface AllocationFacade {

    Optional<AllocationInfo> findActive(long cashierId, long eventId);

    /**
     * 할당 행에 쓰기 락을 잡은 뒤 쿼터를 재확인하고 1 단위를 사용한다.
     * 호출자의 트랜잭션 안에서만 호출할 수 있다.
     */
    QuotaReservation reserveUnit(long allocationId);

    /**
     * 사용량을 1 줄인다(0 미만으로 내려가지 않음). 호출자의 트랜잭션 안에서만 호출할 수 있다.
     */
    void releaseUnit(long allocationId);
}
