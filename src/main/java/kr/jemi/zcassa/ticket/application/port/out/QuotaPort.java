package kr.jemi.zcassa.ticket.application.port.out;

import kr.jemi.zcassa.ticket.domain.AllocationSnapshot;
import kr.jemi.zcassa.ticket.domain.QuotaClaim;

import java.util.Optional;

public interface QuotaPort {

    Optional<AllocationSnapshot> findActive(long cashierId, long eventId);

    /**
     * 할당 행에 락을 잡고 쿼터 1 단위를 사용한다. 트랜잭션 안에서만 호출한다.
     */
    QuotaClaim claimUnit(long allocationId);

    void releaseUnit(long allocationId);
}
