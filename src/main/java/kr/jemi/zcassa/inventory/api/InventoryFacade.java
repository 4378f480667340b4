package kr.jemi.zcassa.inventory.api;

import java.util.Optional;

/**
 * 이벤트/섹터 집계 접근. lock/record/take/release 계열은 호출자의 트랜잭션 안에서만 호출한다.
 */
public interface InventoryFacade {

    Optional<EventInfo> findEvent(long eventId);

    Optional<SectorInfo> findSector(long sectorId);

    /**
     * 이벤트 행에 쓰기 락을 잡고 다음 진행번호를 돌려준다.
     */
    int lockNextProgressiveNumber(long eventId);

    void recordIssued(long eventId, int progressiveNumber, long price);

    void recordCancelled(long eventId, long price);

    boolean takeSeat(long sectorId);

    void releaseSeat(long sectorId);
}
