package kr.jemi.zcassa.ticket.application.port.out;

import kr.jemi.zcassa.ticket.domain.EventSnapshot;
import kr.jemi.zcassa.ticket.domain.SectorSnapshot;

import java.util.Optional;

public interface InventoryPort {

    Optional<EventSnapshot> findEvent(long eventId);

    Optional<SectorSnapshot> findSector(long sectorId);

    int lockNextProgressiveNumber(long eventId);

    void recordIssued(long eventId, int progressiveNumber, long priceMinorUnits);

    void recordCancelled(long eventId, long priceMinorUnits);

    boolean takeSeat(long sectorId);

    void releaseSeat(long sectorId);
}
