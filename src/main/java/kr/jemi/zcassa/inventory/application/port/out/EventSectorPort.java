package kr.jemi.zcassa.inventory.application.port.out;

import kr.jemi.zcassa.inventory.domain.EventSector;

import java.util.List;
import java.util.Optional;

public interface EventSectorPort {

    EventSector insert(EventSector sector);

    void update(EventSector sector);

    Optional<EventSector> findById(long sectorId);

    Optional<EventSector> findByIdForUpdate(long sectorId);

    List<EventSector> findByEventId(long eventId);
}
