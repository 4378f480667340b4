package kr.jemi.zcassa.inventory.infrastructure.out.persistence;

import kr.jemi.zcassa.inventory.application.port.out.EventSectorPort;
import kr.jemi.zcassa.inventory.domain.EventSector;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class EventSectorJpaAdapter implements EventSectorPort {

    private final EventSectorJpaRepository repository;

    public EventSectorJpaAdapter(EventSectorJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public EventSector insert(EventSector sector) {
        return repository.save(EventSectorJpaEntity.fromDomain(sector)).toDomain();
    }

    @Override
    public void update(EventSector sector) {
        EventSectorJpaEntity entity = repository.findById(sector.getId())
                .orElseThrow(() -> new IllegalStateException("섹터를 찾을 수 없습니다: id=" + sector.getId()));
        entity.update(sector);
    }

    @Override
    public Optional<EventSector> findById(long sectorId) {
        return repository.findById(sectorId).map(EventSectorJpaEntity::toDomain);
    }

    @Override
    public Optional<EventSector> findByIdForUpdate(long sectorId) {
        return repository.findByIdForUpdate(sectorId).map(EventSectorJpaEntity::toDomain);
    }

    @Override
    public List<EventSector> findByEventId(long eventId) {
        return repository.findByEventIdOrderBySectorCode(eventId).stream()
                .map(EventSectorJpaEntity::toDomain)
                .toList();
    }
}
