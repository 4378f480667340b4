package kr.jemi.zcassa.inventory.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import kr.jemi.zcassa.inventory.domain.EventSector;

import java.time.LocalDateTime;

@Entity
@Table(name = "event_sectors", indexes = @Index(name = "idx_sector_event", columnList = "eventId"))
public class EventSectorJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private long eventId;

    @Column(nullable = false, length = 2)
    private String sectorCode;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int capacity;

    @Column(nullable = false)
    private int availableSeats;

    @Column(nullable = false)
    private long priceFull;

    private Long priceReduced;

    @Column(nullable = false)
    private long priceComplimentary;

    private LocalDateTime updatedAt;

    protected EventSectorJpaEntity() {}

    public static EventSectorJpaEntity fromDomain(EventSector sector) {
        EventSectorJpaEntity entity = new EventSectorJpaEntity();
        entity.id = sector.getId();
        entity.eventId = sector.getEventId();
        entity.sectorCode = sector.getSectorCode();
        entity.name = sector.getName();
        entity.capacity = sector.getCapacity();
        entity.priceFull = sector.getPriceFull();
        entity.priceReduced = sector.getPriceReduced();
        entity.priceComplimentary = sector.getPriceComplimentary();
        entity.update(sector);
        return entity;
    }

    public EventSector toDomain() {
        return new EventSector(id, eventId, sectorCode, name, capacity, availableSeats,
                priceFull, priceReduced, priceComplimentary, updatedAt);
    }

    public void update(EventSector sector) {
        this.availableSeats = sector.getAvailableSeats();
        this.updatedAt = sector.getUpdatedAt();
    }
}
