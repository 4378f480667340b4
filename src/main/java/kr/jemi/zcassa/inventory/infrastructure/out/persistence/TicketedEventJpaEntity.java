package kr.jemi.zcassa.inventory.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import kr.jemi.zcassa.inventory.domain.TicketedEvent;

import java.time.LocalDateTime;

@Entity
@Table(name = "ticketed_events")
public class TicketedEventJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private long companyId;

    @Column(nullable = false, length = 50)
    private String eventCode;

    @Column(nullable = false)
    private int ticketsSold;

    @Column(nullable = false)
    private int ticketsCancelled;

    @Column(nullable = false)
    private long totalRevenue;

    private LocalDateTime updatedAt;

    protected TicketedEventJpaEntity() {}

    public static TicketedEventJpaEntity fromDomain(TicketedEvent event) {
        TicketedEventJpaEntity entity = new TicketedEventJpaEntity();
        entity.id = event.getId();
        entity.companyId = event.getCompanyId();
        entity.eventCode = event.getEventCode();
        entity.update(event);
        return entity;
    }

    public TicketedEvent toDomain() {
        return new TicketedEvent(id, companyId, eventCode, ticketsSold, ticketsCancelled, totalRevenue, updatedAt);
    }

    public void update(TicketedEvent event) {
        this.ticketsSold = event.getTicketsSold();
        this.ticketsCancelled = event.getTicketsCancelled();
        this.totalRevenue = event.getTotalRevenue();
        this.updatedAt = event.getUpdatedAt();
    }
}
