package kr.jemi.zcassa.allocation.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import kr.jemi.zcassa.allocation.domain.CashierAllocation;

import java.time.LocalDateTime;

@Entity
@Table(name = "cashier_allocations",
        uniqueConstraints = @UniqueConstraint(name = "uk_allocation_cashier_event",
                columnNames = {"cashierId", "eventId"}),
        indexes = @Index(name = "idx_allocation_event", columnList = "eventId"))
public class CashierAllocationJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private long companyId;

    @Column(nullable = false)
    private long eventId;

    @Column(nullable = false)
    private long cashierId;

    private Long sectorId;

    @Column(nullable = false)
    private int quotaQuantity;

    @Column(nullable = false)
    private int quotaUsed;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    protected CashierAllocationJpaEntity() {}

    public static CashierAllocationJpaEntity fromDomain(CashierAllocation allocation) {
        CashierAllocationJpaEntity entity = new CashierAllocationJpaEntity();
        entity.id = allocation.getId();
        entity.companyId = allocation.getCompanyId();
        entity.eventId = allocation.getEventId();
        entity.cashierId = allocation.getCashierId();
        entity.sectorId = allocation.getSectorId();
        entity.createdAt = allocation.getCreatedAt();
        entity.update(allocation);
        return entity;
    }

    public CashierAllocation toDomain() {
        return new CashierAllocation(id, companyId, eventId, cashierId, sectorId,
                quotaQuantity, quotaUsed, active, createdAt, updatedAt);
    }

    public void update(CashierAllocation allocation) {
        this.quotaQuantity = allocation.getQuotaQuantity();
        this.quotaUsed = allocation.getQuotaUsed();
        this.active = allocation.isActive();
        this.updatedAt = allocation.getUpdatedAt();
    }
}
