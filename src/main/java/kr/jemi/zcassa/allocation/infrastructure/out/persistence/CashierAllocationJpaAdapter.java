package kr.jemi.zcassa.allocation.infrastructure.out.persistence;

import kr.jemi.zcassa.allocation.application.port.out.CashierAllocationPort;
import kr.jemi.zcassa.allocation.domain.CashierAllocation;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class CashierAllocationJpaAdapter implements CashierAllocationPort {

    private final CashierAllocationJpaRepository repository;

    public CashierAllocationJpaAdapter(CashierAllocationJpaRepository repository) {
        this.repository = repository;
    }

    // 유니크 제약 위반을 호출 지점에서 잡기 위해 즉시 flush
    @Override
    public CashierAllocation insert(CashierAllocation allocation) {
        return repository.saveAndFlush(CashierAllocationJpaEntity.fromDomain(allocation)).toDomain();
    }

    @Override
    public void update(CashierAllocation allocation) {
        CashierAllocationJpaEntity entity = repository.findById(allocation.getId())
                .orElseThrow(() -> new IllegalStateException("할당을 찾을 수 없습니다: id=" + allocation.getId()));
        entity.update(allocation);
    }

    @Override
    public void delete(long allocationId) {
        repository.deleteById(allocationId);
    }

    @Override
    public Optional<CashierAllocation> findById(long allocationId) {
        return repository.findById(allocationId).map(CashierAllocationJpaEntity::toDomain);
    }

    @Override
    public Optional<CashierAllocation> findByIdForUpdate(long allocationId) {
        return repository.findByIdForUpdate(allocationId).map(CashierAllocationJpaEntity::toDomain);
    }

    @Override
    public Optional<CashierAllocation> findByCashierAndEvent(long cashierId, long eventId) {
        return repository.findByCashierIdAndEventId(cashierId, eventId).map(CashierAllocationJpaEntity::toDomain);
    }

    @Override
    public List<CashierAllocation> findByEventId(long eventId) {
        return repository.findByEventIdOrderByCreatedAt(eventId).stream()
                .map(CashierAllocationJpaEntity::toDomain)
                .toList();
    }
}
