package kr.jemi.zcassa.allocation.application.port.out;

import kr.jemi.zcassa.allocation.domain.CashierAllocation;

import java.util.List;
import java.util.Optional;

public interface CashierAllocationPort {

    CashierAllocation insert(CashierAllocation allocation);

    void update(CashierAllocation allocation);

    void delete(long allocationId);

    Optional<CashierAllocation> findById(long allocationId);

    Optional<CashierAllocation> findByIdForUpdate(long allocationId);

    Optional<CashierAllocation> findByCashierAndEvent(long cashierId, long eventId);

    List<CashierAllocation> findByEventId(long eventId);
}
