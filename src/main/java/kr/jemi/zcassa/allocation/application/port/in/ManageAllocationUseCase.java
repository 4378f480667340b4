package kr.jemi.zcassa.allocation.application.port.in;

import kr.jemi.zcassa.allocation.domain.CashierAllocation;

public interface ManageAllocationUseCase {

    CashierAllocation resize(long actorId, long allocationId, int newQuota);

    CashierAllocation changeActive(long actorId, long allocationId, boolean active);

    void revoke(long actorId, long allocationId);
}
