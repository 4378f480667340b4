package kr.jemi.zcassa.allocation.infrastructure.in.web.dto;

import kr.jemi.zcassa.allocation.domain.CashierAllocation;

public record AllocationResponse(long id, long eventId, long cashierId, Long sectorId,
                                 int quotaQuantity, int quotaUsed, int quotaRemaining, boolean active) {

    public static AllocationResponse from(CashierAllocation allocation) {
        return new AllocationResponse(allocation.getId(), allocation.getEventId(), allocation.getCashierId(),
                allocation.getSectorId(), allocation.getQuotaQuantity(), allocation.getQuotaUsed(),
                allocation.quotaRemaining(), allocation.isActive());
    }
}
