package kr.jemi.zcassa.allocation.application.port.in;

import jakarta.validation.constraints.Min;
import kr.jemi.zcassa.common.validation.SelfValidating;

public record GrantAllocationCommand(long actorId, long companyId, long eventId, long cashierId,
                                     Long sectorId, @Min(0) int quotaQuantity) implements SelfValidating {

    public GrantAllocationCommand(long actorId, long companyId, long eventId, long cashierId,
                                  Long sectorId, int quotaQuantity) {
        this.actorId = actorId;
        this.companyId = companyId;
        this.eventId = eventId;
        this.cashierId = cashierId;
        this.sectorId = sectorId;
        this.quotaQuantity = quotaQuantity;
        validateSelf();
    }
}
