package kr.jemi.zcassa.allocation.application.port.in;

import kr.jemi.zcassa.allocation.domain.CashierAllocation;

public interface GrantAllocationUseCase {

    CashierAllocation grant(GrantAllocationCommand command);
}
