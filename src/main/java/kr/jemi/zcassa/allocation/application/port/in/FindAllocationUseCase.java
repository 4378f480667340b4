package kr.jemi.zcassa.allocation.application.port.in;

import kr.jemi.zcassa.allocation.domain.CashierAllocation;

import java.util.List;
import java.util.Optional;

public interface FindAllocationUseCase {

    Optional<CashierAllocation> find(long cashierId, long eventId);

    List<CashierAllocation> listByEvent(long eventId);
}
