package kr.jemi.zcassa.ticket.infrastructure.out.allocation;

import kr.jemi.zcassa.allocation.api.AllocationFacade;
import kr.jemi.zcassa.ticket.application.port.out.QuotaPort;
import kr.jemi.zcassa.ticket.domain.AllocationSnapshot;
import kr.jemi.zcassa.ticket.domain.QuotaClaim;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class QuotaAdapter implements QuotaPort {

    private final AllocationFacade allocationFacade;

    public QuotaAdapter(AllocationFacade allocationFacade) {
        this.allocationFacade = allocationFacade;
    }

    @Override
    public Optional<AllocationSnapshot> findActive(long cashierId, long eventId) {
        return allocationFacade.findActive(cashierId, eventId)
                .map(info -> new AllocationSnapshot(info.allocationId(), info.sectorId(), info.quotaRemaining()));
    }

    @Override
    public QuotaClaim claimUnit(long allocationId) {
        return switch (allocationFacade.reserveUnit(allocationId)) {
            case GRANTED -> QuotaClaim.GRANTED;
            case EXHAUSTED -> QuotaClaim.EXHAUSTED;
            case NOT_FOUND -> QuotaClaim.NOT_FOUND;
        };
    }

    @Override
    public void releaseUnit(long allocationId) {
        allocationFacade.releaseUnit(allocationId);
    }
}
