package kr.jemi.zcassa.ticket.infrastructure.out.inventory;

import kr.jemi.zcassa.inventory.api.InventoryFacade;
import kr.jemi.zcassa.ticket.application.port.out.InventoryPort;
import kr.jemi.zcassa.ticket.domain.EventSnapshot;
import kr.jemi.zcassa.ticket.domain.SectorSnapshot;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class InventoryAdapter implements InventoryPort {

    private final InventoryFacade inventoryFacade;

    public InventoryAdapter(InventoryFacade inventoryFacade) {
        this.inventoryFacade = inventoryFacade;
    }

    @Override
    public Optional<EventSnapshot> findEvent(long eventId) {
        return inventoryFacade.findEvent(eventId)
                .map(event -> new EventSnapshot(event.eventId(), event.companyId(), event.eventCode()));
    }

    @Override
    public Optional<SectorSnapshot> findSector(long sectorId) {
        return inventoryFacade.findSector(sectorId)
                .map(sector -> new SectorSnapshot(sector.sectorId(), sector.eventId(), sector.availableSeats(),
                        sector.priceFull(), sector.priceReduced(), sector.priceComplimentary()));
    }

    @Override
    public int lockNextProgressiveNumber(long eventId) {
        return inventoryFacade.lockNextProgressiveNumber(eventId);
    }

    @Override
    public void recordIssued(long eventId, int progressiveNumber, long priceMinorUnits) {
        inventoryFacade.recordIssued(eventId, progressiveNumber, priceMinorUnits);
    }

    @Override
    public void recordCancelled(long eventId, long priceMinorUnits) {
        inventoryFacade.recordCancelled(eventId, priceMinorUnits);
    }

    @Override
    public boolean takeSeat(long sectorId) {
        return inventoryFacade.takeSeat(sectorId);
    }

    @Override
    public void releaseSeat(long sectorId) {
        inventoryFacade.releaseSeat(sectorId);
    }
}
