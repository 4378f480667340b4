package kr.jemi.zcassa.allocation.infrastructure.out.inventory;

import kr.jemi.zcassa.allocation.application.port.out.EventLookupPort;
import kr.jemi.zcassa.inventory.api.InventoryFacade;
import org.springframework.stereotype.Component;

@Component
public class EventLookupAdapter implements EventLookupPort {

    private final InventoryFacade inventoryFacade;

    public EventLookupAdapter(InventoryFacade inventoryFacade) {
        this.inventoryFacade = inventoryFacade;
    }

    @Override
    public boolean eventExists(long eventId) {
        return inventoryFacade.findEvent(eventId).isPresent();
    }

    @Override
    public boolean sectorBelongsTo(long sectorId, long eventId) {
        return inventoryFacade.findSector(sectorId)
                .map(sector -> sector.eventId() == eventId)
                .orElse(false);
    }
}
