package kr.jemi.zcassa.inventory.application.port.in;

import kr.jemi.zcassa.inventory.domain.EventSector;
import kr.jemi.zcassa.inventory.domain.TicketedEvent;

import java.util.List;

public interface RegisterEventUseCase {

    TicketedEvent register(long companyId, String eventCode, List<SectorSpec> sectors);

    List<EventSector> getSectors(long eventId);

    record SectorSpec(String sectorCode, String name, int capacity,
                      long priceFull, Long priceReduced, long priceComplimentary) {
    }
}
