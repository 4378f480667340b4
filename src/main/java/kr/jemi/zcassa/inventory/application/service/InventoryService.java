package kr.jemi.zcassa.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.inventory.api.EventInfo;
import kr.jemi.zcassa.inventory.api.InventoryFacade;
import kr.jemi.zcassa.inventory.api.SectorInfo;
import kr.jemi.zcassa.inventory.application.port.in.RegisterEventUseCase;
import kr.jemi.zcassa.inventory.application.port.out.EventSectorPort;
import kr.jemi.zcassa.inventory.application.port.out.TicketedEventPort;
import kr.jemi.zcassa.inventory.domain.EventSector;
import kr.jemi.zcassa.inventory.domain.TicketedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class InventoryService implements RegisterEventUseCase, InventoryFacade {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final TicketedEventPort ticketedEventPort;
    private final EventSectorPort eventSectorPort;
    private final TSID.Factory tsidFactory;

    public InventoryService(TicketedEventPort ticketedEventPort,
                            EventSectorPort eventSectorPort,
                            TSID.Factory tsidFactory) {
        this.ticketedEventPort = ticketedEventPort;
        this.eventSectorPort = eventSectorPort;
        this.tsidFactory = tsidFactory;
    }

    @Override
    @Transactional
    public TicketedEvent register(long companyId, String eventCode, List<SectorSpec> sectors) {
        if (sectors == null || sectors.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "섹터가 최소 1개 필요합니다");
        }
        TicketedEvent event = ticketedEventPort.insert(
                TicketedEvent.open(tsidFactory.generate().toLong(), companyId, eventCode));
        for (SectorSpec spec : sectors) {
            eventSectorPort.insert(EventSector.open(tsidFactory.generate().toLong(), event.getId(),
                    spec.sectorCode(), spec.name(), spec.capacity(),
                    spec.priceFull(), spec.priceReduced(), spec.priceComplimentary()));
        }
        return event;
    }

    @Override
    public List<EventSector> getSectors(long eventId) {
        return eventSectorPort.findByEventId(eventId);
    }

    @Override
    public Optional<EventInfo> findEvent(long eventId) {
        return ticketedEventPort.findById(eventId).map(InventoryService::toInfo);
    }

    @Override
    public Optional<SectorInfo> findSector(long sectorId) {
        return eventSectorPort.findById(sectorId).map(InventoryService::toInfo);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public int lockNextProgressiveNumber(long eventId) {
        return lockEvent(eventId).nextProgressiveNumber();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordIssued(long eventId, int progressiveNumber, long price) {
        TicketedEvent event = lockEvent(eventId);
        event.recordIssued(progressiveNumber, price);
        ticketedEventPort.update(event);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordCancelled(long eventId, long price) {
        TicketedEvent event = lockEvent(eventId);
        long before = event.getTotalRevenue();
        if (event.recordCancelled(price)) {
            log.warn("매출 집계 불일치 보정: eventId={}, totalRevenue={}, 취소 금액={}", eventId, before, price);
        }
        ticketedEventPort.update(event);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean takeSeat(long sectorId) {
        EventSector sector = lockSector(sectorId);
        if (!sector.takeSeat()) {
            return false;
        }
        eventSectorPort.update(sector);
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void releaseSeat(long sectorId) {
        EventSector sector = lockSector(sectorId);
        if (!sector.releaseSeat()) {
            log.warn("좌석 집계 불일치 보정: sectorId={} 잔여 좌석이 이미 수용 인원({})과 같습니다",
                    sectorId, sector.getCapacity());
            return;
        }
        eventSectorPort.update(sector);
    }

    private TicketedEvent lockEvent(long eventId) {
        return ticketedEventPort.findByIdForUpdate(eventId)
                .orElseThrow(() -> new IllegalStateException("이벤트 없음: " + eventId));
    }

    private EventSector lockSector(long sectorId) {
        return eventSectorPort.findByIdForUpdate(sectorId)
                .orElseThrow(() -> new IllegalStateException("섹터 없음: " + sectorId));
    }

    private static EventInfo toInfo(TicketedEvent event) {
        return new EventInfo(event.getId(), event.getCompanyId(), event.getEventCode(),
                event.getTicketsSold(), event.getTicketsCancelled(), event.getTotalRevenue());
    }

    private static SectorInfo toInfo(EventSector sector) {
        return new SectorInfo(sector.getId(), sector.getEventId(), sector.getSectorCode(), sector.getName(),
                sector.getCapacity(), sector.getAvailableSeats(),
                sector.getPriceFull(), sector.getPriceReduced(), sector.getPriceComplimentary());
    }
}
