package kr.jemi.zcassa.allocation.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zcassa.allocation.api.AllocationChangedEvent;
import kr.jemi.zcassa.allocation.api.AllocationFacade;
import kr.jemi.zcassa.allocation.api.AllocationInfo;
import kr.jemi.zcassa.allocation.api.QuotaReservation;
import kr.jemi.zcassa.allocation.application.port.in.FindAllocationUseCase;
import kr.jemi.zcassa.allocation.application.port.in.GrantAllocationCommand;
import kr.jemi.zcassa.allocation.application.port.in.GrantAllocationUseCase;
import kr.jemi.zcassa.allocation.application.port.in.ManageAllocationUseCase;
import kr.jemi.zcassa.allocation.application.port.out.CashierAllocationPort;
import kr.jemi.zcassa.allocation.application.port.out.EventLookupPort;
import kr.jemi.zcassa.allocation.domain.CashierAllocation;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class AllocationService implements GrantAllocationUseCase, ManageAllocationUseCase,
        FindAllocationUseCase, AllocationFacade {

    private static final Logger log = LoggerFactory.getLogger(AllocationService.class);

    private final CashierAllocationPort allocationPort;
    private final EventLookupPort eventLookupPort;
    private final ApplicationEventPublisher eventPublisher;
    private final TSID.Factory tsidFactory;

    public AllocationService(CashierAllocationPort allocationPort,
                             EventLookupPort eventLookupPort,
                             ApplicationEventPublisher eventPublisher,
                             TSID.Factory tsidFactory) {
        this.allocationPort = allocationPort;
        this.eventLookupPort = eventLookupPort;
        this.eventPublisher = eventPublisher;
        this.tsidFactory = tsidFactory;
    }

    @Override
    @Transactional
    public CashierAllocation grant(GrantAllocationCommand command) {
        if (!eventLookupPort.eventExists(command.eventId())) {
            throw new BusinessException(ErrorCode.EVENT_NOT_FOUND);
        }
        if (command.sectorId() != null
                && !eventLookupPort.sectorBelongsTo(command.sectorId(), command.eventId())) {
            throw new BusinessException(ErrorCode.SECTOR_NOT_FOUND);
        }
        if (allocationPort.findByCashierAndEvent(command.cashierId(), command.eventId()).isPresent()) {
            throw new BusinessException(ErrorCode.ALLOCATION_EXISTS);
        }

        CashierAllocation allocation = CashierAllocation.grant(tsidFactory.generate().toLong(),
                command.companyId(), command.eventId(), command.cashierId(),
                command.sectorId(), command.quotaQuantity());
        try {
            allocation = allocationPort.insert(allocation);
        } catch (DataIntegrityViolationException e) {
            // 동시 요청으로 (cashierId, eventId) 유니크 제약에 걸린 경우
            throw new BusinessException(ErrorCode.ALLOCATION_EXISTS);
        }

        eventPublisher.publishEvent(new AllocationChangedEvent(command.actorId(), AllocationChangedEvent.CREATED,
                allocation.getId(), "캐셔 " + command.cashierId() + " 이벤트 " + command.eventId()
                        + " 할당, 쿼터 " + command.quotaQuantity()));
        return allocation;
    }

    @Override
    @Transactional
    public CashierAllocation resize(long actorId, long allocationId, int newQuota) {
        if (newQuota < 0) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "쿼터는 음수일 수 없습니다");
        }
        CashierAllocation allocation = lock(allocationId);
        if (!allocation.canResizeTo(newQuota)) {
            throw new BusinessException(ErrorCode.QUOTA_BELOW_USED,
                    "쿼터는 이미 발권된 수량(" + allocation.getQuotaUsed() + ")보다 작을 수 없습니다");
        }
        int before = allocation.getQuotaQuantity();
        allocation.resize(newQuota);
        allocationPort.update(allocation);

        eventPublisher.publishEvent(new AllocationChangedEvent(actorId, AllocationChangedEvent.UPDATED,
                allocationId, "쿼터 변경 " + before + " → " + newQuota));
        return allocation;
    }

    @Override
    @Transactional
    public CashierAllocation changeActive(long actorId, long allocationId, boolean active) {
        CashierAllocation allocation = lock(allocationId);
        allocation.changeActive(active);
        allocationPort.update(allocation);

        eventPublisher.publishEvent(new AllocationChangedEvent(actorId, AllocationChangedEvent.UPDATED,
                allocationId, active ? "할당 활성화" : "할당 비활성화"));
        return allocation;
    }

    @Override
    @Transactional
    public void revoke(long actorId, long allocationId) {
        CashierAllocation allocation = lock(allocationId);
        if (!allocation.isRevocable()) {
            throw new BusinessException(ErrorCode.QUOTA_IN_USE,
                    "발권 이력(" + allocation.getQuotaUsed() + ")이 있는 할당은 삭제할 수 없습니다. 비활성화하세요");
        }
        allocationPort.delete(allocationId);

        eventPublisher.publishEvent(new AllocationChangedEvent(actorId, AllocationChangedEvent.DELETED,
                allocationId, "할당 삭제"));
    }

    @Override
    public Optional<CashierAllocation> find(long cashierId, long eventId) {
        return allocationPort.findByCashierAndEvent(cashierId, eventId);
    }

    @Override
    public List<CashierAllocation> listByEvent(long eventId) {
        return allocationPort.findByEventId(eventId);
    }

    @Override
    public Optional<AllocationInfo> findActive(long cashierId, long eventId) {
        return allocationPort.findByCashierAndEvent(cashierId, eventId)
                .filter(CashierAllocation::isActive)
                .map(AllocationService::toInfo);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public QuotaReservation reserveUnit(long allocationId) {
        Optional<CashierAllocation> locked = allocationPort.findByIdForUpdate(allocationId);
        if (locked.isEmpty() || !locked.get().isActive()) {
            return QuotaReservation.NOT_FOUND;
        }
        CashierAllocation allocation = locked.get();
        if (!allocation.hasRemainingQuota()) {
            return QuotaReservation.EXHAUSTED;
        }
        allocation.consumeUnit();
        allocationPort.update(allocation);
        return QuotaReservation.GRANTED;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void releaseUnit(long allocationId) {
        Optional<CashierAllocation> locked = allocationPort.findByIdForUpdate(allocationId);
        if (locked.isEmpty()) {
            log.warn("취소 티켓의 할당이 존재하지 않아 쿼터를 복원하지 않습니다: allocationId={}", allocationId);
            return;
        }
        CashierAllocation allocation = locked.get();
        if (!allocation.releaseUnit()) {
            log.warn("쿼터 사용량 불일치 보정: allocationId={} 사용량이 이미 0입니다", allocationId);
            return;
        }
        allocationPort.update(allocation);
    }

    private CashierAllocation lock(long allocationId) {
        return allocationPort.findByIdForUpdate(allocationId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ALLOCATION_NOT_FOUND));
    }

    private static AllocationInfo toInfo(CashierAllocation allocation) {
        return new AllocationInfo(allocation.getId(), allocation.getCashierId(), allocation.getEventId(),
                allocation.getSectorId(), allocation.getQuotaQuantity(), allocation.getQuotaUsed(),
                allocation.isActive());
    }
}
