package kr.jemi.zcassa.ticket.application.service;

import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.ticket.api.TicketIssuanceFailedEvent;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketUseCase;
import kr.jemi.zcassa.ticket.application.port.out.FiscalSealingPort;
import kr.jemi.zcassa.ticket.application.port.out.InventoryPort;
import kr.jemi.zcassa.ticket.application.port.out.QuotaPort;
import kr.jemi.zcassa.ticket.application.service.TicketIssuanceWriter.IssuanceDraft;
import kr.jemi.zcassa.ticket.domain.AllocationSnapshot;
import kr.jemi.zcassa.ticket.domain.BatchIssuanceResult;
import kr.jemi.zcassa.ticket.domain.DeviceReadiness;
import kr.jemi.zcassa.ticket.domain.EventSnapshot;
import kr.jemi.zcassa.ticket.domain.IssuanceResult;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.SealingFailedException;
import kr.jemi.zcassa.ticket.domain.SectorSnapshot;
import kr.jemi.zcassa.ticket.domain.Ticket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 요청 수량만큼 한 장씩 순서대로 발권한다. 첫 실패에서 멈추고 그 전까지의 티켓은 유지한다.
 * 봉인 요청은 DB 트랜잭션 밖에서 이뤄진다.
 */
@Service
public class TicketIssuanceService implements IssueTicketUseCase {

    private static final Logger log = LoggerFactory.getLogger(TicketIssuanceService.class);

    private final QuotaPort quotaPort;
    private final InventoryPort inventoryPort;
    private final FiscalSealingPort fiscalSealingPort;
    private final TicketIssuanceWriter ticketIssuanceWriter;
    private final ApplicationEventPublisher eventPublisher;

    public TicketIssuanceService(QuotaPort quotaPort,
                                 InventoryPort inventoryPort,
                                 FiscalSealingPort fiscalSealingPort,
                                 TicketIssuanceWriter ticketIssuanceWriter,
                                 ApplicationEventPublisher eventPublisher) {
        this.quotaPort = quotaPort;
        this.inventoryPort = inventoryPort;
        this.fiscalSealingPort = fiscalSealingPort;
        this.ticketIssuanceWriter = ticketIssuanceWriter;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public BatchIssuanceResult issue(IssueTicketCommand command) {
        List<Ticket> tickets = new ArrayList<>();
        for (int i = 0; i < command.quantity(); i++) {
            IssuanceResult result;
            try {
                result = issueOne(command);
            } catch (RuntimeException e) {
                // 이미 커밋된 티켓이 있으면 예외 대신 부분 성공으로 돌려준다
                if (tickets.isEmpty()) {
                    throw e;
                }
                log.error("일괄 발권 중 예외: eventId={}, {}/{} 발권 후 중단",
                        command.eventId(), tickets.size(), command.quantity(), e);
                result = IssuanceResult.failure(ErrorCode.INTERNAL_ERROR);
            }
            if (!result.isSuccess()) {
                eventPublisher.publishEvent(new TicketIssuanceFailedEvent(command.actor().actorId(),
                        command.eventId(), result.errorCode().name(),
                        describeFailure(result, tickets.size(), command.quantity())));
                if (!tickets.isEmpty()) {
                    log.warn("일괄 발권 부분 성공: eventId={}, {}/{} 발권, 사유={}",
                            command.eventId(), tickets.size(), command.quantity(), result.errorCode());
                }
                return BatchIssuanceResult.stopped(command.quantity(), tickets, result);
            }
            tickets.add(result.ticket());
        }
        return BatchIssuanceResult.completed(command.quantity(), tickets);
    }

    IssuanceResult issueOne(IssueTicketCommand command) {
        long cashierId = command.actor().actorId();
        boolean bypass = command.bypassesFiscalSeal();

        if (!bypass) {
            DeviceReadiness readiness = fiscalSealingPort.checkReadiness();
            if (!readiness.isReady()) {
                return IssuanceResult.failure(readiness.errorCode(), readiness.message());
            }
        }

        Optional<EventSnapshot> event = inventoryPort.findEvent(command.eventId());
        if (event.isEmpty()) {
            return IssuanceResult.failure(ErrorCode.EVENT_NOT_FOUND);
        }
        Optional<AllocationSnapshot> allocation = quotaPort.findActive(cashierId, command.eventId());
        if (allocation.isEmpty()) {
            return IssuanceResult.failure(ErrorCode.ALLOCATION_NOT_FOUND);
        }

        Long sectorId = command.sectorId() != null ? command.sectorId() : allocation.get().sectorId();
        if (sectorId == null) {
            return IssuanceResult.failure(ErrorCode.INVALID_REQUEST, "섹터를 지정해야 합니다");
        }
        Optional<SectorSnapshot> sector = inventoryPort.findSector(sectorId)
                .filter(found -> found.eventId() == command.eventId());
        if (sector.isEmpty()) {
            return IssuanceResult.failure(ErrorCode.SECTOR_NOT_FOUND);
        }
        if (!allocation.get().authorizesSector(sectorId)) {
            return IssuanceResult.failure(ErrorCode.SECTOR_NOT_ALLOWED);
        }
        if (!sector.get().hasAvailableSeat()) {
            return IssuanceResult.failure(ErrorCode.NO_SEATS_AVAILABLE);
        }
        if (allocation.get().quotaRemaining() < 1) {
            return IssuanceResult.failure(ErrorCode.QUOTA_EXCEEDED);
        }

        long price = command.priceMinorUnits() != null
                ? command.priceMinorUnits()
                : sector.get().priceFor(command.ticketType());
        if (price < 0) {
            return IssuanceResult.failure(ErrorCode.INVALID_REQUEST, "가격은 음수일 수 없습니다");
        }

        SealStamp seal = null;
        if (!bypass) {
            try {
                seal = fiscalSealingPort.sealEmission(price, cashierId);
            } catch (SealingFailedException e) {
                log.warn("발권 봉인 실패: eventId={}, cashierId={}, errorCode={}, cause={}",
                        command.eventId(), cashierId, e.getErrorCode(), e.getMessage());
                return IssuanceResult.failure(e.getErrorCode(), e.getMessage());
            }
        } else {
            log.warn("봉인 없이 발권(관리자 우회): eventId={}, actorId={}", command.eventId(), cashierId);
        }

        IssuanceResult result = ticketIssuanceWriter.write(new IssuanceDraft(event.get(), sectorId,
                allocation.get().allocationId(), command.ticketType(), price, command.paymentMethod(),
                command.participant(), cashierId, seal));

        if (result.isSuccess()) {
            log.info("티켓 발권: ticketCode={}, progressiveNumber={}, price={}",
                    result.ticket().getTicketCode(), result.ticket().getProgressiveNumber(), price);
        } else if (seal != null) {
            log.warn("봉인이 발급되었으나 티켓에 연결되지 않았습니다: sealCode={}, counter={}, 사유={}",
                    seal.sealCode(), seal.counter(), result.errorCode());
        }
        return result;
    }

    private static String describeFailure(IssuanceResult result, int emitted, int requested) {
        return result.message() + " (" + emitted + "/" + requested + " 발권)";
    }
}
