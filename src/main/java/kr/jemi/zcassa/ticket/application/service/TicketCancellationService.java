package kr.jemi.zcassa.ticket.application.service;

import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.actor.ActorRole;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.ticket.api.TicketCancellationFailedEvent;
import kr.jemi.zcassa.ticket.api.TicketRangeCancelledEvent;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketRangeCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketRangeUseCase;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zcassa.ticket.application.port.out.FiscalSealingPort;
import kr.jemi.zcassa.ticket.application.port.out.InventoryPort;
import kr.jemi.zcassa.ticket.application.port.out.TicketPort;
import kr.jemi.zcassa.ticket.domain.CancellationReason;
import kr.jemi.zcassa.ticket.domain.CancellationResult;
import kr.jemi.zcassa.ticket.domain.DeviceReadiness;
import kr.jemi.zcassa.ticket.domain.EventSnapshot;
import kr.jemi.zcassa.ticket.domain.RangeCancellationResult;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.SealingFailedException;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class TicketCancellationService implements CancelTicketUseCase, CancelTicketRangeUseCase {

    private static final Logger log = LoggerFactory.getLogger(TicketCancellationService.class);

    private final TicketPort ticketPort;
    private final InventoryPort inventoryPort;
    private final FiscalSealingPort fiscalSealingPort;
    private final TicketCancellationWriter ticketCancellationWriter;
    private final ApplicationEventPublisher eventPublisher;

    public TicketCancellationService(TicketPort ticketPort,
                                     InventoryPort inventoryPort,
                                     FiscalSealingPort fiscalSealingPort,
                                     TicketCancellationWriter ticketCancellationWriter,
                                     ApplicationEventPublisher eventPublisher) {
        this.ticketPort = ticketPort;
        this.inventoryPort = inventoryPort;
        this.fiscalSealingPort = fiscalSealingPort;
        this.ticketCancellationWriter = ticketCancellationWriter;
        this.eventPublisher = eventPublisher;
    }

    @Override
    public CancellationResult cancel(CancelTicketCommand command) {
        CancellationResult result = cancelOne(command);
        if (!result.isSuccess()) {
            eventPublisher.publishEvent(new TicketCancellationFailedEvent(command.actor().actorId(),
                    command.ticketId(), result.errorCode().name(), result.message()));
        }
        return result;
    }

    @Override
    public RangeCancellationResult cancelRange(CancelTicketRangeCommand command) {
        Actor actor = command.actor();
        if (!actor.isManagerTier()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        if (CancellationReason.fromCode(command.reasonCode()).isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_REASON_CODE);
        }
        EventSnapshot event = inventoryPort.findEvent(command.eventId())
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        if (actor.role() != ActorRole.SUPER_ADMIN
                && event.companyId() != actor.companyId()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "다른 회사의 이벤트입니다");
        }

        List<Ticket> targets = ticketPort.findByEventAndProgressiveRange(command.eventId(),
                command.fromNumber(), command.toNumber(), TicketStatus.ACTIVE);
        int cancelled = 0;
        List<RangeCancellationResult.Failure> errors = new ArrayList<>();
        for (Ticket target : targets) {
            CancellationResult result = cancel(new CancelTicketCommand(actor, target.getId(),
                    command.reasonCode(), command.note(), command.skipFiscalSeal()));
            if (result.isSuccess()) {
                cancelled++;
            } else {
                errors.add(new RangeCancellationResult.Failure(target.getId(), target.getTicketCode(),
                        result.errorCode(), result.message()));
            }
        }

        log.info("구간 취소: eventId={}, {}~{}, {}/{} 취소, 오류 {}건", command.eventId(),
                command.fromNumber(), command.toNumber(), cancelled, targets.size(), errors.size());
        eventPublisher.publishEvent(new TicketRangeCancelledEvent(actor.actorId(), command.eventId(),
                command.fromNumber(), command.toNumber(), cancelled, errors.size()));
        return new RangeCancellationResult(cancelled, targets.size(), errors);
    }

    private CancellationResult cancelOne(CancelTicketCommand command) {
        Optional<CancellationReason> reason = CancellationReason.fromCode(command.reasonCode());
        if (reason.isEmpty()) {
            return CancellationResult.failure(ErrorCode.INVALID_REASON_CODE);
        }
        Optional<Ticket> found = ticketPort.findById(command.ticketId());
        if (found.isEmpty()) {
            return CancellationResult.failure(ErrorCode.TICKET_NOT_FOUND);
        }
        Ticket ticket = found.get();
        if (ticket.getStatus() == TicketStatus.CANCELLED) {
            return CancellationResult.failure(ErrorCode.ALREADY_CANCELLED);
        }
        if (ticket.getStatus() == TicketStatus.USED) {
            return CancellationResult.failure(ErrorCode.TICKET_NOT_CANCELLABLE);
        }
        if (!ticket.canBeCancelledBy(command.actor())) {
            return CancellationResult.failure(ErrorCode.UNAUTHORIZED,
                    "발권한 캐셔 또는 매니저만 취소할 수 있습니다");
        }

        boolean bypass = command.bypassesFiscalSeal();
        SealStamp seal = null;
        if (!bypass) {
            DeviceReadiness readiness = fiscalSealingPort.checkReadiness();
            if (!readiness.isReady()) {
                return CancellationResult.failure(readiness.errorCode(), readiness.message());
            }
            try {
                seal = fiscalSealingPort.sealCancellation(command.actor().actorId());
            } catch (SealingFailedException e) {
                log.warn("취소 봉인 실패: ticketCode={}, errorCode={}, cause={}",
                        ticket.getTicketCode(), e.getErrorCode(), e.getMessage());
                return CancellationResult.failure(e.getErrorCode(), e.getMessage());
            }
        } else {
            log.warn("봉인 없이 취소(관리자 우회): ticketCode={}, actorId={}",
                    ticket.getTicketCode(), command.actor().actorId());
        }

        CancellationResult result = ticketCancellationWriter.write(ticket.getId(), command.actor().actorId(),
                reason.get(), command.note(), seal);
        if (result.isSuccess()) {
            log.info("티켓 취소: ticketCode={}, reason={}", ticket.getTicketCode(), reason.get().code());
        } else if (seal != null) {
            log.warn("취소 봉인이 발급되었으나 티켓에 연결되지 않았습니다: sealCode={}, counter={}, 사유={}",
                    seal.sealCode(), seal.counter(), result.errorCode());
        }
        return result;
    }
}
