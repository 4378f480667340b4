package kr.jemi.zcassa.ticket.application.service;

import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.ticket.api.TicketCancelledEvent;
import kr.jemi.zcassa.ticket.application.port.out.FiscalSealingPort;
import kr.jemi.zcassa.ticket.application.port.out.InventoryPort;
import kr.jemi.zcassa.ticket.application.port.out.QuotaPort;
import kr.jemi.zcassa.ticket.application.port.out.TicketPort;
import kr.jemi.zcassa.ticket.domain.CancellationReason;
import kr.jemi.zcassa.ticket.domain.CancellationResult;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 티켓 취소와 쿼터/좌석/매출 복원을 하나의 트랜잭션으로 기록한다.
 * 도메인 티켓에 취소를 적용한 뒤 조건부 UPDATE 로 저장하므로 동시 취소 중 하나만 반영된다.
 */
@Service
public class TicketCancellationWriter {

    private final TicketPort ticketPort;
    private final QuotaPort quotaPort;
    private final InventoryPort inventoryPort;
    private final FiscalSealingPort fiscalSealingPort;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    public TicketCancellationWriter(TicketPort ticketPort,
                                    QuotaPort quotaPort,
                                    InventoryPort inventoryPort,
                                    FiscalSealingPort fiscalSealingPort,
                                    ApplicationEventPublisher eventPublisher,
                                    PlatformTransactionManager transactionManager) {
        this.ticketPort = ticketPort;
        this.quotaPort = quotaPort;
        this.inventoryPort = inventoryPort;
        this.fiscalSealingPort = fiscalSealingPort;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public CancellationResult write(long ticketId, long cancelledBy, CancellationReason reason, String note,
                                    SealStamp seal) {
        return transactionTemplate.execute(tx -> {
            Optional<Ticket> found = ticketPort.findById(ticketId);
            if (found.isEmpty()) {
                return CancellationResult.failure(ErrorCode.TICKET_NOT_FOUND);
            }
            Ticket ticket = found.get();
            if (!ticket.isActive()) {
                return notCancellable(ticket.getStatus());
            }
            ticket.cancel(cancelledBy, reason, note, seal != null ? seal.sealId() : null, LocalDateTime.now());

            // 조회 이후 다른 요청이 먼저 취소했으면 0 행
            if (ticketPort.cancelIfActive(ticket) == 0) {
                tx.setRollbackOnly();
                return ticketPort.findById(ticketId)
                        .map(current -> notCancellable(current.getStatus()))
                        .orElseGet(() -> CancellationResult.failure(ErrorCode.TICKET_NOT_FOUND));
            }

            if (ticket.getAllocationId() != null) {
                quotaPort.releaseUnit(ticket.getAllocationId());
            }
            inventoryPort.recordCancelled(ticket.getEventId(), ticket.getPriceMinorUnits());
            inventoryPort.releaseSeat(ticket.getSectorId());

            if (seal != null) {
                fiscalSealingPort.bindToTicket(seal.sealId(), ticketId);
            }
            eventPublisher.publishEvent(new TicketCancelledEvent(cancelledBy, ticketId, ticket.getTicketCode(),
                    ticket.getEventId(), reason.code(), note, seal != null));
            return CancellationResult.success(ticket);
        });
    }

    private static CancellationResult notCancellable(TicketStatus status) {
        return status == TicketStatus.USED
                ? CancellationResult.failure(ErrorCode.TICKET_NOT_CANCELLABLE)
                : CancellationResult.failure(ErrorCode.ALREADY_CANCELLED);
    }
}
