package kr.jemi.zcassa.audit.infrastructure.in.event;

import kr.jemi.zcassa.allocation.api.AllocationChangedEvent;
import kr.jemi.zcassa.audit.application.port.in.RecordAuditUseCase;
import kr.jemi.zcassa.ticket.api.TicketCancellationFailedEvent;
import kr.jemi.zcassa.ticket.api.TicketCancelledEvent;
import kr.jemi.zcassa.ticket.api.TicketIssuanceFailedEvent;
import kr.jemi.zcassa.ticket.api.TicketIssuedEvent;
import kr.jemi.zcassa.ticket.api.TicketRangeCancelledEvent;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 커밋 이후 감사 로그를 남긴다. 실패해도 발권/취소 결과에는 영향을 주지 않는다.
 */
@Component
public class AuditEventListener {

    private static final String TICKET = "ticket";

    private final RecordAuditUseCase recordAuditUseCase;

    public AuditEventListener(RecordAuditUseCase recordAuditUseCase) {
        this.recordAuditUseCase = recordAuditUseCase;
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void on(TicketIssuedEvent event) {
        recordAuditUseCase.record(event.actorId(), "ticket_emitted", TICKET, event.ticketId(),
                "티켓 " + event.ticketCode() + " 발권, 진행번호 " + event.progressiveNumber()
                        + ", 금액 " + event.priceMinorUnits()
                        + (event.sealCode() != null ? ", 봉인 " + event.sealCode() : ", 봉인 생략"));
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void on(TicketCancelledEvent event) {
        recordAuditUseCase.record(event.actorId(), "ticket_cancelled", TICKET, event.ticketId(),
                "티켓 " + event.ticketCode() + " 취소, 사유 " + event.reasonCode()
                        + (event.note() != null ? ": " + event.note() : "")
                        + (event.fiscallyRegistered() ? " (취소 봉인 등록)" : " (봉인 생략)"));
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void on(TicketIssuanceFailedEvent event) {
        recordAuditUseCase.record(event.actorId(), "ticket_emission_failed", "ticketed_event", event.eventId(),
                event.errorCode() + ": " + event.message());
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void on(TicketCancellationFailedEvent event) {
        recordAuditUseCase.record(event.actorId(), "ticket_cancellation_failed", TICKET, event.ticketId(),
                event.errorCode() + ": " + event.message());
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void on(TicketRangeCancelledEvent event) {
        recordAuditUseCase.record(event.actorId(), "bulk_tickets_cancelled", "ticketed_event", event.eventId(),
                "진행번호 " + event.fromNumber() + "-" + event.toNumber() + " 구간 취소: "
                        + event.cancelledCount() + "건 취소, " + event.errorCount() + "건 오류");
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void on(AllocationChangedEvent event) {
        recordAuditUseCase.record(event.actorId(), event.action(), "cashier_allocation", event.allocationId(),
                event.description());
    }
}
