package kr.jemi.zcassa.ticket.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.ticket.api.TicketIssuedEvent;
import kr.jemi.zcassa.ticket.application.port.out.FiscalSealingPort;
import kr.jemi.zcassa.ticket.application.port.out.InventoryPort;
import kr.jemi.zcassa.ticket.application.port.out.QuotaPort;
import kr.jemi.zcassa.ticket.application.port.out.TicketPort;
import kr.jemi.zcassa.ticket.domain.EventSnapshot;
import kr.jemi.zcassa.ticket.domain.IssuanceResult;
import kr.jemi.zcassa.ticket.domain.Participant;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.QuotaClaim;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketType;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 봉인을 받은 뒤 티켓 한 장을 하나의 트랜잭션으로 기록한다.
 * 락 순서는 할당, 이벤트, 섹터 순으로 고정한다.
 */
@Service
public class TicketIssuanceWriter {

    private final QuotaPort quotaPort;
    private final InventoryPort inventoryPort;
    private final TicketPort ticketPort;
    private final FiscalSealingPort fiscalSealingPort;
    private final ApplicationEventPublisher eventPublisher;
    private final TSID.Factory tsidFactory;
    private final TransactionTemplate transactionTemplate;

    public TicketIssuanceWriter(QuotaPort quotaPort,
                                InventoryPort inventoryPort,
                                TicketPort ticketPort,
                                FiscalSealingPort fiscalSealingPort,
                                ApplicationEventPublisher eventPublisher,
                                TSID.Factory tsidFactory,
                                PlatformTransactionManager transactionManager) {
        this.quotaPort = quotaPort;
        this.inventoryPort = inventoryPort;
        this.ticketPort = ticketPort;
        this.fiscalSealingPort = fiscalSealingPort;
        this.eventPublisher = eventPublisher;
        this.tsidFactory = tsidFactory;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public IssuanceResult write(IssuanceDraft draft) {
        return transactionTemplate.execute(tx -> {
            QuotaClaim claim = quotaPort.claimUnit(draft.allocationId());
            if (claim != QuotaClaim.GRANTED) {
                tx.setRollbackOnly();
                return claim == QuotaClaim.EXHAUSTED
                        ? IssuanceResult.failure(ErrorCode.QUOTA_EXCEEDED)
                        : IssuanceResult.failure(ErrorCode.ALLOCATION_NOT_FOUND);
            }

            int progressiveNumber = inventoryPort.lockNextProgressiveNumber(draft.event().eventId());
            Ticket ticket = ticketPort.insert(Ticket.issue(tsidFactory.generate().toLong(), draft.event(),
                    draft.sectorId(), draft.allocationId(), progressiveNumber, draft.ticketType(),
                    draft.priceMinorUnits(), draft.paymentMethod(), draft.participant(),
                    draft.issuedBy(), draft.seal()));
            inventoryPort.recordIssued(draft.event().eventId(), progressiveNumber, draft.priceMinorUnits());

            if (!inventoryPort.takeSeat(draft.sectorId())) {
                tx.setRollbackOnly();
                return IssuanceResult.failure(ErrorCode.NO_SEATS_AVAILABLE);
            }

            if (draft.seal() != null) {
                fiscalSealingPort.bindToTicket(draft.seal().sealId(), ticket.getId());
            }
            eventPublisher.publishEvent(new TicketIssuedEvent(draft.issuedBy(), ticket.getId(),
                    ticket.getTicketCode(), ticket.getEventId(), progressiveNumber, ticket.getPriceMinorUnits(),
                    draft.seal() != null ? draft.seal().sealCode() : null));
            return IssuanceResult.success(ticket);
        });
    }

    public record IssuanceDraft(EventSnapshot event, long sectorId, long allocationId, TicketType ticketType,
                                long priceMinorUnits, PaymentMethod paymentMethod, Participant participant,
                                long issuedBy, SealStamp seal) {
    }
}
