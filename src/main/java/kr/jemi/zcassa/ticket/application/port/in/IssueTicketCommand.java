package kr.jemi.zcassa.ticket.application.port.in;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.validation.SelfValidating;
import kr.jemi.zcassa.ticket.domain.Participant;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.TicketType;

public record IssueTicketCommand(
        @NotNull Actor actor,
        long eventId,
        Long sectorId,
        @NotNull TicketType ticketType,
        @Min(0) Long priceMinorUnits,
        int quantity,
        @NotNull PaymentMethod paymentMethod,
        Participant participant,
        boolean skipFiscalSeal) implements SelfValidating {

    public static final int MIN_QUANTITY = 1;
    public static final int MAX_QUANTITY = 50;

    public IssueTicketCommand(Actor actor, long eventId, Long sectorId, TicketType ticketType,
                              Long priceMinorUnits, int quantity, PaymentMethod paymentMethod,
                              Participant participant, boolean skipFiscalSeal) {
        this.actor = actor;
        this.eventId = eventId;
        this.sectorId = sectorId;
        this.ticketType = ticketType;
        this.priceMinorUnits = priceMinorUnits;
        this.quantity = Math.max(MIN_QUANTITY, Math.min(MAX_QUANTITY, quantity));
        this.paymentMethod = paymentMethod;
        // 참가자 정보는 단건 발권에서만 유지한다
        this.participant = this.quantity == 1 ? participant : null;
        this.skipFiscalSeal = skipFiscalSeal;
        validateSelf();
    }

    public boolean bypassesFiscalSeal() {
        return actor.bypassesFiscalSeal(skipFiscalSeal);
    }
}
