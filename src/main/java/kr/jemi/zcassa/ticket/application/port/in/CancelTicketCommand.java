package kr.jemi.zcassa.ticket.application.port.in;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.validation.SelfValidating;

public record CancelTicketCommand(
        @NotNull Actor actor,
        long ticketId,
        String reasonCode,
        @Size(max = 500) String note,
        boolean skipFiscalSeal) implements SelfValidating {

    public CancelTicketCommand(Actor actor, long ticketId, String reasonCode, String note, boolean skipFiscalSeal) {
        this.actor = actor;
        this.ticketId = ticketId;
        this.reasonCode = reasonCode;
        this.note = note;
        this.skipFiscalSeal = skipFiscalSeal;
        validateSelf();
    }

    public boolean bypassesFiscalSeal() {
        return actor.bypassesFiscalSeal(skipFiscalSeal);
    }
}
