package kr.jemi.zcassa.ticket.application.port.in;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.validation.SelfValidating;

public record CancelTicketRangeCommand(
        @NotNull Actor actor,
        long eventId,
        @Min(1) int fromNumber,
        @Min(1) int toNumber,
        String reasonCode,
        @Size(max = 500) String note,
        boolean skipFiscalSeal) implements SelfValidating {

    public CancelTicketRangeCommand(Actor actor, long eventId, int fromNumber, int toNumber,
                                    String reasonCode, String note, boolean skipFiscalSeal) {
        this.actor = actor;
        this.eventId = eventId;
        this.fromNumber = fromNumber;
        this.toNumber = toNumber;
        this.reasonCode = reasonCode;
        this.note = note;
        this.skipFiscalSeal = skipFiscalSeal;
        validateSelf();
        if (fromNumber > toNumber) {
            throw new IllegalArgumentException("시작 번호는 끝 번호보다 클 수 없습니다: " + fromNumber + " > " + toNumber);
        }
    }
}
