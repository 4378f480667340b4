package kr.jemi.zcassa.ticket.infrastructure.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.TicketType;

public record IssueTicketRequest(
        Long sectorId,
        @NotNull TicketType ticketType,
        @Min(0) Long priceMinorUnits,
        Integer quantity,
        String participantFirstName,
        String participantLastName,
        PaymentMethod paymentMethod,
        Boolean skipFiscalSeal) {

    public int quantityOrDefault() {
        return quantity != null ? quantity : 1;
    }

    public PaymentMethod paymentMethodOrDefault() {
        return paymentMethod != null ? paymentMethod : PaymentMethod.CASH;
    }
}
