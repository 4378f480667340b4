package kr.jemi.zcassa.ticket.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CancelTicketRequest(@NotBlank String reasonCode, @Size(max = 500) String note, Boolean skipFiscalSeal) {
}
