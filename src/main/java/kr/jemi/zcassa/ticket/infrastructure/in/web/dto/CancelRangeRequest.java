package kr.jemi.zcassa.ticket.infrastructure.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CancelRangeRequest(
        @NotNull @Min(1) Integer fromNumber,
        @NotNull @Min(1) Integer toNumber,
        @NotBlank String reasonCode,
        @Size(max = 500) String note,
        Boolean skipFiscalSeal) {
}
