package kr.jemi.zcassa.allocation.infrastructure.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record GrantAllocationRequest(
        @NotNull Long cashierId,
        Long sectorId,
        @NotNull @Min(0) Integer quotaQuantity) {
}
