package kr.jemi.zcassa.allocation.infrastructure.in.web.dto;

import jakarta.validation.constraints.Min;

public record UpdateAllocationRequest(@Min(0) Integer quotaQuantity, Boolean active) {
}
