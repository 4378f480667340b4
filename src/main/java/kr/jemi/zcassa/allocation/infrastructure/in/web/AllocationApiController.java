package kr.jemi.zcassa.allocation.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zcassa.allocation.application.port.in.FindAllocationUseCase;
import kr.jemi.zcassa.allocation.application.port.in.GrantAllocationCommand;
import kr.jemi.zcassa.allocation.application.port.in.GrantAllocationUseCase;
import kr.jemi.zcassa.allocation.application.port.in.ManageAllocationUseCase;
import kr.jemi.zcassa.allocation.domain.CashierAllocation;
import kr.jemi.zcassa.allocation.infrastructure.in.web.dto.AllocationResponse;
import kr.jemi.zcassa.allocation.infrastructure.in.web.dto.GrantAllocationRequest;
import kr.jemi.zcassa.allocation.infrastructure.in.web.dto.UpdateAllocationRequest;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.common.exception.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static kr.jemi.zcassa.common.validation.ValidationUtils.fromRequest;

@Tag(name = "Cashier Allocation", description = "캐셔별 발권 쿼터 관리")
@RestController
public class AllocationApiController {

    private final GrantAllocationUseCase grantAllocationUseCase;
    private final ManageAllocationUseCase manageAllocationUseCase;
    private final FindAllocationUseCase findAllocationUseCase;

    public AllocationApiController(GrantAllocationUseCase grantAllocationUseCase,
                                   ManageAllocationUseCase manageAllocationUseCase,
                                   FindAllocationUseCase findAllocationUseCase) {
        this.grantAllocationUseCase = grantAllocationUseCase;
        this.manageAllocationUseCase = manageAllocationUseCase;
        this.findAllocationUseCase = findAllocationUseCase;
    }

    @Operation(summary = "할당 목록 조회", description = "이벤트의 캐셔 할당 목록을 조회합니다. 캐셔는 본인 할당만 조회됩니다.")
    @GetMapping("/api/events/{eventId}/cashier-allocations")
    public ResponseEntity<List<AllocationResponse>> list(
            @Parameter(description = "호출자 ID") @RequestHeader("X-Actor-Id") long actorId,
            @Parameter(description = "호출자 역할") @RequestHeader("X-Actor-Role") String role,
            @Parameter(description = "회사 ID") @RequestHeader("X-Company-Id") long companyId,
            @PathVariable long eventId) {
        Actor actor = fromRequest(() -> Actor.of(actorId, role, companyId));
        List<CashierAllocation> allocations = actor.isManagerTier()
                ? findAllocationUseCase.listByEvent(eventId)
                : findAllocationUseCase.find(actorId, eventId).map(List::of).orElse(List.of());
        return ResponseEntity.ok(allocations.stream().map(AllocationResponse::from).toList());
    }

    @Operation(summary = "할당 생성", description = "캐셔에게 이벤트(선택적으로 섹터) 발권 쿼터를 부여합니다. 매니저 이상 권한이 필요합니다.")
    @PostMapping("/api/events/{eventId}/cashier-allocations")
    public ResponseEntity<AllocationResponse> grant(
            @Parameter(description = "호출자 ID") @RequestHeader("X-Actor-Id") long actorId,
            @Parameter(description = "호출자 역할") @RequestHeader("X-Actor-Role") String role,
            @Parameter(description = "회사 ID") @RequestHeader("X-Company-Id") long companyId,
            @PathVariable long eventId,
            @Valid @RequestBody GrantAllocationRequest request) {
        Actor actor = requireManager(actorId, role, companyId);
        GrantAllocationCommand command = fromRequest(() -> new GrantAllocationCommand(
                actor.actorId(), actor.companyId(), eventId, request.cashierId(),
                request.sectorId(), request.quotaQuantity()));
        CashierAllocation allocation = grantAllocationUseCase.grant(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(AllocationResponse.from(allocation));
    }

    @Operation(summary = "할당 변경", description = "쿼터를 변경하거나 할당을 활성/비활성화합니다. 쿼터는 사용량보다 작을 수 없습니다.")
    @PatchMapping("/api/cashier-allocations/{allocationId}")
    public ResponseEntity<AllocationResponse> update(
            @Parameter(description = "호출자 ID") @RequestHeader("X-Actor-Id") long actorId,
            @Parameter(description = "호출자 역할") @RequestHeader("X-Actor-Role") String role,
            @Parameter(description = "회사 ID") @RequestHeader("X-Company-Id") long companyId,
            @PathVariable long allocationId,
            @Valid @RequestBody UpdateAllocationRequest request) {
        requireManager(actorId, role, companyId);
        if (request.quotaQuantity() == null && request.active() == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "변경할 항목이 없습니다");
        }
        CashierAllocation allocation = null;
        if (request.quotaQuantity() != null) {
            allocation = manageAllocationUseCase.resize(actorId, allocationId, request.quotaQuantity());
        }
        if (request.active() != null) {
            allocation = manageAllocationUseCase.changeActive(actorId, allocationId, request.active());
        }
        return ResponseEntity.ok(AllocationResponse.from(allocation));
    }

    @Operation(summary = "할당 삭제", description = "발권 이력이 없는 할당만 삭제할 수 있습니다.")
    @DeleteMapping("/api/cashier-allocations/{allocationId}")
    public ResponseEntity<Void> revoke(
            @Parameter(description = "호출자 ID") @RequestHeader("X-Actor-Id") long actorId,
            @Parameter(description = "호출자 역할") @RequestHeader("X-Actor-Role") String role,
            @Parameter(description = "회사 ID") @RequestHeader("X-Company-Id") long companyId,
            @PathVariable long allocationId) {
        requireManager(actorId, role, companyId);
        manageAllocationUseCase.revoke(actorId, allocationId);
        return ResponseEntity.noContent().build();
    }

    private Actor requireManager(long actorId, String role, long companyId) {
        Actor actor = fromRequest(() -> Actor.of(actorId, role, companyId));
        if (!actor.isManagerTier()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        return actor;
    }
}
