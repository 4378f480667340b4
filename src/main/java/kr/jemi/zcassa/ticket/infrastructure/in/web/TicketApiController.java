package kr.jemi.zcassa.ticket.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketRangeCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketRangeUseCase;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketUseCase;
import kr.jemi.zcassa.ticket.domain.BatchIssuanceResult;
import kr.jemi.zcassa.ticket.domain.CancellationResult;
import kr.jemi.zcassa.ticket.domain.Participant;
import kr.jemi.zcassa.ticket.infrastructure.in.web.dto.CancelRangeRequest;
import kr.jemi.zcassa.ticket.infrastructure.in.web.dto.CancelTicketRequest;
import kr.jemi.zcassa.ticket.infrastructure.in.web.dto.IssueTicketRequest;
import kr.jemi.zcassa.ticket.infrastructure.in.web.dto.PartialIssuanceResponse;
import kr.jemi.zcassa.ticket.infrastructure.in.web.dto.RangeCancellationResponse;
import kr.jemi.zcassa.ticket.infrastructure.in.web.dto.TicketResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import static kr.jemi.zcassa.common.validation.ValidationUtils.fromRequest;

@Tag(name = "Ticket", description = "매표소 발권 및 취소")
@RestController
public class TicketApiController {

    private final IssueTicketUseCase issueTicketUseCase;
    private final CancelTicketUseCase cancelTicketUseCase;
    private final CancelTicketRangeUseCase cancelTicketRangeUseCase;

    public TicketApiController(IssueTicketUseCase issueTicketUseCase,
                               CancelTicketUseCase cancelTicketUseCase,
                               CancelTicketRangeUseCase cancelTicketRangeUseCase) {
        this.issueTicketUseCase = issueTicketUseCase;
        this.cancelTicketUseCase = cancelTicketUseCase;
        this.cancelTicketRangeUseCase = cancelTicketRangeUseCase;
    }

    @Operation(summary = "티켓 발권",
            description = "할당 쿼터 안에서 1~50장을 순서대로 발권합니다. 중간에 실패하면 그 전까지 발권된 티켓과 함께 207을 반환합니다.")
    @PostMapping("/api/events/{eventId}/tickets")
    public ResponseEntity<?> issue(
            @Parameter(description = "호출자 ID") @RequestHeader("X-Actor-Id") long actorId,
            @Parameter(description = "호출자 역할") @RequestHeader("X-Actor-Role") String role,
            @Parameter(description = "회사 ID") @RequestHeader("X-Company-Id") long companyId,
            @PathVariable long eventId,
            @Valid @RequestBody IssueTicketRequest request) {
        IssueTicketCommand command = fromRequest(() -> new IssueTicketCommand(
                Actor.of(actorId, role, companyId), eventId, request.sectorId(), request.ticketType(),
                request.priceMinorUnits(), request.quantityOrDefault(), request.paymentMethodOrDefault(),
                Participant.ofNullable(request.participantFirstName(), request.participantLastName()),
                Boolean.TRUE.equals(request.skipFiscalSeal())));
        BatchIssuanceResult result = issueTicketUseCase.issue(command);

        if (result.isFailure()) {
            throw new BusinessException(result.errorCode(), result.message());
        }
        if (result.isPartial()) {
            return ResponseEntity.status(HttpStatus.MULTI_STATUS).body(PartialIssuanceResponse.from(result));
        }
        if (result.requestedCount() == 1) {
            return ResponseEntity.status(HttpStatus.CREATED).body(TicketResponse.from(result.tickets().get(0)));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(result.tickets().stream().map(TicketResponse::from).toList());
    }

    @Operation(summary = "티켓 취소",
            description = "취소 사유 코드(01~12, 99)로 티켓을 취소하고 쿼터와 좌석을 복원합니다. 발권한 캐셔 또는 매니저 이상만 가능합니다.")
    @PatchMapping("/api/tickets/{ticketId}/cancel")
    public ResponseEntity<TicketResponse> cancel(
            @Parameter(description = "호출자 ID") @RequestHeader("X-Actor-Id") long actorId,
            @Parameter(description = "호출자 역할") @RequestHeader("X-Actor-Role") String role,
            @Parameter(description = "회사 ID") @RequestHeader("X-Company-Id") long companyId,
            @PathVariable long ticketId,
            @Valid @RequestBody CancelTicketRequest request) {
        CancelTicketCommand command = fromRequest(() -> new CancelTicketCommand(
                Actor.of(actorId, role, companyId), ticketId, request.reasonCode(), request.note(),
                Boolean.TRUE.equals(request.skipFiscalSeal())));
        CancellationResult result = cancelTicketUseCase.cancel(command);
        if (!result.isSuccess()) {
            throw new BusinessException(result.errorCode(), result.message());
        }
        return ResponseEntity.ok(TicketResponse.from(result.ticket()));
    }

    @Operation(summary = "진행번호 구간 취소",
            description = "이벤트의 진행번호 구간에 있는 ACTIVE 티켓을 모두 취소합니다. 매니저 이상 권한이 필요합니다.")
    @PostMapping("/api/events/{eventId}/tickets/cancel-range")
    public ResponseEntity<RangeCancellationResponse> cancelRange(
            @Parameter(description = "호출자 ID") @RequestHeader("X-Actor-Id") long actorId,
            @Parameter(description = "호출자 역할") @RequestHeader("X-Actor-Role") String role,
            @Parameter(description = "회사 ID") @RequestHeader("X-Company-Id") long companyId,
            @PathVariable long eventId,
            @Valid @RequestBody CancelRangeRequest request) {
        CancelTicketRangeCommand command = fromRequest(() -> new CancelTicketRangeCommand(
                Actor.of(actorId, role, companyId), eventId, request.fromNumber(), request.toNumber(),
                request.reasonCode(), request.note(), Boolean.TRUE.equals(request.skipFiscalSeal())));
        return ResponseEntity.ok(RangeCancellationResponse.from(cancelTicketRangeUseCase.cancelRange(command)));
    }
}
