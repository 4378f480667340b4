package kr.jemi.zcassa.seal.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zcassa.seal.application.port.in.ReportDeviceStatusUseCase;
import kr.jemi.zcassa.seal.infrastructure.in.web.dto.BridgeStatusRequest;
import kr.jemi.zcassa.seal.infrastructure.in.web.dto.BridgeStatusResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Seal Bridge", description = "봉인 장치 브리지 상태")
@RestController
public class BridgeStatusController {

    private final ReportDeviceStatusUseCase reportDeviceStatusUseCase;

    public BridgeStatusController(ReportDeviceStatusUseCase reportDeviceStatusUseCase) {
        this.reportDeviceStatusUseCase = reportDeviceStatusUseCase;
    }

    @Operation(summary = "브리지 하트비트", description = "브리지가 주기적으로 장치/카드 상태를 보고합니다. 보고가 끊기면 미연결로 간주됩니다.")
    @PostMapping("/api/bridge/status")
    public ResponseEntity<Void> report(@Valid @RequestBody BridgeStatusRequest request) {
        reportDeviceStatusUseCase.report(request.toDomain());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "브리지 상태 조회", description = "마지막으로 보고된 장치/카드 상태를 조회합니다.")
    @GetMapping("/api/bridge/status")
    public ResponseEntity<BridgeStatusResponse> current() {
        return ResponseEntity.ok(BridgeStatusResponse.from(reportDeviceStatusUseCase.current()));
    }
}
