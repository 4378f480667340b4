package kr.jemi.zcassa.integration;

import kr.jemi.zcassa.allocation.domain.CashierAllocation;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.inventory.application.port.in.RegisterEventUseCase.SectorSpec;
import kr.jemi.zcassa.inventory.domain.EventSector;
import kr.jemi.zcassa.inventory.domain.TicketedEvent;
import kr.jemi.zcassa.seal.api.SealException;
import kr.jemi.zcassa.seal.api.SealFailure;
import kr.jemi.zcassa.seal.domain.DeviceSeal;
import kr.jemi.zcassa.seal.domain.FiscalSeal;
import kr.jemi.zcassa.seal.infrastructure.out.persistence.FiscalSealJpaEntity;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketUseCase;
import kr.jemi.zcassa.ticket.domain.BatchIssuanceResult;
import kr.jemi.zcassa.ticket.domain.Participant;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import kr.jemi.zcassa.ticket.domain.TicketType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

class TicketIssuanceIntegrationTest extends IntegrationTestBase {

    private static final long PRICE = 2_500L;
    private static final long CASHIER_ID = 10L;

    @Autowired
    IssueTicketUseCase issueTicketUseCase;

    @Test
    @DisplayName("10장 일괄 발권: 쿼터, 좌석, 이벤트 집계가 모두 반영되고 봉인이 티켓마다 연결된다")
    void batch_issuance_updates_all_counters() {
        TicketedEvent event = registerEvent("EVT-A", 10, PRICE);
        EventSector sector = sectorOf(event);
        CashierAllocation allocation = grant(CASHIER_ID, event, null, 10);

        BatchIssuanceResult result = issueTicketUseCase.issue(command(cashier(CASHIER_ID), event, sector.getId(), 10));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.emittedCount()).isEqualTo(10);
        assertThat(result.tickets()).extracting(Ticket::getProgressiveNumber)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        assertThat(result.tickets()).allMatch(ticket -> ticket.getStatus() == TicketStatus.ACTIVE);

        assertThat(reloadAllocation(allocation.getId()).getQuotaUsed()).isEqualTo(10);
        assertThat(reloadSector(sector.getId()).getAvailableSeats()).isZero();
        TicketedEvent reloaded = reloadEvent(event.getId());
        assertThat(reloaded.getTicketsSold()).isEqualTo(10);
        assertThat(reloaded.getTotalRevenue()).isEqualTo(10 * PRICE);

        List<FiscalSeal> seals = fiscalSealJpaRepository.findAll().stream().map(FiscalSealJpaEntity::toDomain).toList();
        assertThat(seals).hasSize(10).allMatch(FiscalSeal::isBound);
        assertThat(seals).extracting(FiscalSeal::getTicketId)
                .containsExactlyInAnyOrderElementsOf(result.tickets().stream().map(Ticket::getId).toList());
    }

    @Test
    @DisplayName("티켓 코드는 이벤트 코드와 봉인 카운터를 포함한다")
    void ticket_code_contains_event_code_and_seal_counter() {
        TicketedEvent event = registerEvent("EVT-CODE", 5, PRICE);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, null, 5);

        Ticket ticket = issueTicketUseCase.issue(command(cashier(CASHIER_ID), event, sector.getId(), 1))
                .tickets().get(0);

        assertThat(ticket.getTicketCode()).startsWith("EVT-CODE-").endsWith("-" + ticket.getSeal().counter());
        assertThat(ticket.getSeal().sealCode()).isEqualTo("SEAL-" + ticket.getSeal().counter());
    }

    @Test
    @DisplayName("봉인 장치가 6번째 요청에서 실패하면 앞의 5장만 발권되고 쿼터 사용량도 5가 된다")
    void seal_failure_mid_batch_keeps_previous_tickets() {
        TicketedEvent event = registerEvent("EVT-C", 10, PRICE);
        EventSector sector = sectorOf(event);
        CashierAllocation allocation = grant(CASHIER_ID, event, null, 10);
        given(sealDevicePort.seal(anyLong())).willAnswer(inv -> {
            long counter = sealCounter.incrementAndGet();
            if (counter == 6) {
                throw new SealException(SealFailure.DEVICE_ERROR, "카드 응답 없음");
            }
            return new DeviceSeal(counter, "SEAL-" + counter, DEVICE_SERIAL, "MAC", LocalDateTime.now());
        });

        BatchIssuanceResult result = issueTicketUseCase.issue(command(cashier(CASHIER_ID), event, sector.getId(), 10));

        assertThat(result.isPartial()).isTrue();
        assertThat(result.emittedCount()).isEqualTo(5);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.SEAL_ERROR);
        assertThat(ticketJpaRepository.count()).isEqualTo(5);
        assertThat(reloadAllocation(allocation.getId()).getQuotaUsed()).isEqualTo(5);
        assertThat(reloadSector(sector.getId()).getAvailableSeats()).isEqualTo(5);
    }

    @Test
    @DisplayName("쿼터가 3인데 5장을 요청하면 3장 발권 후 QUOTA_EXCEEDED로 멈추고 4번째 봉인은 요청하지 않는다")
    void quota_exhaustion_stops_batch_without_extra_seal() {
        TicketedEvent event = registerEvent("EVT-Q", 10, PRICE);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, null, 3);

        BatchIssuanceResult result = issueTicketUseCase.issue(command(cashier(CASHIER_ID), event, sector.getId(), 5));

        assertThat(result.emittedCount()).isEqualTo(3);
        assertThat(result.requestedCount()).isEqualTo(5);
        assertThat(result.errorCode()).isEqualTo(ErrorCode.QUOTA_EXCEEDED);
        then(sealDevicePort).should(times(3)).seal(anyLong());
    }

    @Test
    @DisplayName("브리지가 연결되지 않으면 BRIDGE_NOT_CONNECTED로 실패하고 아무것도 변경되지 않는다")
    void disconnected_bridge_rejects_issuance() {
        TicketedEvent event = registerEvent("EVT-D", 10, PRICE);
        EventSector sector = sectorOf(event);
        CashierAllocation allocation = grant(CASHIER_ID, event, null, 10);
        disconnectDevice();

        BatchIssuanceResult result = issueTicketUseCase.issue(command(cashier(CASHIER_ID), event, sector.getId(), 1));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.BRIDGE_NOT_CONNECTED);
        assertThat(ticketJpaRepository.count()).isZero();
        assertThat(reloadAllocation(allocation.getId()).getQuotaUsed()).isZero();
        then(sealDevicePort).should(never()).seal(anyLong());
    }

    @Test
    @DisplayName("SUPER_ADMIN이 봉인 생략을 요청하면 장치 없이 봉인 없는 티켓이 발권된다")
    void super_admin_can_skip_fiscal_seal() {
        TicketedEvent event = registerEvent("EVT-S", 10, PRICE);
        EventSector sector = sectorOf(event);
        Actor admin = superAdmin();
        grant(admin.actorId(), event, null, 10);
        disconnectDevice();

        BatchIssuanceResult result = issueTicketUseCase.issue(new IssueTicketCommand(admin, event.getId(),
                sector.getId(), TicketType.FULL, null, 1, PaymentMethod.CASH, null, true));

        assertThat(result.isComplete()).isTrue();
        Ticket ticket = result.tickets().get(0);
        assertThat(ticket.getSeal()).isNull();
        assertThat(ticket.getTicketCode()).startsWith("EVT-S-");
        assertThat(fiscalSealJpaRepository.count()).isZero();
    }

    @Test
    @DisplayName("캐셔가 봉인 생략을 요청해도 무시되고 봉인 장치를 거친다")
    void cashier_cannot_skip_fiscal_seal() {
        TicketedEvent event = registerEvent("EVT-NS", 10, PRICE);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, null, 10);
        disconnectDevice();

        BatchIssuanceResult result = issueTicketUseCase.issue(new IssueTicketCommand(cashier(CASHIER_ID),
                event.getId(), sector.getId(), TicketType.FULL, null, 1, PaymentMethod.CASH, null, true));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.BRIDGE_NOT_CONNECTED);
    }

    @Test
    @DisplayName("섹터가 지정된 할당으로 다른 섹터를 발권하면 SECTOR_NOT_ALLOWED")
    void sector_restricted_allocation_rejects_other_sector() {
        TicketedEvent event = registerEventUseCase.register(COMPANY_ID, "EVT-R", List.of(
                new SectorSpec("A", "A구역", 10, PRICE, null, 0L),
                new SectorSpec("B", "B구역", 10, PRICE, null, 0L)));
        List<EventSector> sectors = registerEventUseCase.getSectors(event.getId());
        grant(CASHIER_ID, event, sectors.get(0).getId(), 10);

        BatchIssuanceResult result = issueTicketUseCase.issue(
                command(cashier(CASHIER_ID), event, sectors.get(1).getId(), 1));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.SECTOR_NOT_ALLOWED);
    }

    @Test
    @DisplayName("섹터를 생략하면 할당된 섹터로 발권하고 감면 가격이 없으면 정가를 적용한다")
    void omitted_sector_falls_back_to_allocation_sector() {
        TicketedEvent event = registerEvent("EVT-F", 10, PRICE);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, sector.getId(), 10);

        BatchIssuanceResult result = issueTicketUseCase.issue(new IssueTicketCommand(cashier(CASHIER_ID),
                event.getId(), null, TicketType.REDUCED, null, 1, PaymentMethod.CARD,
                new Participant("길동", "홍"), false));

        Ticket ticket = result.tickets().get(0);
        assertThat(ticket.getSectorId()).isEqualTo(sector.getId());
        assertThat(ticket.getPriceMinorUnits()).isEqualTo(PRICE);
        assertThat(ticket.getPaymentMethod()).isEqualTo(PaymentMethod.CARD);
        assertThat(ticket.getParticipant()).isEqualTo(new Participant("길동", "홍"));
    }

    @Test
    @DisplayName("할당이 없는 캐셔는 ALLOCATION_NOT_FOUND")
    void cashier_without_allocation_is_rejected() {
        TicketedEvent event = registerEvent("EVT-N", 10, PRICE);
        EventSector sector = sectorOf(event);

        BatchIssuanceResult result = issueTicketUseCase.issue(command(cashier(CASHIER_ID), event, sector.getId(), 1));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.ALLOCATION_NOT_FOUND);
        then(sealDevicePort).should(never()).seal(anyLong());
    }

    private static IssueTicketCommand command(Actor actor, TicketedEvent event, long sectorId, int quantity) {
        return new IssueTicketCommand(actor, event.getId(), sectorId, TicketType.FULL, null,
                quantity, PaymentMethod.CASH, null, false);
    }
}
