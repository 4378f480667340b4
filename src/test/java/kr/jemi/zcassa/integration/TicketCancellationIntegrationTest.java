package kr.jemi.zcassa.integration;

import kr.jemi.zcassa.allocation.application.port.in.ManageAllocationUseCase;
import kr.jemi.zcassa.allocation.domain.CashierAllocation;
import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.actor.ActorRole;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.inventory.domain.EventSector;
import kr.jemi.zcassa.inventory.domain.TicketedEvent;
import kr.jemi.zcassa.seal.domain.FiscalSeal;
import kr.jemi.zcassa.seal.domain.SealPurpose;
import kr.jemi.zcassa.seal.infrastructure.out.persistence.FiscalSealJpaEntity;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketRangeCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketRangeUseCase;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketUseCase;
import kr.jemi.zcassa.ticket.domain.CancellationReason;
import kr.jemi.zcassa.ticket.domain.CancellationResult;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.RangeCancellationResult;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import kr.jemi.zcassa.ticket.domain.TicketType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TicketCancellationIntegrationTest extends IntegrationTestBase {

    private static final long PRICE = 3_000L;
    private static final long CASHIER_ID = 20L;

    @Autowired
    IssueTicketUseCase issueTicketUseCase;

    @Autowired
    CancelTicketUseCase cancelTicketUseCase;

    @Autowired
    CancelTicketRangeUseCase cancelTicketRangeUseCase;

    @Autowired
    ManageAllocationUseCase manageAllocationUseCase;

    @Test
    @DisplayName("10장 발권 후 1장 취소: 쿼터, 좌석, 취소 수, 매출이 되돌아간다")
    void cancel_restores_quota_seat_and_revenue() {
        TicketedEvent event = registerEvent("EVT-B", 10, PRICE);
        EventSector sector = sectorOf(event);
        CashierAllocation allocation = grant(CASHIER_ID, event, null, 10);
        List<Ticket> tickets = issue(cashier(CASHIER_ID), event, sector, 10);

        CancellationResult result = cancelTicketUseCase.cancel(
                new CancelTicketCommand(cashier(CASHIER_ID), tickets.get(3).getId(), "04", "고객 환불", false));

        assertThat(result.isSuccess()).isTrue();
        Ticket cancelled = result.ticket();
        assertThat(cancelled.getStatus()).isEqualTo(TicketStatus.CANCELLED);
        assertThat(cancelled.getCancellationReason()).isEqualTo(CancellationReason.CUSTOMER_REFUND);
        assertThat(cancelled.getCancelledBy()).isEqualTo(CASHIER_ID);
        assertThat(cancelled.getCancellationSealId()).isNotNull();

        assertThat(reloadAllocation(allocation.getId()).getQuotaUsed()).isEqualTo(9);
        assertThat(reloadSector(sector.getId()).getAvailableSeats()).isEqualTo(1);
        TicketedEvent reloaded = reloadEvent(event.getId());
        assertThat(reloaded.getTicketsSold()).isEqualTo(10);
        assertThat(reloaded.getTicketsCancelled()).isEqualTo(1);
        assertThat(reloaded.getTotalRevenue()).isEqualTo(9 * PRICE);

        FiscalSeal cancellationSeal = fiscalSealJpaRepository.findById(cancelled.getCancellationSealId())
                .map(FiscalSealJpaEntity::toDomain).orElseThrow();
        assertThat(cancellationSeal.getPurpose()).isEqualTo(SealPurpose.CANCELLATION);
        assertThat(cancellationSeal.getTicketId()).isEqualTo(cancelled.getId());
    }

    @Test
    @DisplayName("이미 취소된 티켓을 다시 취소하면 ALREADY_CANCELLED이고 집계는 한 번만 반영된다")
    void second_cancel_is_rejected() {
        TicketedEvent event = registerEvent("EVT-AC", 5, PRICE);
        EventSector sector = sectorOf(event);
        CashierAllocation allocation = grant(CASHIER_ID, event, null, 5);
        Ticket ticket = issue(cashier(CASHIER_ID), event, sector, 1).get(0);
        cancelTicketUseCase.cancel(new CancelTicketCommand(cashier(CASHIER_ID), ticket.getId(), "06", null, false));

        CancellationResult again = cancelTicketUseCase.cancel(
                new CancelTicketCommand(manager(), ticket.getId(), "06", null, false));

        assertThat(again.errorCode()).isEqualTo(ErrorCode.ALREADY_CANCELLED);
        assertThat(reloadAllocation(allocation.getId()).getQuotaUsed()).isZero();
        assertThat(reloadSector(sector.getId()).getAvailableSeats()).isEqualTo(5);
        assertThat(reloadEvent(event.getId()).getTicketsCancelled()).isEqualTo(1);
    }

    @Test
    @DisplayName("다른 캐셔가 발권한 티켓은 캐셔 권한으로 취소할 수 없지만 매니저는 취소할 수 있다")
    void only_issuer_or_manager_can_cancel() {
        TicketedEvent event = registerEvent("EVT-U", 5, PRICE);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, null, 5);
        Ticket ticket = issue(cashier(CASHIER_ID), event, sector, 1).get(0);

        CancellationResult byOther = cancelTicketUseCase.cancel(
                new CancelTicketCommand(cashier(CASHIER_ID + 1), ticket.getId(), "99", null, false));
        CancellationResult byManager = cancelTicketUseCase.cancel(
                new CancelTicketCommand(manager(), ticket.getId(), "99", null, false));

        assertThat(byOther.errorCode()).isEqualTo(ErrorCode.UNAUTHORIZED);
        assertThat(byManager.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("알 수 없는 사유 코드는 INVALID_REASON_CODE이고 봉인을 요청하지 않는다")
    void unknown_reason_code_is_rejected() {
        TicketedEvent event = registerEvent("EVT-IR", 5, PRICE);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, null, 5);
        Ticket ticket = issue(cashier(CASHIER_ID), event, sector, 1).get(0);
        long sealsBefore = fiscalSealJpaRepository.count();

        CancellationResult result = cancelTicketUseCase.cancel(
                new CancelTicketCommand(cashier(CASHIER_ID), ticket.getId(), "42", null, false));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.INVALID_REASON_CODE);
        assertThat(fiscalSealJpaRepository.count()).isEqualTo(sealsBefore);
    }

    @Test
    @DisplayName("할당이 비활성화된 뒤에도 취소하면 쿼터 사용량이 복원된다")
    void cancel_releases_quota_of_inactive_allocation() {
        TicketedEvent event = registerEvent("EVT-IA", 5, PRICE);
        EventSector sector = sectorOf(event);
        CashierAllocation allocation = grant(CASHIER_ID, event, null, 5);
        Ticket ticket = issue(cashier(CASHIER_ID), event, sector, 1).get(0);
        manageAllocationUseCase.changeActive(MANAGER_ID, allocation.getId(), false);

        CancellationResult result = cancelTicketUseCase.cancel(
                new CancelTicketCommand(manager(), ticket.getId(), "01", null, false));

        assertThat(result.isSuccess()).isTrue();
        assertThat(reloadAllocation(allocation.getId()).getQuotaUsed()).isZero();
    }

    @Test
    @DisplayName("구간 취소: 진행번호 범위의 ACTIVE 티켓만 취소하고 이미 취소된 티켓은 건너뛴다")
    void range_cancel_cancels_active_tickets_in_range() {
        TicketedEvent event = registerEvent("EVT-RG", 10, PRICE);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, null, 10);
        List<Ticket> tickets = issue(cashier(CASHIER_ID), event, sector, 6);
        cancelTicketUseCase.cancel(new CancelTicketCommand(cashier(CASHIER_ID), tickets.get(2).getId(), "06", null, false));

        RangeCancellationResult result = cancelTicketRangeUseCase.cancelRange(
                new CancelTicketRangeCommand(manager(), event.getId(), 2, 5, "01", "공연 취소", false));

        assertThat(result.totalInRange()).isEqualTo(3);
        assertThat(result.cancelledCount()).isEqualTo(3);
        assertThat(result.errors()).isEmpty();
        assertThat(ticketJpaRepository.countBySectorIdAndStatus(sector.getId(), TicketStatus.ACTIVE)).isEqualTo(2);
        assertThat(reloadSector(sector.getId()).getAvailableSeats()).isEqualTo(8);
    }

    @Test
    @DisplayName("구간 취소는 캐셔가 요청하면 UNAUTHORIZED 예외")
    void range_cancel_requires_manager() {
        TicketedEvent event = registerEvent("EVT-RU", 5, PRICE);

        assertThatThrownBy(() -> cancelTicketRangeUseCase.cancelRange(
                new CancelTicketRangeCommand(cashier(CASHIER_ID), event.getId(), 1, 5, "01", null, false)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("다른 회사 매니저는 구간 취소를 할 수 없다")
    void range_cancel_rejects_other_company() {
        TicketedEvent event = registerEvent("EVT-RC", 5, PRICE);
        Actor otherCompanyManager = new Actor(MANAGER_ID, ActorRole.MANAGER, COMPANY_ID + 1);

        assertThatThrownBy(() -> cancelTicketRangeUseCase.cancelRange(
                new CancelTicketRangeCommand(otherCompanyManager, event.getId(), 1, 5, "01", null, false)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    private List<Ticket> issue(Actor actor, TicketedEvent event, EventSector sector, int quantity) {
        return issueTicketUseCase.issue(new IssueTicketCommand(actor, event.getId(), sector.getId(),
                TicketType.FULL, null, quantity, PaymentMethod.CASH, null, false)).tickets();
    }
}
