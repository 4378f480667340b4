package kr.jemi.zcassa.ticket.application.service;

import kr.jemi.zcassa.common.actor.Actor;
import kr.jemi.zcassa.common.actor.ActorRole;
import kr.jemi.zcassa.common.exception.BusinessException;
import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.ticket.api.TicketCancellationFailedEvent;
import kr.jemi.zcassa.ticket.api.TicketRangeCancelledEvent;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketRangeCommand;
import kr.jemi.zcassa.ticket.application.port.out.FiscalSealingPort;
import kr.jemi.zcassa.ticket.application.port.out.InventoryPort;
import kr.jemi.zcassa.ticket.application.port.out.TicketPort;
import kr.jemi.zcassa.ticket.domain.CancellationReason;
import kr.jemi.zcassa.ticket.domain.CancellationResult;
import kr.jemi.zcassa.ticket.domain.DeviceReadiness;
import kr.jemi.zcassa.ticket.domain.EventSnapshot;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.RangeCancellationResult;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.SealingFailedException;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import kr.jemi.zcassa.ticket.domain.TicketType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class TicketCancellationServiceTest {

    private static final long EVENT_ID = 10L;
    private static final long COMPANY_ID = 1L;
    private static final long ISSUER = 7L;
    private static final EventSnapshot EVENT = new EventSnapshot(EVENT_ID, COMPANY_ID, "EVT");

    @Mock
    private TicketPort ticketPort;

    @Mock
    private InventoryPort inventoryPort;

    @Mock
    private FiscalSealingPort fiscalSealingPort;

    @Mock
    private TicketCancellationWriter ticketCancellationWriter;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private TicketCancellationService ticketCancellationService;

    @BeforeEach
    void setUp() {
        ticketCancellationService = new TicketCancellationService(
                ticketPort, inventoryPort, fiscalSealingPort, ticketCancellationWriter, eventPublisher);
    }

    private static Ticket activeTicket(long id, int progressiveNumber) {
        return Ticket.issue(id, EVENT, 20L, 30L, progressiveNumber, TicketType.FULL, 1_000L,
                PaymentMethod.CASH, null, ISSUER, new SealStamp(id, "S" + id, id));
    }

    private static Actor cashier(long id) {
        return new Actor(id, ActorRole.CASHIER, COMPANY_ID);
    }

    private static Actor manager() {
        return new Actor(99L, ActorRole.MANAGER, COMPANY_ID);
    }

    @Nested
    @DisplayName("cancel()")
    class Cancel {

        @Test
        @DisplayName("정상 취소: 취소 봉인을 받아 기록기에 넘긴다")
        void shouldSealThenWrite() {
            // given
            Ticket ticket = activeTicket(1L, 1);
            SealStamp cancellationSeal = new SealStamp(50L, "C50", 50L);
            given(ticketPort.findById(1L)).willReturn(Optional.of(ticket));
            given(fiscalSealingPort.checkReadiness()).willReturn(DeviceReadiness.ready());
            given(fiscalSealingPort.sealCancellation(ISSUER)).willReturn(cancellationSeal);
            given(ticketCancellationWriter.write(1L, ISSUER, CancellationReason.CUSTOMER_REFUND, "환불", cancellationSeal))
                    .willReturn(CancellationResult.success(ticket));

            // when
            CancellationResult result = ticketCancellationService.cancel(
                    new CancelTicketCommand(cashier(ISSUER), 1L, "04", "환불", false));

            // then
            assertThat(result.isSuccess()).isTrue();
            then(eventPublisher).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("잘못된 사유 코드는 티켓 조회 없이 INVALID_REASON_CODE")
        void shouldRejectUnknownReason() {
            CancellationResult result = ticketCancellationService.cancel(
                    new CancelTicketCommand(cashier(ISSUER), 1L, "77", null, false));

            assertThat(result.errorCode()).isEqualTo(ErrorCode.INVALID_REASON_CODE);
            then(ticketPort).shouldHaveNoInteractions();
            then(eventPublisher).should().publishEvent(any(TicketCancellationFailedEvent.class));
        }

        @Test
        @DisplayName("없는 티켓은 TICKET_NOT_FOUND")
        void shouldFailForMissingTicket() {
            given(ticketPort.findById(1L)).willReturn(Optional.empty());

            CancellationResult result = ticketCancellationService.cancel(
                    new CancelTicketCommand(cashier(ISSUER), 1L, "04", null, false));

            assertThat(result.errorCode()).isEqualTo(ErrorCode.TICKET_NOT_FOUND);
        }

        @Test
        @DisplayName("이미 취소된 티켓은 봉인을 요청하지 않고 ALREADY_CANCELLED")
        void shouldFailForCancelledTicket() {
            Ticket ticket = activeTicket(1L, 1);
            ticket.cancel(ISSUER, CancellationReason.OTHER, null, null, LocalDateTime.now());
            given(ticketPort.findById(1L)).willReturn(Optional.of(ticket));

            CancellationResult result = ticketCancellationService.cancel(
                    new CancelTicketCommand(cashier(ISSUER), 1L, "04", null, false));

            assertThat(result.errorCode()).isEqualTo(ErrorCode.ALREADY_CANCELLED);
            then(fiscalSealingPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("다른 캐셔의 티켓은 UNAUTHORIZED")
        void shouldRejectOtherCashier() {
            given(ticketPort.findById(1L)).willReturn(Optional.of(activeTicket(1L, 1)));

            CancellationResult result = ticketCancellationService.cancel(
                    new CancelTicketCommand(cashier(ISSUER + 1), 1L, "04", null, false));

            assertThat(result.errorCode()).isEqualTo(ErrorCode.UNAUTHORIZED);
            then(fiscalSealingPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("취소 봉인이 실패하면 기록하지 않는다")
        void shouldNotWriteWhenSealFails() {
            given(ticketPort.findById(1L)).willReturn(Optional.of(activeTicket(1L, 1)));
            given(fiscalSealingPort.checkReadiness()).willReturn(DeviceReadiness.ready());
            given(fiscalSealingPort.sealCancellation(ISSUER))
                    .willThrow(new SealingFailedException(ErrorCode.SEAL_ERROR, "장치 바쁨", null));

            CancellationResult result = ticketCancellationService.cancel(
                    new CancelTicketCommand(cashier(ISSUER), 1L, "04", null, false));

            assertThat(result.errorCode()).isEqualTo(ErrorCode.SEAL_ERROR);
            then(ticketCancellationWriter).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("SUPER_ADMIN 봉인 생략이면 봉인 없이 기록한다")
        void shouldWriteWithoutSealOnBypass() {
            Ticket ticket = activeTicket(1L, 1);
            Actor admin = new Actor(5L, ActorRole.SUPER_ADMIN, COMPANY_ID);
            given(ticketPort.findById(1L)).willReturn(Optional.of(ticket));
            given(ticketCancellationWriter.write(1L, 5L, CancellationReason.EVENT_CANCELLED, null, null))
                    .willReturn(CancellationResult.success(ticket));

            CancellationResult result = ticketCancellationService.cancel(
                    new CancelTicketCommand(admin, 1L, "01", null, true));

            assertThat(result.isSuccess()).isTrue();
            then(fiscalSealingPort).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("cancelRange()")
    class CancelRange {

        @Test
        @DisplayName("구간의 ACTIVE 티켓을 하나씩 취소하고 실패는 errors에 모은다")
        void shouldCollectPerTicketErrors() {
            // given
            Ticket first = activeTicket(1L, 1);
            Ticket second = activeTicket(2L, 2);
            given(inventoryPort.findEvent(EVENT_ID)).willReturn(Optional.of(EVENT));
            given(ticketPort.findByEventAndProgressiveRange(EVENT_ID, 1, 2, TicketStatus.ACTIVE))
                    .willReturn(List.of(first, second));
            given(ticketPort.findById(1L)).willReturn(Optional.of(first));
            given(ticketPort.findById(2L)).willReturn(Optional.of(second));
            given(fiscalSealingPort.checkReadiness()).willReturn(DeviceReadiness.ready());
            given(fiscalSealingPort.sealCancellation(99L)).willReturn(new SealStamp(50L, "C", 50L));
            given(ticketCancellationWriter.write(eq(1L), eq(99L), any(), any(), any()))
                    .willReturn(CancellationResult.success(first));
            given(ticketCancellationWriter.write(eq(2L), eq(99L), any(), any(), any()))
                    .willReturn(CancellationResult.failure(ErrorCode.ALREADY_CANCELLED));

            // when
            RangeCancellationResult result = ticketCancellationService.cancelRange(
                    new CancelTicketRangeCommand(manager(), EVENT_ID, 1, 2, "01", null, false));

            // then
            assertThat(result.cancelledCount()).isEqualTo(1);
            assertThat(result.totalInRange()).isEqualTo(2);
            assertThat(result.errors()).singleElement().satisfies(error -> {
                assertThat(error.ticketId()).isEqualTo(2L);
                assertThat(error.errorCode()).isEqualTo(ErrorCode.ALREADY_CANCELLED);
            });
            ArgumentCaptor<TicketRangeCancelledEvent> captor = ArgumentCaptor.forClass(TicketRangeCancelledEvent.class);
            then(eventPublisher).should().publishEvent(captor.capture());
            assertThat(captor.getValue().cancelledCount()).isEqualTo(1);
            assertThat(captor.getValue().errorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("캐셔는 구간 취소를 할 수 없다")
        void shouldRejectCashier() {
            assertThatThrownBy(() -> ticketCancellationService.cancelRange(
                    new CancelTicketRangeCommand(cashier(ISSUER), EVENT_ID, 1, 2, "01", null, false)))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.UNAUTHORIZED);
            then(ticketPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("사유 코드가 잘못되면 INVALID_REASON_CODE 예외")
        void shouldRejectInvalidReason() {
            assertThatThrownBy(() -> ticketCancellationService.cancelRange(
                    new CancelTicketRangeCommand(manager(), EVENT_ID, 1, 2, "00", null, false)))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_REASON_CODE);
        }

        @Test
        @DisplayName("SUPER_ADMIN은 다른 회사의 이벤트도 구간 취소할 수 있다")
        void superAdminCrossesCompanies() {
            given(inventoryPort.findEvent(EVENT_ID)).willReturn(Optional.of(EVENT));
            given(ticketPort.findByEventAndProgressiveRange(EVENT_ID, 1, 2, TicketStatus.ACTIVE))
                    .willReturn(List.of());

            RangeCancellationResult result = ticketCancellationService.cancelRange(new CancelTicketRangeCommand(
                    new Actor(5L, ActorRole.SUPER_ADMIN, COMPANY_ID + 1), EVENT_ID, 1, 2, "01", null, false));

            assertThat(result.totalInRange()).isZero();
            assertThat(result.errors()).isEmpty();
        }
    }
}
