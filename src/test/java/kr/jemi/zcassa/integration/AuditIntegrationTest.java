package kr.jemi.zcassa.integration;

import kr.jemi.zcassa.audit.domain.AuditLog;
import kr.jemi.zcassa.audit.infrastructure.out.persistence.AuditLogJpaEntity;
import kr.jemi.zcassa.inventory.domain.EventSector;
import kr.jemi.zcassa.inventory.domain.TicketedEvent;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketCommand;
import kr.jemi.zcassa.ticket.application.port.in.IssueTicketUseCase;
import kr.jemi.zcassa.ticket.domain.PaymentMethod;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AuditIntegrationTest extends IntegrationTestBase {

    private static final long CASHIER_ID = 50L;

    @Autowired
    IssueTicketUseCase issueTicketUseCase;

    @Autowired
    CancelTicketUseCase cancelTicketUseCase;

    @Test
    @DisplayName("발권과 취소가 커밋되면 비동기로 감사 로그가 남는다")
    void issuance_and_cancellation_are_audited() {
        TicketedEvent event = registerEvent("EVT-AU", 5, 1_500L);
        EventSector sector = sectorOf(event);
        grant(CASHIER_ID, event, null, 5);

        Ticket ticket = issueTicketUseCase.issue(new IssueTicketCommand(cashier(CASHIER_ID), event.getId(),
                sector.getId(), TicketType.FULL, null, 1, PaymentMethod.CASH, null, false)).tickets().get(0);
        cancelTicketUseCase.cancel(new CancelTicketCommand(cashier(CASHIER_ID), ticket.getId(), "04", "환불", false));

        await().atMost(5, SECONDS).untilAsserted(() -> {
            List<AuditLog> logs = auditLogJpaRepository
                    .findByEntityTypeAndEntityIdOrderByCreatedAt("ticket", ticket.getId())
                    .stream().map(AuditLogJpaEntity::toDomain).toList();
            assertThat(logs).extracting(AuditLog::getAction)
                    .containsExactlyInAnyOrder("ticket_emitted", "ticket_cancelled");
            assertThat(logs).allMatch(log -> log.getActorId() == CASHIER_ID);
        });
    }

    @Test
    @DisplayName("할당 생성도 감사 로그로 남는다")
    void allocation_grant_is_audited() {
        TicketedEvent event = registerEvent("EVT-AL", 5, 1_500L);

        long allocationId = grant(CASHIER_ID, event, null, 3).getId();

        await().atMost(5, SECONDS).untilAsserted(() ->
                assertThat(auditLogJpaRepository.findByActionOrderByCreatedAt("cashier_allocation_created"))
                        .map(AuditLogJpaEntity::toDomain)
                        .extracting(AuditLog::getEntityId)
                        .contains(allocationId));
    }

    @Test
    @DisplayName("발권 실패도 이벤트 단위 감사 로그로 남는다")
    void failed_issuance_is_audited() {
        TicketedEvent event = registerEvent("EVT-AF", 5, 1_500L);
        EventSector sector = sectorOf(event);

        issueTicketUseCase.issue(new IssueTicketCommand(cashier(CASHIER_ID), event.getId(), sector.getId(),
                TicketType.FULL, null, 1, PaymentMethod.CASH, null, false));

        await().atMost(5, SECONDS).untilAsserted(() ->
                assertThat(auditLogJpaRepository.findByEntityTypeAndEntityIdOrderByCreatedAt("ticketed_event", event.getId()))
                        .map(AuditLogJpaEntity::toDomain)
                        .singleElement()
                        .satisfies(log -> {
                            assertThat(log.getAction()).isEqualTo("ticket_emission_failed");
                            assertThat(log.getDescription()).startsWith("ALLOCATION_NOT_FOUND");
                        }));
    }
}
