package kr.jemi.zcassa.ticket.application.port.out;

import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;

import java.util.List;
import java.util.Optional;

public interface TicketPort {

    Ticket insert(Ticket ticket);

    Optional<Ticket> findById(long ticketId);

    /**
     * 취소 처리된 티켓의 취소 정보를 저장 행이 아직 ACTIVE 인 경우에만 반영한다.
     * 반영된 행 수(0 또는 1)를 돌려준다.
     */
    int cancelIfActive(Ticket cancelled);

    List<Ticket> findByEventAndProgressiveRange(long eventId, int fromNumber, int toNumber, TicketStatus status);
}
