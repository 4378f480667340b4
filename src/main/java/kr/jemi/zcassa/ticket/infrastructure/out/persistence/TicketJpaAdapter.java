package kr.jemi.zcassa.ticket.infrastructure.out.persistence;

import kr.jemi.zcassa.ticket.application.port.out.TicketPort;
import kr.jemi.zcassa.ticket.domain.Ticket;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class TicketJpaAdapter implements TicketPort {

    private final TicketJpaRepository repository;

    public TicketJpaAdapter(TicketJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public Ticket insert(Ticket ticket) {
        return repository.save(TicketJpaEntity.fromDomain(ticket)).toDomain();
    }

    @Override
    public Optional<Ticket> findById(long ticketId) {
        return repository.findById(ticketId).map(TicketJpaEntity::toDomain);
    }

    @Override
    public int cancelIfActive(Ticket cancelled) {
        if (cancelled.getStatus() != TicketStatus.CANCELLED) {
            throw new IllegalArgumentException("취소 처리되지 않은 티켓입니다: " + cancelled.getId());
        }
        return repository.cancelIfActive(cancelled.getId(), cancelled.getCancelledBy(),
                cancelled.getCancellationReason(), cancelled.getCancellationNote(),
                cancelled.getCancellationSealId(), cancelled.getCancelledAt());
    }

    @Override
    public List<Ticket> findByEventAndProgressiveRange(long eventId, int fromNumber, int toNumber,
                                                       TicketStatus status) {
        return repository.findByEventIdAndProgressiveNumberBetweenAndStatusOrderByProgressiveNumber(
                        eventId, fromNumber, toNumber, status).stream()
                .map(TicketJpaEntity::toDomain)
                .toList();
    }
}
