package kr.jemi.zcassa.inventory.application.port.out;

import kr.jemi.zcassa.inventory.domain.TicketedEvent;

import java.util.Optional;

public interface TicketedEventPort {

    TicketedEvent insert(TicketedEvent event);

    void update(TicketedEvent event);

    Optional<TicketedEvent> findById(long eventId);

    Optional<TicketedEvent> findByIdForUpdate(long eventId);
}
