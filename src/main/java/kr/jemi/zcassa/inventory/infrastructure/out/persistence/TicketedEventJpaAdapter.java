package kr.jemi.zcassa.inventory.infrastructure.out.persistence;

import kr.jemi.zcassa.inventory.application.port.out.TicketedEventPort;
import kr.jemi.zcassa.inventory.domain.TicketedEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class TicketedEventJpaAdapter implements TicketedEventPort {

    private final TicketedEventJpaRepository repository;

    public TicketedEventJpaAdapter(TicketedEventJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public TicketedEvent insert(TicketedEvent event) {
        return repository.save(TicketedEventJpaEntity.fromDomain(event)).toDomain();
    }

    // 영속 컨텍스트에 올라와 있는 엔티티를 갱신한다. 트랜잭션 안에서만 의미가 있다.
    @Override
    public void update(TicketedEvent event) {
        TicketedEventJpaEntity entity = repository.findById(event.getId())
                .orElseThrow(() -> new IllegalStateException("이벤트를 찾을 수 없습니다: id=" + event.getId()));
        entity.update(event);
    }

    @Override
    public Optional<TicketedEvent> findById(long eventId) {
        return repository.findById(eventId).map(TicketedEventJpaEntity::toDomain);
    }

    @Override
    public Optional<TicketedEvent> findByIdForUpdate(long eventId) {
        return repository.findByIdForUpdate(eventId).map(TicketedEventJpaEntity::toDomain);
    }
}
