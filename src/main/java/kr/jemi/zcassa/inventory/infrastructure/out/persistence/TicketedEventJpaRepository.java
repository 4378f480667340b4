package kr.jemi.zcassa.inventory.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TicketedEventJpaRepository extends JpaRepository<TicketedEventJpaEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from TicketedEventJpaEntity e where e.id = :id")
    Optional<TicketedEventJpaEntity> findByIdForUpdate(@Param("id") long id);
}
