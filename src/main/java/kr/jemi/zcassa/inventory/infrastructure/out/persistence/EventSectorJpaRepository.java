package kr.jemi.zcassa.inventory.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface EventSectorJpaRepository extends JpaRepository<EventSectorJpaEntity, Long> {

    List<EventSectorJpaEntity> findByEventIdOrderBySectorCode(long eventId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from EventSectorJpaEntity s where s.id = :id")
    Optional<EventSectorJpaEntity> findByIdForUpdate(@Param("id") long id);
}
