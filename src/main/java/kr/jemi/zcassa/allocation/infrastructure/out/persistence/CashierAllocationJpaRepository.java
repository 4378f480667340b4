package kr.jemi.zcassa.allocation.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CashierAllocationJpaRepository extends JpaRepository<CashierAllocationJpaEntity, Long> {

    Optional<CashierAllocationJpaEntity> findByCashierIdAndEventId(long cashierId, long eventId);

    List<CashierAllocationJpaEntity> findByEventIdOrderByCreatedAt(long eventId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from CashierAllocationJpaEntity a where a.id = :id")
    Optional<CashierAllocationJpaEntity> findByIdForUpdate(@Param("id") long id);
}
