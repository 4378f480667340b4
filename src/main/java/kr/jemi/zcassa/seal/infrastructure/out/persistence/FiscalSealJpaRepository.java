package kr.jemi.zcassa.seal.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface FiscalSealJpaRepository extends JpaRepository<FiscalSealJpaEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from FiscalSealJpaEntity s where s.id = :id")
    Optional<FiscalSealJpaEntity> findByIdForUpdate(@Param("id") long id);

    @Query("select s from FiscalSealJpaEntity s where s.ticketId is null and s.createdAt < :cutoff order by s.createdAt")
    List<FiscalSealJpaEntity> findUnboundCreatedBefore(@Param("cutoff") LocalDateTime cutoff, Pageable pageable);
}
