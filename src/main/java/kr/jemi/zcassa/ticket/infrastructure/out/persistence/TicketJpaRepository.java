package kr.jemi.zcassa.ticket.infrastructure.out.persistence;

import kr.jemi.zcassa.ticket.domain.CancellationReason;
import kr.jemi.zcassa.ticket.domain.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface TicketJpaRepository extends JpaRepository<TicketJpaEntity, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TicketJpaEntity t
               set t.status = kr.jemi.zcassa.ticket.domain.TicketStatus.CANCELLED,
                   t.cancelledBy = :cancelledBy,
                   t.cancellationReason = :reason,
                   t.cancellationNote = :note,
                   t.cancellationSealId = :sealId,
                   t.cancelledAt = :cancelledAt
             where t.id = :id
               and t.status = kr.jemi.zcassa.ticket.domain.TicketStatus.ACTIVE
            """)
    int cancelIfActive(@Param("id") long id,
                       @Param("cancelledBy") long cancelledBy,
                       @Param("reason") CancellationReason reason,
                       @Param("note") String note,
                       @Param("sealId") Long sealId,
                       @Param("cancelledAt") LocalDateTime cancelledAt);

    List<TicketJpaEntity> findByEventIdAndProgressiveNumberBetweenAndStatusOrderByProgressiveNumber(
            long eventId, int fromNumber, int toNumber, TicketStatus status);

    long countBySectorIdAndStatus(long sectorId, TicketStatus status);
}
