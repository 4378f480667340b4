package kr.jemi.zcassa.audit.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogJpaRepository extends JpaRepository<AuditLogJpaEntity, Long> {

    List<AuditLogJpaEntity> findByEntityTypeAndEntityIdOrderByCreatedAt(String entityType, Long entityId);

    List<AuditLogJpaEntity> findByActionOrderByCreatedAt(String action);
}
