package kr.jemi.zcassa.audit.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import kr.jemi.zcassa.audit.domain.AuditLog;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs", indexes = @Index(name = "idx_audit_entity", columnList = "entityType, entityId"))
public class AuditLogJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private long actorId;

    @Column(nullable = false, length = 50)
    private String action;

    @Column(nullable = false, length = 30)
    private String entityType;

    private Long entityId;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    protected AuditLogJpaEntity() {}

    public static AuditLogJpaEntity fromDomain(AuditLog auditLog) {
        AuditLogJpaEntity entity = new AuditLogJpaEntity();
        entity.id = auditLog.getId();
        entity.actorId = auditLog.getActorId();
        entity.action = auditLog.getAction();
        entity.entityType = auditLog.getEntityType();
        entity.entityId = auditLog.getEntityId();
        entity.description = auditLog.getDescription();
        entity.createdAt = auditLog.getCreatedAt();
        return entity;
    }

    public AuditLog toDomain() {
        return new AuditLog(id, actorId, action, entityType, entityId, description, createdAt);
    }
}
