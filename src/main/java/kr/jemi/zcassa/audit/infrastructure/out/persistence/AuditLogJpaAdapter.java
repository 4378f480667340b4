package kr.jemi.zcassa.audit.infrastructure.out.persistence;

import kr.jemi.zcassa.audit.application.port.out.AuditLogPort;
import kr.jemi.zcassa.audit.domain.AuditLog;
import org.springframework.stereotype.Component;

@Component
public class AuditLogJpaAdapter implements AuditLogPort {

    private final AuditLogJpaRepository repository;

    public AuditLogJpaAdapter(AuditLogJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public void insert(AuditLog auditLog) {
        repository.save(AuditLogJpaEntity.fromDomain(auditLog));
    }
}
