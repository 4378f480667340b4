package kr.jemi.zcassa.audit.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zcassa.audit.application.port.in.RecordAuditUseCase;
import kr.jemi.zcassa.audit.application.port.out.AuditLogPort;
import kr.jemi.zcassa.audit.domain.AuditLog;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditService implements RecordAuditUseCase {

    private final AuditLogPort auditLogPort;
    private final TSID.Factory tsidFactory;

    public AuditService(AuditLogPort auditLogPort, TSID.Factory tsidFactory) {
        this.auditLogPort = auditLogPort;
        this.tsidFactory = tsidFactory;
    }

    @Override
    @Transactional
    public void record(long actorId, String action, String entityType, Long entityId, String description) {
        auditLogPort.insert(AuditLog.record(tsidFactory.generate().toLong(), actorId, action, entityType,
                entityId, description));
    }
}
