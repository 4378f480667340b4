package kr.jemi.zcassa.audit.application.port.out;

import kr.jemi.zcassa.audit.domain.AuditLog;

public interface AuditLogPort {

    void insert(AuditLog auditLog);
}
