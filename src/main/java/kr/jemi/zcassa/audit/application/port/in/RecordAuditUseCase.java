package kr.jemi.zcassa.audit.application.port.in;

public interface RecordAuditUseCase {

    void record(long actorId, String action, String entityType, Long entityId, String description);
}
