package kr.jemi.zcassa.audit.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zcassa.common.validation.SelfValidating;

import java.time.LocalDateTime;

public class AuditLog implements SelfValidating {

    private static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final long id;
    private final long actorId;
    @NotBlank
    private final String action;
    @NotBlank
    private final String entityType;
    private final Long entityId;
    private final String description;
    @NotNull
    private final LocalDateTime createdAt;

    public AuditLog(long id, long actorId, String action, String entityType, Long entityId,
                    String description, LocalDateTime createdAt) {
        this.id = id;
        this.actorId = actorId;
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        this.description = truncate(description);
        this.createdAt = createdAt;
        validateSelf();
    }

    public static AuditLog record(long id, long actorId, String action, String entityType, Long entityId,
                                  String description) {
        return new AuditLog(id, actorId, action, entityType, entityId, description, LocalDateTime.now());
    }

    private static String truncate(String description) {
        if (description == null || description.length() <= MAX_DESCRIPTION_LENGTH) {
            return description;
        }
        return description.substring(0, MAX_DESCRIPTION_LENGTH);
    }

    public long getId() {
        return id;
    }

    public long getActorId() {
        return actorId;
    }

    public String getAction() {
        return action;
    }

    public String getEntityType() {
        return entityType;
    }

    public Long getEntityId() {
        return entityId;
    }

    public String getDescription() {
        return description;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
