package at.sv.lock.api;

import java.util.Map;

public record AuditEvent(String action, String subjectType, String subjectId, String actor, String reason,
                         Map<String, Object> metadata) {

    public AuditEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
