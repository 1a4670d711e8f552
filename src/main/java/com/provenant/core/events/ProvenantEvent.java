package com.provenant.core.events;

import com.provenant.core.model.AuditEntry;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something the followers of a build job should see.
 * <p>
 * Audited events mirror an {@link AuditEntry} and carry its {@code sequence} and
 * {@code hash}. Progress events that are never audited, such as {@code builder.started},
 * carry neither.
 *
 * @param jobId the build job this event relates to (null for key and suspension events)
 */
public record ProvenantEvent(
    String eventType,
    String entityType,
    String entityId,
    String jobId,
    Long sequence,
    String hash,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public ProvenantEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static ProvenantEvent audited(AuditEntry entry, String jobId) {
        return new ProvenantEvent(entry.eventType(), entry.entityType(), entry.entityId(), jobId,
                entry.sequence(), entry.hash(), new LinkedHashMap<>(entry.payload()), entry.recordedAt());
    }

    public static ProvenantEvent progress(String eventType, String entityType, String entityId, String jobId,
                                          Map<String, Object> payload, Instant timestamp) {
        return new ProvenantEvent(eventType, entityType, entityId, jobId, null, null, payload, timestamp);
    }

    public boolean isAudited() {
        return sequence != null;
    }
}
