package com.provenant.core.audit;

import java.util.Map;

/**
 * A state transition to be appended to the audit log.
 *
 * @param entityType kind of entity ({@link #BUILD_JOB}, {@link #SIGNING_REQUEST}, ...)
 * @param entityId   entity id
 * @param eventType  transition name, e.g. {@code job.submitted}
 * @param jobId      build job the transition belongs to, used to route live events; nullable
 * @param payload    event context
 */
public record AuditEvent(
    String entityType,
    String entityId,
    String eventType,
    String jobId,
    Map<String, String> payload
) {

    public static final String BUILD_JOB = "build-job";
    public static final String SIGNING_REQUEST = "signing-request";
    public static final String KEY = "key";
    public static final String SUSPENSION = "suspension";
    public static final String SECURITY = "security";

    public AuditEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static AuditEvent forJob(String jobId, String eventType, Map<String, String> payload) {
        return new AuditEvent(BUILD_JOB, jobId, eventType, jobId, payload);
    }

    public static AuditEvent forSigningRequest(String requestId, String jobId, String eventType,
                                               Map<String, String> payload) {
        return new AuditEvent(SIGNING_REQUEST, requestId, eventType, jobId, payload);
    }

    public static AuditEvent of(String entityType, String entityId, String eventType,
                                Map<String, String> payload) {
        return new AuditEvent(entityType, entityId, eventType, null, payload);
    }
}
