package com.provenant.core.suspension;

import com.provenant.core.audit.AuditEvent;
import com.provenant.core.audit.AuditLog;
import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.metrics.ProvenantMetrics;
import com.provenant.core.model.SignedArtifact;
import com.provenant.core.model.SuspensionRecord;
import com.provenant.core.signing.ArtifactRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Emergency suspension of published artifacts or whole applications. Independent of the
 * publication quorum: a single valid authority token takes effect immediately.
 * <p>
 * Suspension state is keyed by artifact id (the digest) and application id, so rebuilding
 * the same source never clears it.
 */
@Service
public class SuspensionController {

    private static final Logger log = LoggerFactory.getLogger(SuspensionController.class);

    private final SuspensionStore store;
    private final SuspensionAuthorityService authority;
    private final ArtifactRegistry artifactRegistry;
    private final AuditLog auditLog;
    private final ProvenantMetrics metrics;
    private final Clock clock;

    public SuspensionController(SuspensionStore store, SuspensionAuthorityService authority,
                                ArtifactRegistry artifactRegistry, AuditLog auditLog,
                                ProvenantMetrics metrics, Clock clock) {
        this.store = store;
        this.authority = authority;
        this.artifactRegistry = artifactRegistry;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;
    }

    public SuspensionRecord suspend(SuspensionRecord.TargetType targetType, String targetId,
                                    String reason, String authorityToken) {
        String subject = authorize(targetType, targetId, authorityToken, SuspensionAuthorityService.SCOPE_APPLY);
        synchronized (this) {
            if (isActive(targetType, targetId)) {
                throw ProvenantException.conflict(targetType + " " + targetId + " is already suspended");
            }
            return record(targetType, targetId, SuspensionRecord.Action.SUSPEND, reason, subject);
        }
    }

    public SuspensionRecord lift(SuspensionRecord.TargetType targetType, String targetId,
                                 String reason, String authorityToken) {
        String subject = authorize(targetType, targetId, authorityToken, SuspensionAuthorityService.SCOPE_LIFT);
        synchronized (this) {
            if (!isActive(targetType, targetId)) {
                throw ProvenantException.conflict(targetType + " " + targetId + " is not suspended");
            }
            return record(targetType, targetId, SuspensionRecord.Action.LIFT, reason, subject);
        }
    }

    /**
     * True if the artifact itself, or the application it was published for, is suspended.
     */
    public boolean isSuspended(String artifactId) {
        if (isActive(SuspensionRecord.TargetType.ARTIFACT, artifactId)) {
            return true;
        }
        return artifactRegistry.find(artifactId)
                .map(SignedArtifact::applicationId)
                .map(app -> isActive(SuspensionRecord.TargetType.APPLICATION, app))
                .orElse(false);
    }

    public boolean isApplicationSuspended(String applicationId) {
        return isActive(SuspensionRecord.TargetType.APPLICATION, applicationId);
    }

    private boolean isActive(SuspensionRecord.TargetType targetType, String targetId) {
        return store.latest(targetType, targetId)
                .map(r -> r.action() == SuspensionRecord.Action.SUSPEND)
                .orElse(false);
    }

    private String authorize(SuspensionRecord.TargetType targetType, String targetId, String token, String scope) {
        if (targetId == null || targetId.isBlank()) {
            throw ProvenantException.invalid("Suspension target id is required");
        }
        try {
            return authority.validate(token, scope);
        } catch (ProvenantException e) {
            if (e.code() != ErrorCode.UNAUTHORIZED) {
                throw e;
            }
            log.warn("SECURITY: rejected {} request for {} {}: {}", scope, targetType, targetId, e.getMessage());
            metrics.recordSecurityEvent("suspension-rejected");
            auditLog.append(AuditEvent.of(AuditEvent.SUSPENSION, targetId, "suspension.rejected",
                    Map.of("target_type", targetType.name(), "scope", scope, "detail", e.getMessage())));
            throw e;
        }
    }

    private SuspensionRecord record(SuspensionRecord.TargetType targetType, String targetId,
                                    SuspensionRecord.Action action, String reason, String subject) {
        SuspensionRecord record = new SuspensionRecord("susp-" + UUID.randomUUID(), targetType, targetId,
                action, reason, subject, clock.instant().truncatedTo(ChronoUnit.MILLIS));
        store.append(record);
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("record_id", record.recordId());
        payload.put("target_type", targetType.name());
        payload.put("reason", reason != null ? reason : "");
        payload.put("authority", subject);
        String eventType = action == SuspensionRecord.Action.SUSPEND ? "suspension.applied" : "suspension.lifted";
        auditLog.append(AuditEvent.of(AuditEvent.SUSPENSION, targetId, eventType, payload));
        log.warn("{} {} {} by {}: {}", action, targetType, targetId, subject, reason);
        return record;
    }
}
