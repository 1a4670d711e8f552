package com.provenant.core.signing;

import com.provenant.core.audit.AuditEvent;
import com.provenant.core.audit.AuditLog;
import com.provenant.core.model.SignedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Published records of signed artifacts, keyed by artifact id (the artifact's digest).
 * This is what the repository index publisher reads.
 */
@Service
public class ArtifactRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRegistry.class);

    private final ConcurrentHashMap<String, SignedArtifact> artifacts = new ConcurrentHashMap<>();
    private final AuditLog auditLog;

    public ArtifactRegistry(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    public void publish(SignedArtifact artifact) {
        SignedArtifact previous = artifacts.put(artifact.artifactId(), artifact);
        if (previous != null) {
            log.info("Artifact {} re-published by job {} (previously job {})",
                    artifact.artifactId(), artifact.jobId(), previous.jobId());
        }
        auditLog.append(new AuditEvent("artifact", artifact.artifactId(), "artifact.published", artifact.jobId(),
                Map.of("application_id", artifact.applicationId(),
                        "signing_request_id", artifact.signingRequestId(),
                        "key_id", artifact.signature().keyId(),
                        "size", String.valueOf(artifact.size()))));
    }

    public Optional<SignedArtifact> find(String artifactId) {
        return Optional.ofNullable(artifacts.get(artifactId));
    }

    public List<SignedArtifact> forApplication(String applicationId) {
        return artifacts.values().stream()
                .filter(a -> a.applicationId().equals(applicationId))
                .toList();
    }
}
