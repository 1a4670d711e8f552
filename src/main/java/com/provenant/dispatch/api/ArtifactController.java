package com.provenant.dispatch.api;

import com.provenant.core.error.ProvenantException;
import com.provenant.core.keys.KeyHierarchyManager;
import com.provenant.core.model.SignedArtifact;
import com.provenant.core.signing.ArtifactRegistry;
import com.provenant.core.suspension.SuspensionController;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Published artifact records, read by the repository index publisher.
 */
@RestController
@RequestMapping("/api/v1/artifacts")
public class ArtifactController {

    private final ArtifactRegistry registry;
    private final SuspensionController suspensions;
    private final KeyHierarchyManager keyManager;

    public ArtifactController(ArtifactRegistry registry, SuspensionController suspensions,
                              KeyHierarchyManager keyManager) {
        this.registry = registry;
        this.suspensions = suspensions;
        this.keyManager = keyManager;
    }

    @GetMapping("/{artifactId}")
    public Map<String, Object> get(@PathVariable String artifactId) {
        SignedArtifact artifact = find(artifactId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("artifact", artifact);
        result.put("suspended", suspensions.isSuspended(artifactId));
        return result;
    }

    /**
     * Checks the published signature against the signing key's public material. Revocation
     * does not affect the answer; it only stops new signatures.
     */
    @GetMapping("/{artifactId}/verification")
    public Map<String, Object> verifySignature(@PathVariable String artifactId) {
        SignedArtifact artifact = find(artifactId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("artifact_id", artifactId);
        result.put("key_id", artifact.signature().keyId());
        result.put("valid", keyManager.verify(artifact.signature(), artifact.artifactId()));
        return result;
    }

    @GetMapping("/applications/{applicationId}")
    public List<SignedArtifact> forApplication(@PathVariable String applicationId) {
        return registry.forApplication(applicationId);
    }

    private SignedArtifact find(String artifactId) {
        return registry.find(artifactId).orElseThrow(() -> ProvenantException.notFound("Artifact", artifactId));
    }
}
