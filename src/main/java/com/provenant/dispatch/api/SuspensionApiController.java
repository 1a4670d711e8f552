package com.provenant.dispatch.api;

import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.SuspensionRecord;
import com.provenant.core.suspension.SuspensionController;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emergency suspension of published artifacts or whole applications.
 */
@RestController
@RequestMapping("/api/v1/suspensions")
public class SuspensionApiController {

    private final SuspensionController suspensions;

    public SuspensionApiController(SuspensionController suspensions) {
        this.suspensions = suspensions;
    }

    @PostMapping
    public SuspensionRecord suspend(@RequestBody SuspensionRequest body) {
        Target target = target(body);
        return suspensions.suspend(target.type(), target.id(), body.reason(), body.authorityToken());
    }

    @PostMapping("/lift")
    public SuspensionRecord lift(@RequestBody SuspensionRequest body) {
        Target target = target(body);
        return suspensions.lift(target.type(), target.id(), body.reason(), body.authorityToken());
    }

    @GetMapping("/{artifactId}")
    public Map<String, Object> status(@PathVariable String artifactId) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("artifact_id", artifactId);
        result.put("suspended", suspensions.isSuspended(artifactId));
        return result;
    }

    private static Target target(SuspensionRequest body) {
        boolean hasArtifact = body.artifactId() != null && !body.artifactId().isBlank();
        boolean hasApplication = body.applicationId() != null && !body.applicationId().isBlank();
        if (hasArtifact == hasApplication) {
            throw ProvenantException.invalid("Exactly one of artifact_id and application_id is required");
        }
        if (body.reason() == null || body.reason().isBlank()) {
            throw ProvenantException.invalid("reason is required");
        }
        return hasArtifact
                ? new Target(SuspensionRecord.TargetType.ARTIFACT, body.artifactId())
                : new Target(SuspensionRecord.TargetType.APPLICATION, body.applicationId());
    }

    private record Target(SuspensionRecord.TargetType type, String id) {}
}
