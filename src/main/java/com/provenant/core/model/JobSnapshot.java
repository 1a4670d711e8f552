package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a build job as returned by {@code status(jobId)}.
 */
public record JobSnapshot(
    BuildJob job,
    JobStatus status,
    RejectionReason reason,
    @JsonProperty("builder_results") List<BuilderResult> builderResults,
    @JsonProperty("verification_decision") VerificationDecision decision,
    @JsonProperty("updated_at") Instant updatedAt
) implements Serializable {

    public JobSnapshot {
        builderResults = builderResults != null ? List.copyOf(builderResults) : List.of();
    }
}
