package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * The verification engine's verdict for a job. Immutable once produced and referenced by
 * at most one signing request.
 */
public record VerificationDecision(
    @JsonProperty("decision_id") String decisionId,
    @JsonProperty("job_id") String jobId,
    VerificationOutcome outcome,
    @JsonProperty("winning_digest") String winningDigest,
    @JsonProperty("required_matches") int requiredMatches,
    List<BuilderResult> agreeing,
    List<BuilderResult> disagreeing,
    @JsonProperty("diff_reports") List<DiffReport> diffReports,
    @JsonProperty("decided_at") Instant decidedAt
) implements Serializable {

    public VerificationDecision {
        agreeing = agreeing != null ? List.copyOf(agreeing) : List.of();
        disagreeing = disagreeing != null ? List.copyOf(disagreeing) : List.of();
        diffReports = diffReports != null ? List.copyOf(diffReports) : List.of();
    }

    @JsonIgnore
    public boolean isConsensus() {
        return outcome == VerificationOutcome.CONSENSUS;
    }
}
