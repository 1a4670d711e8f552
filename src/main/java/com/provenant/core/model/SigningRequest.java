package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a signing request. Transitions produce new snapshots; see
 * {@code SigningRequestStateMachine}.
 */
public record SigningRequest(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("job_id") String jobId,
    @JsonProperty("decision_id") String decisionId,
    String digest,
    @JsonProperty("application_id") String applicationId,
    @JsonProperty("key_id") String keyId,
    int threshold,
    SigningState state,
    List<AuthorizationRecord> authorizations,
    Instant deadline,
    ArtifactSignature signature,
    @JsonProperty("failure_reason") String failureReason,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) implements Serializable {

    public SigningRequest {
        authorizations = authorizations != null ? List.copyOf(authorizations) : List.of();
    }

    @JsonProperty("quorum_state")
    public QuorumState quorumState() {
        return state.quorumState();
    }

    public long approvals() {
        return authorizations.stream()
                .filter(a -> a.decision() == AuthorizationDecision.APPROVE)
                .map(AuthorizationRecord::authorizerId)
                .distinct()
                .count();
    }
}
