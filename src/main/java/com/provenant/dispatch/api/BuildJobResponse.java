package com.provenant.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.provenant.core.model.BuilderResult;
import com.provenant.core.model.JobSnapshot;
import com.provenant.core.model.SigningRequest;
import com.provenant.core.model.VerificationDecision;

import java.util.List;

/**
 * JSON response for GET /api/v1/build-jobs/{jobId}.
 *
 * @param auditSequences sequence numbers of the job's audit entries, in order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BuildJobResponse(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("application_id") String applicationId,
    String state,
    String reason,
    @JsonProperty("verification_decision") VerificationDecision verificationDecision,
    @JsonProperty("builder_results") List<BuilderResult> builderResults,
    @JsonProperty("signing_request") SigningRequest signingRequest,
    @JsonProperty("audit_sequences") List<Long> auditSequences
) {

    static BuildJobResponse from(JobSnapshot snapshot, SigningRequest signingRequest, List<Long> auditSequences) {
        return new BuildJobResponse(
                snapshot.job().jobId(),
                snapshot.job().applicationId(),
                snapshot.status().name(),
                snapshot.reason() != null ? snapshot.reason().name() : null,
                snapshot.decision(),
                snapshot.builderResults(),
                signingRequest,
                auditSequences);
    }
}
