package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of one builder attempt for a job. Never mutated; a retry produces a new result
 * with a higher {@code attempt}.
 *
 * @param jobId        the job this attempt belongs to
 * @param builderId    builder node identity
 * @param attempt      0 for the first attempt, 1+ for retries
 * @param status       completion status
 * @param digest       {@code sha256:<hex>} of the produced artifact; null unless {@code SUCCESS}
 * @param artifactSize artifact size in bytes, or -1 when no artifact was produced
 * @param durationMs   wall-clock duration of the attempt
 * @param logRef       reference to the stored build log
 * @param sandboxId    the sandbox that ran the attempt
 * @param detail       short failure description; null on success
 * @param completedAt  when the attempt ended
 */
public record BuilderResult(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("builder_id") String builderId,
    int attempt,
    BuilderStatus status,
    String digest,
    @JsonProperty("artifact_size") long artifactSize,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("log_ref") String logRef,
    @JsonProperty("sandbox_id") String sandboxId,
    String detail,
    @JsonProperty("completed_at") Instant completedAt
) implements Serializable {

    @JsonIgnore
    public boolean isSuccess() {
        return status == BuilderStatus.SUCCESS && digest != null;
    }
}
