package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * The published record of a signed artifact, read by the repository/index publisher.
 * The artifact id is its digest, so rebuilding identical bytes yields the same id.
 */
public record SignedArtifact(
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("application_id") String applicationId,
    @JsonProperty("job_id") String jobId,
    @JsonProperty("signing_request_id") String signingRequestId,
    long size,
    ArtifactSignature signature,
    @JsonProperty("published_at") Instant publishedAt
) implements Serializable {}
