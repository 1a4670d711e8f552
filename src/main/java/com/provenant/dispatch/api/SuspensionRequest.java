package com.provenant.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for suspending or lifting. Exactly one of {@code artifactId} and
 * {@code applicationId} is set.
 */
public record SuspensionRequest(
    @JsonProperty("artifact_id") String artifactId,
    @JsonProperty("application_id") String applicationId,
    String reason,
    @JsonProperty("authority_token") String authorityToken
) {}
