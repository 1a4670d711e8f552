package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A unit of reproducible-build work. Immutable once dispatched.
 *
 * @param jobId            unique job identifier
 * @param applicationId    package id of the application being built (e.g. {@code dk.digst.mitid})
 * @param source           pinned source reference
 * @param recipeId         build recipe identifier, resolved against the configured recipe catalog
 * @param recipeParameters parameters passed to the recipe as environment variables
 * @param n                number of independent builders to dispatch to
 * @param k                number of builders that must agree on the output digest
 * @param submittedAt      when the job was accepted
 */
public record BuildJob(
    @JsonProperty("job_id") String jobId,
    @JsonProperty("application_id") String applicationId,
    SourceReference source,
    @JsonProperty("recipe_id") String recipeId,
    @JsonProperty("recipe_parameters") Map<String, String> recipeParameters,
    int n,
    int k,
    @JsonProperty("submitted_at") Instant submittedAt
) implements Serializable {

    public BuildJob {
        recipeParameters = recipeParameters != null ? Map.copyOf(recipeParameters) : Map.of();
    }
}
