package com.provenant.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.provenant.core.build.BuildJobRequest;
import com.provenant.core.model.SourceReference;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/build-jobs.
 *
 * @param sourceSignerId  publisher who signed the revision; nullable for unsigned sources
 * @param sourceSignature base64 Ed25519 signature over {@code locator + "\n" + revision}
 */
public record BuildJobRequestBody(
    @JsonProperty("application_id") String applicationId,
    @JsonProperty("source_locator") String sourceLocator,
    @JsonProperty("source_revision") String sourceRevision,
    @JsonProperty("source_signer_id") String sourceSignerId,
    @JsonProperty("source_signature") String sourceSignature,
    @JsonProperty("recipe_id") String recipeId,
    @JsonProperty("recipe_parameters") Map<String, String> recipeParameters,
    int n,
    int k
) {

    BuildJobRequest toRequest() {
        return new BuildJobRequest(applicationId,
                new SourceReference(sourceLocator, sourceRevision, sourceSignerId, sourceSignature),
                recipeId, recipeParameters, n, k);
    }
}
