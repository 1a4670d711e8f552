package com.provenant.core.build;

import com.provenant.core.model.SourceReference;

import java.util.Map;

/**
 * Input to {@link BuildOrchestrator#submit}.
 */
public record BuildJobRequest(
    String applicationId,
    SourceReference source,
    String recipeId,
    Map<String, String> recipeParameters,
    int n,
    int k
) {

    public BuildJobRequest {
        recipeParameters = recipeParameters != null ? Map.copyOf(recipeParameters) : Map.of();
    }
}
