package com.provenant.sandbox;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything a provider needs to start one builder attempt.
 *
 * @param jobId         build job
 * @param builderId     builder node running the attempt
 * @param attempt       0 for the first attempt, 1+ for retries
 * @param image         recipe image, ideally pinned by digest
 * @param command       recipe command; empty to use the image entrypoint
 * @param envVars       recipe parameters and source coordinates
 * @param outputDir     fresh host directory mounted at the sandbox's output path
 * @param allowlist     egress hosts; empty means no network at all
 * @param memoryLimitMb memory cap
 * @param cpuCount      CPU cap
 */
public record BuildRequest(
    String jobId,
    String builderId,
    int attempt,
    String image,
    List<String> command,
    Map<String, String> envVars,
    Path outputDir,
    List<String> allowlist,
    int memoryLimitMb,
    int cpuCount
) {

    public BuildRequest {
        command = command != null ? List.copyOf(command) : List.of();
        envVars = envVars != null ? Map.copyOf(envVars) : Map.of();
        allowlist = allowlist != null ? List.copyOf(allowlist) : List.of();
    }

    public boolean needsNetwork() {
        return !allowlist.isEmpty();
    }
}
