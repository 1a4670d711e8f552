package com.provenant.sandbox;

/**
 * Abstraction for ephemeral build sandboxes on one builder node.
 * Implementations: {@link DockerSandboxProvider}.
 */
public interface SandboxProvider {

    /**
     * Creates and starts a fresh, single-use sandbox.
     * @return the sandbox ID
     */
    String openSandbox(BuildRequest request);

    /**
     * Blocks until the sandbox exits.
     * @return the exit code (0 = success)
     * @throws SandboxTimeoutException if the sandbox is still running after {@code timeoutSeconds}
     * @throws SandboxException if waiting is interrupted or fails
     */
    int waitForCompletion(String sandboxId, int timeoutSeconds);

    /**
     * Captures stdout/stderr logs from the sandbox.
     */
    String captureOutput(String sandboxId);

    /**
     * Stops and removes the sandbox. Safe to call more than once.
     */
    void teardownSandbox(String sandboxId);

    /** Cheap liveness probe for health checks. */
    default boolean isAvailable() {
        return true;
    }
}
