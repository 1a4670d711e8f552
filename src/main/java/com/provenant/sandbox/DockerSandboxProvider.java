package com.provenant.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based SandboxProvider. One instance talks to one builder node's Docker daemon.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>A fresh host output directory bind-mounted at the configured output path</li>
 *   <li>Recipe parameters and source coordinates as environment variables</li>
 *   <li>Memory and CPU limits from the BuildRequest</li>
 *   <li>Network mode {@code none}, or the egress-restricted mirror network when the
 *       recipe declares an allowlist</li>
 *   <li>Labels identifying the job, builder and attempt</li>
 * </ul>
 */
public class DockerSandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxProvider.class);

    static final String NO_NETWORK = "none";

    private final DockerClient dockerClient;
    private final String mirrorNetwork;
    private final String outputMount;

    public DockerSandboxProvider(DockerClient dockerClient, String mirrorNetwork, String outputMount) {
        this.dockerClient = dockerClient;
        this.mirrorNetwork = mirrorNetwork;
        this.outputMount = outputMount;
    }

    @Override
    public String openSandbox(BuildRequest request) {
        String containerName = "provenant-" + request.jobId() + "-" + request.builderId() + "-" + request.attempt();
        log.info("Opening sandbox {} for job {} on {} (image: {})",
                containerName, request.jobId(), request.builderId(), request.image());

        try {
            dockerClient.inspectImageCmd(request.image()).exec();
        } catch (NotFoundException e) {
            throw new SandboxException("Recipe image " + request.image() + " is not present on " + request.builderId(), e);
        }

        // A leftover container with this name can only come from a crashed earlier run
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (NotFoundException e) {
            log.trace("No stale container {}", containerName);
        }

        var envList = new ArrayList<String>();
        request.envVars().forEach((k, v) -> envList.add(k + "=" + v));
        envList.add("PROVENANT_OUTPUT_DIR=" + outputMount);
        if (request.needsNetwork()) {
            envList.add("PROVENANT_EGRESS_ALLOWLIST=" + String.join(",", request.allowlist()));
        }

        String networkMode = request.needsNetwork() ? mirrorNetwork : NO_NETWORK;
        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(request.outputDir().toAbsolutePath().toString(), new Volume(outputMount), AccessMode.rw))
                .withMemory((long) request.memoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) request.cpuCount())
                .withNetworkMode(networkMode)
                .withSecurityOpts(List.of("no-new-privileges"));

        var create = dockerClient.createContainerCmd(request.image())
                .withName(containerName)
                .withHostConfig(hostConfig)
                .withEnv(envList)
                .withLabels(Map.of(
                        "provenant.job", request.jobId(),
                        "provenant.builder", request.builderId(),
                        "provenant.attempt", String.valueOf(request.attempt())));
        if (!request.command().isEmpty()) {
            create = create.withCmd(request.command());
        }
        var response = create.exec();

        String containerId = response.getId();
        dockerClient.startContainerCmd(containerId).exec();
        log.info("Sandbox {} started (container {}, network {})", containerName, containerId, networkMode);
        return containerId;
    }

    @Override
    public int waitForCompletion(String sandboxId, int timeoutSeconds) {
        WaitContainerResultCallback callback;
        try {
            callback = dockerClient.waitContainerCmd(sandboxId).exec(new WaitContainerResultCallback());
        } catch (RuntimeException e) {
            throw new SandboxException("Cannot wait for sandbox " + sandboxId, e);
        }
        try {
            if (!callback.awaitCompletion(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new SandboxTimeoutException(sandboxId, timeoutSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while waiting for sandbox " + sandboxId, e);
        }
        Integer status = callback.awaitStatusCode();
        return status != null ? status : -1;
    }

    @Override
    public String captureOutput(String sandboxId) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(sandboxId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from sandbox {}", sandboxId);
        }
        return sb.toString();
    }

    @Override
    public void teardownSandbox(String sandboxId) {
        try {
            dockerClient.stopContainerCmd(sandboxId).withTimeout(5).exec();
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", sandboxId, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(sandboxId).withForce(true).withRemoveVolumes(true).exec();
            log.info("Sandbox {} torn down", sandboxId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", sandboxId, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (Exception e) {
            log.debug("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }
}
