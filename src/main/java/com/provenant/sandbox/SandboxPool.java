package com.provenant.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The configured builder nodes. Hands out a fresh sandbox per attempt; nothing is reused
 * between attempts or jobs.
 */
public class SandboxPool {

    private static final Logger log = LoggerFactory.getLogger(SandboxPool.class);

    private final Map<String, BuilderNode> nodes = new LinkedHashMap<>();

    public SandboxPool(List<BuilderNode> nodes) {
        for (BuilderNode node : nodes) {
            if (this.nodes.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate builder node id " + node.id());
            }
        }
        log.info("Sandbox pool has {} builder node(s): {}", this.nodes.size(), this.nodes.keySet());
    }

    /**
     * Opens a new sandbox for {@code request} on the request's builder node. If opening
     * fails the output directory is removed before the exception propagates.
     */
    public SandboxLease acquire(BuildRequest request) {
        BuilderNode node = nodes.get(request.builderId());
        if (node == null) {
            throw new SandboxException("Unknown builder node " + request.builderId());
        }
        try {
            String sandboxId = node.provider().openSandbox(request);
            return new SandboxLease(node, sandboxId, request.outputDir());
        } catch (RuntimeException e) {
            SandboxLease.deleteRecursively(request.outputDir());
            throw e;
        }
    }

    public List<String> builderIds() {
        return List.copyOf(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /** Availability per builder node, for health checks. */
    public Map<String, Boolean> availability() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        nodes.forEach((id, node) -> result.put(id, node.provider().isAvailable()));
        return result;
    }
}
