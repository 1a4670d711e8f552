package com.provenant.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * A running, single-use sandbox. Closing the lease tears the sandbox down and deletes its
 * output directory; use it in try-with-resources so that happens on every exit path.
 */
public class SandboxLease implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SandboxLease.class);

    private final BuilderNode node;
    private final String sandboxId;
    private final Path outputDir;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SandboxLease(BuilderNode node, String sandboxId, Path outputDir) {
        this.node = node;
        this.sandboxId = sandboxId;
        this.outputDir = outputDir;
    }

    public String sandboxId() {
        return sandboxId;
    }

    public String builderId() {
        return node.id();
    }

    public Path outputDir() {
        return outputDir;
    }

    /**
     * @see SandboxProvider#waitForCompletion(String, int)
     */
    public int awaitExit(int timeoutSeconds) {
        return node.provider().waitForCompletion(sandboxId, timeoutSeconds);
    }

    public String output() {
        return node.provider().captureOutput(sandboxId);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            node.provider().teardownSandbox(sandboxId);
        } catch (RuntimeException e) {
            log.warn("Teardown of sandbox {} on {} failed: {}", sandboxId, node.id(), e.getMessage(), e);
        }
        deleteRecursively(outputDir);
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean output directory {}: {}", dir, e.getMessage());
        }
    }
}
