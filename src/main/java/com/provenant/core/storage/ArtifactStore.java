package com.provenant.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;

/**
 * Content-addressed, write-once file store for builder outputs, plus the build logs
 * referenced by {@code BuilderResult.logRef}.
 *
 * <p>Layout under the configured root:
 * <ul>
 *   <li>{@code artifacts/<hex>}: artifact bytes keyed by their SHA-256</li>
 *   <li>{@code logs/<jobId>/<builderId>-<attempt>.log}: captured builder output</li>
 *   <li>{@code work/}: scratch directories handed to sandboxes as their output mount</li>
 * </ul>
 */
@Service
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final Path root;

    @Autowired
    public ArtifactStore(StorageProperties properties) {
        this(Path.of(properties.getRoot()));
    }

    public ArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root.resolve("artifacts"));
            Files.createDirectories(this.root.resolve("logs"));
            Files.createDirectories(this.root.resolve("work"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot initialise artifact store at " + this.root, e);
        }
    }

    /**
     * Hashes {@code file} and stores its bytes under the resulting digest. Storing the same
     * content twice is a no-op.
     *
     * @return the {@code sha256:} digest of the file
     */
    public String put(Path file) {
        String digest = ArtifactDigests.of(file);
        Path target = artifactPath(digest);
        if (Files.exists(target)) {
            return digest;
        }
        Path tmp = root.resolve("artifacts").resolve(".tmp-" + UUID.randomUUID());
        try {
            Files.copy(file, tmp);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store artifact " + digest, e);
        } finally {
            deleteQuietly(tmp);
        }
        log.debug("Stored artifact {} ({} bytes)", digest, size(digest));
        return digest;
    }

    public String put(byte[] bytes) {
        String digest = ArtifactDigests.of(bytes);
        Path target = artifactPath(digest);
        if (Files.exists(target)) {
            return digest;
        }
        Path tmp = root.resolve("artifacts").resolve(".tmp-" + UUID.randomUUID());
        try {
            Files.write(tmp, bytes);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store artifact " + digest, e);
        } finally {
            deleteQuietly(tmp);
        }
        return digest;
    }

    public Optional<Path> locate(String digest) {
        if (!ArtifactDigests.isValid(digest)) {
            return Optional.empty();
        }
        Path path = artifactPath(digest);
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    public boolean contains(String digest) {
        return locate(digest).isPresent();
    }

    public long size(String digest) {
        return locate(digest).map(p -> {
            try {
                return Files.size(p);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }).orElse(-1L);
    }

    /**
     * Writes a builder's captured output and returns its log reference.
     */
    public String writeLog(String jobId, String builderId, int attempt, String content) {
        String ref = "logs/" + safe(jobId) + "/" + safe(builderId) + "-" + attempt + ".log";
        Path path = root.resolve(ref);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content != null ? content : "", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write build log " + ref, e);
        }
        return ref;
    }

    public Optional<String> readLog(String logRef) {
        Path path = root.resolve(logRef).normalize();
        if (!path.startsWith(root.resolve("logs")) || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read build log " + logRef, e);
        }
    }

    /** Creates an empty, uniquely named scratch directory for one sandbox attempt. */
    public Path newWorkDirectory(String prefix) {
        try {
            return Files.createTempDirectory(root.resolve("work"), safe(prefix) + "-");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create work directory", e);
        }
    }

    public Path root() {
        return root;
    }

    private Path artifactPath(String digest) {
        return root.resolve("artifacts").resolve(ArtifactDigests.hex(digest));
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (FileAlreadyExistsException e) {
            // same content already stored by a concurrent writer
        } catch (AtomicMoveNotSupportedException e) {
            if (!Files.exists(target)) {
                Files.move(tmp, target);
            }
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
        }
    }

    private static String safe(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
