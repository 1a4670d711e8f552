package com.provenant.core.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactStoreTest {

    @TempDir
    Path root;

    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(root);
    }

    @Test
    @DisplayName("stores files under their sha256 digest")
    void contentAddressed() throws Exception {
        Path file = root.resolve("app.apk");
        Files.writeString(file, "apk-bytes");

        String digest = store.put(file);

        assertEquals(ArtifactDigests.of("apk-bytes".getBytes(StandardCharsets.UTF_8)), digest);
        assertTrue(store.contains(digest));
        assertEquals(9, store.size(digest));
        assertEquals("apk-bytes", Files.readString(store.locate(digest).orElseThrow()));
    }

    @Test
    @DisplayName("storing the same bytes twice is a no-op")
    void idempotentPut() {
        String first = store.put("same".getBytes(StandardCharsets.UTF_8));
        String second = store.put("same".getBytes(StandardCharsets.UTF_8));

        assertEquals(first, second);
        assertEquals(4, store.size(first));
    }

    @Test
    @DisplayName("unknown and malformed digests are not found")
    void missing() {
        assertTrue(store.locate("sha256:" + "0".repeat(64)).isEmpty());
        assertTrue(store.locate("../../etc/passwd").isEmpty());
        assertEquals(-1, store.size("nope"));
    }

    @Test
    @DisplayName("build logs are written per job, builder and attempt")
    void logs() {
        String ref = store.writeLog("job-1", "builder-a", 1, "gradle output");

        assertEquals("logs/job-1/builder-a-1.log", ref);
        assertEquals("gradle output", store.readLog(ref).orElseThrow());
        assertTrue(store.readLog("../outside.log").isEmpty());
    }

    @Test
    @DisplayName("work directories are unique and live under the store")
    void workDirectories() {
        Path a = store.newWorkDirectory("job-1-builder-a");
        Path b = store.newWorkDirectory("job-1-builder-a");

        assertNotEquals(a, b);
        assertTrue(Files.isDirectory(a));
        assertTrue(a.startsWith(store.root().resolve("work")));
    }

    @Test
    @DisplayName("digest helpers validate format")
    void digestFormat() {
        assertTrue(ArtifactDigests.isValid("sha256:" + "ab".repeat(32)));
        assertFalse(ArtifactDigests.isValid("sha256:" + "AB".repeat(32)));
        assertFalse(ArtifactDigests.isValid("sha1:abc"));
        assertThrows(IllegalArgumentException.class, () -> ArtifactDigests.hex("bogus"));
    }
}
