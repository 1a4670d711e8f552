package com.provenant.core.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditHasherTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("moving a separator character between fields changes the hash")
    void fieldBoundariesAreUnambiguous() {
        String left = AuditHasher.hash(7, AT, "job", "job-1|builder", "completed", Map.of(),
                AuditHasher.GENESIS_PREVIOUS_HASH);
        String right = AuditHasher.hash(7, AT, "job", "job-1", "builder|completed", Map.of(),
                AuditHasher.GENESIS_PREVIOUS_HASH);

        assertNotEquals(left, right);
    }

    @Test
    @DisplayName("payload key order does not affect the hash")
    void payloadOrderIndependent() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("a", "1");
        first.put("b", "2");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("b", "2");
        second.put("a", "1");

        assertEquals(
                AuditHasher.hash(1, AT, "job", "job-1", "job.submitted", first, AuditHasher.GENESIS_PREVIOUS_HASH),
                AuditHasher.hash(1, AT, "job", "job-1", "job.submitted", second, AuditHasher.GENESIS_PREVIOUS_HASH));
    }

    @Test
    @DisplayName("the hash covers the sequence number and the previous hash")
    void coversSequenceAndLink() {
        String base = AuditHasher.hash(1, AT, "job", "job-1", "job.submitted", Map.of(), "a".repeat(64));

        assertNotEquals(base, AuditHasher.hash(2, AT, "job", "job-1", "job.submitted", Map.of(), "a".repeat(64)));
        assertNotEquals(base, AuditHasher.hash(1, AT, "job", "job-1", "job.submitted", Map.of(), "b".repeat(64)));
        assertEquals(64, base.length());
    }
}
