package com.provenant.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.provenant.core.model.AuditEntry;
import com.provenant.core.storage.ArtifactDigests;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes audit entry hashes. The hashed form is the entry serialized as a JSON object
 * with sorted keys ({@code entity_id}, {@code entity_type}, {@code event_type},
 * {@code payload}, {@code previous_hash}, {@code recorded_at}, {@code sequence}), so no
 * field value can shift into its neighbour.
 */
public final class AuditHasher {

    public static final String GENESIS_PREVIOUS_HASH = "0".repeat(64);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private AuditHasher() {}

    public static String hash(long sequence, Instant recordedAt, String entityType, String entityId,
                              String eventType, Map<String, String> payload, String previousHash) {
        Map<String, Object> material = new TreeMap<>();
        material.put("sequence", sequence);
        material.put("recorded_at", recordedAt.toString());
        material.put("entity_type", entityType);
        material.put("entity_id", entityId);
        material.put("event_type", eventType);
        material.put("payload", new TreeMap<>(payload));
        material.put("previous_hash", previousHash);
        return ArtifactDigests.sha256Hex(serialize(material).getBytes(StandardCharsets.UTF_8));
    }

    public static String hash(AuditEntry entry) {
        return hash(entry.sequence(), entry.recordedAt(), entry.entityType(), entry.entityId(),
                entry.eventType(), entry.payload(), entry.previousHash());
    }

    public static String canonicalJson(Map<String, String> payload) {
        return serialize(new TreeMap<>(payload));
    }

    private static String serialize(Map<String, ?> value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit entry is not serializable", e);
        }
    }
}
