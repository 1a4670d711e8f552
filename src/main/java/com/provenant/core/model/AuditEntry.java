package com.provenant.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One write-once link in the audit hash chain.
 *
 * @param sequence     position in the chain; 0 is the genesis entry
 * @param entityType   kind of entity the transition belongs to ({@code build-job}, {@code signing-request}, ...)
 * @param entityId     the entity's id
 * @param eventType    the transition ({@code job.submitted}, {@code signing.signed}, ...)
 * @param payload      event context; serialized canonically (sorted keys) for hashing
 * @param recordedAt   append time, truncated to millis
 * @param previousHash hash of the entry at {@code sequence - 1}
 * @param hash         SHA-256 over this entry's fields and {@code previousHash}
 */
public record AuditEntry(
    long sequence,
    @JsonProperty("entity_type") String entityType,
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("event_type") String eventType,
    Map<String, String> payload,
    @JsonProperty("recorded_at") Instant recordedAt,
    @JsonProperty("previous_hash") String previousHash,
    String hash
) implements Serializable {

    public AuditEntry {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
