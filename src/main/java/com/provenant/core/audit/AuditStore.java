package com.provenant.core.audit;

import com.provenant.core.model.AuditEntry;

import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence for audit entries. Implementations never update or delete rows;
 * {@link AuditLog} is the only writer.
 */
public interface AuditStore {

    /** The entry with the highest sequence, if any. */
    Optional<AuditEntry> last();

    /** Persists {@code entry}; its sequence must be exactly one past {@link #last()}. */
    void insert(AuditEntry entry);

    /** Entries with {@code fromSeq <= sequence <= toSeq}, ordered by sequence. */
    List<AuditEntry> range(long fromSeq, long toSeq);

    Optional<AuditEntry> get(long sequence);

    List<AuditEntry> byEntity(String entityType, String entityId);

    /** Entries whose event was routed to {@code jobId}, ordered by sequence. */
    List<AuditEntry> byJob(String jobId);
}
