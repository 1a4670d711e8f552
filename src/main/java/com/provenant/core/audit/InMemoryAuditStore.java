package com.provenant.core.audit;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.AuditEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Volatile {@link AuditStore} used when no DataSource is configured. The list index is
 * the sequence number.
 */
public class InMemoryAuditStore implements AuditStore {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public synchronized Optional<AuditEntry> last() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    @Override
    public synchronized void insert(AuditEntry entry) {
        if (entry.sequence() != entries.size()) {
            throw new ProvenantException(ErrorCode.CONFLICT,
                    "Audit sequence " + entry.sequence() + " does not follow " + (entries.size() - 1));
        }
        entries.add(entry);
    }

    @Override
    public synchronized List<AuditEntry> range(long fromSeq, long toSeq) {
        if (fromSeq < 0 || fromSeq > toSeq || fromSeq >= entries.size()) {
            return List.of();
        }
        int end = (int) Math.min(toSeq + 1, entries.size());
        return List.copyOf(entries.subList((int) fromSeq, end));
    }

    @Override
    public synchronized Optional<AuditEntry> get(long sequence) {
        if (sequence < 0 || sequence >= entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get((int) sequence));
    }

    @Override
    public synchronized List<AuditEntry> byEntity(String entityType, String entityId) {
        return entries.stream()
                .filter(e -> e.entityType().equals(entityType) && e.entityId().equals(entityId))
                .toList();
    }

    @Override
    public synchronized List<AuditEntry> byJob(String jobId) {
        return entries.stream()
                .filter(e -> jobId.equals(e.payload().get(AuditLog.JOB_ID_KEY)))
                .toList();
    }
}
