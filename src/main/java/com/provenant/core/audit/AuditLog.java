package com.provenant.core.audit;

import com.provenant.core.events.EventBus;
import com.provenant.core.events.ProvenantEvent;
import com.provenant.core.metrics.ProvenantMetrics;
import com.provenant.core.model.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, hash-chained audit log. Every state transition of a tracked entity is
 * appended here exactly once.
 * <p>
 * Appends are serialized by a single lock held only while the tail is read, the next
 * hash computed and the entry inserted. Entries are published on the {@link EventBus}
 * after the lock is released.
 */
@Service
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    /** Payload key carrying the build job an entry belongs to. */
    public static final String JOB_ID_KEY = "job_id";

    private final AuditStore store;
    private final EventBus eventBus;
    private final ProvenantMetrics metrics;
    private final Clock clock;
    private final ReentrantLock appendLock = new ReentrantLock();

    public AuditLog(AuditStore store, EventBus eventBus, ProvenantMetrics metrics, Clock clock) {
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Appends {@code event} to the chain.
     *
     * @return the persisted entry with its sequence and hash
     */
    public AuditEntry append(AuditEvent event) {
        Map<String, String> payload = new HashMap<>(event.payload());
        if (event.jobId() != null) {
            payload.put(JOB_ID_KEY, event.jobId());
        }

        AuditEntry entry;
        appendLock.lock();
        try {
            Optional<AuditEntry> tail = store.last();
            long sequence = tail.map(e -> e.sequence() + 1).orElse(0L);
            String previousHash = tail.map(AuditEntry::hash).orElse(AuditHasher.GENESIS_PREVIOUS_HASH);
            Instant recordedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
            String hash = AuditHasher.hash(sequence, recordedAt, event.entityType(), event.entityId(),
                    event.eventType(), payload, previousHash);
            entry = new AuditEntry(sequence, event.entityType(), event.entityId(), event.eventType(),
                    payload, recordedAt, previousHash, hash);
            store.insert(entry);
        } finally {
            appendLock.unlock();
        }

        metrics.recordAuditAppend();
        log.debug("Audit #{} {} {} {}", entry.sequence(), entry.eventType(), entry.entityType(), entry.entityId());
        publish(entry, event.jobId());
        return entry;
    }

    public boolean verifyChain(long fromSeq, long toSeq) {
        return inspectChain(fromSeq, toSeq).valid();
    }

    /**
     * Recomputes every hash in {@code [fromSeq, toSeq]} and checks linkage to the entry
     * before it. Stops at the first broken entry. Never repairs anything.
     */
    public ChainVerification inspectChain(long fromSeq, long toSeq) {
        if (fromSeq < 0 || toSeq < fromSeq) {
            throw new IllegalArgumentException("Invalid audit range [" + fromSeq + ", " + toSeq + "]");
        }
        long head = head().map(AuditEntry::sequence).orElse(-1L);
        long end = Math.min(toSeq, head);
        if (fromSeq > end) {
            return ChainVerification.ok(0);
        }

        String expectedPrevious;
        if (fromSeq == 0) {
            expectedPrevious = AuditHasher.GENESIS_PREVIOUS_HASH;
        } else {
            Optional<AuditEntry> before = store.get(fromSeq - 1);
            if (before.isEmpty()) {
                return reportBreak(ChainVerification.broken(0, fromSeq - 1,
                        "Entry " + (fromSeq - 1) + " is missing"));
            }
            expectedPrevious = before.get().hash();
        }

        List<AuditEntry> entries = store.range(fromSeq, end);
        long expectedSequence = fromSeq;
        long checked = 0;
        for (AuditEntry entry : entries) {
            if (entry.sequence() != expectedSequence) {
                return reportBreak(ChainVerification.broken(checked, expectedSequence,
                        "Entry " + expectedSequence + " is missing"));
            }
            if (!entry.previousHash().equals(expectedPrevious)) {
                return reportBreak(ChainVerification.broken(checked, entry.sequence(),
                        "Entry " + entry.sequence() + " does not link to its predecessor"));
            }
            if (!AuditHasher.hash(entry).equals(entry.hash())) {
                return reportBreak(ChainVerification.broken(checked, entry.sequence(),
                        "Entry " + entry.sequence() + " hash does not match its contents"));
            }
            expectedPrevious = entry.hash();
            expectedSequence++;
            checked++;
        }
        if (expectedSequence <= end) {
            return reportBreak(ChainVerification.broken(checked, expectedSequence,
                    "Entry " + expectedSequence + " is missing"));
        }
        return ChainVerification.ok(checked);
    }

    public List<AuditEntry> range(long fromSeq, long toSeq) {
        return store.range(fromSeq, toSeq);
    }

    public List<AuditEntry> entriesFor(String entityType, String entityId) {
        return store.byEntity(entityType, entityId);
    }

    public List<AuditEntry> entriesForJob(String jobId) {
        return store.byJob(jobId);
    }

    public Optional<AuditEntry> head() {
        return store.last();
    }

    /**
     * Verifies the whole chain once the application is up. A broken chain is reported,
     * not repaired; the service keeps running so operators can inspect it.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void verifyAtStartup() {
        long head = head().map(AuditEntry::sequence).orElse(-1L);
        if (head < 0) {
            log.info("Audit log is empty");
            return;
        }
        ChainVerification result = inspectChain(0, head);
        if (result.valid()) {
            log.info("Audit chain verified: {} entries", result.entriesChecked());
        }
    }

    private ChainVerification reportBreak(ChainVerification result) {
        log.error("AUDIT CHAIN BROKEN at sequence {}: {}", result.firstBrokenSequence(), result.detail());
        metrics.recordChainBreak();
        return result;
    }

    private void publish(AuditEntry entry, String jobId) {
        eventBus.publish(ProvenantEvent.audited(entry, jobId));
    }
}
