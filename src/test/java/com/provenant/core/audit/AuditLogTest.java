package com.provenant.core.audit;

import com.provenant.core.events.EventBus;
import com.provenant.core.events.ProvenantEvent;
import com.provenant.core.metrics.ProvenantMetrics;
import com.provenant.core.model.AuditEntry;
import com.provenant.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private TamperableStore store;
    private AuditLog auditLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        store = new TamperableStore();
        auditLog = new AuditLog(store, eventBus, new ProvenantMetrics(registry), clock);
    }

    private AuditEntry appendJobEvent(String jobId, String type) {
        clock.advance(Duration.ofSeconds(1));
        return auditLog.append(AuditEvent.forJob(jobId, type, Map.of("detail", type)));
    }

    @Nested
    @DisplayName("append")
    class AppendTests {

        @Test
        @DisplayName("first entry links to the genesis hash")
        void genesisEntry() {
            AuditEntry entry = appendJobEvent("job-1", "job.submitted");

            assertEquals(0, entry.sequence());
            assertEquals(AuditHasher.GENESIS_PREVIOUS_HASH, entry.previousHash());
            assertEquals(64, entry.hash().length());
        }

        @Test
        @DisplayName("each entry links to the hash of its predecessor")
        void entriesAreChained() {
            AuditEntry first = appendJobEvent("job-1", "job.submitted");
            AuditEntry second = appendJobEvent("job-1", "job.dispatched");

            assertEquals(1, second.sequence());
            assertEquals(first.hash(), second.previousHash());
            assertNotEquals(first.hash(), second.hash());
        }

        @Test
        @DisplayName("job id is carried in the payload and routed on the event bus")
        void jobIdRoutedToSubscribers() {
            List<ProvenantEvent> received = new ArrayList<>();
            eventBus.subscribe("job-7", received::add);

            AuditEntry entry = appendJobEvent("job-7", "job.submitted");
            appendJobEvent("job-8", "job.submitted");

            assertEquals("job-7", entry.payload().get(AuditLog.JOB_ID_KEY));
            assertEquals(1, received.size());
            assertEquals("job.submitted", received.get(0).eventType());
            assertEquals(0L, received.get(0).sequence());
            assertEquals(entry.hash(), received.get(0).hash());
            assertEquals("job-7", received.get(0).payload().get(AuditLog.JOB_ID_KEY));
        }

        @Test
        @DisplayName("concurrent appends produce a gapless valid chain")
        void concurrentAppends() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(200);
            for (int i = 0; i < 200; i++) {
                int n = i;
                pool.submit(() -> {
                    try {
                        auditLog.append(AuditEvent.forJob("job-" + (n % 5), "job.tick", Map.of("n", String.valueOf(n))));
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
            pool.shutdown();

            assertEquals(199, auditLog.head().orElseThrow().sequence());
            assertTrue(auditLog.verifyChain(0, 199));
        }

        @Test
        @DisplayName("appends are counted")
        void appendsCounted() {
            appendJobEvent("job-1", "job.submitted");
            appendJobEvent("job-1", "job.verified");

            assertEquals(2.0, registry.counter("provenant.audit.appends").count());
        }
    }

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("entriesForJob returns only that job's entries in order")
        void entriesForJob() {
            appendJobEvent("job-1", "job.submitted");
            appendJobEvent("job-2", "job.submitted");
            auditLog.append(AuditEvent.forSigningRequest("sr-1", "job-1", "signing.opened", Map.of()));

            List<AuditEntry> entries = auditLog.entriesForJob("job-1");
            assertEquals(List.of("job.submitted", "signing.opened"),
                    entries.stream().map(AuditEntry::eventType).toList());
        }

        @Test
        @DisplayName("entriesFor filters by entity type and id")
        void entriesForEntity() {
            auditLog.append(AuditEvent.of(AuditEvent.KEY, "key-1", "key.created", Map.of()));
            auditLog.append(AuditEvent.of(AuditEvent.KEY, "key-2", "key.created", Map.of()));
            auditLog.append(AuditEvent.of(AuditEvent.KEY, "key-1", "key.revoked", Map.of()));

            assertEquals(2, auditLog.entriesFor(AuditEvent.KEY, "key-1").size());
        }

        @Test
        @DisplayName("head is empty for a fresh log")
        void emptyHead() {
            assertTrue(auditLog.head().isEmpty());
        }
    }

    @Nested
    @DisplayName("verifyChain")
    class VerifyChainTests {

        @BeforeEach
        void fillChain() {
            for (int i = 0; i < 5; i++) {
                appendJobEvent("job-1", "step." + i);
            }
        }

        @Test
        @DisplayName("an untouched chain verifies")
        void intactChain() {
            ChainVerification result = auditLog.inspectChain(0, 4);

            assertTrue(result.valid());
            assertEquals(5, result.entriesChecked());
            assertNull(result.firstBrokenSequence());
        }

        @Test
        @DisplayName("a sub-range verifies against the entry before it")
        void subRange() {
            assertTrue(auditLog.verifyChain(2, 3));
        }

        @Test
        @DisplayName("a range past the head checks only existing entries")
        void rangePastHead() {
            ChainVerification result = auditLog.inspectChain(3, 100);

            assertTrue(result.valid());
            assertEquals(2, result.entriesChecked());
        }

        @Test
        @DisplayName("a modified payload breaks the chain at that entry")
        void tamperedPayload() {
            AuditEntry original = store.get(2).orElseThrow();
            store.replace(new AuditEntry(original.sequence(), original.entityType(), original.entityId(),
                    original.eventType(), Map.of("detail", "forged"), original.recordedAt(),
                    original.previousHash(), original.hash()));

            ChainVerification result = auditLog.inspectChain(0, 4);

            assertFalse(result.valid());
            assertEquals(2L, result.firstBrokenSequence());
            assertEquals(2, result.entriesChecked());
            assertEquals(1.0, registry.counter("provenant.audit.chain_breaks").count());
        }

        @Test
        @DisplayName("a recomputed hash still breaks the link to the next entry")
        void rehashedEntryBreaksSuccessor() {
            AuditEntry original = store.get(1).orElseThrow();
            Map<String, String> forged = Map.of("detail", "forged");
            String rehash = AuditHasher.hash(original.sequence(), original.recordedAt(), original.entityType(),
                    original.entityId(), original.eventType(), forged, original.previousHash());
            store.replace(new AuditEntry(original.sequence(), original.entityType(), original.entityId(),
                    original.eventType(), forged, original.recordedAt(), original.previousHash(), rehash));

            ChainVerification result = auditLog.inspectChain(0, 4);

            assertFalse(result.valid());
            assertEquals(2L, result.firstBrokenSequence());
        }

        @Test
        @DisplayName("invalid ranges are rejected")
        void invalidRange() {
            assertThrows(IllegalArgumentException.class, () -> auditLog.inspectChain(3, 1));
            assertThrows(IllegalArgumentException.class, () -> auditLog.inspectChain(-1, 1));
        }
    }

    /** In-memory store whose entries a test can overwrite, as an attacker with database access could. */
    static final class TamperableStore implements AuditStore {

        private final InMemoryAuditStore delegate = new InMemoryAuditStore();
        private final Map<Long, AuditEntry> overrides = new java.util.concurrent.ConcurrentHashMap<>();

        void replace(AuditEntry entry) {
            overrides.put(entry.sequence(), entry);
        }

        private AuditEntry view(AuditEntry entry) {
            return overrides.getOrDefault(entry.sequence(), entry);
        }

        @Override
        public Optional<AuditEntry> last() {
            return delegate.last().map(this::view);
        }

        @Override
        public void insert(AuditEntry entry) {
            delegate.insert(entry);
        }

        @Override
        public List<AuditEntry> range(long fromSeq, long toSeq) {
            return delegate.range(fromSeq, toSeq).stream().map(this::view).toList();
        }

        @Override
        public Optional<AuditEntry> get(long sequence) {
            return delegate.get(sequence).map(this::view);
        }

        @Override
        public List<AuditEntry> byEntity(String entityType, String entityId) {
            return delegate.byEntity(entityType, entityId);
        }

        @Override
        public List<AuditEntry> byJob(String jobId) {
            return delegate.byJob(jobId);
        }
    }
}
