package com.provenant.core.audit;

import com.provenant.core.events.EventBus;
import com.provenant.core.metrics.ProvenantMetrics;
import com.provenant.core.model.AuditEntry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the audit log against H2 so tampering can be done the way it would happen in
 * production: with an UPDATE issued behind the application's back.
 */
class JdbcAuditStoreTest {

    private JdbcDataSource dataSource;
    private JdbcAuditStore store;
    private AuditLog auditLog;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:audit-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        store = new JdbcAuditStore(dataSource);
        store.createTables();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00.123Z"), ZoneOffset.UTC);
        auditLog = new AuditLog(store, new EventBus(), new ProvenantMetrics(new SimpleMeterRegistry()), clock);
    }

    @Test
    @DisplayName("entries read back exactly as written")
    void roundTripsEntries() {
        AuditEntry written = auditLog.append(AuditEvent.forJob("job-1", "job.submitted",
                Map.of("application_id", "dk.digst.mitid", "n", "3")));

        AuditEntry read = store.get(0).orElseThrow();
        assertEquals(written, read);
        assertEquals(written, store.last().orElseThrow());
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() throws Exception {
        auditLog.append(AuditEvent.forJob("job-1", "job.submitted", Map.of()));
        store.createTables();

        assertEquals(1, store.range(0, 10).size());
    }

    @Test
    @DisplayName("job and entity lookups use the stored columns")
    void lookups() {
        auditLog.append(AuditEvent.forJob("job-1", "job.submitted", Map.of()));
        auditLog.append(AuditEvent.forSigningRequest("sr-1", "job-1", "signing.opened", Map.of()));
        auditLog.append(AuditEvent.forJob("job-2", "job.submitted", Map.of()));

        assertEquals(2, store.byJob("job-1").size());
        assertEquals(1, store.byEntity(AuditEvent.SIGNING_REQUEST, "sr-1").size());
    }

    @Test
    @DisplayName("a second entry at the same sequence is rejected by the primary key")
    void duplicateSequenceRejected() {
        AuditEntry first = auditLog.append(AuditEvent.forJob("job-1", "job.submitted", Map.of()));

        assertThrows(RuntimeException.class, () -> store.insert(first));
    }

    @Test
    @DisplayName("an out-of-band UPDATE is detected by chain verification")
    void sqlTamperDetected() throws Exception {
        for (int i = 0; i < 4; i++) {
            auditLog.append(AuditEvent.forJob("job-1", "step." + i, Map.of("i", String.valueOf(i))));
        }
        assertTrue(auditLog.verifyChain(0, 3));

        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("UPDATE " + JdbcAuditStore.TABLE_NAME
                    + " SET payload = '{\"i\":\"9\",\"job_id\":\"job-1\"}' WHERE sequence = 1");
        }

        ChainVerification result = auditLog.inspectChain(0, 3);
        assertFalse(result.valid());
        assertEquals(1L, result.firstBrokenSequence());
    }

    @Test
    @DisplayName("a deleted row is reported as missing")
    void deletedRowDetected() throws Exception {
        for (int i = 0; i < 3; i++) {
            auditLog.append(AuditEvent.forJob("job-1", "step." + i, Map.of()));
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM " + JdbcAuditStore.TABLE_NAME + " WHERE sequence = 1");
        }

        ChainVerification result = auditLog.inspectChain(0, 2);
        assertFalse(result.valid());
        assertEquals(1L, result.firstBrokenSequence());
        assertTrue(result.detail().contains("missing"));
    }
}
