package com.provenant.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link AuditStore}. The table is append-only: this class issues no UPDATE
 * or DELETE statements, and the primary key on {@code sequence} rejects a second writer
 * racing for the same position.
 */
public class JdbcAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditStore.class);

    static final String TABLE_NAME = "provenant_audit_log";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                sequence      BIGINT       NOT NULL PRIMARY KEY,
                entity_type   VARCHAR(64)  NOT NULL,
                entity_id     VARCHAR(255) NOT NULL,
                event_type    VARCHAR(128) NOT NULL,
                job_id        VARCHAR(255),
                payload       TEXT         NOT NULL,
                recorded_at   BIGINT       NOT NULL,
                previous_hash CHAR(64)     NOT NULL,
                hash          CHAR(64)     NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (sequence, entity_type, entity_id, event_type, job_id, payload,
                            recorded_at, previous_hash, hash)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String COLUMNS =
            "sequence, entity_type, entity_id, event_type, payload, recorded_at, previous_hash, hash";

    private static final String SELECT_LAST_SQL = """
            SELECT %s FROM %s ORDER BY sequence DESC LIMIT 1
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_RANGE_SQL = """
            SELECT %s FROM %s WHERE sequence BETWEEN ? AND ? ORDER BY sequence ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ONE_SQL = """
            SELECT %s FROM %s WHERE sequence = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_ENTITY_SQL = """
            SELECT %s FROM %s WHERE entity_type = ? AND entity_id = ? ORDER BY sequence ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_JOB_SQL = """
            SELECT %s FROM %s WHERE job_id = ? ORDER BY sequence ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final TypeReference<Map<String, String>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcAuditStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the audit table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Audit table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<AuditEntry> last() {
        List<AuditEntry> rows = query(SELECT_LAST_SQL);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void insert(AuditEntry entry) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setLong(1, entry.sequence());
            stmt.setString(2, entry.entityType());
            stmt.setString(3, entry.entityId());
            stmt.setString(4, entry.eventType());
            stmt.setString(5, entry.payload().get(AuditLog.JOB_ID_KEY));
            stmt.setString(6, AuditHasher.canonicalJson(entry.payload()));
            stmt.setLong(7, entry.recordedAt().toEpochMilli());
            stmt.setString(8, entry.previousHash());
            stmt.setString(9, entry.hash());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL,
                    "Failed to append audit entry " + entry.sequence(), e);
        }
    }

    @Override
    public List<AuditEntry> range(long fromSeq, long toSeq) {
        return query(SELECT_RANGE_SQL, fromSeq, toSeq);
    }

    @Override
    public Optional<AuditEntry> get(long sequence) {
        List<AuditEntry> rows = query(SELECT_ONE_SQL, sequence);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<AuditEntry> byEntity(String entityType, String entityId) {
        return query(SELECT_BY_ENTITY_SQL, entityType, entityId);
    }

    @Override
    public List<AuditEntry> byJob(String jobId) {
        return query(SELECT_BY_JOB_SQL, jobId);
    }

    private List<AuditEntry> query(String sql, Object... params) {
        List<AuditEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL, "Failed to read audit log", e);
        }
        return entries;
    }

    private AuditEntry fromResultSet(ResultSet rs) throws SQLException {
        Map<String, String> payload;
        try {
            payload = objectMapper.readValue(rs.getString("payload"), PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt audit payload at sequence " + rs.getLong("sequence"), e);
        }
        return new AuditEntry(
                rs.getLong("sequence"),
                rs.getString("entity_type"),
                rs.getString("entity_id"),
                rs.getString("event_type"),
                payload,
                Instant.ofEpochMilli(rs.getLong("recorded_at")),
                rs.getString("previous_hash").trim(),
                rs.getString("hash").trim());
    }
}
