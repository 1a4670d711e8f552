package com.provenant.core.suspension;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.SuspensionRecord;
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
import java.util.Objects;
import java.util.Optional;

public class JdbcSuspensionStore implements SuspensionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSuspensionStore.class);

    private static final String TABLE_NAME = "provenant_suspensions";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                record_id   VARCHAR(64)  NOT NULL UNIQUE,
                target_type VARCHAR(16)  NOT NULL,
                target_id   VARCHAR(255) NOT NULL,
                action      VARCHAR(16)  NOT NULL,
                reason      TEXT,
                authority   VARCHAR(255) NOT NULL,
                recorded_at BIGINT       NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (record_id, target_type, target_id, action, reason, authority, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_HISTORY_SQL = """
            SELECT record_id, target_type, target_id, action, reason, authority, recorded_at
            FROM %s
            WHERE target_type = ? AND target_id = ?
            ORDER BY id ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT record_id, target_type, target_id, action, reason, authority, recorded_at
            FROM %s
            WHERE target_type = ? AND target_id = ?
            ORDER BY id DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcSuspensionStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Suspension table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void append(SuspensionRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, record.recordId());
            stmt.setString(2, record.targetType().name());
            stmt.setString(3, record.targetId());
            stmt.setString(4, record.action().name());
            stmt.setString(5, record.reason());
            stmt.setString(6, record.authority());
            stmt.setLong(7, record.recordedAt().toEpochMilli());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL, "Failed to store suspension " + record.recordId(), e);
        }
    }

    @Override
    public Optional<SuspensionRecord> latest(SuspensionRecord.TargetType targetType, String targetId) {
        List<SuspensionRecord> rows = query(SELECT_LATEST_SQL, targetType, targetId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<SuspensionRecord> history(SuspensionRecord.TargetType targetType, String targetId) {
        return query(SELECT_HISTORY_SQL, targetType, targetId);
    }

    private List<SuspensionRecord> query(String sql, SuspensionRecord.TargetType targetType, String targetId) {
        List<SuspensionRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, targetType.name());
            stmt.setString(2, targetId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(new SuspensionRecord(
                            rs.getString("record_id"),
                            SuspensionRecord.TargetType.valueOf(rs.getString("target_type")),
                            rs.getString("target_id"),
                            SuspensionRecord.Action.valueOf(rs.getString("action")),
                            rs.getString("reason"),
                            rs.getString("authority"),
                            Instant.ofEpochMilli(rs.getLong("recorded_at"))));
                }
            }
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL, "Failed to read suspensions", e);
        }
        return records;
    }
}
