package com.provenant.core.keys;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.KeyRecord;
import com.provenant.core.model.KeyRole;
import com.provenant.core.model.KeyState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link KeyRecordStore}. Stores public material and HSM handles only.
 */
public class JdbcKeyRecordStore implements KeyRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcKeyRecordStore.class);

    private static final String TABLE_NAME = "provenant_keys";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                key_id        VARCHAR(64)  NOT NULL PRIMARY KEY,
                role          VARCHAR(32)  NOT NULL,
                scope         VARCHAR(255) NOT NULL,
                hsm_handle    VARCHAR(255) NOT NULL,
                public_key    TEXT         NOT NULL,
                algorithm     VARCHAR(64)  NOT NULL,
                parent_key_id VARCHAR(64),
                created_at    BIGINT       NOT NULL,
                state         VARCHAR(16)  NOT NULL,
                revoked_at    BIGINT
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (key_id, role, scope, hsm_handle, public_key, algorithm,
                            parent_key_id, created_at, state, revoked_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String REVOKE_SQL = """
            UPDATE %s SET state = 'REVOKED', revoked_at = ?
            WHERE key_id = ? AND state = 'ACTIVE'
            """.formatted(TABLE_NAME);

    private static final String SELECT_ONE_SQL = """
            SELECT * FROM %s WHERE key_id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT * FROM %s ORDER BY created_at ASC, key_id ASC
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcKeyRecordStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Key table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void insert(KeyRecord key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, key.keyId());
            stmt.setString(2, key.role().name());
            stmt.setString(3, key.scope());
            stmt.setString(4, key.hsmHandle());
            stmt.setString(5, key.publicKey());
            stmt.setString(6, key.algorithm());
            stmt.setString(7, key.parentKeyId());
            stmt.setLong(8, key.createdAt().toEpochMilli());
            stmt.setString(9, key.state().name());
            if (key.revokedAt() != null) {
                stmt.setLong(10, key.revokedAt().toEpochMilli());
            } else {
                stmt.setNull(10, Types.BIGINT);
            }
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL, "Failed to store key " + key.keyId(), e);
        }
    }

    @Override
    public boolean markRevoked(KeyRecord revoked) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(REVOKE_SQL)) {
            stmt.setLong(1, revoked.revokedAt().toEpochMilli());
            stmt.setString(2, revoked.keyId());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL, "Failed to revoke key " + revoked.keyId(), e);
        }
    }

    @Override
    public Optional<KeyRecord> find(String keyId) {
        List<KeyRecord> rows = query(SELECT_ONE_SQL, keyId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<KeyRecord> findAll() {
        return query(SELECT_ALL_SQL);
    }

    private List<KeyRecord> query(String sql, String... params) {
        List<KeyRecord> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL, "Failed to read key records", e);
        }
        return keys;
    }

    private static KeyRecord fromResultSet(ResultSet rs) throws SQLException {
        long revokedAt = rs.getLong("revoked_at");
        boolean revokedNull = rs.wasNull();
        return new KeyRecord(
                rs.getString("key_id"),
                KeyRole.valueOf(rs.getString("role")),
                rs.getString("scope"),
                rs.getString("hsm_handle"),
                rs.getString("public_key"),
                rs.getString("algorithm"),
                rs.getString("parent_key_id"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                KeyState.valueOf(rs.getString("state")),
                revokedNull ? null : Instant.ofEpochMilli(revokedAt));
    }
}
