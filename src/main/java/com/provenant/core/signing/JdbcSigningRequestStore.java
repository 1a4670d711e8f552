package com.provenant.core.signing;

import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import com.provenant.core.model.ArtifactSignature;
import com.provenant.core.model.AuthorizationDecision;
import com.provenant.core.model.AuthorizationRecord;
import com.provenant.core.model.SigningRequest;
import com.provenant.core.model.SigningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC-backed {@link SigningRequestStore}. One row per request holds its latest snapshot;
 * its votes live in a child table that is rewritten with every snapshot, in the same
 * transaction.
 */
public class JdbcSigningRequestStore implements SigningRequestStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSigningRequestStore.class);

    static final String REQUEST_TABLE = "provenant_signing_requests";
    static final String VOTE_TABLE = "provenant_authorizations";

    private static final String CREATE_REQUEST_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                request_id          VARCHAR(64)  NOT NULL PRIMARY KEY,
                job_id              VARCHAR(255) NOT NULL,
                decision_id         VARCHAR(64)  NOT NULL UNIQUE,
                digest              VARCHAR(80)  NOT NULL,
                application_id      VARCHAR(255) NOT NULL,
                key_id              VARCHAR(64)  NOT NULL,
                threshold           INT          NOT NULL,
                state               VARCHAR(32)  NOT NULL,
                deadline            BIGINT       NOT NULL,
                signature_algorithm VARCHAR(64),
                signature_value     TEXT,
                signed_at           BIGINT,
                failure_reason      TEXT,
                artifact_size       BIGINT       NOT NULL,
                created_at          BIGINT       NOT NULL,
                updated_at          BIGINT       NOT NULL
            )
            """.formatted(REQUEST_TABLE);

    private static final String CREATE_VOTE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                signing_request_id VARCHAR(64)  NOT NULL,
                authorizer_id      VARCHAR(128) NOT NULL,
                decision           VARCHAR(16)  NOT NULL,
                bound_digest       VARCHAR(80)  NOT NULL,
                proof              TEXT         NOT NULL,
                recorded_at        BIGINT       NOT NULL,
                PRIMARY KEY (signing_request_id, authorizer_id)
            )
            """.formatted(VOTE_TABLE);

    private static final String UPDATE_REQUEST_SQL = """
            UPDATE %s SET state = ?, signature_algorithm = ?, signature_value = ?, signed_at = ?,
                          failure_reason = ?, artifact_size = ?, updated_at = ?
            WHERE request_id = ?
            """.formatted(REQUEST_TABLE);

    private static final String INSERT_REQUEST_SQL = """
            INSERT INTO %s (state, signature_algorithm, signature_value, signed_at, failure_reason,
                            artifact_size, updated_at, request_id, job_id, decision_id, digest,
                            application_id, key_id, threshold, deadline, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(REQUEST_TABLE);

    private static final String DELETE_VOTES_SQL = """
            DELETE FROM %s WHERE signing_request_id = ?
            """.formatted(VOTE_TABLE);

    private static final String INSERT_VOTE_SQL = """
            INSERT INTO %s (signing_request_id, authorizer_id, decision, bound_digest, proof, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(VOTE_TABLE);

    private static final String SELECT_REQUESTS_SQL = """
            SELECT * FROM %s ORDER BY created_at ASC, request_id ASC
            """.formatted(REQUEST_TABLE);

    private static final String SELECT_VOTES_SQL = """
            SELECT * FROM %s ORDER BY recorded_at ASC, authorizer_id ASC
            """.formatted(VOTE_TABLE);

    private final DataSource dataSource;

    public JdbcSigningRequestStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_REQUEST_TABLE_SQL);
            stmt.execute(CREATE_VOTE_TABLE_SQL);
            log.info("Signing request tables '{}' and '{}' ensured", REQUEST_TABLE, VOTE_TABLE);
        }
    }

    @Override
    public void save(SigningRequest request, long artifactSize) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (update(conn, request, artifactSize) == 0) {
                    insert(conn, request, artifactSize);
                }
                replaceVotes(conn, request);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL,
                    "Failed to store signing request " + request.requestId(), e);
        }
    }

    @Override
    public List<StoredRequest> loadAll() {
        try (Connection conn = dataSource.getConnection()) {
            Map<String, List<AuthorizationRecord>> votes = loadVotes(conn);
            List<StoredRequest> requests = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_REQUESTS_SQL);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String requestId = rs.getString("request_id");
                    requests.add(new StoredRequest(
                            fromResultSet(rs, votes.getOrDefault(requestId, List.of())),
                            rs.getLong("artifact_size")));
                }
            }
            return requests;
        } catch (SQLException e) {
            throw new ProvenantException(ErrorCode.INTERNAL, "Failed to read signing requests", e);
        }
    }

    private int update(Connection conn, SigningRequest request, long artifactSize) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(UPDATE_REQUEST_SQL)) {
            bindMutable(stmt, request, artifactSize);
            stmt.setString(8, request.requestId());
            return stmt.executeUpdate();
        }
    }

    private void insert(Connection conn, SigningRequest request, long artifactSize) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_REQUEST_SQL)) {
            bindMutable(stmt, request, artifactSize);
            stmt.setString(8, request.requestId());
            stmt.setString(9, request.jobId());
            stmt.setString(10, request.decisionId());
            stmt.setString(11, request.digest());
            stmt.setString(12, request.applicationId());
            stmt.setString(13, request.keyId());
            stmt.setInt(14, request.threshold());
            stmt.setLong(15, request.deadline().toEpochMilli());
            stmt.setLong(16, request.createdAt().toEpochMilli());
            stmt.executeUpdate();
        }
    }

    /** Binds parameters 1 to 7, shared by the update and insert statements. */
    private static void bindMutable(PreparedStatement stmt, SigningRequest request, long artifactSize)
            throws SQLException {
        ArtifactSignature signature = request.signature();
        stmt.setString(1, request.state().name());
        stmt.setString(2, signature != null ? signature.algorithm() : null);
        stmt.setString(3, signature != null ? signature.value() : null);
        if (signature != null) {
            stmt.setLong(4, signature.signedAt().toEpochMilli());
        } else {
            stmt.setNull(4, Types.BIGINT);
        }
        stmt.setString(5, request.failureReason());
        stmt.setLong(6, artifactSize);
        stmt.setLong(7, request.updatedAt().toEpochMilli());
    }

    private void replaceVotes(Connection conn, SigningRequest request) throws SQLException {
        try (PreparedStatement delete = conn.prepareStatement(DELETE_VOTES_SQL)) {
            delete.setString(1, request.requestId());
            delete.executeUpdate();
        }
        if (request.authorizations().isEmpty()) {
            return;
        }
        try (PreparedStatement insert = conn.prepareStatement(INSERT_VOTE_SQL)) {
            for (AuthorizationRecord vote : request.authorizations()) {
                insert.setString(1, request.requestId());
                insert.setString(2, vote.authorizerId());
                insert.setString(3, vote.decision().name());
                insert.setString(4, vote.boundDigest());
                insert.setString(5, vote.proof());
                insert.setLong(6, vote.recordedAt().toEpochMilli());
                insert.addBatch();
            }
            insert.executeBatch();
        }
    }

    private Map<String, List<AuthorizationRecord>> loadVotes(Connection conn) throws SQLException {
        Map<String, List<AuthorizationRecord>> votes = new HashMap<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_VOTES_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String requestId = rs.getString("signing_request_id");
                votes.computeIfAbsent(requestId, id -> new ArrayList<>()).add(new AuthorizationRecord(
                        rs.getString("authorizer_id"),
                        AuthorizationDecision.valueOf(rs.getString("decision")),
                        rs.getString("bound_digest"),
                        requestId,
                        rs.getString("proof"),
                        Instant.ofEpochMilli(rs.getLong("recorded_at"))));
            }
        }
        return votes;
    }

    private static SigningRequest fromResultSet(ResultSet rs, List<AuthorizationRecord> votes) throws SQLException {
        String keyId = rs.getString("key_id");
        String digest = rs.getString("digest");
        String signatureValue = rs.getString("signature_value");
        ArtifactSignature signature = signatureValue == null ? null : new ArtifactSignature(
                keyId, rs.getString("signature_algorithm"), digest, signatureValue,
                Instant.ofEpochMilli(rs.getLong("signed_at")));
        return new SigningRequest(
                rs.getString("request_id"),
                rs.getString("job_id"),
                rs.getString("decision_id"),
                digest,
                rs.getString("application_id"),
                keyId,
                rs.getInt("threshold"),
                SigningState.valueOf(rs.getString("state")),
                votes,
                Instant.ofEpochMilli(rs.getLong("deadline")),
                signature,
                rs.getString("failure_reason"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }
}
