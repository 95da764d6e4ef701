package io.meetflow.jdbc.store;

import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.JdbcTemplate;
import io.meetflow.jdbc.TableNames;
import io.meetflow.model.DeadLetter;
import io.meetflow.model.FailureHistoryEntry;
import io.meetflow.model.Platform;
import io.meetflow.model.RetryableStep;
import io.meetflow.spi.DeadLetterStore;
import io.meetflow.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link DeadLetterStore}. {@code webhook_failure_id} is unique, so a failure is promoted
 * at most once.
 */
public final class JdbcDeadLetterStore extends AbstractJdbcStore implements DeadLetterStore {
    private static final String COLUMNS = "id, webhook_failure_id, platform, event_type, step, reference_id, "
        + "payload, last_error, total_attempts, failure_history, alert_sent, resolved, resolved_at, "
        + "resolution_notes, created_at";

    private final JdbcTemplate.RowMapper<DeadLetter> rowMapper = this::map;

    public JdbcDeadLetterStore(Dialect dialect, TableNames tables, JsonCodec jsonCodec) {
        super(dialect, tables, jsonCodec);
    }

    private String table() {
        return tables().deadLetters();
    }

    @Override
    public void insert(Connection conn, DeadLetter deadLetter) {
        JdbcTemplate.update(conn,
            "INSERT INTO " + table() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
            deadLetter.id(), deadLetter.webhookFailureId(), deadLetter.platform().code(), deadLetter.eventType(),
            deadLetter.step().code(), deadLetter.referenceId(), deadLetter.payloadJson(),
            truncateError(deadLetter.error()), deadLetter.totalAttempts(),
            jsonCodec().toJson(deadLetter.failureHistory()), deadLetter.alertSent(), deadLetter.resolved(),
            deadLetter.resolvedAt(), deadLetter.resolutionNotes(), deadLetter.createdAt());
    }

    @Override
    public Optional<DeadLetter> findById(Connection conn, String id) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE id=?", rowMapper, id);
    }

    @Override
    public Optional<DeadLetter> findByFailureId(Connection conn, String webhookFailureId) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE webhook_failure_id=?", rowMapper, webhookFailureId);
    }

    @Override
    public List<DeadLetter> findUnresolved(Connection conn, int limit) {
        return JdbcTemplate.query(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE resolved=FALSE ORDER BY created_at, id LIMIT ?",
            rowMapper, limit);
    }

    @Override
    public List<DeadLetter> findPendingAlerts(Connection conn, int limit) {
        return JdbcTemplate.query(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE alert_sent=FALSE ORDER BY created_at, id LIMIT ?",
            rowMapper, limit);
    }

    @Override
    public int markAlertSent(Connection conn, String id) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET alert_sent=TRUE WHERE id=? AND alert_sent=FALSE", id);
    }

    @Override
    public int resolve(Connection conn, String id, String notes, Instant resolvedAt) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET resolved=TRUE, resolved_at=?, resolution_notes=? "
                + "WHERE id=? AND resolved=FALSE",
            resolvedAt, notes, id);
    }

    @Override
    public long countUnresolved(Connection conn) {
        return JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + table() + " WHERE resolved=FALSE");
    }

    private DeadLetter map(ResultSet rs) throws SQLException {
        return new DeadLetter(
            rs.getString("id"),
            rs.getString("webhook_failure_id"),
            Platform.fromCode(rs.getString("platform")),
            rs.getString("event_type"),
            RetryableStep.fromCode(rs.getString("step")),
            rs.getString("reference_id"),
            rs.getString("payload"),
            rs.getString("last_error"),
            rs.getInt("total_attempts"),
            jsonCodec().parseList(rs.getString("failure_history"), FailureHistoryEntry.class),
            rs.getBoolean("alert_sent"),
            rs.getBoolean("resolved"),
            JdbcTemplate.instant(rs, "resolved_at"),
            rs.getString("resolution_notes"),
            JdbcTemplate.instant(rs, "created_at"));
    }
}
