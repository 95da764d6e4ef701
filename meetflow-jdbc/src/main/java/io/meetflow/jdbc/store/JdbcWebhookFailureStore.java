package io.meetflow.jdbc.store;

import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.JdbcTemplate;
import io.meetflow.jdbc.TableNames;
import io.meetflow.model.FailureHistoryEntry;
import io.meetflow.model.FailureStatus;
import io.meetflow.model.Platform;
import io.meetflow.model.RetryableStep;
import io.meetflow.model.WebhookFailure;
import io.meetflow.spi.WebhookFailureStore;
import io.meetflow.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link WebhookFailureStore}.
 *
 * <p>Claims and outcome writes are compare-and-set on {@code attempts} plus a retryable status,
 * so two workers never both record an outcome for the same attempt.
 */
public final class JdbcWebhookFailureStore extends AbstractJdbcStore implements WebhookFailureStore {
    private static final String COLUMNS = "id, platform, event_type, step, reference_id, payload, last_error, "
        + "attempts, max_attempts, next_retry_at, last_attempt_at, status, history, created_at, updated_at";
    private static final String RETRYABLE_STATUS_IN =
        "('" + FailureStatus.PENDING.code() + "','" + FailureStatus.RETRYING.code() + "')";

    private final JdbcTemplate.RowMapper<WebhookFailure> rowMapper = this::map;

    public JdbcWebhookFailureStore(Dialect dialect, TableNames tables, JsonCodec jsonCodec) {
        super(dialect, tables, jsonCodec);
    }

    private String table() {
        return tables().webhookFailures();
    }

    @Override
    public void insert(Connection conn, WebhookFailure failure) {
        JdbcTemplate.update(conn,
            "INSERT INTO " + table() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
            failure.id(), failure.platform().code(), failure.eventType(), failure.step().code(),
            failure.referenceId(), failure.payloadJson(), truncateError(failure.error()), failure.attempts(),
            failure.maxAttempts(), failure.nextRetryAt(), failure.lastAttemptAt(), failure.status().code(),
            jsonCodec().toJson(failure.history()), failure.createdAt(), failure.updatedAt());
    }

    @Override
    public Optional<WebhookFailure> findById(Connection conn, String id) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE id=?", rowMapper, id);
    }

    @Override
    public List<WebhookFailure> findDue(Connection conn, Instant now, int limit) {
        return JdbcTemplate.query(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE status IN " + RETRYABLE_STATUS_IN
                + " AND next_retry_at <= ? ORDER BY next_retry_at, created_at, id LIMIT ?",
            rowMapper, now, limit);
    }

    @Override
    public int claim(Connection conn, String id, int expectedAttempts, Instant now, Instant leaseUntil) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET status=?, next_retry_at=?, updated_at=? "
                + "WHERE id=? AND attempts=? AND status IN " + RETRYABLE_STATUS_IN + " AND next_retry_at <= ?",
            FailureStatus.RETRYING.code(), leaseUntil, now, id, expectedAttempts, now);
    }

    @Override
    public int update(Connection conn, WebhookFailure failure, int expectedAttempts) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET status=?, attempts=?, last_error=?, next_retry_at=?, last_attempt_at=?, "
                + "history=?, updated_at=? WHERE id=? AND attempts=? AND status IN " + RETRYABLE_STATUS_IN,
            failure.status().code(), failure.attempts(), truncateError(failure.error()), failure.nextRetryAt(),
            failure.lastAttemptAt(), jsonCodec().toJson(failure.history()), failure.updatedAt(),
            failure.id(), expectedAttempts);
    }

    @Override
    public List<StatusCount> countByPlatformAndStatus(Connection conn) {
        return JdbcTemplate.query(conn,
            "SELECT platform, status, COUNT(*) AS cnt FROM " + table() + " GROUP BY platform, status",
            rs -> new StatusCount(
                Platform.fromCode(rs.getString("platform")),
                FailureStatus.fromCode(rs.getString("status")),
                rs.getLong("cnt")));
    }

    private WebhookFailure map(ResultSet rs) throws SQLException {
        return new WebhookFailure(
            rs.getString("id"),
            Platform.fromCode(rs.getString("platform")),
            rs.getString("event_type"),
            RetryableStep.fromCode(rs.getString("step")),
            rs.getString("reference_id"),
            rs.getString("payload"),
            rs.getString("last_error"),
            rs.getInt("attempts"),
            rs.getInt("max_attempts"),
            JdbcTemplate.instant(rs, "next_retry_at"),
            JdbcTemplate.instant(rs, "last_attempt_at"),
            FailureStatus.fromCode(rs.getString("status")),
            jsonCodec().parseList(rs.getString("history"), FailureHistoryEntry.class),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "updated_at"));
    }
}
