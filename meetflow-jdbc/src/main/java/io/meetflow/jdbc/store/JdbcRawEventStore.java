package io.meetflow.jdbc.store;

import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.JdbcTemplate;
import io.meetflow.jdbc.TableNames;
import io.meetflow.model.EventHints;
import io.meetflow.model.Platform;
import io.meetflow.model.RawEvent;
import io.meetflow.model.RawEventStatus;
import io.meetflow.spi.RawEventStore;
import io.meetflow.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link RawEventStore}. Idempotency rests on the unique key
 * {@code (platform, external_event_id)}.
 */
public final class JdbcRawEventStore extends AbstractJdbcStore implements RawEventStore {
    private static final String COLUMNS = "id, platform, event_type, external_event_id, payload, status, "
        + "meeting_external_id, meeting_end_time, recording_available, transcript_available, "
        + "error_message, received_at, processed_at";

    private static final JdbcTemplate.RowMapper<RawEvent> ROW_MAPPER = rs -> new RawEvent(
        rs.getString("id"),
        Platform.fromCode(rs.getString("platform")),
        rs.getString("event_type"),
        rs.getString("external_event_id"),
        rs.getString("payload"),
        RawEventStatus.fromCode(rs.getString("status")),
        new EventHints(
            rs.getString("meeting_external_id"),
            JdbcTemplate.instant(rs, "meeting_end_time"),
            rs.getBoolean("recording_available"),
            rs.getBoolean("transcript_available")),
        rs.getString("error_message"),
        JdbcTemplate.instant(rs, "received_at"),
        JdbcTemplate.instant(rs, "processed_at"));

    public JdbcRawEventStore(Dialect dialect, TableNames tables, JsonCodec jsonCodec) {
        super(dialect, tables, jsonCodec);
    }

    private String table() {
        return tables().rawEvents();
    }

    @Override
    public boolean insert(Connection conn, RawEvent event) {
        String sql = "INSERT INTO " + table() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";
        EventHints hints = event.hints() != null ? event.hints() : EventHints.NONE;
        return JdbcTemplate.insertIfAbsent(conn, dialect(), sql,
            event.id(), event.platform().code(), event.eventType(), event.externalEventId(),
            event.payloadJson(), event.status().code(),
            hints.meetingExternalId(), hints.endTime(), hints.recordingAvailable(), hints.transcriptAvailable(),
            truncateError(event.errorMessage()), event.receivedAt(), event.processedAt());
    }

    @Override
    public Optional<RawEvent> findById(Connection conn, String id) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE id=?", ROW_MAPPER, id);
    }

    @Override
    public Optional<RawEvent> findByExternalId(Connection conn, Platform platform, String externalEventId) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE platform=? AND external_event_id=?",
            ROW_MAPPER, platform.code(), externalEventId);
    }

    @Override
    public List<RawEvent> pollReceived(Connection conn, int limit) {
        return JdbcTemplate.query(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE status=? ORDER BY received_at, id LIMIT ?",
            ROW_MAPPER, RawEventStatus.RECEIVED.code(), limit);
    }

    @Override
    public int transition(Connection conn, String id, RawEventStatus from, RawEventStatus to,
                          String errorMessage, Instant processedAt) {
        if (processedAt == null) {
            return JdbcTemplate.update(conn,
                "UPDATE " + table() + " SET status=?, error_message=? WHERE id=? AND status=?",
                to.code(), truncateError(errorMessage), id, from.code());
        }
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET status=?, error_message=?, processed_at=? WHERE id=? AND status=?",
            to.code(), truncateError(errorMessage), processedAt, id, from.code());
    }

    @Override
    public int countByStatus(Connection conn, RawEventStatus status) {
        return (int) JdbcTemplate.queryLong(conn,
            "SELECT COUNT(*) FROM " + table() + " WHERE status=?", status.code());
    }
}
