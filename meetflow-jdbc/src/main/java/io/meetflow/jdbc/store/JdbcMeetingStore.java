package io.meetflow.jdbc.store;

import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.JdbcTemplate;
import io.meetflow.jdbc.TableNames;
import io.meetflow.model.Meeting;
import io.meetflow.model.MeetingStatus;
import io.meetflow.model.Platform;
import io.meetflow.model.ProcessingLogEntry;
import io.meetflow.model.ProcessingStep;
import io.meetflow.model.TranscriptStatus;
import io.meetflow.spi.MeetingStore;
import io.meetflow.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link MeetingStore}. The processing log is kept as a JSON array column; every state
 * change is a compare-and-set on {@code (processing_step, status)}.
 */
public final class JdbcMeetingStore extends AbstractJdbcStore implements MeetingStore {
    private static final String[] COLUMN_NAMES = {
        "id", "platform", "platform_meeting_id", "host_email", "topic", "start_time", "end_time",
        "status", "processing_step", "processing_progress", "processing_logs", "processing_started_at",
        "processing_completed_at", "processing_error", "last_raw_event_id", "created_at", "updated_at"
    };
    private static final String COLUMNS = columns("");
    private static final String ACTIVE_STATUS_IN =
        "('" + MeetingStatus.PENDING.code() + "','" + MeetingStatus.PROCESSING.code() + "')";

    private final JdbcTemplate.RowMapper<Meeting> rowMapper = this::map;

    public JdbcMeetingStore(Dialect dialect, TableNames tables, JsonCodec jsonCodec) {
        super(dialect, tables, jsonCodec);
    }

    private String table() {
        return tables().meetings();
    }

    @Override
    public boolean insert(Connection conn, Meeting meeting) {
        String sql = "INSERT INTO " + table() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        return JdbcTemplate.insertIfAbsent(conn, dialect(), sql,
            meeting.id(), meeting.platform().code(), meeting.platformMeetingId(), meeting.hostEmail(),
            meeting.topic(), meeting.startTime(), meeting.endTime(), meeting.status().code(),
            meeting.processingStep().code(), meeting.processingProgress(),
            jsonCodec().toJson(meeting.processingLogs()), meeting.processingStartedAt(),
            meeting.processingCompletedAt(), truncateError(meeting.processingError()), meeting.lastRawEventId(),
            meeting.createdAt(), meeting.updatedAt());
    }

    @Override
    public Optional<Meeting> findById(Connection conn, String id) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE id=?", rowMapper, id);
    }

    @Override
    public Optional<Meeting> findByPlatformMeetingId(Connection conn, Platform platform, String platformMeetingId) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE platform=? AND platform_meeting_id=?",
            rowMapper, platform.code(), platformMeetingId);
    }

    @Override
    public int update(Connection conn, Meeting meeting, ProcessingStep expectedStep, MeetingStatus expectedStatus) {
        String sql = "UPDATE " + table() + " SET status=?, processing_step=?, processing_progress=?, "
            + "processing_logs=?, processing_started_at=?, processing_completed_at=?, processing_error=?, "
            + "last_raw_event_id=?, updated_at=? "
            + "WHERE id=? AND processing_step=? AND status=?";
        return JdbcTemplate.update(conn, sql,
            meeting.status().code(), meeting.processingStep().code(), meeting.processingProgress(),
            jsonCodec().toJson(meeting.processingLogs()), meeting.processingStartedAt(),
            meeting.processingCompletedAt(), truncateError(meeting.processingError()), meeting.lastRawEventId(),
            meeting.updatedAt(), meeting.id(), expectedStep.code(), expectedStatus.code());
    }

    @Override
    public List<Meeting> findAtStep(Connection conn, ProcessingStep step, int limit) {
        return JdbcTemplate.query(conn,
            "SELECT " + COLUMNS + " FROM " + table()
                + " WHERE processing_step=? AND status=? ORDER BY updated_at, id LIMIT ?",
            rowMapper, step.code(), MeetingStatus.PROCESSING.code(), limit);
    }

    @Override
    public List<Meeting> findAwaitingTranscript(Connection conn, int limit) {
        String sql = "SELECT " + columns("m.") + " FROM " + table() + " m"
            + " JOIN " + tables().transcripts() + " t ON t.meeting_id = m.id"
            + " WHERE m.processing_step=? AND m.status=? AND t.source_ref IS NOT NULL AND t.status<>?"
            + " ORDER BY m.updated_at, m.id LIMIT ?";
        return JdbcTemplate.query(conn, sql, rowMapper,
            ProcessingStep.MEETING_CREATED.code(), MeetingStatus.PROCESSING.code(),
            TranscriptStatus.READY.code(), limit);
    }

    @Override
    public List<Meeting> findStale(Connection conn, Instant updatedBefore, int limit) {
        return JdbcTemplate.query(conn,
            "SELECT " + COLUMNS + " FROM " + table()
                + " WHERE status IN " + ACTIVE_STATUS_IN + " AND updated_at < ? ORDER BY updated_at, id LIMIT ?",
            rowMapper, updatedBefore, limit);
    }

    private Meeting map(ResultSet rs) throws SQLException {
        List<ProcessingLogEntry> logs = jsonCodec().parseList(rs.getString("processing_logs"), ProcessingLogEntry.class);
        return new Meeting(
            rs.getString("id"),
            Platform.fromCode(rs.getString("platform")),
            rs.getString("platform_meeting_id"),
            rs.getString("host_email"),
            rs.getString("topic"),
            JdbcTemplate.instant(rs, "start_time"),
            JdbcTemplate.instant(rs, "end_time"),
            MeetingStatus.fromCode(rs.getString("status")),
            ProcessingStep.fromCode(rs.getString("processing_step")),
            rs.getInt("processing_progress"),
            logs,
            JdbcTemplate.instant(rs, "processing_started_at"),
            JdbcTemplate.instant(rs, "processing_completed_at"),
            rs.getString("processing_error"),
            rs.getString("last_raw_event_id"),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "updated_at"));
    }

    private static String columns(String alias) {
        StringBuilder sb = new StringBuilder();
        for (String column : COLUMN_NAMES) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(alias).append(column);
        }
        return sb.toString();
    }
}
