package io.meetflow.jdbc.store;

import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.JdbcTemplate;
import io.meetflow.jdbc.TableNames;
import io.meetflow.model.SpeakerSegment;
import io.meetflow.model.Transcript;
import io.meetflow.model.TranscriptFormat;
import io.meetflow.model.TranscriptStatus;
import io.meetflow.spi.TranscriptStore;
import io.meetflow.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC {@link TranscriptStore}. Each mutation is guarded by {@code status <> 'ready'}.
 */
public final class JdbcTranscriptStore extends AbstractJdbcStore implements TranscriptStore {
    private static final String COLUMNS = "id, meeting_id, status, source_ref, format, raw_content, parsed_content, "
        + "segments, word_count, fetch_attempts, last_fetch_error, created_at, updated_at";
    private static final String NOT_READY = " AND status<>'" + TranscriptStatus.READY.code() + "'";

    private final JdbcTemplate.RowMapper<Transcript> rowMapper = this::map;

    public JdbcTranscriptStore(Dialect dialect, TableNames tables, JsonCodec jsonCodec) {
        super(dialect, tables, jsonCodec);
    }

    private String table() {
        return tables().transcripts();
    }

    @Override
    public boolean insert(Connection conn, Transcript transcript) {
        String sql = "INSERT INTO " + table() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";
        return JdbcTemplate.insertIfAbsent(conn, dialect(), sql,
            transcript.id(), transcript.meetingId(), transcript.status().code(), transcript.sourceRef(),
            transcript.format() != null ? transcript.format().code() : null,
            transcript.rawContent(), transcript.parsedContent(), jsonCodec().toJson(transcript.segments()),
            transcript.wordCount(), transcript.fetchAttempts(), truncateError(transcript.lastFetchError()),
            transcript.createdAt(), transcript.updatedAt());
    }

    @Override
    public Optional<Transcript> findByMeetingId(Connection conn, String meetingId) {
        return JdbcTemplate.queryOne(conn,
            "SELECT " + COLUMNS + " FROM " + table() + " WHERE meeting_id=?", rowMapper, meetingId);
    }

    @Override
    public int updateSource(Connection conn, String id, String sourceRef, TranscriptFormat format, Instant now) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET source_ref=?, format=?, updated_at=? WHERE id=?" + NOT_READY,
            sourceRef, format != null ? format.code() : null, now, id);
    }

    @Override
    public int beginAttempt(Connection conn, String id, Instant now) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET status=?, fetch_attempts=fetch_attempts+1, updated_at=? WHERE id=?" + NOT_READY,
            TranscriptStatus.FETCHING.code(), now, id);
    }

    @Override
    public int markFailed(Connection conn, String id, String error, Instant now) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET status=?, last_fetch_error=?, updated_at=? WHERE id=?" + NOT_READY,
            TranscriptStatus.FAILED.code(), truncateError(error), now, id);
    }

    @Override
    public int markReady(Connection conn, String id, String rawContent, String parsedContent,
                         List<SpeakerSegment> segments, int wordCount, Instant now) {
        return JdbcTemplate.update(conn,
            "UPDATE " + table() + " SET status=?, raw_content=?, parsed_content=?, segments=?, word_count=?, "
                + "updated_at=? WHERE id=?" + NOT_READY,
            TranscriptStatus.READY.code(), rawContent, parsedContent, jsonCodec().toJson(segments),
            wordCount, now, id);
    }

    private Transcript map(ResultSet rs) throws SQLException {
        String format = rs.getString("format");
        return new Transcript(
            rs.getString("id"),
            rs.getString("meeting_id"),
            TranscriptStatus.fromCode(rs.getString("status")),
            rs.getString("source_ref"),
            format != null ? TranscriptFormat.fromCode(format) : null,
            rs.getString("raw_content"),
            rs.getString("parsed_content"),
            jsonCodec().parseList(rs.getString("segments"), SpeakerSegment.class),
            rs.getInt("word_count"),
            rs.getInt("fetch_attempts"),
            rs.getString("last_fetch_error"),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "updated_at"));
    }
}
