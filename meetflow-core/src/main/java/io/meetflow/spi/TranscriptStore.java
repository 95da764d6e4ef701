package io.meetflow.spi;

import io.meetflow.model.SpeakerSegment;
import io.meetflow.model.Transcript;
import io.meetflow.model.TranscriptFormat;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for transcripts. Every mutating method leaves a ready transcript untouched.
 */
public interface TranscriptStore {

    /**
     * @return {@code false} if the meeting already has a transcript
     */
    boolean insert(Connection conn, Transcript transcript);

    Optional<Transcript> findByMeetingId(Connection conn, String meetingId);

    /**
     * Sets the download location of a transcript that has none yet or is not ready.
     */
    int updateSource(Connection conn, String id, String sourceRef, TranscriptFormat format, Instant now);

    /**
     * Increments {@code fetch_attempts} and sets status {@code fetching}.
     */
    int beginAttempt(Connection conn, String id, Instant now);

    int markFailed(Connection conn, String id, String error, Instant now);

    int markReady(Connection conn, String id, String rawContent, String parsedContent,
                  List<SpeakerSegment> segments, int wordCount, Instant now);
}
