package io.meetflow.spi;

import io.meetflow.model.Meeting;
import io.meetflow.model.MeetingStatus;
import io.meetflow.model.Platform;
import io.meetflow.model.ProcessingStep;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for meetings and their processing state.
 */
public interface MeetingStore {

    /**
     * Inserts a meeting.
     *
     * @return {@code false} if a meeting with the same {@code (platform, platformMeetingId)}
     *         already exists
     */
    boolean insert(Connection conn, Meeting meeting);

    Optional<Meeting> findById(Connection conn, String id);

    Optional<Meeting> findByPlatformMeetingId(Connection conn, Platform platform, String platformMeetingId);

    /**
     * Writes the processing state of {@code meeting} (status, step, progress, logs, timestamps,
     * error) if the stored row is still at {@code expectedStep} with {@code expectedStatus}.
     *
     * @return rows updated (0 if the row moved on concurrently)
     */
    int update(Connection conn, Meeting meeting, ProcessingStep expectedStep, MeetingStatus expectedStatus);

    /**
     * Returns processing meetings at {@code step}, least recently updated first.
     */
    List<Meeting> findAtStep(Connection conn, ProcessingStep step, int limit);

    /**
     * Returns processing meetings at {@link ProcessingStep#MEETING_CREATED} whose transcript has a
     * source reference and is not yet ready.
     */
    List<Meeting> findAwaitingTranscript(Connection conn, int limit);

    /**
     * Returns pending or processing meetings not updated since {@code updatedBefore}.
     */
    List<Meeting> findStale(Connection conn, Instant updatedBefore, int limit);
}
