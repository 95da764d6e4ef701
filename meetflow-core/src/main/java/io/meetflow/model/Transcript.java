package io.meetflow.model;

import java.time.Instant;
import java.util.List;

/**
 * Transcript content of exactly one meeting.
 *
 * <p>{@code fetchAttempts} counts every acquisition attempt regardless of outcome;
 * {@code lastFetchError} keeps the most recent failure so repeated meeting-level retries
 * do not hide why the fetch keeps failing. A {@link TranscriptStatus#READY} transcript is
 * never modified again.
 */
public record Transcript(
    String id,
    String meetingId,
    TranscriptStatus status,
    String sourceRef,
    TranscriptFormat format,
    String rawContent,
    String parsedContent,
    List<SpeakerSegment> segments,
    int wordCount,
    int fetchAttempts,
    String lastFetchError,
    Instant createdAt,
    Instant updatedAt
) {
    public Transcript {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }
}
