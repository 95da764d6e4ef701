package io.meetflow.spi;

import io.meetflow.model.Platform;
import io.meetflow.model.TranscriptFormat;

import java.time.Instant;
import java.util.Objects;

/**
 * Meeting facts read from a webhook payload.
 *
 * @param transcriptRef    where the transcript can be fetched, or {@code null} if not yet known
 * @param transcriptFormat format served at {@code transcriptRef}
 */
public record MeetingDescriptor(
    Platform platform,
    String platformMeetingId,
    String hostEmail,
    String topic,
    Instant startTime,
    Instant endTime,
    String transcriptRef,
    TranscriptFormat transcriptFormat
) {
    public MeetingDescriptor {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(platformMeetingId, "platformMeetingId");
        Objects.requireNonNull(transcriptFormat, "transcriptFormat");
    }
}
