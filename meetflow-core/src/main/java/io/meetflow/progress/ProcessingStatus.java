package io.meetflow.progress;

import io.meetflow.model.MeetingStatus;
import io.meetflow.model.ProcessingLogEntry;
import io.meetflow.model.ProcessingStep;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read model of a meeting's progress for status endpoints.
 *
 * @param estimatedRemaining zero once the meeting is terminal
 */
public record ProcessingStatus(
    String meetingId,
    MeetingStatus status,
    ProcessingStep step,
    int progress,
    String label,
    List<ProcessingLogEntry> logs,
    String error,
    Duration estimatedRemaining,
    Instant startedAt,
    Instant completedAt
) {}
