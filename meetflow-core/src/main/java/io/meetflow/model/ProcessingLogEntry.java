package io.meetflow.model;

import java.time.Instant;

/**
 * Append-only audit entry on a meeting.
 *
 * @param durationMs time the step took, or {@code null} when not measured
 */
public record ProcessingLogEntry(
    Instant timestamp,
    ProcessingStep step,
    String message,
    Long durationMs
) {}
