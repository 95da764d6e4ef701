package io.meetflow.model;

import java.time.Instant;

/**
 * One failed attempt of a retryable step.
 *
 * @param attempt 1-based attempt number
 */
public record FailureHistoryEntry(
    int attempt,
    String error,
    Instant timestamp
) {}
