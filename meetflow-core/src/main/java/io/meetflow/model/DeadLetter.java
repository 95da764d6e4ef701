package io.meetflow.model;

import java.time.Instant;
import java.util.List;

/**
 * Permanent record of a failure that exhausted its retries.
 *
 * <p>Immutable apart from the alert flag and the resolution fields. Resolving does not requeue
 * any work.
 */
public record DeadLetter(
    String id,
    String webhookFailureId,
    Platform platform,
    String eventType,
    RetryableStep step,
    String referenceId,
    String payloadJson,
    String error,
    int totalAttempts,
    List<FailureHistoryEntry> failureHistory,
    boolean alertSent,
    boolean resolved,
    Instant resolvedAt,
    String resolutionNotes,
    Instant createdAt
) {
    public DeadLetter {
        failureHistory = failureHistory == null ? List.of() : List.copyOf(failureHistory);
    }
}
