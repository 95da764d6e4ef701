package io.meetflow.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A pipeline step that threw and is scheduled for retry.
 *
 * <p>{@code attempts} starts at 1 and never exceeds {@code maxAttempts} while the status is not
 * {@link FailureStatus#DEAD_LETTER}. {@code history} holds one entry per failed attempt.
 */
public record WebhookFailure(
    String id,
    Platform platform,
    String eventType,
    RetryableStep step,
    String referenceId,
    String payloadJson,
    String error,
    int attempts,
    int maxAttempts,
    Instant nextRetryAt,
    Instant lastAttemptAt,
    FailureStatus status,
    List<FailureHistoryEntry> history,
    Instant createdAt,
    Instant updatedAt
) {
    public WebhookFailure {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * Returns the snapshot after one more failed attempt.
     */
    public WebhookFailure withFailedAttempt(String newError, Instant now, Instant nextRetry, FailureStatus newStatus) {
        int next = attempts + 1;
        List<FailureHistoryEntry> entries = new ArrayList<>(history);
        entries.add(new FailureHistoryEntry(next, newError, now));
        return new WebhookFailure(id, platform, eventType, step, referenceId, payloadJson, newError,
            next, maxAttempts, nextRetry, now, newStatus, entries, createdAt, now);
    }

    public WebhookFailure withStatus(FailureStatus newStatus, Instant nextRetry, Instant now) {
        return new WebhookFailure(id, platform, eventType, step, referenceId, payloadJson, error,
            attempts, maxAttempts, nextRetry, lastAttemptAt, newStatus, history, createdAt, now);
    }
}
