package io.meetflow.spi;

import io.meetflow.model.FailureStatus;
import io.meetflow.model.Platform;
import io.meetflow.model.WebhookFailure;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for the retry queue.
 */
public interface WebhookFailureStore {

    void insert(Connection conn, WebhookFailure failure);

    Optional<WebhookFailure> findById(Connection conn, String id);

    /**
     * Returns pending or retrying failures with {@code next_retry_at <= now}, ordered by
     * {@code next_retry_at} ascending.
     */
    List<WebhookFailure> findDue(Connection conn, Instant now, int limit);

    /**
     * Marks a due failure as retrying and moves its {@code next_retry_at} to {@code leaseUntil},
     * provided it is still due at {@code now} with {@code expectedAttempts}.
     *
     * @return rows updated (0 if another worker claimed it first)
     */
    int claim(Connection conn, String id, int expectedAttempts, Instant now, Instant leaseUntil);

    /**
     * Writes the mutable state of {@code failure} (status, attempts, error, schedule, history)
     * if the stored row is still retryable with {@code expectedAttempts}.
     */
    int update(Connection conn, WebhookFailure failure, int expectedAttempts);

    /**
     * Counts failures grouped by platform and status.
     */
    List<StatusCount> countByPlatformAndStatus(Connection conn);

    record StatusCount(Platform platform, FailureStatus status, long count) {}
}
