package io.meetflow.retry;

import io.meetflow.PipelineException;
import io.meetflow.dead.DeadLetterManager;
import io.meetflow.model.FailureHistoryEntry;
import io.meetflow.model.FailureStatus;
import io.meetflow.model.Platform;
import io.meetflow.model.RetryableStep;
import io.meetflow.model.WebhookFailure;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.MetricsExporter;
import io.meetflow.spi.WebhookFailureStore;
import io.meetflow.util.Connections;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable retry queue for pipeline steps that threw.
 *
 * <p>A failure starts with {@code attempts=1}. Every failed retry increments the count; the retry
 * that brings it to {@code maxAttempts} moves the record to {@code dead_letter} and creates the
 * {@link io.meetflow.model.DeadLetter} in the same transaction, so a failure is never visible as
 * both retryable and dead-lettered.
 *
 * <p>Workers take a due failure with {@link #claimForRetry}, which leases it by pushing
 * {@code nextRetryAt} forward; a worker that dies mid-retry leaves the failure due again once
 * the lease runs out.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class WebhookFailureQueue {
    private static final Logger logger = Logger.getLogger(WebhookFailureQueue.class.getName());

    static final int MAX_ERROR_LENGTH = 4000;
    private static final int DEFAULT_DUE_LIMIT = 100;

    private final ConnectionProvider connectionProvider;
    private final WebhookFailureStore failureStore;
    private final DeadLetterManager deadLetterManager;
    private final RetryPolicy retryPolicy;
    private final int maxAttempts;
    private final long leaseMs;
    private final MetricsExporter metrics;
    private final Clock clock;

    private WebhookFailureQueue(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.failureStore = Objects.requireNonNull(builder.failureStore, "failureStore");
        this.deadLetterManager = Objects.requireNonNull(builder.deadLetterManager, "deadLetterManager");
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (builder.leaseMs <= 0) {
            throw new IllegalArgumentException("leaseMs must be > 0");
        }
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new LinearBackoffRetryPolicy();
        this.maxAttempts = builder.maxAttempts;
        this.leaseMs = builder.leaseMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Records the first failure of a step.
     *
     * @param referenceId the raw event id for {@link RetryableStep#EVENT_PROCESSING}, otherwise
     *                    the meeting id
     * @param payloadJson enough context to replay the step
     * @return the stored failure; already {@code dead_letter} when {@code maxAttempts} is 1
     */
    public WebhookFailure recordFailure(Platform platform, String eventType, RetryableStep step,
                                        String referenceId, String payloadJson, String error) {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(referenceId, "referenceId");
        Instant now = Instant.now(clock);
        String message = truncateError(error);
        boolean exhausted = maxAttempts <= 1;
        WebhookFailure failure = new WebhookFailure(
            UUID.randomUUID().toString(),
            platform,
            eventType,
            step,
            referenceId,
            payloadJson,
            message,
            1,
            maxAttempts,
            exhausted ? null : now.plusMillis(retryPolicy.computeDelayMs(1)),
            now,
            exhausted ? FailureStatus.DEAD_LETTER : FailureStatus.PENDING,
            List.of(new FailureHistoryEntry(1, message, now)),
            now,
            now);

        Connections.transaction(connectionProvider, "record failure of " + step.code() + " for " + referenceId, conn -> {
            failureStore.insert(conn, failure);
            if (exhausted) {
                deadLetterManager.promote(conn, failure);
            }
            return null;
        });
        metrics.incrementFailuresRecorded();
        logger.log(Level.WARNING, "Step {0} failed for {1} (attempt 1/{2}): {3}",
            new Object[]{step.code(), referenceId, maxAttempts, message});
        return failure;
    }

    /**
     * Failures in {@code pending} or {@code retrying} whose {@code nextRetryAt <= now}, oldest
     * due first.
     */
    public List<WebhookFailure> dueForRetry(Instant now, int limit) {
        Objects.requireNonNull(now, "now");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return Connections.autoCommit(connectionProvider, "query due webhook failures",
            conn -> failureStore.findDue(conn, now, limit));
    }

    public List<WebhookFailure> dueForRetry(Instant now) {
        return dueForRetry(now, DEFAULT_DUE_LIMIT);
    }

    /**
     * Leases a due failure to the caller by marking it {@code retrying} and moving
     * {@code nextRetryAt} past the lease.
     *
     * @return the claimed failure, or empty if another worker claimed it first or it is no
     *         longer due
     */
    public Optional<WebhookFailure> claimForRetry(WebhookFailure failure) {
        Objects.requireNonNull(failure, "failure");
        Instant now = Instant.now(clock);
        return Connections.autoCommit(connectionProvider, "claim webhook failure " + failure.id(), conn -> {
            int claimed = failureStore.claim(conn, failure.id(), failure.attempts(), now, now.plusMillis(leaseMs));
            if (claimed == 0) {
                logger.log(Level.FINE, "Webhook failure {0} already claimed", failure.id());
                return Optional.empty();
            }
            return failureStore.findById(conn, failure.id());
        });
    }

    /**
     * Records the outcome of a retry.
     *
     * <p>On success the failure is {@code completed}. On failure the attempt count is incremented;
     * reaching {@code maxAttempts} promotes it to the dead-letter store, otherwise the next
     * attempt is scheduled with the {@link RetryPolicy}.
     *
     * @return the updated failure
     * @throws PipelineException if the failure does not exist or changed concurrently
     */
    public WebhookFailure recordRetryOutcome(String failureId, boolean success, String error) {
        Objects.requireNonNull(failureId, "failureId");
        Instant now = Instant.now(clock);
        WebhookFailure updated = Connections.transaction(connectionProvider, "record retry outcome of " + failureId, conn -> {
            WebhookFailure failure = load(conn, failureId);
            if (!failure.status().isRetryable()) {
                logger.log(Level.WARNING, "Retry outcome for webhook failure {0} ignored: already {1}",
                    new Object[]{failureId, failure.status().code()});
                return failure;
            }
            if (success) {
                WebhookFailure completed = failure.withStatus(FailureStatus.COMPLETED, null, now);
                write(conn, completed, failure);
                return completed;
            }
            String message = truncateError(error);
            int nextAttempts = failure.attempts() + 1;
            if (nextAttempts >= failure.maxAttempts()) {
                WebhookFailure dead = failure.withFailedAttempt(message, now, null, FailureStatus.DEAD_LETTER);
                write(conn, dead, failure);
                deadLetterManager.promote(conn, dead);
                return dead;
            }
            WebhookFailure retrying = failure.withFailedAttempt(message,
                now, now.plusMillis(retryPolicy.computeDelayMs(nextAttempts)), FailureStatus.RETRYING);
            write(conn, retrying, failure);
            return retrying;
        });

        switch (updated.status()) {
            case COMPLETED -> {
                metrics.incrementRetrySucceeded();
                logger.log(Level.INFO, "Retry of {0} for {1} succeeded after {2} failed attempt(s)",
                    new Object[]{updated.step().code(), updated.referenceId(), updated.attempts()});
            }
            case DEAD_LETTER -> {
                metrics.incrementRetryFailed();
                logger.log(Level.SEVERE, "Retries of {0} for {1} exhausted after {2} attempts: {3}",
                    new Object[]{updated.step().code(), updated.referenceId(), updated.attempts(), updated.error()});
            }
            case RETRYING -> {
                metrics.incrementRetryFailed();
                logger.log(Level.WARNING, "Retry of {0} for {1} failed (attempt {2}/{3}), next at {4}: {5}",
                    new Object[]{updated.step().code(), updated.referenceId(), updated.attempts(),
                        updated.maxAttempts(), updated.nextRetryAt(), updated.error()});
            }
            default -> {
            }
        }
        return updated;
    }

    /**
     * Closes a failure whose target has moved on (for example the meeting was failed by the
     * stuck sweeper or advanced by another path). The failure ends {@code completed} and no
     * attempt is counted.
     *
     * @return {@code true} if the failure was still retryable and is now closed
     */
    public boolean recordSuperseded(String failureId, String reason) {
        Objects.requireNonNull(failureId, "failureId");
        Instant now = Instant.now(clock);
        return Connections.transaction(connectionProvider, "supersede webhook failure " + failureId, conn -> {
            WebhookFailure failure = load(conn, failureId);
            if (!failure.status().isRetryable()) {
                return false;
            }
            write(conn, failure.withStatus(FailureStatus.COMPLETED, null, now), failure);
            logger.log(Level.INFO, "Webhook failure {0} superseded: {1}", new Object[]{failureId, reason});
            return true;
        });
    }

    public Optional<WebhookFailure> find(String failureId) {
        return Connections.autoCommit(connectionProvider, "load webhook failure " + failureId,
            conn -> failureStore.findById(conn, failureId));
    }

    /**
     * Counts failures by status, in total and per platform.
     */
    public FailureMetrics metrics() {
        FailureMetrics snapshot = Connections.autoCommit(connectionProvider, "count webhook failures",
            conn -> FailureMetrics.from(failureStore.countByPlatformAndStatus(conn)));
        metrics.recordRetryQueueDepth((int) Math.min(Integer.MAX_VALUE, snapshot.queueDepth()));
        return snapshot;
    }

    private WebhookFailure load(Connection conn, String failureId) {
        return failureStore.findById(conn, failureId)
            .orElseThrow(() -> new PipelineException("Unknown webhook failure " + failureId));
    }

    private void write(Connection conn, WebhookFailure next, WebhookFailure previous) {
        if (failureStore.update(conn, next, previous.attempts()) == 0) {
            throw new PipelineException("Webhook failure " + previous.id() + " changed concurrently");
        }
    }

    static String truncateError(String error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }

    /**
     * Builder for {@link WebhookFailureQueue}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private WebhookFailureStore failureStore;
        private DeadLetterManager deadLetterManager;
        private RetryPolicy retryPolicy;
        private int maxAttempts = 3;
        private long leaseMs = 60_000L;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder failureStore(WebhookFailureStore failureStore) {
            this.failureStore = failureStore;
            return this;
        }

        /**
         * Sets the manager that receives exhausted failures.
         *
         * <p><b>Required.</b>
         */
        public Builder deadLetterManager(DeadLetterManager deadLetterManager) {
            this.deadLetterManager = deadLetterManager;
            return this;
        }

        /**
         * Optional. Defaults to {@link LinearBackoffRetryPolicy} with a one second base delay.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Sets the number of attempts, including the first, before a failure is dead-lettered.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets how long a claimed failure stays invisible to other workers.
         *
         * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
         */
        public Builder leaseMs(long leaseMs) {
            this.leaseMs = leaseMs;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public WebhookFailureQueue build() {
            return new WebhookFailureQueue(this);
        }
    }
}
