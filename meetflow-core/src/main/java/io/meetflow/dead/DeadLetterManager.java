package io.meetflow.dead;

import io.meetflow.PipelineException;
import io.meetflow.ingest.EventIngestor;
import io.meetflow.ingest.IngestResult;
import io.meetflow.model.DeadLetter;
import io.meetflow.model.FailureStatus;
import io.meetflow.model.ProcessingStep;
import io.meetflow.model.RetryableStep;
import io.meetflow.model.WebhookFailure;
import io.meetflow.progress.ProcessingStateMachine;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.DeadLetterAlerter;
import io.meetflow.spi.DeadLetterStore;
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
 * Facade over the dead-letter store: promotion, operator resolution, alert delivery and replay.
 *
 * <p>Dead letters are permanent. Resolution only records the operator's notes; it never
 * requeues work. {@link #replay} is the explicit operator path back into the pipeline.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see io.meetflow.retry.WebhookFailureQueue
 */
public final class DeadLetterManager {
    private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

    static final String REPLAY_ID_PREFIX = "replay-";
    private static final int DEFAULT_LIST_LIMIT = 100;

    private final ConnectionProvider connectionProvider;
    private final DeadLetterStore deadLetterStore;
    private final WebhookFailureStore failureStore;
    private final DeadLetterAlerter alerter;
    private final EventIngestor ingestor;
    private final ProcessingStateMachine stateMachine;
    private final MetricsExporter metrics;
    private final Clock clock;

    private DeadLetterManager(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.deadLetterStore = Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore");
        this.failureStore = Objects.requireNonNull(builder.failureStore, "failureStore");
        this.alerter = builder.alerter != null ? builder.alerter : new LoggingDeadLetterAlerter();
        this.ingestor = builder.ingestor;
        this.stateMachine = builder.stateMachine;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates the dead letter for an exhausted failure on the caller's connection, so it commits
     * or rolls back together with the failure's status change. Promoting the same failure twice
     * returns the existing record.
     */
    public DeadLetter promote(Connection conn, WebhookFailure failure) {
        Objects.requireNonNull(conn, "conn");
        Objects.requireNonNull(failure, "failure");
        Optional<DeadLetter> existing = deadLetterStore.findByFailureId(conn, failure.id());
        if (existing.isPresent()) {
            return existing.get();
        }
        if (failure.history().size() != failure.attempts()) {
            throw new IllegalStateException("Webhook failure " + failure.id() + " has " + failure.attempts()
                + " attempts but " + failure.history().size() + " history entries");
        }
        DeadLetter deadLetter = new DeadLetter(
            UUID.randomUUID().toString(),
            failure.id(),
            failure.platform(),
            failure.eventType(),
            failure.step(),
            failure.referenceId(),
            failure.payloadJson(),
            failure.error(),
            failure.attempts(),
            failure.history(),
            false,
            false,
            null,
            null,
            Instant.now(clock));
        deadLetterStore.insert(conn, deadLetter);
        metrics.incrementDeadLettered();
        logger.log(Level.WARNING, "Webhook failure {0} promoted to dead letter {1} after {2} attempts",
            new Object[]{failure.id(), deadLetter.id(), failure.attempts()});
        return deadLetter;
    }

    /**
     * Moves a failure to the dead-letter store regardless of its remaining attempts. The status
     * change and the insert happen in one transaction.
     *
     * <p>For a meeting-level step the meeting is then failed with the failure's error, as the
     * worker does when retries run out. That needs the {@link ProcessingStateMachine}; without
     * one the caller owns the meeting's transition.
     *
     * @throws PipelineException if the failure does not exist or is already completed
     */
    public DeadLetter promote(WebhookFailure failure) {
        Objects.requireNonNull(failure, "failure");
        DeadLetter deadLetter = Connections.transaction(connectionProvider, "promote webhook failure " + failure.id(),
            conn -> {
                WebhookFailure current = failureStore.findById(conn, failure.id())
                    .orElseThrow(() -> new PipelineException("Unknown webhook failure " + failure.id()));
                if (current.status() == FailureStatus.COMPLETED) {
                    throw new PipelineException("Webhook failure " + failure.id() + " already completed");
                }
                if (current.status() != FailureStatus.DEAD_LETTER) {
                    WebhookFailure dead = current.withStatus(FailureStatus.DEAD_LETTER, null, Instant.now(clock));
                    if (failureStore.update(conn, dead, current.attempts()) == 0) {
                        throw new PipelineException("Webhook failure " + failure.id() + " changed concurrently");
                    }
                    current = dead;
                }
                return promote(conn, current);
            });
        if (deadLetter.step().isMeetingLevel() && stateMachine != null) {
            stateMachine.fail(deadLetter.referenceId(), deadLetter.error());
        }
        return deadLetter;
    }

    /**
     * Records the operator's resolution. Does not requeue any work.
     *
     * @return {@code true} if the dead letter existed and was unresolved
     */
    public boolean resolve(String deadLetterId, String notes) {
        Objects.requireNonNull(deadLetterId, "deadLetterId");
        boolean resolved = Connections.autoCommit(connectionProvider, "resolve dead letter " + deadLetterId,
            conn -> deadLetterStore.resolve(conn, deadLetterId, notes, Instant.now(clock)) > 0);
        if (resolved) {
            logger.log(Level.INFO, "Dead letter {0} resolved", deadLetterId);
        }
        return resolved;
    }

    public Optional<DeadLetter> find(String deadLetterId) {
        return Connections.autoCommit(connectionProvider, "load dead letter " + deadLetterId,
            conn -> deadLetterStore.findById(conn, deadLetterId));
    }

    /**
     * Unresolved dead letters, oldest first.
     */
    public List<DeadLetter> listUnresolved(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return Connections.autoCommit(connectionProvider, "list unresolved dead letters",
            conn -> deadLetterStore.findUnresolved(conn, limit));
    }

    public List<DeadLetter> listUnresolved() {
        return listUnresolved(DEFAULT_LIST_LIMIT);
    }

    public long countUnresolved() {
        return Connections.autoCommit(connectionProvider, "count unresolved dead letters",
            deadLetterStore::countUnresolved);
    }

    /**
     * Delivers every alert still owed through the {@link DeadLetterAlerter}. A dead letter is
     * marked {@code alertSent} only after its delivery succeeded; failed deliveries stay pending
     * for the next call.
     *
     * @return the number of alerts delivered
     */
    public int sendPendingAlerts() {
        List<DeadLetter> pending = Connections.autoCommit(connectionProvider, "query pending dead-letter alerts",
            conn -> deadLetterStore.findPendingAlerts(conn, DEFAULT_LIST_LIMIT));
        int sent = 0;
        for (DeadLetter deadLetter : pending) {
            try {
                alerter.alert(deadLetter);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Alert for dead letter " + deadLetter.id() + " failed; will retry", e);
                continue;
            }
            Connections.autoCommit(connectionProvider, "mark alert sent for dead letter " + deadLetter.id(),
                conn -> deadLetterStore.markAlertSent(conn, deadLetter.id()));
            metrics.incrementAlertsSent();
            sent++;
        }
        return sent;
    }

    /**
     * Re-submits a dead letter's work and resolves it with {@code notes}.
     *
     * <p>Event-processing failures are re-ingested from the preserved payload under the external
     * id {@code replay-<deadLetterId>}, so replaying twice stays idempotent. Meeting-level
     * failures restart the meeting at the step that failed.
     *
     * @return {@code false} if the dead letter is unknown or already resolved
     * @throws IllegalStateException if the collaborator the replay needs was not configured
     */
    public boolean replay(String deadLetterId, String notes) {
        Objects.requireNonNull(deadLetterId, "deadLetterId");
        DeadLetter deadLetter = find(deadLetterId).orElse(null);
        if (deadLetter == null || deadLetter.resolved()) {
            logger.log(Level.WARNING, "Replay of dead letter {0} ignored: unknown or resolved", deadLetterId);
            return false;
        }
        if (deadLetter.step() == RetryableStep.EVENT_PROCESSING) {
            if (ingestor == null) {
                throw new IllegalStateException("Replay of event processing requires an EventIngestor");
            }
            IngestResult result = ingestor.ingest(deadLetter.platform(), deadLetter.eventType(),
                REPLAY_ID_PREFIX + deadLetter.id(), deadLetter.payloadJson());
            logger.log(Level.INFO, "Dead letter {0} replayed as raw event {1}",
                new Object[]{deadLetterId, result.rawEventId()});
        } else {
            if (stateMachine == null) {
                throw new IllegalStateException("Replay of meeting steps requires a ProcessingStateMachine");
            }
            ProcessingStep resumeAt = resumeStep(deadLetter.step());
            if (!stateMachine.restart(deadLetter.referenceId(), resumeAt)) {
                logger.log(Level.WARNING, "Meeting {0} was not failed; dead letter {1} resolved without restart",
                    new Object[]{deadLetter.referenceId(), deadLetterId});
            }
        }
        String resolution = notes != null ? notes : "Replayed";
        return resolve(deadLetterId, resolution);
    }

    /**
     * The step a meeting resumes at so the failed step's work is redone.
     */
    static ProcessingStep resumeStep(RetryableStep step) {
        return switch (step) {
            case TRANSCRIPT_FETCH -> ProcessingStep.MEETING_CREATED;
            case DRAFT_GENERATION -> ProcessingStep.TRANSCRIPT_STORED;
            case EVENT_PROCESSING -> throw new IllegalArgumentException("Event processing is not meeting-level");
        };
    }

    /**
     * Builder for {@link DeadLetterManager}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private DeadLetterStore deadLetterStore;
        private WebhookFailureStore failureStore;
        private DeadLetterAlerter alerter;
        private EventIngestor ingestor;
        private ProcessingStateMachine stateMachine;
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
        public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
            this.deadLetterStore = deadLetterStore;
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
         * Optional. Defaults to {@link LoggingDeadLetterAlerter}.
         */
        public Builder alerter(DeadLetterAlerter alerter) {
            this.alerter = alerter;
            return this;
        }

        /**
         * Sets the ingestor used to replay event-processing dead letters.
         *
         * <p>Optional. Without it such replays throw {@link IllegalStateException}.
         */
        public Builder ingestor(EventIngestor ingestor) {
            this.ingestor = ingestor;
            return this;
        }

        /**
         * Sets the state machine used to restart meetings on replay.
         *
         * <p>Optional. Without it meeting-level replays throw {@link IllegalStateException}.
         */
        public Builder stateMachine(ProcessingStateMachine stateMachine) {
            this.stateMachine = stateMachine;
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

        public DeadLetterManager build() {
            return new DeadLetterManager(this);
        }
    }
}
