package io.meetflow.progress;

import io.meetflow.model.Meeting;
import io.meetflow.model.MeetingStatus;
import io.meetflow.model.ProcessingLogEntry;
import io.meetflow.model.ProcessingStep;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.MeetingDescriptor;
import io.meetflow.spi.MeetingStore;
import io.meetflow.spi.MetricsExporter;
import io.meetflow.util.Connections;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Progress and audit ledger for meetings, and the gate that keeps their steps in order.
 *
 * <p>{@link #advance} only moves a meeting strictly forward along {@link ProcessingStep}'s order;
 * any other request is logged at {@code SEVERE} and ignored. {@link #fail} is allowed from any
 * non-terminal step. Every write is a single-row compare-and-set on the step and status that
 * were read, so concurrent writers cannot interleave a regression.
 *
 * <p>The work of each step is done by callers; this class only records it.
 */
public final class ProcessingStateMachine {
    private static final Logger logger = Logger.getLogger(ProcessingStateMachine.class.getName());

    static final double ESTIMATE_SAFETY_FACTOR = 1.1;

    private final ConnectionProvider connectionProvider;
    private final MeetingStore meetingStore;
    private final MetricsExporter metrics;
    private final Clock clock;

    private ProcessingStateMachine(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.meetingStore = Objects.requireNonNull(builder.meetingStore, "meetingStore");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the meeting described by {@code descriptor}, creating it as {@code pending} at
     * {@link ProcessingStep#WEBHOOK_RECEIVED} if it does not exist yet.
     */
    public MeetingRegistration register(MeetingDescriptor descriptor, String rawEventId) {
        Objects.requireNonNull(descriptor, "descriptor");
        return Connections.autoCommit(connectionProvider, "register meeting " + descriptor.platformMeetingId(), conn -> {
            Optional<Meeting> existing = meetingStore.findByPlatformMeetingId(
                conn, descriptor.platform(), descriptor.platformMeetingId());
            if (existing.isPresent()) {
                return new MeetingRegistration(existing.get(), false);
            }
            Instant now = Instant.now(clock);
            ProcessingStep first = ProcessingStep.WEBHOOK_RECEIVED;
            Meeting meeting = new Meeting(
                UUID.randomUUID().toString(),
                descriptor.platform(),
                descriptor.platformMeetingId(),
                descriptor.hostEmail(),
                descriptor.topic(),
                descriptor.startTime(),
                descriptor.endTime(),
                MeetingStatus.PENDING,
                first,
                first.progress(),
                List.of(),
                null,
                null,
                null,
                rawEventId,
                now,
                now);
            if (meetingStore.insert(conn, meeting)) {
                logger.log(Level.INFO, "Created meeting {0} for {1} meeting {2}",
                    new Object[]{meeting.id(), descriptor.platform().code(), descriptor.platformMeetingId()});
                return new MeetingRegistration(meeting, true);
            }
            Meeting raced = meetingStore.findByPlatformMeetingId(conn, descriptor.platform(), descriptor.platformMeetingId())
                .orElseThrow(() -> new IllegalStateException(
                    "Meeting " + descriptor.platformMeetingId() + " reported as duplicate but not found"));
            return new MeetingRegistration(raced, false);
        });
    }

    /**
     * Starts processing a pending meeting: sets status {@code processing}, stamps
     * {@code processingStartedAt} and logs the receipt of the webhook.
     *
     * @return {@code false} if the meeting is unknown or not pending
     */
    public boolean start(String meetingId) {
        Objects.requireNonNull(meetingId, "meetingId");
        return Connections.autoCommit(connectionProvider, "start meeting " + meetingId, conn -> {
            Meeting meeting = meetingStore.findById(conn, meetingId).orElse(null);
            if (meeting == null || meeting.status() != MeetingStatus.PENDING) {
                logger.log(Level.FINE, "Meeting {0} not pending; start ignored", meetingId);
                return false;
            }
            Instant now = Instant.now(clock);
            Meeting next = meeting.withStart(new ProcessingLogEntry(now, meeting.processingStep(),
                "Webhook received from " + meeting.platform().code(), null), now);
            if (!write(conn, next, meeting)) {
                return false;
            }
            logger.log(Level.INFO, "Meeting {0} processing started", meetingId);
            return true;
        });
    }

    /**
     * Moves a meeting to {@code toStep}, appending a log entry and raising the progress to the
     * step's percentage. Reaching {@link ProcessingStep#COMPLETED} also sets status
     * {@link MeetingStatus#READY}.
     *
     * @param durationMs time spent on the step that just finished, or {@code null}
     * @return {@code true} if the meeting moved; {@code false} if the request was out of order,
     *         the meeting is terminal or unknown, or it changed concurrently
     */
    public boolean advance(String meetingId, ProcessingStep toStep, String message, Long durationMs) {
        Objects.requireNonNull(meetingId, "meetingId");
        Objects.requireNonNull(toStep, "toStep");
        return Connections.autoCommit(connectionProvider, "advance meeting " + meetingId, conn -> {
            Meeting meeting = meetingStore.findById(conn, meetingId).orElse(null);
            if (meeting == null) {
                logger.log(Level.SEVERE, "Cannot advance unknown meeting {0} to {1}",
                    new Object[]{meetingId, toStep.code()});
                return false;
            }
            if (meeting.status() == MeetingStatus.FAILED || meeting.processingStep().isTerminal()) {
                logger.log(Level.SEVERE, "Cannot advance meeting {0} to {1}: already {2}",
                    new Object[]{meetingId, toStep.code(), meeting.processingStep().code()});
                return false;
            }
            if (!toStep.isAfter(meeting.processingStep())) {
                logger.log(Level.SEVERE, "Out-of-order step for meeting {0}: {1} -> {2} ignored",
                    new Object[]{meetingId, meeting.processingStep().code(), toStep.code()});
                return false;
            }
            Instant now = Instant.now(clock);
            Meeting next = meeting.withStep(toStep,
                Math.max(toStep.progress(), meeting.processingProgress()),
                new ProcessingLogEntry(now, toStep, message != null ? message : toStep.label(), durationMs),
                now);
            if (toStep == ProcessingStep.COMPLETED) {
                next = next.withStatus(MeetingStatus.READY, now, null, now);
            }
            if (!write(conn, next, meeting)) {
                return false;
            }
            if (toStep == ProcessingStep.COMPLETED) {
                metrics.incrementMeetingsCompleted();
            }
            logger.log(Level.FINE, "Meeting {0} -> {1}", new Object[]{meetingId, toStep.code()});
            return true;
        });
    }

    /**
     * Shorthand for advancing to {@link ProcessingStep#COMPLETED}.
     */
    public boolean complete(String meetingId, String message) {
        return advance(meetingId, ProcessingStep.COMPLETED, message, null);
    }

    /**
     * Marks a meeting failed. Progress is left where it was so readers can see how far it got.
     *
     * @return {@code false} if the meeting is unknown, already failed, completed, or changed
     *         concurrently
     */
    public boolean fail(String meetingId, String error) {
        Objects.requireNonNull(meetingId, "meetingId");
        return Connections.autoCommit(connectionProvider, "fail meeting " + meetingId,
            conn -> fail(conn, meetingId, error));
    }

    private boolean fail(Connection conn, String meetingId, String error) {
        Meeting meeting = meetingStore.findById(conn, meetingId).orElse(null);
        if (meeting == null) {
            logger.log(Level.SEVERE, "Cannot fail unknown meeting {0}", meetingId);
            return false;
        }
        if (meeting.status() == MeetingStatus.FAILED) {
            logger.log(Level.FINE, "Meeting {0} already failed", meetingId);
            return false;
        }
        if (meeting.processingStep().isTerminal() || !meeting.status().isActive()) {
            logger.log(Level.SEVERE, "Cannot fail meeting {0}: already {1}",
                new Object[]{meetingId, meeting.status().code()});
            return false;
        }
        Instant now = Instant.now(clock);
        String failedAt = meeting.processingStep().code();
        Meeting next = meeting
            .withStep(ProcessingStep.FAILED, meeting.processingProgress(),
                new ProcessingLogEntry(now, ProcessingStep.FAILED, "Failed at " + failedAt + ": " + error, null), now)
            .withStatus(MeetingStatus.FAILED, now, error, now);
        if (!write(conn, next, meeting)) {
            return false;
        }
        metrics.incrementMeetingsFailed();
        logger.log(Level.WARNING, "Meeting {0} failed at {1}: {2}", new Object[]{meetingId, failedAt, error});
        return true;
    }

    /**
     * Re-drives a failed meeting from {@link ProcessingStep#MEETING_CREATED}.
     */
    public boolean restart(String meetingId) {
        return restart(meetingId, ProcessingStep.MEETING_CREATED);
    }

    /**
     * Re-drives a failed meeting from {@code resumeAt} as a new logical attempt. The error is
     * cleared and the existing log is kept.
     *
     * @throws IllegalArgumentException if {@code resumeAt} is terminal or precedes
     *                                  {@link ProcessingStep#MEETING_CREATED}
     */
    public boolean restart(String meetingId, ProcessingStep resumeAt) {
        Objects.requireNonNull(meetingId, "meetingId");
        Objects.requireNonNull(resumeAt, "resumeAt");
        if (resumeAt.isTerminal() || ProcessingStep.MEETING_CREATED.isAfter(resumeAt)) {
            throw new IllegalArgumentException("Cannot resume at " + resumeAt.code());
        }
        return Connections.autoCommit(connectionProvider, "restart meeting " + meetingId, conn -> {
            Meeting meeting = meetingStore.findById(conn, meetingId).orElse(null);
            if (meeting == null || meeting.status() != MeetingStatus.FAILED) {
                logger.log(Level.WARNING, "Restart of meeting {0} ignored: not failed", meetingId);
                return false;
            }
            Instant now = Instant.now(clock);
            Meeting next = meeting.withRestart(resumeAt,
                new ProcessingLogEntry(now, resumeAt, "Restarted from " + resumeAt.label(), null), now);
            if (!write(conn, next, meeting)) {
                return false;
            }
            logger.log(Level.INFO, "Meeting {0} restarted at {1}", new Object[]{meetingId, resumeAt.code()});
            return true;
        });
    }

    /**
     * Fails every pending or processing meeting that has not moved for {@code timeout}.
     *
     * @return ids of the meetings that were failed
     */
    public List<String> failStuckMeetings(Duration timeout, int limit) {
        Instant now = Instant.now(clock);
        Instant cutoff = now.minus(timeout);
        return Connections.autoCommit(connectionProvider, "sweep stuck meetings", conn -> {
            List<String> failed = new ArrayList<>();
            for (Meeting meeting : meetingStore.findStale(conn, cutoff, limit)) {
                long minutes = Duration.between(meeting.updatedAt(), now).toMinutes();
                String error = "Processing timed out after " + minutes + " minutes (stuck at step: "
                    + meeting.processingStep().code() + "). This usually means the recording was not"
                    + " available yet; try retrying.";
                if (fail(conn, meeting.id(), error)) {
                    metrics.incrementStuckMeetings();
                    failed.add(meeting.id());
                }
            }
            return failed;
        });
    }

    public Optional<Meeting> find(String meetingId) {
        return Connections.autoCommit(connectionProvider, "load meeting " + meetingId,
            conn -> meetingStore.findById(conn, meetingId));
    }

    public List<Meeting> meetingsAt(ProcessingStep step, int limit) {
        return Connections.autoCommit(connectionProvider, "query meetings at " + step.code(),
            conn -> meetingStore.findAtStep(conn, step, limit));
    }

    public List<Meeting> meetingsAwaitingTranscript(int limit) {
        return Connections.autoCommit(connectionProvider, "query meetings awaiting transcript",
            conn -> meetingStore.findAwaitingTranscript(conn, limit));
    }

    public Optional<ProcessingStatus> status(String meetingId) {
        return find(meetingId).map(meeting -> new ProcessingStatus(
            meeting.id(),
            meeting.status(),
            meeting.processingStep(),
            meeting.processingProgress(),
            meeting.processingStep().label(),
            meeting.processingLogs(),
            meeting.processingError(),
            estimateRemaining(meeting),
            meeting.processingStartedAt(),
            meeting.processingCompletedAt()));
    }

    /**
     * Estimates time to completion as the average durations of the remaining steps plus half of
     * the current one, padded by 10%.
     */
    public static Duration estimateRemaining(Meeting meeting) {
        ProcessingStep current = meeting.processingStep();
        if (current.isTerminal() || !meeting.status().isActive()) {
            return Duration.ZERO;
        }
        double remaining = current.avgDurationMs() / 2.0;
        for (ProcessingStep step : ProcessingStep.values()) {
            if (step.isAfter(current)) {
                remaining += step.avgDurationMs();
            }
        }
        return Duration.ofMillis(Math.round(remaining * ESTIMATE_SAFETY_FACTOR));
    }

    private boolean write(Connection conn, Meeting next, Meeting previous) {
        int updated = meetingStore.update(conn, next, previous.processingStep(), previous.status());
        if (updated == 0) {
            logger.log(Level.WARNING, "Meeting {0} changed concurrently; {1} -> {2} not applied",
                new Object[]{previous.id(), previous.processingStep().code(), next.processingStep().code()});
            return false;
        }
        return true;
    }

    /**
     * Builder for {@link ProcessingStateMachine}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private MeetingStore meetingStore;
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
        public Builder meetingStore(MeetingStore meetingStore) {
            this.meetingStore = meetingStore;
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

        public ProcessingStateMachine build() {
            return new ProcessingStateMachine(this);
        }
    }
}
