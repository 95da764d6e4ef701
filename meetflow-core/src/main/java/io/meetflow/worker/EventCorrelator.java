package io.meetflow.worker;

import io.meetflow.PipelineException;
import io.meetflow.ingest.platform.PlatformEventAdapters;
import io.meetflow.model.Meeting;
import io.meetflow.model.MeetingStatus;
import io.meetflow.model.ProcessingStep;
import io.meetflow.model.RawEvent;
import io.meetflow.model.RawEventStatus;
import io.meetflow.model.Transcript;
import io.meetflow.model.TranscriptStatus;
import io.meetflow.progress.MeetingRegistration;
import io.meetflow.progress.ProcessingStateMachine;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.MeetingDescriptor;
import io.meetflow.spi.MetricsExporter;
import io.meetflow.spi.RawEventStore;
import io.meetflow.spi.TranscriptStore;
import io.meetflow.util.Connections;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns stored raw events into meetings and transcript rows.
 *
 * <p>A raw event is claimed by moving it from {@code received} to {@code processing}; only the
 * caller whose transition succeeded correlates it. Non-actionable events (per the platform
 * adapter) are marked processed without touching any meeting.
 */
public final class EventCorrelator {
    private static final Logger logger = Logger.getLogger(EventCorrelator.class.getName());

    private final ConnectionProvider connectionProvider;
    private final RawEventStore rawEventStore;
    private final TranscriptStore transcriptStore;
    private final PlatformEventAdapters adapters;
    private final ProcessingStateMachine stateMachine;
    private final MetricsExporter metrics;
    private final Clock clock;

    private EventCorrelator(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.rawEventStore = Objects.requireNonNull(builder.rawEventStore, "rawEventStore");
        this.transcriptStore = Objects.requireNonNull(builder.transcriptStore, "transcriptStore");
        this.stateMachine = Objects.requireNonNull(builder.stateMachine, "stateMachine");
        this.adapters = builder.adapters != null ? builder.adapters : PlatformEventAdapters.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Raw events still in {@code received}, oldest first.
     */
    public List<RawEvent> pollReceived(int limit) {
        return Connections.autoCommit(connectionProvider, "poll received raw events",
            conn -> rawEventStore.pollReceived(conn, limit));
    }

    public Optional<RawEvent> find(String rawEventId) {
        return Connections.autoCommit(connectionProvider, "load raw event " + rawEventId,
            conn -> rawEventStore.findById(conn, rawEventId));
    }

    /**
     * Claims a received event for this caller.
     *
     * @return {@code false} if another worker already claimed it
     */
    public boolean claim(RawEvent event) {
        return transition(event.id(), RawEventStatus.RECEIVED, RawEventStatus.PROCESSING, null);
    }

    /**
     * Correlates a claimed event and marks it processed.
     *
     * @throws RuntimeException if correlation failed; the event is left in {@code processing}
     *                          for the caller to mark failed
     */
    public Optional<Meeting> process(RawEvent event) {
        Optional<Meeting> meeting = correlate(event);
        transition(event.id(), RawEventStatus.PROCESSING, RawEventStatus.PROCESSED, null);
        metrics.incrementEventsProcessed();
        return meeting;
    }

    /**
     * Re-runs correlation for an event whose earlier attempt failed.
     *
     * @return {@code false} if the event is no longer {@code failed}
     */
    public boolean reprocess(RawEvent event) {
        if (event.status() != RawEventStatus.FAILED) {
            return false;
        }
        correlate(event);
        if (!transition(event.id(), RawEventStatus.FAILED, RawEventStatus.PROCESSED, null)) {
            return false;
        }
        metrics.incrementEventsProcessed();
        return true;
    }

    /**
     * Records why a claimed event could not be correlated.
     */
    public void markFailed(RawEvent event, String error) {
        transition(event.id(), RawEventStatus.PROCESSING, RawEventStatus.FAILED, error);
    }

    private Optional<Meeting> correlate(RawEvent event) {
        Optional<MeetingDescriptor> described = adapters.forPlatform(event.platform()).correlate(event);
        if (described.isEmpty()) {
            logger.log(Level.FINE, "{0} event {1} is not actionable; stored for audit only",
                new Object[]{event.platform().code(), event.eventType()});
            return Optional.empty();
        }
        MeetingDescriptor descriptor = described.get();
        MeetingRegistration registration = stateMachine.register(descriptor, event.id());
        Meeting meeting = registration.meeting();
        if (meeting.status() == MeetingStatus.PENDING) {
            stateMachine.start(meeting.id());
        }
        ensureTranscript(meeting, descriptor);
        advanceIfBehind(meeting.id(), ProcessingStep.MEETING_FETCHED,
            "Fetched meeting details from " + descriptor.platform().code());
        advanceIfBehind(meeting.id(), ProcessingStep.MEETING_CREATED, "Meeting record created");
        return stateMachine.find(meeting.id());
    }

    private void advanceIfBehind(String meetingId, ProcessingStep step, String message) {
        Meeting current = stateMachine.find(meetingId)
            .orElseThrow(() -> new PipelineException("Meeting " + meetingId + " disappeared"));
        if (current.status() == MeetingStatus.PROCESSING && step.isAfter(current.processingStep())) {
            stateMachine.advance(meetingId, step, message, null);
        }
    }

    private void ensureTranscript(Meeting meeting, MeetingDescriptor descriptor) {
        Instant now = Instant.now(clock);
        Connections.autoCommit(connectionProvider, "register transcript of meeting " + meeting.id(), conn -> {
            Optional<Transcript> existing = transcriptStore.findByMeetingId(conn, meeting.id());
            if (existing.isEmpty()) {
                Transcript transcript = new Transcript(
                    UUID.randomUUID().toString(),
                    meeting.id(),
                    TranscriptStatus.PENDING,
                    descriptor.transcriptRef(),
                    descriptor.transcriptFormat(),
                    null,
                    null,
                    List.of(),
                    0,
                    0,
                    null,
                    now,
                    now);
                if (transcriptStore.insert(conn, transcript)) {
                    return null;
                }
                existing = transcriptStore.findByMeetingId(conn, meeting.id());
            }
            Transcript transcript = existing.orElseThrow(() ->
                new PipelineException("Transcript of meeting " + meeting.id() + " reported as duplicate but not found"));
            if (descriptor.transcriptRef() != null && !descriptor.transcriptRef().equals(transcript.sourceRef())) {
                transcriptStore.updateSource(conn, transcript.id(), descriptor.transcriptRef(),
                    descriptor.transcriptFormat(), now);
            }
            return null;
        });
    }

    private boolean transition(String rawEventId, RawEventStatus from, RawEventStatus to, String error) {
        if (!from.canTransitionTo(to)) {
            logger.log(Level.SEVERE, "Illegal raw event transition {0} -> {1} for {2}",
                new Object[]{from.code(), to.code(), rawEventId});
            return false;
        }
        Instant processedAt = to == RawEventStatus.PROCESSED ? Instant.now(clock) : null;
        return Connections.autoCommit(connectionProvider, "move raw event " + rawEventId + " to " + to.code(),
            conn -> rawEventStore.transition(conn, rawEventId, from, to, error, processedAt) > 0);
    }

    /**
     * Builder for {@link EventCorrelator}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RawEventStore rawEventStore;
        private TranscriptStore transcriptStore;
        private PlatformEventAdapters adapters;
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
        public Builder rawEventStore(RawEventStore rawEventStore) {
            this.rawEventStore = rawEventStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder transcriptStore(TranscriptStore transcriptStore) {
            this.transcriptStore = transcriptStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder stateMachine(ProcessingStateMachine stateMachine) {
            this.stateMachine = stateMachine;
            return this;
        }

        /**
         * Optional. Defaults to {@link PlatformEventAdapters#defaults()}.
         */
        public Builder adapters(PlatformEventAdapters adapters) {
            this.adapters = adapters;
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

        public EventCorrelator build() {
            return new EventCorrelator(this);
        }
    }
}
