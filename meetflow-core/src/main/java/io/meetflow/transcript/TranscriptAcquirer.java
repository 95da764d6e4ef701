package io.meetflow.transcript;

import io.meetflow.model.Meeting;
import io.meetflow.model.Transcript;
import io.meetflow.model.TranscriptStatus;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.TranscriptSource;
import io.meetflow.spi.TranscriptStore;
import io.meetflow.util.BoundedCallExecutor;
import io.meetflow.util.Connections;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs one transcript download-and-parse attempt for a meeting.
 *
 * <p>The attempt counter is incremented and committed before the download starts, so an attempt
 * that crashes the process is still counted. Transport, platform, timeout and parse errors mark
 * the transcript {@code failed}, record {@code lastFetchError}, and come back as
 * {@link AcquisitionResult.Failed}; nothing is retried here.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class TranscriptAcquirer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(TranscriptAcquirer.class.getName());

    private final ConnectionProvider connectionProvider;
    private final TranscriptStore transcriptStore;
    private final TranscriptSource transcriptSource;
    private final TranscriptParsers parsers;
    private final long fetchTimeoutMs;
    private final Clock clock;
    private final BoundedCallExecutor executor = new BoundedCallExecutor("transcript");

    private TranscriptAcquirer(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.transcriptStore = Objects.requireNonNull(builder.transcriptStore, "transcriptStore");
        this.transcriptSource = Objects.requireNonNull(builder.transcriptSource, "transcriptSource");
        if (builder.fetchTimeoutMs <= 0) {
            throw new IllegalArgumentException("fetchTimeoutMs must be > 0");
        }
        this.parsers = builder.parsers != null ? builder.parsers : TranscriptParsers.defaults();
        this.fetchTimeoutMs = builder.fetchTimeoutMs;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Downloads, parses and stores the meeting's transcript.
     *
     * <p>A transcript that is already ready is returned as-is without a new attempt. Any other
     * call counts one attempt, including one that fails before the download starts.
     */
    public AcquisitionResult fetchTranscript(Meeting meeting) {
        Objects.requireNonNull(meeting, "meeting");
        Optional<Transcript> found = find(meeting.id());
        if (found.isEmpty()) {
            return new AcquisitionResult.Failed("No transcript registered for meeting " + meeting.id(), false);
        }
        Transcript transcript = found.get();
        if (transcript.status() == TranscriptStatus.READY) {
            return new AcquisitionResult.Acquired(transcript);
        }

        Connections.autoCommit(connectionProvider, "record fetch attempt for transcript " + transcript.id(),
            conn -> transcriptStore.beginAttempt(conn, transcript.id(), Instant.now(clock)));
        if (transcript.sourceRef() == null) {
            return fail(transcript, "Transcript location is not known yet", false);
        }

        String content;
        try {
            content = executor.call(() -> transcriptSource.fetch(meeting, transcript), fetchTimeoutMs);
        } catch (TimeoutException e) {
            return fail(transcript, "Transcript download timed out after " + fetchTimeoutMs + "ms", false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return fail(transcript, "Transcript download failed: " + describe(cause), false);
        } catch (InterruptedException e) {
            // record with the flag cleared so the store write is not aborted, then restore it
            AcquisitionResult result = fail(transcript, "Transcript download interrupted", true);
            Thread.currentThread().interrupt();
            return result;
        }

        ParsedTranscript parsed;
        try {
            parsed = parsers.forFormat(transcript.format()).parse(content);
        } catch (RuntimeException e) {
            return fail(transcript, "Transcript could not be parsed: " + describe(e), false);
        }
        if (parsed.segments().isEmpty()) {
            return fail(transcript, "Transcript contains no speech segments", false);
        }

        int updated = Connections.autoCommit(connectionProvider, "store transcript " + transcript.id(),
            conn -> transcriptStore.markReady(conn, transcript.id(), content, parsed.fullText(),
                parsed.segments(), parsed.wordCount(), Instant.now(clock)));
        Transcript stored = find(meeting.id()).orElseThrow(() ->
            new IllegalStateException("Transcript " + transcript.id() + " disappeared after store"));
        if (updated == 0 && stored.status() != TranscriptStatus.READY) {
            return new AcquisitionResult.Failed("Transcript " + transcript.id() + " could not be marked ready", false);
        }
        logger.log(Level.INFO, "Transcript {0} ready: {1} segments, {2} words",
            new Object[]{transcript.id(), parsed.segments().size(), parsed.wordCount()});
        return new AcquisitionResult.Acquired(stored);
    }

    private Optional<Transcript> find(String meetingId) {
        return Connections.autoCommit(connectionProvider, "load transcript of meeting " + meetingId,
            conn -> transcriptStore.findByMeetingId(conn, meetingId));
    }

    private AcquisitionResult fail(Transcript transcript, String error, boolean interrupted) {
        if (interrupted) {
            Thread.interrupted();
        }
        logger.log(Level.WARNING, "Transcript {0} attempt failed: {1}", new Object[]{transcript.id(), error});
        Connections.autoCommit(connectionProvider, "record fetch failure for transcript " + transcript.id(),
            conn -> transcriptStore.markFailed(conn, transcript.id(), error, Instant.now(clock)));
        return new AcquisitionResult.Failed(error, interrupted);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    @Override
    public void close() {
        executor.close();
    }

    /**
     * Builder for {@link TranscriptAcquirer}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private TranscriptStore transcriptStore;
        private TranscriptSource transcriptSource;
        private TranscriptParsers parsers;
        private long fetchTimeoutMs = 20_000;
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
        public Builder transcriptStore(TranscriptStore transcriptStore) {
            this.transcriptStore = transcriptStore;
            return this;
        }

        /**
         * Sets the platform download client.
         *
         * <p><b>Required.</b>
         */
        public Builder transcriptSource(TranscriptSource transcriptSource) {
            this.transcriptSource = transcriptSource;
            return this;
        }

        /**
         * Optional. Defaults to {@link TranscriptParsers#defaults()}.
         */
        public Builder parsers(TranscriptParsers parsers) {
            this.parsers = parsers;
            return this;
        }

        /**
         * Sets the upper bound on one download.
         *
         * <p>Optional. Defaults to {@code 20000} ms. Must be &gt; 0.
         */
        public Builder fetchTimeoutMs(long fetchTimeoutMs) {
            this.fetchTimeoutMs = fetchTimeoutMs;
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TranscriptAcquirer build() {
            return new TranscriptAcquirer(this);
        }
    }
}
