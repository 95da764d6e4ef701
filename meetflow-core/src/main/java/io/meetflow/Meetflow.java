package io.meetflow;

import io.meetflow.dead.DeadLetterManager;
import io.meetflow.ingest.EventIngestor;
import io.meetflow.ingest.platform.PlatformEventAdapters;
import io.meetflow.progress.ProcessingStateMachine;
import io.meetflow.retry.RetryPolicy;
import io.meetflow.retry.WebhookFailureQueue;
import io.meetflow.spi.ConnectionProvider;
import io.meetflow.spi.DeadLetterAlerter;
import io.meetflow.spi.DeadLetterStore;
import io.meetflow.spi.DraftGenerationTrigger;
import io.meetflow.spi.MeetingStore;
import io.meetflow.spi.MetricsExporter;
import io.meetflow.spi.RawEventStore;
import io.meetflow.spi.TranscriptSource;
import io.meetflow.spi.TranscriptStore;
import io.meetflow.spi.WebhookFailureStore;
import io.meetflow.transcript.TranscriptAcquirer;
import io.meetflow.transcript.TranscriptParsers;
import io.meetflow.util.JsonCodec;
import io.meetflow.worker.EventCorrelator;
import io.meetflow.worker.PipelineWorker;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires every pipeline component over one set of stores into a
 * single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Meetflow meetflow = Meetflow.builder()
 *     .connectionProvider(connections)
 *     .rawEventStore(stores.rawEvents())
 *     .meetingStore(stores.meetings())
 *     .transcriptStore(stores.transcripts())
 *     .failureStore(stores.webhookFailures())
 *     .deadLetterStore(stores.deadLetters())
 *     .transcriptSource(source)
 *     .draftTrigger(trigger)
 *     .build()) {
 *   meetflow.start();
 *   meetflow.ingestor().ingestDelivery(Platform.ZOOM, body);
 * }
 * }</pre>
 *
 * @see PipelineWorker
 * @see EventIngestor
 */
public final class Meetflow implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Meetflow.class.getName());

    private final EventIngestor ingestor;
    private final ProcessingStateMachine stateMachine;
    private final DeadLetterManager deadLetterManager;
    private final WebhookFailureQueue failureQueue;
    private final TranscriptAcquirer acquirer;
    private final PipelineWorker worker;
    private final MetricsExporter metrics;

    private Meetflow(Builder builder) {
        MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        PlatformEventAdapters adapters = builder.adapters != null ? builder.adapters : PlatformEventAdapters.defaults();

        this.ingestor = EventIngestor.builder()
            .connectionProvider(builder.connectionProvider)
            .rawEventStore(builder.rawEventStore)
            .adapters(adapters)
            .metrics(metrics)
            .clock(clock)
            .build();
        this.stateMachine = ProcessingStateMachine.builder()
            .connectionProvider(builder.connectionProvider)
            .meetingStore(builder.meetingStore)
            .metrics(metrics)
            .clock(clock)
            .build();
        this.deadLetterManager = DeadLetterManager.builder()
            .connectionProvider(builder.connectionProvider)
            .deadLetterStore(builder.deadLetterStore)
            .failureStore(builder.failureStore)
            .alerter(builder.alerter)
            .ingestor(ingestor)
            .stateMachine(stateMachine)
            .metrics(metrics)
            .clock(clock)
            .build();
        this.failureQueue = WebhookFailureQueue.builder()
            .connectionProvider(builder.connectionProvider)
            .failureStore(builder.failureStore)
            .deadLetterManager(deadLetterManager)
            .retryPolicy(builder.retryPolicy)
            .maxAttempts(builder.maxAttempts)
            .leaseMs(builder.leaseMs)
            .metrics(metrics)
            .clock(clock)
            .build();
        this.acquirer = TranscriptAcquirer.builder()
            .connectionProvider(builder.connectionProvider)
            .transcriptStore(builder.transcriptStore)
            .transcriptSource(builder.transcriptSource)
            .parsers(builder.parsers)
            .fetchTimeoutMs(builder.fetchTimeoutMs)
            .clock(clock)
            .build();
        EventCorrelator correlator = EventCorrelator.builder()
            .connectionProvider(builder.connectionProvider)
            .rawEventStore(builder.rawEventStore)
            .transcriptStore(builder.transcriptStore)
            .stateMachine(stateMachine)
            .adapters(adapters)
            .metrics(metrics)
            .clock(clock)
            .build();
        this.worker = PipelineWorker.builder()
            .correlator(correlator)
            .stateMachine(stateMachine)
            .acquirer(acquirer)
            .failureQueue(failureQueue)
            .deadLetterManager(deadLetterManager)
            .draftTrigger(builder.draftTrigger)
            .jsonCodec(builder.jsonCodec)
            .batchSize(builder.batchSize)
            .intervalMs(builder.intervalMs)
            .drainTimeoutMs(builder.drainTimeoutMs)
            .stuckTimeout(builder.stuckTimeout)
            .generationTimeoutMs(builder.generationTimeoutMs)
            .clock(clock)
            .build();
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the background worker on a daemon thread.
     *
     * @throws IllegalStateException if already started or closed
     */
    public Thread start() {
        return worker.start();
    }

    public EventIngestor ingestor() {
        return ingestor;
    }

    public ProcessingStateMachine stateMachine() {
        return stateMachine;
    }

    public DeadLetterManager deadLetters() {
        return deadLetterManager;
    }

    public WebhookFailureQueue failureQueue() {
        return failureQueue;
    }

    public PipelineWorker worker() {
        return worker;
    }

    /**
     * Shuts the worker down gracefully, then releases the transcript download threads and,
     * when it is closeable, the metrics exporter.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        try {
            worker.shutdown("close");
        } catch (RuntimeException e) {
            first = e;
        }
        try {
            acquirer.close();
        } catch (RuntimeException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            logger.log(Level.WARNING, "Error while closing Meetflow", first);
            throw first;
        }
    }

    /**
     * Builder for {@link Meetflow}. Single use.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RawEventStore rawEventStore;
        private MeetingStore meetingStore;
        private TranscriptStore transcriptStore;
        private WebhookFailureStore failureStore;
        private DeadLetterStore deadLetterStore;
        private TranscriptSource transcriptSource;
        private DraftGenerationTrigger draftTrigger;
        private DeadLetterAlerter alerter;
        private PlatformEventAdapters adapters;
        private TranscriptParsers parsers;
        private RetryPolicy retryPolicy;
        private int maxAttempts = 3;
        private long leaseMs = 60_000L;
        private long fetchTimeoutMs = 20_000L;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;
        private int batchSize = 25;
        private long intervalMs = 5000L;
        private long drainTimeoutMs = 5000L;
        private Duration stuckTimeout;
        private long generationTimeoutMs = 20_000L;
        private Clock clock;
        private final AtomicBoolean built = new AtomicBoolean(false);

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
        public Builder meetingStore(MeetingStore meetingStore) {
            this.meetingStore = meetingStore;
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
        public Builder failureStore(WebhookFailureStore failureStore) {
            this.failureStore = failureStore;
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
         * Sets where transcript bodies are downloaded from.
         *
         * <p><b>Required.</b>
         */
        public Builder transcriptSource(TranscriptSource transcriptSource) {
            this.transcriptSource = transcriptSource;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder draftTrigger(DraftGenerationTrigger draftTrigger) {
            this.draftTrigger = draftTrigger;
            return this;
        }

        /**
         * Optional. Defaults to a logging alerter.
         */
        public Builder alerter(DeadLetterAlerter alerter) {
            this.alerter = alerter;
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
         * Optional. Defaults to {@link TranscriptParsers#defaults()}.
         */
        public Builder parsers(TranscriptParsers parsers) {
            this.parsers = parsers;
            return this;
        }

        /**
         * Optional. Defaults to linear backoff with a one second base.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Optional. Defaults to {@code 3}. Must be &gt; 0.
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets how long a claimed retry stays invisible to other workers.
         *
         * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
         */
        public Builder leaseMs(long leaseMs) {
            this.leaseMs = leaseMs;
            return this;
        }

        /**
         * Optional. Defaults to {@code 20000} ms. Must be &gt; 0.
         */
        public Builder fetchTimeoutMs(long fetchTimeoutMs) {
            this.fetchTimeoutMs = fetchTimeoutMs;
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
         * Optional. Defaults to {@link JsonCodec#getDefault()}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Optional. Defaults to {@code 25}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        /**
         * Optional. Defaults to 15 minutes.
         */
        public Builder stuckTimeout(Duration stuckTimeout) {
            this.stuckTimeout = stuckTimeout;
            return this;
        }

        /**
         * Optional. Defaults to {@code 20000} ms. Must be &gt; 0.
         */
        public Builder generationTimeoutMs(long generationTimeoutMs) {
            this.generationTimeoutMs = generationTimeoutMs;
            return this;
        }

        /**
         * Optional. Defaults to the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws IllegalStateException if build() was already called
         * @throws NullPointerException if a required collaborator is missing
         */
        public Meetflow build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            return new Meetflow(this);
        }
    }
}
