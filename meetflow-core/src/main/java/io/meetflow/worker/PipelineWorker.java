package io.meetflow.worker;

import io.meetflow.dead.DeadLetterManager;
import io.meetflow.model.FailureStatus;
import io.meetflow.model.Meeting;
import io.meetflow.model.MeetingStatus;
import io.meetflow.model.ProcessingStep;
import io.meetflow.model.RawEvent;
import io.meetflow.model.RetryableStep;
import io.meetflow.model.WebhookFailure;
import io.meetflow.progress.ProcessingStateMachine;
import io.meetflow.retry.WebhookFailureQueue;
import io.meetflow.spi.DraftGenerationTrigger;
import io.meetflow.transcript.AcquisitionResult;
import io.meetflow.transcript.TranscriptAcquirer;
import io.meetflow.util.BoundedCallExecutor;
import io.meetflow.util.JsonCodec;
import io.meetflow.util.PipelineThreads;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background loop that drives the pipeline.
 *
 * <p>Each {@link #tick()} runs these phases in order, each one isolated from the others:
 * <ol>
 *   <li>claim {@code received} raw events and correlate them to meetings;</li>
 *   <li>claim due webhook failures and re-execute the failed step;</li>
 *   <li>download transcripts for meetings at {@code meeting_created};</li>
 *   <li>request draft generation for meetings at {@code transcript_stored};</li>
 *   <li>fail meetings that have not moved within the stuck timeout;</li>
 *   <li>deliver pending dead-letter alerts;</li>
 *   <li>refresh the retry-queue depth gauge.</li>
 * </ol>
 * Every item is processed on its own: an exception is caught at the item boundary and
 * recorded in the retry queue instead of escaping the loop.
 *
 * <p>{@link #shutdown(String)} stops claiming new work, waits up to the drain timeout for the
 * in-flight item, then interrupts it. An interrupted item is recorded as a failure, so nothing
 * is lost silently.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class PipelineWorker implements Runnable, AutoCloseable {
    private static final Logger logger = Logger.getLogger(PipelineWorker.class.getName());

    private final EventCorrelator correlator;
    private final ProcessingStateMachine stateMachine;
    private final TranscriptAcquirer acquirer;
    private final WebhookFailureQueue failureQueue;
    private final DeadLetterManager deadLetterManager;
    private final DraftGenerationTrigger draftTrigger;
    private final JsonCodec jsonCodec;
    private final int batchSize;
    private final long intervalMs;
    private final long drainTimeoutMs;
    private final Duration stuckTimeout;
    private final long generationTimeoutMs;
    private final Clock clock;

    private final BoundedCallExecutor generationExecutor = new BoundedCallExecutor("generation");
    private final Object tickLock = new Object();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private volatile Thread runner;

    private PipelineWorker(Builder builder) {
        this.correlator = Objects.requireNonNull(builder.correlator, "correlator");
        this.stateMachine = Objects.requireNonNull(builder.stateMachine, "stateMachine");
        this.acquirer = Objects.requireNonNull(builder.acquirer, "acquirer");
        this.failureQueue = Objects.requireNonNull(builder.failureQueue, "failureQueue");
        this.deadLetterManager = Objects.requireNonNull(builder.deadLetterManager, "deadLetterManager");
        this.draftTrigger = Objects.requireNonNull(builder.draftTrigger, "draftTrigger");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.drainTimeoutMs < 0L) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        if (builder.generationTimeoutMs <= 0L) {
            throw new IllegalArgumentException("generationTimeoutMs must be > 0");
        }
        Duration stuckTimeout = builder.stuckTimeout != null ? builder.stuckTimeout : Duration.ofMinutes(15);
        if (stuckTimeout.isNegative() || stuckTimeout.isZero()) {
            throw new IllegalArgumentException("stuckTimeout must be positive");
        }
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.stuckTimeout = stuckTimeout;
        this.generationTimeoutMs = builder.generationTimeoutMs;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts {@link #run()} on a daemon thread and returns it.
     */
    public synchronized Thread start() {
        if (runner != null || stopRequested) {
            throw new IllegalStateException("PipelineWorker already started or stopped");
        }
        Thread thread = PipelineThreads.newThread("worker", this);
        runner = thread;
        thread.start();
        return thread;
    }

    /**
     * Polls until {@link #shutdown(String)} is called. Blocks the calling thread.
     */
    @Override
    public void run() {
        synchronized (this) {
            if (runner == null) {
                runner = Thread.currentThread();
            }
        }
        logger.log(Level.INFO, "Pipeline worker started (interval {0} ms, batch {1})",
            new Object[]{intervalMs, batchSize});
        try {
            while (!stopRequested) {
                tick();
                if (!awaitNextTick()) {
                    break;
                }
            }
        } finally {
            generationExecutor.close();
            stopped.countDown();
            logger.info("Pipeline worker stopped");
        }
    }

    /**
     * Runs one pass over every phase. Called by {@link #run()}, and directly by tests.
     */
    public void tick() {
        phase("raw events", this::processReceivedEvents);
        phase("retries", this::processDueRetries);
        phase("transcripts", this::processAwaitingTranscripts);
        phase("draft generation", this::processReadyForDrafts);
        phase("stuck sweep", this::sweepStuckMeetings);
        phase("alerts", deadLetterManager::sendPendingAlerts);
        phase("queue depth", failureQueue::metrics);
    }

    /**
     * Stops claiming new work and waits for the in-flight item. If it has not finished within the
     * drain timeout the worker thread is interrupted and the item recorded as failed.
     *
     * @param signal what asked for the shutdown, for the log
     */
    public void shutdown(String signal) {
        logger.log(Level.INFO, "Pipeline worker shutting down on {0}", signal);
        stopRequested = true;
        synchronized (tickLock) {
            tickLock.notifyAll();
        }
        Thread thread = runner;
        if (thread == null) {
            generationExecutor.close();
            return;
        }
        if (thread == Thread.currentThread()) {
            return;
        }
        try {
            if (!stopped.await(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "In-flight work did not finish within {0} ms; interrupting", drainTimeoutMs);
                thread.interrupt();
                if (!stopped.await(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.warning("Pipeline worker did not stop after interruption");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Equivalent to {@code shutdown("close")}.
     */
    @Override
    public void close() {
        shutdown("close");
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    private boolean awaitNextTick() {
        synchronized (tickLock) {
            if (stopRequested) {
                return false;
            }
            try {
                tickLock.wait(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return !Thread.currentThread().isInterrupted();
    }

    private void phase(String name, Runnable work) {
        if (stopRequested) {
            return;
        }
        try {
            work.run();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Worker phase '" + name + "' failed", t);
        }
    }

    // raw events

    private void processReceivedEvents() {
        for (RawEvent event : correlator.pollReceived(batchSize)) {
            if (stopRequested) {
                return;
            }
            if (!correlator.claim(event)) {
                continue;
            }
            try {
                correlator.process(event);
            } catch (Throwable t) {
                String error = describe(t);
                logger.log(Level.SEVERE, "Correlation of raw event " + event.id() + " failed", t);
                recordGuarded(() -> {
                    correlator.markFailed(event, error);
                    failureQueue.recordFailure(event.platform(), event.eventType(),
                        RetryableStep.EVENT_PROCESSING, event.id(), event.payloadJson(), error);
                });
            }
        }
    }

    // retries

    private void processDueRetries() {
        List<WebhookFailure> due = failureQueue.dueForRetry(Instant.now(clock), batchSize);
        for (WebhookFailure candidate : due) {
            if (stopRequested) {
                return;
            }
            Optional<WebhookFailure> claimed;
            try {
                claimed = failureQueue.claimForRetry(candidate);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Could not claim webhook failure " + candidate.id(), e);
                continue;
            }
            if (claimed.isEmpty()) {
                continue;
            }
            try {
                retry(claimed.get());
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Retry of webhook failure " + candidate.id() + " failed", t);
                recordGuarded(() -> afterOutcome(failureQueue.recordRetryOutcome(candidate.id(), false, describe(t))));
            }
        }
    }

    private void retry(WebhookFailure failure) {
        switch (failure.step()) {
            case EVENT_PROCESSING -> retryEvent(failure);
            case TRANSCRIPT_FETCH -> retryTranscript(failure);
            case DRAFT_GENERATION -> retryDraft(failure);
        }
    }

    private void retryEvent(WebhookFailure failure) {
        RawEvent event = correlator.find(failure.referenceId()).orElse(null);
        if (event == null) {
            failureQueue.recordSuperseded(failure.id(), "raw event " + failure.referenceId() + " no longer exists");
            return;
        }
        if (!correlator.reprocess(event)) {
            failureQueue.recordSuperseded(failure.id(), "raw event " + event.id() + " is already " + event.status().code());
            return;
        }
        afterOutcome(failureQueue.recordRetryOutcome(failure.id(), true, null));
    }

    private void retryTranscript(WebhookFailure failure) {
        Meeting meeting = retryTarget(failure);
        if (meeting == null) {
            return;
        }
        AcquisitionResult result = acquirer.fetchTranscript(meeting);
        if (result instanceof AcquisitionResult.Failed failed) {
            recordInterruptible(failed.interrupted(),
                () -> afterOutcome(failureQueue.recordRetryOutcome(failure.id(), false, failed.error())));
            return;
        }
        storeTranscriptSteps(meeting);
        afterOutcome(failureQueue.recordRetryOutcome(failure.id(), true, null));
    }

    private void retryDraft(WebhookFailure failure) {
        Meeting meeting = retryTarget(failure);
        if (meeting == null) {
            return;
        }
        String error = requestGeneration(meeting.id());
        if (error != null) {
            boolean interrupted = Thread.currentThread().isInterrupted();
            recordInterruptible(interrupted,
                () -> afterOutcome(failureQueue.recordRetryOutcome(failure.id(), false, error)));
            return;
        }
        stateMachine.complete(meeting.id(), "Draft generation requested");
        afterOutcome(failureQueue.recordRetryOutcome(failure.id(), true, null));
    }

    /**
     * Loads the meeting a meeting-level retry targets, or closes the failure as superseded when
     * the meeting has moved on.
     */
    private Meeting retryTarget(WebhookFailure failure) {
        ProcessingStep expected = failure.step().meetingStep();
        Meeting meeting = stateMachine.find(failure.referenceId()).orElse(null);
        if (meeting == null) {
            failureQueue.recordSuperseded(failure.id(), "meeting " + failure.referenceId() + " no longer exists");
            return null;
        }
        if (meeting.status() != MeetingStatus.PROCESSING || meeting.processingStep() != expected) {
            failureQueue.recordSuperseded(failure.id(), "meeting " + meeting.id() + " is "
                + meeting.status().code() + " at " + meeting.processingStep().code() + ", expected " + expected.code());
            return null;
        }
        return meeting;
    }

    /**
     * Fails the meeting behind a meeting-level failure that was just dead-lettered.
     */
    private void afterOutcome(WebhookFailure failure) {
        if (failure.status() == FailureStatus.DEAD_LETTER && failure.step().isMeetingLevel()) {
            stateMachine.fail(failure.referenceId(), failure.error());
        }
    }

    // transcripts

    private void processAwaitingTranscripts() {
        for (Meeting meeting : stateMachine.meetingsAwaitingTranscript(batchSize)) {
            if (stopRequested) {
                return;
            }
            try {
                acquire(meeting);
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Transcript acquisition for meeting " + meeting.id() + " failed", t);
                recordGuarded(() -> recordMeetingFailure(meeting, RetryableStep.TRANSCRIPT_FETCH, describe(t)));
            }
        }
    }

    private void acquire(Meeting meeting) {
        if (!stateMachine.advance(meeting.id(), ProcessingStep.TRANSCRIPT_DOWNLOAD, "Downloading transcript", null)) {
            return;
        }
        long started = clock.millis();
        AcquisitionResult result = acquirer.fetchTranscript(meeting);
        if (result instanceof AcquisitionResult.Failed failed) {
            recordInterruptible(failed.interrupted(),
                () -> recordMeetingFailure(meeting, RetryableStep.TRANSCRIPT_FETCH, failed.error()));
            return;
        }
        logger.log(Level.FINE, "Transcript of meeting {0} downloaded in {1} ms",
            new Object[]{meeting.id(), clock.millis() - started});
        storeTranscriptSteps(meeting);
    }

    private void storeTranscriptSteps(Meeting meeting) {
        stateMachine.advance(meeting.id(), ProcessingStep.TRANSCRIPT_PARSE, "Transcript downloaded", null);
        stateMachine.advance(meeting.id(), ProcessingStep.TRANSCRIPT_STORED, "Transcript parsed and stored", null);
    }

    // drafts

    private void processReadyForDrafts() {
        for (Meeting meeting : stateMachine.meetingsAt(ProcessingStep.TRANSCRIPT_STORED, batchSize)) {
            if (stopRequested) {
                return;
            }
            if (meeting.status() != MeetingStatus.PROCESSING) {
                continue;
            }
            try {
                generate(meeting);
            } catch (Throwable t) {
                logger.log(Level.SEVERE, "Draft generation for meeting " + meeting.id() + " failed", t);
                recordGuarded(() -> recordMeetingFailure(meeting, RetryableStep.DRAFT_GENERATION, describe(t)));
            }
        }
    }

    private void generate(Meeting meeting) {
        if (!stateMachine.advance(meeting.id(), ProcessingStep.DRAFT_GENERATION, "Requesting draft generation", null)) {
            return;
        }
        String error = requestGeneration(meeting.id());
        if (error != null) {
            boolean interrupted = Thread.currentThread().isInterrupted();
            recordInterruptible(interrupted,
                () -> recordMeetingFailure(meeting, RetryableStep.DRAFT_GENERATION, error));
            return;
        }
        stateMachine.complete(meeting.id(), "Draft generation requested");
    }

    /**
     * Calls the draft trigger under the generation timeout.
     *
     * @return {@code null} on success, otherwise the error to record
     */
    private String requestGeneration(String meetingId) {
        try {
            generationExecutor.call(() -> {
                draftTrigger.requestGeneration(meetingId);
                return null;
            }, generationTimeoutMs);
            return null;
        } catch (TimeoutException e) {
            return "Draft generation request timed out after " + generationTimeoutMs + "ms";
        } catch (ExecutionException e) {
            return "Draft generation request failed: " + describe(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Draft generation request interrupted";
        }
    }

    private void recordMeetingFailure(Meeting meeting, RetryableStep step, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("meetingId", meeting.id());
        payload.put("platformMeetingId", meeting.platformMeetingId());
        payload.put("step", step.code());
        afterOutcome(failureQueue.recordFailure(meeting.platform(), step.code(), step, meeting.id(),
            jsonCodec.toJson(payload), error));
    }

    // housekeeping

    private void sweepStuckMeetings() {
        List<String> failed = stateMachine.failStuckMeetings(stuckTimeout, batchSize);
        if (!failed.isEmpty()) {
            logger.log(Level.WARNING, "Failed {0} stuck meeting(s): {1}", new Object[]{failed.size(), failed});
        }
    }

    /**
     * Runs a failure-recording action with the interrupt flag cleared so that the store writes
     * are not aborted, then restores the flag.
     */
    private void recordInterruptible(boolean interrupted, Runnable record) {
        boolean flagged = Thread.interrupted() || interrupted;
        try {
            record.run();
        } finally {
            if (flagged) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void recordGuarded(Runnable record) {
        try {
            recordInterruptible(false, record);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Failed to record pipeline failure", t);
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null ? t.getClass().getSimpleName() + ": " + message : t.getClass().getName();
    }

    /**
     * Builder for {@link PipelineWorker}.
     */
    public static final class Builder {
        private EventCorrelator correlator;
        private ProcessingStateMachine stateMachine;
        private TranscriptAcquirer acquirer;
        private WebhookFailureQueue failureQueue;
        private DeadLetterManager deadLetterManager;
        private DraftGenerationTrigger draftTrigger;
        private JsonCodec jsonCodec;
        private int batchSize = 25;
        private long intervalMs = 5000;
        private long drainTimeoutMs = 5000;
        private Duration stuckTimeout;
        private long generationTimeoutMs = 20_000;
        private Clock clock;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder correlator(EventCorrelator correlator) {
            this.correlator = correlator;
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
         * <p><b>Required.</b>
         */
        public Builder acquirer(TranscriptAcquirer acquirer) {
            this.acquirer = acquirer;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder failureQueue(WebhookFailureQueue failureQueue) {
            this.failureQueue = failureQueue;
            return this;
        }

        /**
         * <p><b>Required.</b>
         */
        public Builder deadLetterManager(DeadLetterManager deadLetterManager) {
            this.deadLetterManager = deadLetterManager;
            return this;
        }

        /**
         * Sets the downstream generation hook called once a transcript is stored.
         *
         * <p><b>Required.</b>
         */
        public Builder draftTrigger(DraftGenerationTrigger draftTrigger) {
            this.draftTrigger = draftTrigger;
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
         * Sets the maximum number of items claimed per phase per tick.
         *
         * <p>Optional. Defaults to {@code 25}. Must be &gt; 0.
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
         * Sets how long {@link #shutdown(String)} waits for in-flight work before interrupting it.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &ge; 0.
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
         * Sets the upper bound on one draft-generation request.
         *
         * <p>Optional. Defaults to {@code 20000} ms. Must be &gt; 0.
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

        public PipelineWorker build() {
            return new PipelineWorker(this);
        }
    }
}
