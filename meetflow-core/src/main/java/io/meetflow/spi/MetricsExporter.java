package io.meetflow.spi;

/**
 * Observability hook for pipeline counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /**
     * A new raw event was stored.
     */
    void incrementEventsIngested();

    /**
     * A delivery was recognised as a duplicate and dropped.
     */
    void incrementDuplicateEvents();

    /**
     * A raw event was correlated and marked processed.
     */
    void incrementEventsProcessed();

    /**
     * A step failed for the first time and entered the retry queue.
     */
    void incrementFailuresRecorded();

    void incrementRetrySucceeded();

    void incrementRetryFailed();

    void incrementDeadLettered();

    default void incrementAlertsSent() {
    }

    default void incrementMeetingsCompleted() {
    }

    default void incrementMeetingsFailed() {
    }

    default void incrementStuckMeetings() {
    }

    /**
     * Records how many failures are waiting for a retry (pending plus retrying).
     */
    default void recordRetryQueueDepth(int depth) {
    }

    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsIngested() {
        }

        @Override
        public void incrementDuplicateEvents() {
        }

        @Override
        public void incrementEventsProcessed() {
        }

        @Override
        public void incrementFailuresRecorded() {
        }

        @Override
        public void incrementRetrySucceeded() {
        }

        @Override
        public void incrementRetryFailed() {
        }

        @Override
        public void incrementDeadLettered() {
        }
    }
}
