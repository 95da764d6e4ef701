package io.meetflow.micrometer;

import io.meetflow.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code meetflow.events.ingested} - new raw events stored</li>
 *   <li>{@code meetflow.events.duplicate} - deliveries dropped as duplicates</li>
 *   <li>{@code meetflow.events.processed} - raw events correlated</li>
 *   <li>{@code meetflow.failures.recorded} - steps that entered the retry queue</li>
 *   <li>{@code meetflow.retry.success} - retries that succeeded</li>
 *   <li>{@code meetflow.retry.failure} - retries that failed again</li>
 *   <li>{@code meetflow.deadletter.promoted} - failures moved to the dead-letter store</li>
 *   <li>{@code meetflow.deadletter.alerts} - dead-letter alerts delivered</li>
 *   <li>{@code meetflow.meetings.completed} - meetings that reached {@code completed}</li>
 *   <li>{@code meetflow.meetings.failed} - meetings that ended {@code failed}</li>
 *   <li>{@code meetflow.meetings.stuck} - meetings failed by the stuck sweeper</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code meetflow.retry.queue.depth} - failures pending or retrying</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter eventsIngested;
    private final Counter duplicateEvents;
    private final Counter eventsProcessed;
    private final Counter failuresRecorded;
    private final Counter retrySucceeded;
    private final Counter retryFailed;
    private final Counter deadLettered;
    private final Counter alertsSent;
    private final Counter meetingsCompleted;
    private final Counter meetingsFailed;
    private final Counter stuckMeetings;
    private final Gauge queueDepthGauge;

    private final AtomicInteger queueDepth = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "meetflow"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "meetflow");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for several pipelines in one
     * registry.
     *
     * @param namePrefix prefix for all meter names (e.g. {@code "sales.meetflow"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.eventsIngested = counter(namePrefix + ".events.ingested", "New raw events stored");
        this.duplicateEvents = counter(namePrefix + ".events.duplicate", "Deliveries dropped as duplicates");
        this.eventsProcessed = counter(namePrefix + ".events.processed", "Raw events correlated to meetings");
        this.failuresRecorded = counter(namePrefix + ".failures.recorded", "Steps that entered the retry queue");
        this.retrySucceeded = counter(namePrefix + ".retry.success", "Retries that succeeded");
        this.retryFailed = counter(namePrefix + ".retry.failure", "Retries that failed again");
        this.deadLettered = counter(namePrefix + ".deadletter.promoted", "Failures moved to the dead-letter store");
        this.alertsSent = counter(namePrefix + ".deadletter.alerts", "Dead-letter alerts delivered");
        this.meetingsCompleted = counter(namePrefix + ".meetings.completed", "Meetings fully processed");
        this.meetingsFailed = counter(namePrefix + ".meetings.failed", "Meetings that ended failed");
        this.stuckMeetings = counter(namePrefix + ".meetings.stuck", "Meetings failed by the stuck sweeper");

        this.queueDepthGauge = Gauge.builder(namePrefix + ".retry.queue.depth", queueDepth, AtomicInteger::get)
            .description("Failures pending or retrying")
            .register(registry);
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    @Override
    public void incrementEventsIngested() {
        if (closed) return;
        eventsIngested.increment();
    }

    @Override
    public void incrementDuplicateEvents() {
        if (closed) return;
        duplicateEvents.increment();
    }

    @Override
    public void incrementEventsProcessed() {
        if (closed) return;
        eventsProcessed.increment();
    }

    @Override
    public void incrementFailuresRecorded() {
        if (closed) return;
        failuresRecorded.increment();
    }

    @Override
    public void incrementRetrySucceeded() {
        if (closed) return;
        retrySucceeded.increment();
    }

    @Override
    public void incrementRetryFailed() {
        if (closed) return;
        retryFailed.increment();
    }

    @Override
    public void incrementDeadLettered() {
        if (closed) return;
        deadLettered.increment();
    }

    @Override
    public void incrementAlertsSent() {
        if (closed) return;
        alertsSent.increment();
    }

    @Override
    public void incrementMeetingsCompleted() {
        if (closed) return;
        meetingsCompleted.increment();
    }

    @Override
    public void incrementMeetingsFailed() {
        if (closed) return;
        meetingsFailed.increment();
    }

    @Override
    public void incrementStuckMeetings() {
        if (closed) return;
        stuckMeetings.increment();
    }

    @Override
    public void recordRetryQueueDepth(int depth) {
        if (closed) return;
        queueDepth.set(depth);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Called when the owning {@link io.meetflow.Meetflow} is closed, so no stale gauge is left
     * behind.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(eventsIngested, duplicateEvents, eventsProcessed, failuresRecorded,
                retrySucceeded, retryFailed, deadLettered, alertsSent, meetingsCompleted, meetingsFailed,
                stuckMeetings, queueDepthGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
