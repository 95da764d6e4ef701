package io.meetflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void ingestionCounters() {
        exporter.incrementEventsIngested();
        exporter.incrementEventsIngested();
        exporter.incrementDuplicateEvents();
        exporter.incrementEventsProcessed();

        assertEquals(2.0, counter("meetflow.events.ingested").count());
        assertEquals(1.0, counter("meetflow.events.duplicate").count());
        assertEquals(1.0, counter("meetflow.events.processed").count());
    }

    @Test
    void retryAndDeadLetterCounters() {
        exporter.incrementFailuresRecorded();
        exporter.incrementRetryFailed();
        exporter.incrementRetryFailed();
        exporter.incrementRetrySucceeded();
        exporter.incrementDeadLettered();
        exporter.incrementAlertsSent();

        assertEquals(1.0, counter("meetflow.failures.recorded").count());
        assertEquals(2.0, counter("meetflow.retry.failure").count());
        assertEquals(1.0, counter("meetflow.retry.success").count());
        assertEquals(1.0, counter("meetflow.deadletter.promoted").count());
        assertEquals(1.0, counter("meetflow.deadletter.alerts").count());
    }

    @Test
    void meetingCounters() {
        exporter.incrementMeetingsCompleted();
        exporter.incrementMeetingsFailed();
        exporter.incrementStuckMeetings();

        assertEquals(1.0, counter("meetflow.meetings.completed").count());
        assertEquals(1.0, counter("meetflow.meetings.failed").count());
        assertEquals(1.0, counter("meetflow.meetings.stuck").count());
    }

    @Test
    void queueDepthGaugeFollowsLatestValue() {
        exporter.recordRetryQueueDepth(12);
        assertEquals(12.0, gauge("meetflow.retry.queue.depth").value());

        exporter.recordRetryQueueDepth(0);
        assertEquals(0.0, gauge("meetflow.retry.queue.depth").value());
    }

    @Test
    void customNamePrefix() {
        MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "sales.meetflow");
        custom.incrementEventsIngested();
        custom.recordRetryQueueDepth(3);

        assertEquals(1.0, counter("sales.meetflow.events.ingested").count());
        assertEquals(3.0, gauge("sales.meetflow.retry.queue.depth").value());
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterUpdates() {
        exporter.incrementEventsIngested();
        exporter.close();
        exporter.incrementEventsIngested();
        exporter.recordRetryQueueDepth(5);

        assertNull(registry.find("meetflow.events.ingested").counter());
        assertNull(registry.find("meetflow.retry.queue.depth").gauge());
    }

    @Test
    void invalidArgumentsThrow() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "meetflow."));
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
