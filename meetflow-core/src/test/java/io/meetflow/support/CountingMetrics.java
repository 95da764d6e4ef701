package io.meetflow.support;

import io.meetflow.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

public final class CountingMetrics implements MetricsExporter {
    public final AtomicInteger eventsIngested = new AtomicInteger();
    public final AtomicInteger duplicateEvents = new AtomicInteger();
    public final AtomicInteger eventsProcessed = new AtomicInteger();
    public final AtomicInteger failuresRecorded = new AtomicInteger();
    public final AtomicInteger retrySucceeded = new AtomicInteger();
    public final AtomicInteger retryFailed = new AtomicInteger();
    public final AtomicInteger deadLettered = new AtomicInteger();
    public final AtomicInteger alertsSent = new AtomicInteger();
    public final AtomicInteger meetingsCompleted = new AtomicInteger();
    public final AtomicInteger meetingsFailed = new AtomicInteger();
    public final AtomicInteger stuckMeetings = new AtomicInteger();
    public final AtomicInteger lastQueueDepth = new AtomicInteger(-1);

    @Override
    public void incrementEventsIngested() {
        eventsIngested.incrementAndGet();
    }

    @Override
    public void incrementDuplicateEvents() {
        duplicateEvents.incrementAndGet();
    }

    @Override
    public void incrementEventsProcessed() {
        eventsProcessed.incrementAndGet();
    }

    @Override
    public void incrementFailuresRecorded() {
        failuresRecorded.incrementAndGet();
    }

    @Override
    public void incrementRetrySucceeded() {
        retrySucceeded.incrementAndGet();
    }

    @Override
    public void incrementRetryFailed() {
        retryFailed.incrementAndGet();
    }

    @Override
    public void incrementDeadLettered() {
        deadLettered.incrementAndGet();
    }

    @Override
    public void incrementAlertsSent() {
        alertsSent.incrementAndGet();
    }

    @Override
    public void incrementMeetingsCompleted() {
        meetingsCompleted.incrementAndGet();
    }

    @Override
    public void incrementMeetingsFailed() {
        meetingsFailed.incrementAndGet();
    }

    @Override
    public void incrementStuckMeetings() {
        stuckMeetings.incrementAndGet();
    }

    @Override
    public void recordRetryQueueDepth(int depth) {
        lastQueueDepth.set(depth);
    }
}
