package io.meetflow.dead;

import io.meetflow.PipelineException;
import io.meetflow.model.DeadLetter;
import io.meetflow.model.FailureStatus;
import io.meetflow.model.Meeting;
import io.meetflow.model.MeetingStatus;
import io.meetflow.model.Platform;
import io.meetflow.model.ProcessingStep;
import io.meetflow.model.RawEvent;
import io.meetflow.model.RetryableStep;
import io.meetflow.model.TranscriptFormat;
import io.meetflow.model.WebhookFailure;
import io.meetflow.spi.MeetingDescriptor;
import io.meetflow.support.Fixtures;
import io.meetflow.support.StubConnections;
import io.meetflow.support.TestPipeline;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadLetterManagerTest {
    private final TestPipeline pipeline = new TestPipeline(1);
    private final DeadLetterManager manager = pipeline.deadLetters;

    @Test
    void promoteIsIdempotentPerFailure() {
        TestPipeline lenient = new TestPipeline();
        WebhookFailure failure = lenient.failureQueue.recordFailure(Platform.ZOOM, "meeting.ended",
            RetryableStep.EVENT_PROCESSING, "raw-1", "{}", "boom");

        DeadLetter first = lenient.deadLetters.promote(failure);
        DeadLetter second = lenient.deadLetters.promote(failure);

        assertEquals(first.id(), second.id());
        assertEquals(1, lenient.stores.deadLetters.all().size());
        assertEquals(FailureStatus.DEAD_LETTER, lenient.failureQueue.find(failure.id()).orElseThrow().status());
        assertEquals(1, first.totalAttempts());
        assertEquals(1, lenient.metrics.deadLettered.get());
    }

    @Test
    void manualPromotionOfMeetingStepFailsMeeting() {
        TestPipeline lenient = new TestPipeline();
        String meetingId = activeMeeting(lenient);
        WebhookFailure failure = lenient.failureQueue.recordFailure(Platform.ZOOM,
            RetryableStep.TRANSCRIPT_FETCH.code(), RetryableStep.TRANSCRIPT_FETCH, meetingId, "{}", "HTTP 404");
        assertEquals(MeetingStatus.PROCESSING, lenient.stateMachine.find(meetingId).orElseThrow().status());

        DeadLetter deadLetter = lenient.deadLetters.promote(failure);

        Meeting meeting = lenient.stateMachine.find(meetingId).orElseThrow();
        assertEquals(MeetingStatus.FAILED, meeting.status());
        assertEquals("HTTP 404", meeting.processingError());
        assertEquals(ProcessingStep.MEETING_CREATED.progress(), meeting.processingProgress());
        assertEquals(meetingId, deadLetter.referenceId());
    }

    @Test
    void completedFailureCannotBePromoted() {
        TestPipeline lenient = new TestPipeline();
        WebhookFailure failure = lenient.failureQueue.recordFailure(Platform.ZOOM, "meeting.ended",
            RetryableStep.EVENT_PROCESSING, "raw-1", "{}", "boom");
        lenient.failureQueue.recordRetryOutcome(failure.id(), true, null);

        assertThrows(PipelineException.class, () -> lenient.deadLetters.promote(failure));
    }

    @Test
    void promoteRejectsInconsistentHistory() {
        WebhookFailure broken = new WebhookFailure("f-1", Platform.ZOOM, "x", RetryableStep.EVENT_PROCESSING,
            "raw-1", "{}", "boom", 2, 3, null, TestPipeline.START, FailureStatus.DEAD_LETTER, List.of(),
            TestPipeline.START, TestPipeline.START);

        assertThrows(IllegalStateException.class,
            () -> manager.promote(StubConnections.dummyConnection(), broken));
    }

    @Test
    void resolveMarksOnce() {
        DeadLetter deadLetter = deadLetterFor(RetryableStep.EVENT_PROCESSING, "raw-1", "{}");

        assertEquals(1, manager.countUnresolved());
        assertTrue(manager.resolve(deadLetter.id(), "fixed upstream"));
        assertFalse(manager.resolve(deadLetter.id(), "again"));

        DeadLetter resolved = manager.find(deadLetter.id()).orElseThrow();
        assertTrue(resolved.resolved());
        assertEquals("fixed upstream", resolved.resolutionNotes());
        assertEquals(TestPipeline.START, resolved.resolvedAt());
        assertEquals(0, manager.countUnresolved());
        assertTrue(manager.listUnresolved().isEmpty());
    }

    @Test
    void alertsAreSentOnceAndRetriedAfterFailure() {
        DeadLetter deadLetter = deadLetterFor(RetryableStep.EVENT_PROCESSING, "raw-1", "{}");
        pipeline.alerter = d -> {
            throw new IllegalStateException("alert channel down");
        };

        assertEquals(0, manager.sendPendingAlerts());
        assertFalse(manager.find(deadLetter.id()).orElseThrow().alertSent());

        pipeline.alerter = d -> pipeline.alerts.add(d.id());
        assertEquals(1, manager.sendPendingAlerts());
        assertEquals(0, manager.sendPendingAlerts());

        assertEquals(List.of(deadLetter.id()), pipeline.alerts);
        assertTrue(manager.find(deadLetter.id()).orElseThrow().alertSent());
        assertEquals(1, pipeline.metrics.alertsSent.get());
    }

    @Test
    void replayOfEventProcessingReingestsPayload() {
        String payload = Fixtures.zoomMeetingEnded("uuid-1", 1709287200000L);
        DeadLetter deadLetter = deadLetterFor(RetryableStep.EVENT_PROCESSING, "raw-1", payload);

        assertTrue(manager.replay(deadLetter.id(), null));

        RawEvent replayed = pipeline.stores.rawEvents.all().get(0);
        assertEquals(DeadLetterManager.REPLAY_ID_PREFIX + deadLetter.id(), replayed.externalEventId());
        assertEquals(payload, replayed.payloadJson());
        assertEquals("meeting.ended", replayed.eventType());
        DeadLetter resolved = manager.find(deadLetter.id()).orElseThrow();
        assertTrue(resolved.resolved());
        assertEquals("Replayed", resolved.resolutionNotes());

        assertFalse(manager.replay(deadLetter.id(), null));
        assertEquals(1, pipeline.stores.rawEvents.all().size());
    }

    @Test
    void replayOfTranscriptFetchRestartsFailedMeeting() {
        String meetingId = failedMeeting();
        DeadLetter deadLetter = deadLetterFor(RetryableStep.TRANSCRIPT_FETCH, meetingId, "{}");

        assertTrue(manager.replay(deadLetter.id(), "source restored"));

        Meeting meeting = pipeline.stateMachine.find(meetingId).orElseThrow();
        assertEquals(MeetingStatus.PROCESSING, meeting.status());
        assertEquals(ProcessingStep.MEETING_CREATED, meeting.processingStep());
        assertEquals("source restored", manager.find(deadLetter.id()).orElseThrow().resolutionNotes());
    }

    @Test
    void replayOfDraftGenerationResumesAfterStoredTranscript() {
        String meetingId = failedMeeting();
        DeadLetter deadLetter = deadLetterFor(RetryableStep.DRAFT_GENERATION, meetingId, "{}");

        assertTrue(manager.replay(deadLetter.id(), null));

        assertEquals(ProcessingStep.TRANSCRIPT_STORED,
            pipeline.stateMachine.find(meetingId).orElseThrow().processingStep());
    }

    @Test
    void replayOfUnknownDeadLetterIsIgnored() {
        assertFalse(manager.replay("missing", null));
    }

    @Test
    void resumeStepsFollowFailedStep() {
        assertSame(ProcessingStep.MEETING_CREATED, DeadLetterManager.resumeStep(RetryableStep.TRANSCRIPT_FETCH));
        assertSame(ProcessingStep.TRANSCRIPT_STORED, DeadLetterManager.resumeStep(RetryableStep.DRAFT_GENERATION));
        assertThrows(IllegalArgumentException.class,
            () -> DeadLetterManager.resumeStep(RetryableStep.EVENT_PROCESSING));
    }

    @Test
    void builderRequiresStores() {
        assertThrows(NullPointerException.class, () -> DeadLetterManager.builder()
            .connectionProvider(StubConnections.dummyProvider())
            .failureStore(pipeline.stores.failures)
            .build());
    }

    private DeadLetter deadLetterFor(RetryableStep step, String referenceId, String payload) {
        String eventType = step == RetryableStep.EVENT_PROCESSING ? "meeting.ended" : step.code();
        WebhookFailure failure = pipeline.failureQueue.recordFailure(Platform.ZOOM, eventType, step,
            referenceId, payload, "boom");
        DeadLetter deadLetter = pipeline.stores.deadLetters.all().stream()
            .filter(d -> d.webhookFailureId().equals(failure.id()))
            .findFirst()
            .orElseThrow();
        assertNotNull(deadLetter.createdAt());
        return deadLetter;
    }

    private String failedMeeting() {
        String id = activeMeeting(pipeline);
        pipeline.stateMachine.fail(id, "download failed");
        return id;
    }

    private static String activeMeeting(TestPipeline target) {
        MeetingDescriptor descriptor = new MeetingDescriptor(Platform.ZOOM, "zm-1", "host@example.com",
            "Weekly sync", Instant.parse("2024-03-01T09:00:00Z"), null, null, TranscriptFormat.VTT);
        String id = target.stateMachine.register(descriptor, "raw-1").meeting().id();
        target.stateMachine.start(id);
        target.stateMachine.advance(id, ProcessingStep.MEETING_CREATED, "created", null);
        return id;
    }
}
