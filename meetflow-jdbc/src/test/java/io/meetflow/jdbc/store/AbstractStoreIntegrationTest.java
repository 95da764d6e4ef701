package io.meetflow.jdbc.store;

import io.meetflow.jdbc.Dialect;
import io.meetflow.jdbc.JdbcStores;
import io.meetflow.jdbc.StoreException;
import io.meetflow.model.DeadLetter;
import io.meetflow.model.EventHints;
import io.meetflow.model.FailureHistoryEntry;
import io.meetflow.model.FailureStatus;
import io.meetflow.model.Meeting;
import io.meetflow.model.MeetingStatus;
import io.meetflow.model.Platform;
import io.meetflow.model.ProcessingLogEntry;
import io.meetflow.model.ProcessingStep;
import io.meetflow.model.RawEvent;
import io.meetflow.model.RawEventStatus;
import io.meetflow.model.RetryableStep;
import io.meetflow.model.SpeakerSegment;
import io.meetflow.model.Transcript;
import io.meetflow.model.TranscriptFormat;
import io.meetflow.model.TranscriptStatus;
import io.meetflow.model.WebhookFailure;
import io.meetflow.spi.WebhookFailureStore.StatusCount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store contract shared by every database: subclasses provide a data source with the schema
 * installed and empty tables.
 */
abstract class AbstractStoreIntegrationTest {
    static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    JdbcStores stores;

    abstract DataSource dataSource();

    abstract Dialect dialect();

    @BeforeEach
    void createStores() {
        stores = JdbcStores.builder().dialect(dialect()).build();
    }

    Connection connection() throws SQLException {
        Connection conn = dataSource().getConnection();
        conn.setAutoCommit(true);
        return conn;
    }

    // ── raw events ───────────────────────────────────────────────────

    @Test
    void rawEventInsertIsIdempotentPerPlatform() throws Exception {
        try (Connection conn = connection()) {
            assertTrue(stores.rawEvents().insert(conn, rawEvent(Platform.ZOOM, "evt-1", T0)));
            assertFalse(stores.rawEvents().insert(conn, rawEvent(Platform.ZOOM, "evt-1", T0.plusSeconds(1))));
            assertTrue(stores.rawEvents().insert(conn, rawEvent(Platform.MICROSOFT_TEAMS, "evt-1", T0)));

            assertEquals(2, stores.rawEvents().countByStatus(conn, RawEventStatus.RECEIVED));
        }
    }

    @Test
    void rawEventRoundTripsHints() throws Exception {
        try (Connection conn = connection()) {
            RawEvent event = new RawEvent(UUID.randomUUID().toString(), Platform.ZOOM, "recording.completed",
                "evt-hints", "{\"event\":\"recording.completed\"}", RawEventStatus.RECEIVED,
                new EventHints("uuid-1", T0.minusSeconds(60), true, false), null, T0, null);
            stores.rawEvents().insert(conn, event);

            RawEvent found = stores.rawEvents().findByExternalId(conn, Platform.ZOOM, "evt-hints").orElseThrow();
            assertEquals(event, found);
            assertEquals(found, stores.rawEvents().findById(conn, event.id()).orElseThrow());
        }
    }

    @Test
    void pollReceivedReturnsOldestFirst() throws Exception {
        try (Connection conn = connection()) {
            stores.rawEvents().insert(conn, rawEvent(Platform.ZOOM, "late", T0.plusSeconds(20)));
            stores.rawEvents().insert(conn, rawEvent(Platform.ZOOM, "early", T0));
            stores.rawEvents().insert(conn, rawEvent(Platform.ZOOM, "middle", T0.plusSeconds(10)));

            List<RawEvent> polled = stores.rawEvents().pollReceived(conn, 2);
            assertEquals(List.of("early", "middle"), polled.stream().map(RawEvent::externalEventId).toList());
        }
    }

    @Test
    void rawEventTransitionIsCompareAndSet() throws Exception {
        try (Connection conn = connection()) {
            RawEvent event = rawEvent(Platform.ZOOM, "evt-cas", T0);
            stores.rawEvents().insert(conn, event);

            assertEquals(1, stores.rawEvents().transition(conn, event.id(),
                RawEventStatus.RECEIVED, RawEventStatus.PROCESSING, null, null));
            assertEquals(0, stores.rawEvents().transition(conn, event.id(),
                RawEventStatus.RECEIVED, RawEventStatus.PROCESSING, null, null));

            assertEquals(1, stores.rawEvents().transition(conn, event.id(),
                RawEventStatus.PROCESSING, RawEventStatus.FAILED, "boom", null));
            assertEquals("boom", stores.rawEvents().findById(conn, event.id()).orElseThrow().errorMessage());

            assertEquals(1, stores.rawEvents().transition(conn, event.id(),
                RawEventStatus.FAILED, RawEventStatus.PROCESSED, null, T0.plusSeconds(5)));
            RawEvent done = stores.rawEvents().findById(conn, event.id()).orElseThrow();
            assertEquals(RawEventStatus.PROCESSED, done.status());
            assertNull(done.errorMessage());
            assertEquals(T0.plusSeconds(5), done.processedAt());
        }
    }

    // ── meetings ─────────────────────────────────────────────────────

    @Test
    void meetingInsertIsUniquePerPlatformMeeting() throws Exception {
        try (Connection conn = connection()) {
            assertTrue(stores.meetings().insert(conn, meeting("m-1", MeetingStatus.PENDING,
                ProcessingStep.WEBHOOK_RECEIVED, T0)));
            assertFalse(stores.meetings().insert(conn, meeting("m-1", MeetingStatus.PENDING,
                ProcessingStep.WEBHOOK_RECEIVED, T0)));

            Meeting found = stores.meetings().findByPlatformMeetingId(conn, Platform.ZOOM, "m-1").orElseThrow();
            assertEquals(MeetingStatus.PENDING, found.status());
            assertEquals("host@example.com", found.hostEmail());
        }
    }

    @Test
    void meetingUpdateChecksExpectedStepAndStatus() throws Exception {
        try (Connection conn = connection()) {
            Meeting created = meeting("m-1", MeetingStatus.PROCESSING, ProcessingStep.MEETING_CREATED, T0);
            stores.meetings().insert(conn, created);

            Meeting advanced = created.withStep(ProcessingStep.TRANSCRIPT_DOWNLOAD, 30,
                new ProcessingLogEntry(T0.plusSeconds(1), ProcessingStep.TRANSCRIPT_DOWNLOAD, "Downloading", 1200L),
                T0.plusSeconds(1));
            assertEquals(0, stores.meetings().update(conn, advanced,
                ProcessingStep.WEBHOOK_RECEIVED, MeetingStatus.PROCESSING));
            assertEquals(1, stores.meetings().update(conn, advanced,
                ProcessingStep.MEETING_CREATED, MeetingStatus.PROCESSING));
            assertEquals(0, stores.meetings().update(conn, advanced,
                ProcessingStep.MEETING_CREATED, MeetingStatus.PROCESSING));

            Meeting found = stores.meetings().findById(conn, created.id()).orElseThrow();
            assertEquals(ProcessingStep.TRANSCRIPT_DOWNLOAD, found.processingStep());
            assertEquals(30, found.processingProgress());
            assertEquals(advanced.processingLogs(), found.processingLogs());
            assertEquals(T0.plusSeconds(1), found.updatedAt());
        }
    }

    @Test
    void findAtStepReturnsOnlyProcessingMeetings() throws Exception {
        try (Connection conn = connection()) {
            stores.meetings().insert(conn, meeting("a", MeetingStatus.PROCESSING, ProcessingStep.TRANSCRIPT_STORED, T0));
            stores.meetings().insert(conn, meeting("b", MeetingStatus.FAILED, ProcessingStep.TRANSCRIPT_STORED, T0));
            stores.meetings().insert(conn, meeting("c", MeetingStatus.PROCESSING, ProcessingStep.MEETING_CREATED, T0));

            List<Meeting> atStep = stores.meetings().findAtStep(conn, ProcessingStep.TRANSCRIPT_STORED, 10);
            assertEquals(List.of("a"), atStep.stream().map(Meeting::platformMeetingId).toList());
        }
    }

    @Test
    void findAwaitingTranscriptNeedsSourceAndUnreadyTranscript() throws Exception {
        try (Connection conn = connection()) {
            Meeting withSource = meeting("with-source", MeetingStatus.PROCESSING, ProcessingStep.MEETING_CREATED, T0);
            Meeting noSource = meeting("no-source", MeetingStatus.PROCESSING, ProcessingStep.MEETING_CREATED, T0);
            Meeting ready = meeting("ready", MeetingStatus.PROCESSING, ProcessingStep.MEETING_CREATED, T0);
            for (Meeting m : List.of(withSource, noSource, ready)) {
                stores.meetings().insert(conn, m);
            }
            stores.transcripts().insert(conn, transcript(withSource.id(), "https://zoom.example/t/1"));
            stores.transcripts().insert(conn, transcript(noSource.id(), null));
            Transcript done = transcript(ready.id(), "https://zoom.example/t/3");
            stores.transcripts().insert(conn, done);
            stores.transcripts().markReady(conn, done.id(), "raw", "parsed", List.of(), 1, T0);

            List<Meeting> awaiting = stores.meetings().findAwaitingTranscript(conn, 10);
            assertEquals(List.of(withSource.id()), awaiting.stream().map(Meeting::id).toList());
        }
    }

    @Test
    void findStaleSkipsTerminalMeetings() throws Exception {
        try (Connection conn = connection()) {
            stores.meetings().insert(conn, meeting("old", MeetingStatus.PROCESSING, ProcessingStep.TRANSCRIPT_DOWNLOAD,
                T0.minusSeconds(3600)));
            stores.meetings().insert(conn, meeting("pending", MeetingStatus.PENDING, ProcessingStep.WEBHOOK_RECEIVED,
                T0.minusSeconds(3600)));
            stores.meetings().insert(conn, meeting("done", MeetingStatus.READY, ProcessingStep.COMPLETED,
                T0.minusSeconds(3600)));
            stores.meetings().insert(conn, meeting("fresh", MeetingStatus.PROCESSING, ProcessingStep.TRANSCRIPT_DOWNLOAD,
                T0));

            List<String> stale = stores.meetings().findStale(conn, T0.minusSeconds(900), 10).stream()
                .map(Meeting::platformMeetingId).sorted().toList();
            assertEquals(List.of("old", "pending"), stale);
        }
    }

    // ── transcripts ──────────────────────────────────────────────────

    @Test
    void transcriptLifecycle() throws Exception {
        try (Connection conn = connection()) {
            Transcript t = transcript("meeting-1", null);
            assertTrue(stores.transcripts().insert(conn, t));
            assertFalse(stores.transcripts().insert(conn, transcript("meeting-1", null)));

            assertEquals(1, stores.transcripts().updateSource(conn, t.id(), "https://zoom.example/t",
                TranscriptFormat.VTT, T0));
            assertEquals(1, stores.transcripts().beginAttempt(conn, t.id(), T0));
            assertEquals(1, stores.transcripts().markFailed(conn, t.id(), "HTTP 503", T0));
            assertEquals(1, stores.transcripts().beginAttempt(conn, t.id(), T0.plusSeconds(1)));

            Transcript failedOnce = stores.transcripts().findByMeetingId(conn, "meeting-1").orElseThrow();
            assertEquals(TranscriptStatus.FETCHING, failedOnce.status());
            assertEquals(2, failedOnce.fetchAttempts());
            assertEquals("HTTP 503", failedOnce.lastFetchError());

            List<SpeakerSegment> segments = List.of(new SpeakerSegment("Alice", "Hello", 1000, 4000));
            assertEquals(1, stores.transcripts().markReady(conn, t.id(), "WEBVTT", "Alice: Hello",
                segments, 1, T0.plusSeconds(2)));

            Transcript ready = stores.transcripts().findByMeetingId(conn, "meeting-1").orElseThrow();
            assertEquals(TranscriptStatus.READY, ready.status());
            assertEquals(TranscriptFormat.VTT, ready.format());
            assertEquals(segments, ready.segments());
            assertEquals(1, ready.wordCount());
        }
    }

    @Test
    void readyTranscriptIsNeverModified() throws Exception {
        try (Connection conn = connection()) {
            Transcript t = transcript("meeting-1", "https://zoom.example/t");
            stores.transcripts().insert(conn, t);
            stores.transcripts().markReady(conn, t.id(), "raw", "parsed", List.of(), 1, T0);

            assertEquals(0, stores.transcripts().beginAttempt(conn, t.id(), T0));
            assertEquals(0, stores.transcripts().markFailed(conn, t.id(), "late", T0));
            assertEquals(0, stores.transcripts().updateSource(conn, t.id(), "other", TranscriptFormat.VTT, T0));
            assertEquals(0, stores.transcripts().markReady(conn, t.id(), "x", "y", List.of(), 2, T0));
            assertEquals("parsed", stores.transcripts().findByMeetingId(conn, "meeting-1").orElseThrow().parsedContent());
        }
    }

    // ── webhook failures ─────────────────────────────────────────────

    @Test
    void failureRoundTripsHistory() throws Exception {
        try (Connection conn = connection()) {
            WebhookFailure failure = failure(T0.plusSeconds(1)).withFailedAttempt("HTTP 500", T0.plusSeconds(1),
                T0.plusSeconds(3), FailureStatus.PENDING);
            stores.webhookFailures().insert(conn, failure);

            WebhookFailure found = stores.webhookFailures().findById(conn, failure.id()).orElseThrow();
            assertEquals(failure, found);
            assertEquals(List.of(1, 2), found.history().stream().map(FailureHistoryEntry::attempt).toList());
        }
    }

    @Test
    void findDueOrdersByNextRetryAndSkipsSettled() throws Exception {
        try (Connection conn = connection()) {
            WebhookFailure later = failure(T0.plusSeconds(20));
            WebhookFailure sooner = failure(T0.plusSeconds(10));
            WebhookFailure future = failure(T0.plusSeconds(600));
            WebhookFailure settled = failure(T0).withStatus(FailureStatus.COMPLETED, null, T0);
            for (WebhookFailure f : List.of(later, sooner, future, settled)) {
                stores.webhookFailures().insert(conn, f);
            }

            List<WebhookFailure> due = stores.webhookFailures().findDue(conn, T0.plusSeconds(60), 10);
            assertEquals(List.of(sooner.id(), later.id()), due.stream().map(WebhookFailure::id).toList());
        }
    }

    @Test
    void claimIsExclusiveUntilLeaseExpires() throws Exception {
        try (Connection conn = connection()) {
            WebhookFailure f = failure(T0);
            stores.webhookFailures().insert(conn, f);
            Instant now = T0.plusSeconds(1);
            Instant lease = now.plusSeconds(60);

            assertEquals(1, stores.webhookFailures().claim(conn, f.id(), 1, now, lease));
            assertEquals(0, stores.webhookFailures().claim(conn, f.id(), 1, now, lease));

            WebhookFailure claimed = stores.webhookFailures().findById(conn, f.id()).orElseThrow();
            assertEquals(FailureStatus.RETRYING, claimed.status());
            assertEquals(lease, claimed.nextRetryAt());

            assertEquals(1, stores.webhookFailures().claim(conn, f.id(), 1, lease, lease.plusSeconds(60)));
        }
    }

    @Test
    void updateRequiresExpectedAttemptsAndRetryableStatus() throws Exception {
        try (Connection conn = connection()) {
            WebhookFailure f = failure(T0);
            stores.webhookFailures().insert(conn, f);

            WebhookFailure retried = f.withFailedAttempt("still down", T0.plusSeconds(2), T0.plusSeconds(4),
                FailureStatus.PENDING);
            assertEquals(0, stores.webhookFailures().update(conn, retried, 2));
            assertEquals(1, stores.webhookFailures().update(conn, retried, 1));

            WebhookFailure completed = retried.withStatus(FailureStatus.COMPLETED, null, T0.plusSeconds(5));
            assertEquals(1, stores.webhookFailures().update(conn, completed, 2));
            assertEquals(0, stores.webhookFailures().update(conn, completed, 2));

            WebhookFailure found = stores.webhookFailures().findById(conn, f.id()).orElseThrow();
            assertEquals(FailureStatus.COMPLETED, found.status());
            assertEquals(2, found.attempts());
            assertEquals("still down", found.error());
            assertNull(found.nextRetryAt());
        }
    }

    @Test
    void countsGroupByPlatformAndStatus() throws Exception {
        try (Connection conn = connection()) {
            stores.webhookFailures().insert(conn, failure(T0));
            stores.webhookFailures().insert(conn, failure(T0));
            stores.webhookFailures().insert(conn, failure(T0).withStatus(FailureStatus.DEAD_LETTER, null, T0));

            List<StatusCount> counts = stores.webhookFailures().countByPlatformAndStatus(conn);
            assertTrue(counts.contains(new StatusCount(Platform.ZOOM, FailureStatus.PENDING, 2)));
            assertTrue(counts.contains(new StatusCount(Platform.ZOOM, FailureStatus.DEAD_LETTER, 1)));
            assertEquals(2, counts.size());
        }
    }

    // ── dead letters ─────────────────────────────────────────────────

    @Test
    void deadLetterIsUniquePerFailure() throws Exception {
        try (Connection conn = connection()) {
            DeadLetter letter = deadLetter("failure-1");
            stores.deadLetters().insert(conn, letter);

            assertEquals(letter, stores.deadLetters().findById(conn, letter.id()).orElseThrow());
            assertEquals(letter, stores.deadLetters().findByFailureId(conn, "failure-1").orElseThrow());
            assertThrows(StoreException.class, () -> stores.deadLetters().insert(conn, deadLetter("failure-1")));
        }
    }

    @Test
    void alertIsMarkedOnce() throws Exception {
        try (Connection conn = connection()) {
            DeadLetter letter = deadLetter("failure-1");
            stores.deadLetters().insert(conn, letter);

            assertEquals(1, stores.deadLetters().findPendingAlerts(conn, 10).size());
            assertEquals(1, stores.deadLetters().markAlertSent(conn, letter.id()));
            assertEquals(0, stores.deadLetters().markAlertSent(conn, letter.id()));
            assertTrue(stores.deadLetters().findPendingAlerts(conn, 10).isEmpty());
        }
    }

    @Test
    void resolveIsRecordedOnce() throws Exception {
        try (Connection conn = connection()) {
            DeadLetter first = deadLetter("failure-1");
            DeadLetter second = deadLetter("failure-2");
            stores.deadLetters().insert(conn, first);
            stores.deadLetters().insert(conn, second);
            assertEquals(2L, stores.deadLetters().countUnresolved(conn));

            assertEquals(1, stores.deadLetters().resolve(conn, first.id(), "fixed token", T0.plusSeconds(60)));
            assertEquals(0, stores.deadLetters().resolve(conn, first.id(), "again", T0.plusSeconds(120)));
            assertEquals(0, stores.deadLetters().resolve(conn, "missing", "none", T0));

            DeadLetter resolved = stores.deadLetters().findById(conn, first.id()).orElseThrow();
            assertTrue(resolved.resolved());
            assertEquals("fixed token", resolved.resolutionNotes());
            assertEquals(T0.plusSeconds(60), resolved.resolvedAt());
            assertEquals(1L, stores.deadLetters().countUnresolved(conn));
            assertEquals(List.of(second.id()),
                stores.deadLetters().findUnresolved(conn, 10).stream().map(DeadLetter::id).toList());
        }
    }

    // ── fixtures ─────────────────────────────────────────────────────

    static RawEvent rawEvent(Platform platform, String externalId, Instant receivedAt) {
        return new RawEvent(UUID.randomUUID().toString(), platform, "meeting.ended", externalId, "{}",
            RawEventStatus.RECEIVED, EventHints.NONE, null, receivedAt, null);
    }

    static Meeting meeting(String platformMeetingId, MeetingStatus status, ProcessingStep step, Instant updatedAt) {
        List<ProcessingLogEntry> logs = List.of(
            new ProcessingLogEntry(updatedAt, ProcessingStep.WEBHOOK_RECEIVED, "Webhook received", null));
        return new Meeting(UUID.randomUUID().toString(), Platform.ZOOM, platformMeetingId, "host@example.com",
            "Weekly sync", T0.minusSeconds(3600), T0.minusSeconds(1800), status, step, step.progress(), logs,
            updatedAt, null, null, null, updatedAt, updatedAt);
    }

    static Transcript transcript(String meetingId, String sourceRef) {
        return new Transcript(UUID.randomUUID().toString(), meetingId, TranscriptStatus.PENDING, sourceRef,
            sourceRef != null ? TranscriptFormat.VTT : null, null, null, List.of(), 0, 0, null, T0, T0);
    }

    static WebhookFailure failure(Instant nextRetryAt) {
        return new WebhookFailure(UUID.randomUUID().toString(), Platform.ZOOM, "transcript_fetch",
            RetryableStep.TRANSCRIPT_FETCH, UUID.randomUUID().toString(), "{\"meetingId\":\"m\"}", "HTTP 503", 1, 3,
            nextRetryAt, T0, FailureStatus.PENDING, List.of(new FailureHistoryEntry(1, "HTTP 503", T0)), T0, T0);
    }

    static DeadLetter deadLetter(String failureId) {
        List<FailureHistoryEntry> history = List.of(
            new FailureHistoryEntry(1, "HTTP 503", T0),
            new FailureHistoryEntry(2, "HTTP 503", T0.plusSeconds(1)),
            new FailureHistoryEntry(3, "HTTP 404", T0.plusSeconds(3)));
        return new DeadLetter(UUID.randomUUID().toString(), failureId, Platform.GOOGLE_MEET, "transcript_fetch",
            RetryableStep.TRANSCRIPT_FETCH, "meeting-1", "{}", "HTTP 404", 3, history, false, false, null, null,
            T0.plusSeconds(3));
    }
}
