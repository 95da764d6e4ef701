package io.meetflow.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The unit of work the pipeline advances.
 *
 * <p>Instances are immutable snapshots. The {@code with*} methods return the next snapshot
 * that a store writes back under an optimistic check on the previous step.
 */
public record Meeting(
    String id,
    Platform platform,
    String platformMeetingId,
    String hostEmail,
    String topic,
    Instant startTime,
    Instant endTime,
    MeetingStatus status,
    ProcessingStep processingStep,
    int processingProgress,
    List<ProcessingLogEntry> processingLogs,
    Instant processingStartedAt,
    Instant processingCompletedAt,
    String processingError,
    String lastRawEventId,
    Instant createdAt,
    Instant updatedAt
) {
    public Meeting {
        processingLogs = processingLogs == null ? List.of() : List.copyOf(processingLogs);
    }

    public Meeting withStep(ProcessingStep step, int progress, ProcessingLogEntry entry, Instant now) {
        return new Meeting(id, platform, platformMeetingId, hostEmail, topic, startTime, endTime,
            status, step, progress, append(entry), processingStartedAt, processingCompletedAt,
            processingError, lastRawEventId, createdAt, now);
    }

    public Meeting withStatus(MeetingStatus newStatus, Instant completedAt, String error, Instant now) {
        return new Meeting(id, platform, platformMeetingId, hostEmail, topic, startTime, endTime,
            newStatus, processingStep, processingProgress, processingLogs, processingStartedAt,
            completedAt, error, lastRawEventId, createdAt, now);
    }

    public Meeting withStart(ProcessingLogEntry entry, Instant now) {
        return new Meeting(id, platform, platformMeetingId, hostEmail, topic, startTime, endTime,
            MeetingStatus.PROCESSING, processingStep, processingProgress, append(entry), now, null,
            null, lastRawEventId, createdAt, now);
    }

    public Meeting withRestart(ProcessingStep resumeAt, ProcessingLogEntry entry, Instant now) {
        return new Meeting(id, platform, platformMeetingId, hostEmail, topic, startTime, endTime,
            MeetingStatus.PROCESSING, resumeAt, resumeAt.progress(), append(entry), now, null,
            null, lastRawEventId, createdAt, now);
    }

    private List<ProcessingLogEntry> append(ProcessingLogEntry entry) {
        List<ProcessingLogEntry> logs = new ArrayList<>(processingLogs.size() + 1);
        logs.addAll(processingLogs);
        logs.add(entry);
        return logs;
    }
}
