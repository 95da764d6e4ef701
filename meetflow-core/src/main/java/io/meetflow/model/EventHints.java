package io.meetflow.model;

import java.time.Instant;

/**
 * Lightweight fields pulled out of a webhook payload at ingestion time, without deep parsing.
 *
 * @param meetingExternalId    platform meeting identifier, if present
 * @param endTime              meeting end time, if present
 * @param recordingAvailable   whether the event announces a recording
 * @param transcriptAvailable  whether the event announces a transcript
 */
public record EventHints(
    String meetingExternalId,
    Instant endTime,
    boolean recordingAvailable,
    boolean transcriptAvailable
) {
    public static final EventHints NONE = new EventHints(null, null, false, false);
}
