package io.meetflow.support;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Webhook bodies and transcript content shaped like real platform deliveries.
 */
public final class Fixtures {

    public static final String VTT = String.join("\n",
        "WEBVTT",
        "",
        "1",
        "00:00:01.000 --> 00:00:04.000",
        "Alice: Hello everyone",
        "",
        "2",
        "00:00:04.500 --> 00:00:06.000",
        "Alice: welcome to the sync",
        "",
        "3",
        "00:00:07.000 --> 00:00:09.000",
        "<v Bob>Thanks Alice</v>",
        "");

    private Fixtures() {
    }

    public static String zoomTranscriptCompleted(String uuid, long eventTs) {
        return "{"
            + "\"event\":\"recording.transcript_completed\","
            + "\"event_ts\":" + eventTs + ","
            + "\"download_token\":\"dl-token\","
            + "\"payload\":{\"account_id\":\"acct-1\",\"object\":{"
            + "\"uuid\":\"" + uuid + "\","
            + "\"id\":85012345678,"
            + "\"host_email\":\"host@example.com\","
            + "\"topic\":\"Weekly sync\","
            + "\"start_time\":\"2024-03-01T09:00:00Z\","
            + "\"end_time\":\"2024-03-01T09:30:00Z\","
            + "\"recording_files\":["
            + "{\"file_type\":\"MP4\",\"download_url\":\"https://zoom.example/rec/video\"},"
            + "{\"file_type\":\"TRANSCRIPT\",\"download_url\":\"https://zoom.example/rec/transcript\"}"
            + "]}}}";
    }

    public static String zoomMeetingEnded(String uuid, long eventTs) {
        return "{"
            + "\"event\":\"meeting.ended\","
            + "\"event_ts\":" + eventTs + ","
            + "\"payload\":{\"object\":{"
            + "\"uuid\":\"" + uuid + "\","
            + "\"id\":85012345678,"
            + "\"host_email\":\"host@example.com\","
            + "\"topic\":\"Weekly sync\","
            + "\"end_time\":\"2024-03-01T09:30:00Z\""
            + "}}}";
    }

    public static String zoomParticipantJoined(long eventTs) {
        return "{\"event\":\"meeting.participant_joined\",\"event_ts\":" + eventTs
            + ",\"payload\":{\"object\":{\"uuid\":\"uuid-p\",\"id\":1}}}";
    }

    public static String meetTranscriptEvent() {
        return "{"
            + "\"eventType\":\"google.workspace.meet.transcript.v2.fileGenerated\","
            + "\"eventTime\":\"2024-03-01T09:35:00Z\","
            + "\"organizerEmail\":\"organizer@example.com\","
            + "\"conferenceRecord\":{\"name\":\"conferenceRecords/abc-123\","
            + "\"startTime\":\"2024-03-01T09:00:00Z\",\"endTime\":\"2024-03-01T09:30:00Z\","
            + "\"space\":{\"meetingCode\":\"abc-defg-hij\"}},"
            + "\"transcript\":{\"name\":\"conferenceRecords/abc-123/transcripts/t-1\"}"
            + "}";
    }

    public static String meetPubSubEnvelope(String event, String messageId) {
        String data = Base64.getEncoder().encodeToString(event.getBytes(StandardCharsets.UTF_8));
        return "{\"message\":{\"data\":\"" + data + "\",\"messageId\":\"" + messageId + "\","
            + "\"attributes\":{\"ce-type\":\"google.workspace.meet.transcript.v2.fileGenerated\"}},"
            + "\"subscription\":\"projects/p/subscriptions/s\"}";
    }

    public static String teamsNotifications() {
        return "{\"value\":["
            + "{\"subscriptionId\":\"sub-1\",\"changeType\":\"created\",\"tenantId\":\"tenant\","
            + "\"resource\":\"users/u-1/onlineMeetings/m-1/transcripts/t-1\","
            + "\"resourceData\":{\"id\":\"t-1\"}},"
            + "{\"subscriptionId\":\"sub-1\",\"changeType\":\"updated\",\"tenantId\":\"tenant\","
            + "\"resource\":\"users/u-1/onlineMeetings/m-1\","
            + "\"resourceData\":{\"id\":\"m-1\"}}"
            + "]}";
    }
}
