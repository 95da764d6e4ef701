package io.meetflow.ingest.platform;

import com.fasterxml.jackson.databind.JsonNode;
import io.meetflow.model.EventHints;
import io.meetflow.model.Platform;
import io.meetflow.model.RawEvent;
import io.meetflow.model.TranscriptFormat;
import io.meetflow.spi.MeetingDescriptor;
import io.meetflow.spi.PlatformEventAdapter;
import io.meetflow.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads Google Workspace Events for Meet, delivered either as a Pub/Sub push envelope
 * ({@code {message: {data: <base64>, messageId, attributes}}}) or as the bare event.
 *
 * <p>The stored payload is the decoded Workspace event. The meeting id is the conference record
 * name and the transcript reference is the transcript resource name, whose entries are served
 * as JSON.
 */
public final class GoogleMeetEventAdapter implements PlatformEventAdapter {
    public static final String CONFERENCE_ENDED = "google.workspace.meet.conference.v2.ended";
    public static final String TRANSCRIPT_GENERATED = "google.workspace.meet.transcript.v2.fileGenerated";

    private static final String TRANSCRIPTS_SEGMENT = "/transcripts/";

    private final JsonCodec jsonCodec;

    public GoogleMeetEventAdapter() {
        this(JsonCodec.getDefault());
    }

    public GoogleMeetEventAdapter(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    @Override
    public Platform platform() {
        return Platform.GOOGLE_MEET;
    }

    @Override
    public List<InboundEvent> split(String body) {
        JsonNode root = jsonCodec.readTree(body);
        JsonNode message = root.path("message");
        String eventJson;
        String deliveryId;
        String eventType;
        if (message.isObject()) {
            String data = Payloads.requireText(message, "data", "Pub/Sub message");
            eventJson = new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8);
            deliveryId = Payloads.requireText(message, "messageId", "Pub/Sub message");
            eventType = Payloads.text(message.path("attributes"), "ce-type");
        } else {
            eventJson = body;
            deliveryId = Payloads.text(root, "id");
            eventType = null;
        }
        JsonNode event = jsonCodec.readTree(eventJson);
        if (eventType == null) {
            eventType = Payloads.requireText(event, "eventType", "Meet event");
        }
        String recordName = conferenceRecordName(event);
        if (deliveryId == null) {
            deliveryId = Payloads.text(event, "eventTime");
        }
        String externalId = eventType + "-" + recordName + "-" + deliveryId;
        return List.of(new InboundEvent(eventType, externalId, eventJson));
    }

    @Override
    public EventHints extractHints(String eventType, String payloadJson) {
        JsonNode event = jsonCodec.readTree(payloadJson);
        JsonNode record = event.path("conferenceRecord");
        return new EventHints(
            conferenceRecordName(event),
            Payloads.instant(record, "endTime"),
            false,
            TRANSCRIPT_GENERATED.equals(eventType));
    }

    @Override
    public Optional<MeetingDescriptor> correlate(RawEvent event) {
        boolean ended = CONFERENCE_ENDED.equals(event.eventType());
        boolean transcript = TRANSCRIPT_GENERATED.equals(event.eventType());
        if (!ended && !transcript) {
            return Optional.empty();
        }
        JsonNode payload = jsonCodec.readTree(event.payloadJson());
        String recordName = conferenceRecordName(payload);
        if (recordName == null) {
            throw new IllegalArgumentException("Meet " + event.eventType() + " payload has no conference record");
        }
        JsonNode record = payload.path("conferenceRecord");
        String transcriptName = transcript ? Payloads.text(payload.path("transcript"), "name") : null;
        return Optional.of(new MeetingDescriptor(
            Platform.GOOGLE_MEET,
            recordName,
            Payloads.text(payload, "organizerEmail"),
            Payloads.text(record.path("space"), "meetingCode"),
            Payloads.instant(record, "startTime"),
            Payloads.instant(record, "endTime"),
            transcriptName,
            TranscriptFormat.JSON_SEGMENTS));
    }

    private static String conferenceRecordName(JsonNode event) {
        JsonNode record = event.path("conferenceRecord");
        String name = Payloads.text(record, "name");
        if (name == null) {
            name = Payloads.text(record, "conferenceRecordName");
        }
        if (name == null) {
            String transcriptName = Payloads.text(event.path("transcript"), "name");
            if (transcriptName != null && transcriptName.contains(TRANSCRIPTS_SEGMENT)) {
                name = transcriptName.substring(0, transcriptName.indexOf(TRANSCRIPTS_SEGMENT));
            }
        }
        return name;
    }
}
