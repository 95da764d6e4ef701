package io.meetflow.ingest.platform;

import com.fasterxml.jackson.databind.JsonNode;
import io.meetflow.model.EventHints;
import io.meetflow.model.Platform;
import io.meetflow.model.RawEvent;
import io.meetflow.model.TranscriptFormat;
import io.meetflow.spi.MeetingDescriptor;
import io.meetflow.spi.PlatformEventAdapter;
import io.meetflow.util.JsonCodec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads Zoom webhook payloads ({@code {event, event_ts, payload: {object: {...}}}}).
 *
 * <p>The external event id is {@code <event>-<meeting uuid>-<event_ts>}; Zoom does not send a
 * delivery id of its own. The transcript is the recording file of type {@code TRANSCRIPT}.
 */
public final class ZoomEventAdapter implements PlatformEventAdapter {
    public static final String MEETING_ENDED = "meeting.ended";
    public static final String RECORDING_COMPLETED = "recording.completed";
    public static final String TRANSCRIPT_COMPLETED = "recording.transcript_completed";
    public static final String URL_VALIDATION = "endpoint.url_validation";

    private static final Set<String> ACTIONABLE = Set.of(MEETING_ENDED, RECORDING_COMPLETED, TRANSCRIPT_COMPLETED);

    private final JsonCodec jsonCodec;

    public ZoomEventAdapter() {
        this(JsonCodec.getDefault());
    }

    public ZoomEventAdapter(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    @Override
    public Platform platform() {
        return Platform.ZOOM;
    }

    @Override
    public List<InboundEvent> split(String body) {
        JsonNode root = jsonCodec.readTree(body);
        String event = Payloads.requireText(root, "event", "Zoom webhook");
        String eventTs = Payloads.text(root, "event_ts");
        String uuid = Payloads.text(meetingObject(root), "uuid");
        String externalId = uuid == null
            ? event + "-" + eventTs
            : event + "-" + uuid + "-" + eventTs;
        return List.of(new InboundEvent(event, externalId, body));
    }

    @Override
    public EventHints extractHints(String eventType, String payloadJson) {
        JsonNode object = meetingObject(jsonCodec.readTree(payloadJson));
        if (object == null) {
            return EventHints.NONE;
        }
        return new EventHints(
            meetingId(object),
            Payloads.instant(object, "end_time"),
            eventType.startsWith("recording.") || object.has("recording_files"),
            transcriptUrl(object) != null);
    }

    @Override
    public Optional<MeetingDescriptor> correlate(RawEvent event) {
        if (!ACTIONABLE.contains(event.eventType())) {
            return Optional.empty();
        }
        JsonNode root = jsonCodec.readTree(event.payloadJson());
        JsonNode object = meetingObject(root);
        if (object == null) {
            throw new IllegalArgumentException("Zoom " + event.eventType() + " payload has no meeting object");
        }
        String meetingId = meetingId(object);
        if (meetingId == null) {
            throw new IllegalArgumentException("Zoom " + event.eventType() + " payload has no meeting id");
        }
        return Optional.of(new MeetingDescriptor(
            Platform.ZOOM,
            meetingId,
            Payloads.text(object, "host_email"),
            Payloads.text(object, "topic"),
            Payloads.instant(object, "start_time"),
            Payloads.instant(object, "end_time"),
            withDownloadToken(transcriptUrl(object), Payloads.text(root, "download_token")),
            TranscriptFormat.VTT));
    }

    private static JsonNode meetingObject(JsonNode root) {
        JsonNode object = root.path("payload").path("object");
        return object.isObject() ? object : null;
    }

    // uuid identifies one occurrence; id is shared by every occurrence of a recurring meeting
    private static String meetingId(JsonNode object) {
        String uuid = Payloads.text(object, "uuid");
        return uuid != null ? uuid : Payloads.text(object, "id");
    }

    // recording webhooks carry a short-lived token that authorizes the download on its own
    static String withDownloadToken(String url, String downloadToken) {
        if (url == null || downloadToken == null) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + "access_token=" + downloadToken;
    }

    private static String transcriptUrl(JsonNode object) {
        JsonNode files = object.path("recording_files");
        if (!files.isArray()) {
            return null;
        }
        for (JsonNode file : files) {
            if ("TRANSCRIPT".equalsIgnoreCase(Payloads.text(file, "file_type"))) {
                return Payloads.text(file, "download_url");
            }
        }
        return null;
    }
}
