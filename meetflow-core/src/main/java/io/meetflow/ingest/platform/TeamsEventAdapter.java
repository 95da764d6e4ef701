package io.meetflow.ingest.platform;

import com.fasterxml.jackson.databind.JsonNode;
import io.meetflow.model.EventHints;
import io.meetflow.model.Platform;
import io.meetflow.model.RawEvent;
import io.meetflow.model.TranscriptFormat;
import io.meetflow.spi.MeetingDescriptor;
import io.meetflow.spi.PlatformEventAdapter;
import io.meetflow.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Microsoft Graph change notifications ({@code {value: [notification, ...]}}).
 *
 * <p>Each notification becomes one event of type {@code teams.<changeType>} with external id
 * {@code <eventType>-<subscriptionId>-<resourceData.id>}. Only created transcripts drive the
 * pipeline; their resource path gives the online meeting id.
 */
public final class TeamsEventAdapter implements PlatformEventAdapter {
    public static final String TRANSCRIPT_CREATED = "teams.created";

    // users/{u}/onlineMeetings/{m}/transcripts/{t} or users('u')/onlineMeetings('m')/transcripts('t')
    private static final Pattern TRANSCRIPT_RESOURCE = Pattern.compile(
        "onlineMeetings[/(']+([^/')]+)[')]*/transcripts[/(']+([^/')]+)");

    private final JsonCodec jsonCodec;

    public TeamsEventAdapter() {
        this(JsonCodec.getDefault());
    }

    public TeamsEventAdapter(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    @Override
    public Platform platform() {
        return Platform.MICROSOFT_TEAMS;
    }

    @Override
    public List<InboundEvent> split(String body) {
        JsonNode notifications = jsonCodec.readTree(body).path("value");
        if (!notifications.isArray()) {
            throw new IllegalArgumentException("Graph notification body has no 'value' array");
        }
        List<InboundEvent> events = new ArrayList<>(notifications.size());
        for (JsonNode notification : notifications) {
            String changeType = Payloads.requireText(notification, "changeType", "Graph notification");
            String subscriptionId = Payloads.requireText(notification, "subscriptionId", "Graph notification");
            String resourceId = Payloads.text(notification.path("resourceData"), "id");
            if (resourceId == null) {
                resourceId = Payloads.requireText(notification, "resource", "Graph notification");
            }
            String eventType = "teams." + changeType;
            events.add(new InboundEvent(eventType, eventType + "-" + subscriptionId + "-" + resourceId,
                jsonCodec.toJson(notification)));
        }
        return events;
    }

    @Override
    public EventHints extractHints(String eventType, String payloadJson) {
        String resource = Payloads.text(jsonCodec.readTree(payloadJson), "resource");
        Matcher matcher = resource == null ? null : TRANSCRIPT_RESOURCE.matcher(resource);
        if (matcher == null || !matcher.find()) {
            return EventHints.NONE;
        }
        return new EventHints(matcher.group(1), null, false, true);
    }

    @Override
    public Optional<MeetingDescriptor> correlate(RawEvent event) {
        if (!TRANSCRIPT_CREATED.equals(event.eventType())) {
            return Optional.empty();
        }
        String resource = Payloads.requireText(jsonCodec.readTree(event.payloadJson()), "resource",
            "Graph notification");
        Matcher matcher = TRANSCRIPT_RESOURCE.matcher(resource);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new MeetingDescriptor(
            Platform.MICROSOFT_TEAMS,
            matcher.group(1),
            null,
            null,
            null,
            null,
            resource,
            TranscriptFormat.VTT));
    }
}
