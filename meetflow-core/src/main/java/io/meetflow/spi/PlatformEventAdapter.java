package io.meetflow.spi;

import io.meetflow.model.EventHints;
import io.meetflow.model.Platform;
import io.meetflow.model.RawEvent;

import java.util.List;
import java.util.Optional;

/**
 * Platform-specific reading of webhook payloads.
 *
 * <p>Adapters only read JSON; they never call the platform.
 */
public interface PlatformEventAdapter {

    Platform platform();

    /**
     * Splits a webhook request body into individually deduplicated events.
     *
     * @throws IllegalArgumentException if the body is not a payload of this platform
     */
    List<InboundEvent> split(String body);

    /**
     * Extracts ingestion hints. Must not throw for well-formed JSON of an unknown event type.
     */
    EventHints extractHints(String eventType, String payloadJson);

    /**
     * Maps a stored event to the meeting it concerns.
     *
     * @return empty if the event type does not drive the pipeline
     * @throws IllegalArgumentException if an actionable event lacks required fields
     */
    Optional<MeetingDescriptor> correlate(RawEvent event);

    /**
     * One deduplicated event carried by a webhook request.
     */
    record InboundEvent(String eventType, String externalEventId, String payloadJson) {}
}
