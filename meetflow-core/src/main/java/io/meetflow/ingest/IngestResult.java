package io.meetflow.ingest;

/**
 * Outcome of one {@link EventIngestor#ingest} call.
 *
 * @param created    {@code true} if this delivery was stored for the first time
 * @param rawEventId id of the stored event, whether new or pre-existing
 */
public record IngestResult(boolean created, String rawEventId, String externalEventId) {

    static IngestResult created(String rawEventId, String externalEventId) {
        return new IngestResult(true, rawEventId, externalEventId);
    }

    static IngestResult duplicate(String rawEventId, String externalEventId) {
        return new IngestResult(false, rawEventId, externalEventId);
    }
}
