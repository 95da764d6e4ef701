package io.meetflow.util;

import com.fasterxml.jackson.databind.JsonNode;
import io.meetflow.model.FailureHistoryEntry;
import io.meetflow.model.SpeakerSegment;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonJsonCodecTest {
    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void instantsAreWrittenAsIsoStrings() {
        String json = codec.toJson(List.of(
            new FailureHistoryEntry(1, "HTTP 503", Instant.parse("2024-03-01T10:00:00Z"))));

        assertEquals("[{\"attempt\":1,\"error\":\"HTTP 503\",\"timestamp\":\"2024-03-01T10:00:00Z\"}]", json);
    }

    @Test
    void readsHistoryColumn() {
        List<FailureHistoryEntry> history = codec.parseList(
            "[{\"attempt\":2,\"error\":\"timeout\",\"timestamp\":\"2024-03-01T10:00:02Z\",\"extra\":true}]",
            FailureHistoryEntry.class);

        assertEquals(List.of(new FailureHistoryEntry(2, "timeout", Instant.parse("2024-03-01T10:00:02Z"))), history);
    }

    @Test
    void readsSegmentsColumn() {
        List<SpeakerSegment> segments = codec.parseList(
            codec.toJson(List.of(new SpeakerSegment("Alice", "Hello", 0, 1500))), SpeakerSegment.class);

        assertEquals("Alice", segments.get(0).speaker());
        assertEquals(1500, segments.get(0).endMs());
    }

    @Test
    void emptyColumnsDecodeToEmptyList() {
        assertTrue(codec.parseList(null, FailureHistoryEntry.class).isEmpty());
        assertTrue(codec.parseList(" ", FailureHistoryEntry.class).isEmpty());
        assertTrue(codec.parseList("null", FailureHistoryEntry.class).isEmpty());
    }

    @Test
    void nullValueEncodesToNull() {
        assertNull(codec.toJson(null));
    }

    @Test
    void readTreeRejectsMalformedInput() {
        JsonNode node = codec.readTree("{\"event\":\"meeting.ended\"}");
        assertEquals("meeting.ended", node.path("event").asText());

        assertThrows(IllegalArgumentException.class, () -> codec.readTree("{not json"));
        assertThrows(IllegalArgumentException.class, () -> codec.readTree(""));
        assertThrows(IllegalArgumentException.class,
            () -> codec.parseList("{\"attempt\":1}", FailureHistoryEntry.class));
    }
}
