package io.meetflow.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import io.meetflow.model.SpeakerSegment;
import io.meetflow.model.TranscriptFormat;
import io.meetflow.util.JsonCodec;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Parser for JSON transcript entries as returned by the Meet REST API.
 *
 * <p>Accepts a bare array or an object holding it under {@code transcriptEntries} or
 * {@code entries}. Each entry needs {@code text}; the speaker is read from {@code speaker},
 * {@code participantName} or {@code participant}. Times are either numeric millisecond offsets
 * ({@code startOffset}/{@code endOffset}) or ISO-8601 instants ({@code startTime}/{@code endTime}),
 * the latter made relative to the earliest entry.
 */
public final class JsonSegmentTranscriptParser implements TranscriptParser {

    private final JsonCodec jsonCodec;

    public JsonSegmentTranscriptParser() {
        this(JsonCodec.getDefault());
    }

    public JsonSegmentTranscriptParser(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    @Override
    public TranscriptFormat format() {
        return TranscriptFormat.JSON_SEGMENTS;
    }

    @Override
    public ParsedTranscript parse(String content) {
        JsonNode root = jsonCodec.readTree(content);
        JsonNode entries = root;
        if (root.isObject()) {
            entries = root.has("transcriptEntries") ? root.get("transcriptEntries") : root.path("entries");
        }
        if (!entries.isArray()) {
            throw new IllegalArgumentException("Transcript JSON has no entry array");
        }

        List<Entry> parsed = new ArrayList<>();
        Instant origin = null;
        for (JsonNode node : entries) {
            String text = node.path("text").asText("").strip();
            if (text.isEmpty()) {
                continue;
            }
            Instant start = instant(node.path("startTime"));
            if (start != null && (origin == null || start.isBefore(origin))) {
                origin = start;
            }
            parsed.add(new Entry(speaker(node), text, node));
        }

        List<SpeakerSegment> segments = new ArrayList<>(parsed.size());
        for (Entry entry : parsed) {
            long startMs = offset(entry.node, "startOffset", "startTime", origin);
            long endMs = Math.max(startMs, offset(entry.node, "endOffset", "endTime", origin));
            segments.add(new SpeakerSegment(entry.speaker, entry.text, startMs, endMs));
        }
        segments.sort(Comparator.comparingLong(SpeakerSegment::startMs));
        return ParsedTranscript.of(segments);
    }

    private static String speaker(JsonNode node) {
        for (String field : new String[]{"speaker", "participantName", "participant"}) {
            String value = node.path(field).asText("").strip();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return VttTranscriptParser.UNKNOWN_SPEAKER;
    }

    private static long offset(JsonNode node, String offsetField, String timeField, Instant origin) {
        JsonNode offset = node.path(offsetField);
        if (offset.isNumber()) {
            return offset.asLong();
        }
        Instant time = instant(node.path(timeField));
        if (time != null && origin != null) {
            return time.toEpochMilli() - origin.toEpochMilli();
        }
        return 0L;
    }

    private static Instant instant(JsonNode value) {
        if (!value.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private record Entry(String speaker, String text, JsonNode node) {}
}
