package io.meetflow.transcript;

import io.meetflow.model.TranscriptFormat;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup of one {@link TranscriptParser} per {@link TranscriptFormat}.
 */
public final class TranscriptParsers {
    private final Map<TranscriptFormat, TranscriptParser> parsers = new EnumMap<>(TranscriptFormat.class);

    public TranscriptParsers(List<? extends TranscriptParser> parsers) {
        for (TranscriptParser parser : parsers) {
            this.parsers.put(parser.format(), parser);
        }
    }

    public static TranscriptParsers defaults() {
        return new TranscriptParsers(List.of(new VttTranscriptParser(), new JsonSegmentTranscriptParser()));
    }

    public TranscriptParser forFormat(TranscriptFormat format) {
        TranscriptParser parser = parsers.get(format);
        if (parser == null) {
            throw new IllegalArgumentException("No transcript parser for format: " + format.code());
        }
        return parser;
    }
}
