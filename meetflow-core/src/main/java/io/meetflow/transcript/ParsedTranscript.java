package io.meetflow.transcript;

import io.meetflow.model.SpeakerSegment;

import java.util.ArrayList;
import java.util.List;

/**
 * Speaker segments plus the flattened text stored on the transcript.
 *
 * @param fullText  {@code speaker: text} per segment, separated by a blank line
 * @param wordCount whitespace-separated tokens in {@code fullText}
 */
public record ParsedTranscript(List<SpeakerSegment> segments, String fullText, int wordCount) {

    /** Gap under which consecutive turns of one speaker are joined. */
    static final long MERGE_GAP_MS = 2000;

    public ParsedTranscript {
        segments = List.copyOf(segments);
    }

    /**
     * Builds the result from segments in time order, merging consecutive turns of the same
     * speaker that are less than two seconds apart.
     */
    public static ParsedTranscript of(List<SpeakerSegment> segments) {
        List<SpeakerSegment> merged = merge(segments);
        StringBuilder text = new StringBuilder();
        for (SpeakerSegment segment : merged) {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append(segment.speaker()).append(": ").append(segment.text());
        }
        String fullText = text.toString();
        return new ParsedTranscript(merged, fullText, countWords(fullText));
    }

    static int countWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static List<SpeakerSegment> merge(List<SpeakerSegment> segments) {
        List<SpeakerSegment> merged = new ArrayList<>();
        SpeakerSegment current = null;
        for (SpeakerSegment next : segments) {
            if (current != null
                && current.speaker().equals(next.speaker())
                && next.startMs() - current.endMs() < MERGE_GAP_MS) {
                current = new SpeakerSegment(current.speaker(), current.text() + " " + next.text(),
                    current.startMs(), next.endMs());
                continue;
            }
            if (current != null) {
                merged.add(current);
            }
            current = next;
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }
}
