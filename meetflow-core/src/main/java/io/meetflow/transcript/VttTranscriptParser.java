package io.meetflow.transcript;

import io.meetflow.model.SpeakerSegment;
import io.meetflow.model.TranscriptFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * WebVTT parser for Zoom and Teams transcripts.
 *
 * <p>Speakers come from a {@code <v Name>} voice tag (Teams) or a {@code Name: text} prefix
 * (Zoom); cues with neither are attributed to {@value #UNKNOWN_SPEAKER}.
 */
public final class VttTranscriptParser implements TranscriptParser {
    static final String UNKNOWN_SPEAKER = "Unknown";

    private static final String TIMESTAMP = "(\\d{1,2}:\\d{2}(?::\\d{2})?(?:\\.\\d{1,3})?)";
    private static final Pattern CUE_TIMING = Pattern.compile(TIMESTAMP + "\\s*-->\\s*" + TIMESTAMP);
    private static final Pattern VOICE_TAG = Pattern.compile("<v(?:\\.[^\\s>]+)*\\s+([^>]+)>");
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern SPEAKER_PREFIX = Pattern.compile("^([^:]+):\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern CUE_NUMBER = Pattern.compile("^\\d+$");

    @Override
    public TranscriptFormat format() {
        return TranscriptFormat.VTT;
    }

    @Override
    public ParsedTranscript parse(String content) {
        if (content == null) {
            throw new IllegalArgumentException("VTT content is null");
        }
        List<SpeakerSegment> segments = new ArrayList<>();
        Cue cue = null;
        boolean inNote = false;
        for (String rawLine : content.split("\\r?\\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                inNote = false;
                cue = flush(cue, segments);
                continue;
            }
            if (inNote || line.equals("WEBVTT") || line.startsWith("WEBVTT ") || line.startsWith("NOTE")) {
                inNote = line.startsWith("NOTE") || inNote;
                continue;
            }
            Matcher timing = CUE_TIMING.matcher(line);
            if (timing.find()) {
                flush(cue, segments);
                cue = new Cue(parseTimestamp(timing.group(1)), parseTimestamp(timing.group(2)));
                continue;
            }
            if (cue == null || CUE_NUMBER.matcher(line).matches()) {
                continue;
            }
            Matcher voice = VOICE_TAG.matcher(line);
            if (voice.find() && cue.voice == null) {
                cue.voice = voice.group(1).strip();
            }
            String text = TAG.matcher(line).replaceAll("").strip();
            if (!text.isEmpty()) {
                cue.lines.add(text);
            }
        }
        flush(cue, segments);
        return ParsedTranscript.of(segments);
    }

    private static Cue flush(Cue cue, List<SpeakerSegment> segments) {
        if (cue == null || cue.lines.isEmpty()) {
            return null;
        }
        String combined = String.join(" ", cue.lines);
        String speaker = cue.voice;
        String text = combined;
        if (speaker == null) {
            Matcher prefix = SPEAKER_PREFIX.matcher(combined);
            if (prefix.matches()) {
                speaker = prefix.group(1).strip();
                text = prefix.group(2).strip();
            } else {
                speaker = UNKNOWN_SPEAKER;
            }
        }
        segments.add(new SpeakerSegment(speaker, text, cue.startMs, cue.endMs));
        cue.lines.clear();
        return null;
    }

    /**
     * Parses {@code HH:MM:SS.mmm} or {@code MM:SS.mmm} into milliseconds.
     */
    static long parseTimestamp(String timestamp) {
        String[] parts = timestamp.strip().split(":");
        long hours = 0;
        long minutes;
        double seconds;
        if (parts.length == 3) {
            hours = Long.parseLong(parts[0]);
            minutes = Long.parseLong(parts[1]);
            seconds = Double.parseDouble(parts[2]);
        } else if (parts.length == 2) {
            minutes = Long.parseLong(parts[0]);
            seconds = Double.parseDouble(parts[1]);
        } else {
            throw new IllegalArgumentException("Invalid VTT timestamp: " + timestamp);
        }
        return Math.round((hours * 3600 + minutes * 60 + seconds) * 1000);
    }

    private static final class Cue {
        final long startMs;
        final long endMs;
        final List<String> lines = new ArrayList<>();
        String voice;

        Cue(long startMs, long endMs) {
            this.startMs = startMs;
            this.endMs = endMs;
        }
    }
}
