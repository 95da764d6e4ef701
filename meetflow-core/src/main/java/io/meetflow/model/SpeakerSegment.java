package io.meetflow.model;

/**
 * One speaker turn of a parsed transcript. Offsets are milliseconds from the start of the meeting.
 */
public record SpeakerSegment(
    String speaker,
    String text,
    long startMs,
    long endMs
) {}
