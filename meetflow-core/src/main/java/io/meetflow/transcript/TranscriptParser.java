package io.meetflow.transcript;

import io.meetflow.model.TranscriptFormat;

/**
 * Turns raw transcript content of one {@link TranscriptFormat} into speaker segments.
 */
public interface TranscriptParser {

    TranscriptFormat format();

    /**
     * @throws IllegalArgumentException if the content is not valid for {@link #format()}
     */
    ParsedTranscript parse(String content);
}
