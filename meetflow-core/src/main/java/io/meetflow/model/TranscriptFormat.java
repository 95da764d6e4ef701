package io.meetflow.model;

/**
 * Wire format of a downloaded transcript.
 */
public enum TranscriptFormat {
    /** WebVTT cues, as served by Zoom and Teams. */
    VTT("vtt"),
    /** JSON array of speaker entries, as served by Google Meet. */
    JSON_SEGMENTS("json_segments");

    private final String code;

    TranscriptFormat(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TranscriptFormat fromCode(String code) {
        for (TranscriptFormat format : values()) {
            if (format.code.equals(code)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown transcript format: " + code);
    }
}
