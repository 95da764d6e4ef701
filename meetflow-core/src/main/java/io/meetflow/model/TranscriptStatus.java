package io.meetflow.model;

public enum TranscriptStatus {
    PENDING("pending"),
    FETCHING("fetching"),
    READY("ready"),
    FAILED("failed");

    private final String code;

    TranscriptStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static TranscriptStatus fromCode(String code) {
        for (TranscriptStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown transcript status: " + code);
    }
}
