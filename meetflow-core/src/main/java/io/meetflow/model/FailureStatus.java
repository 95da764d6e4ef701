package io.meetflow.model;

public enum FailureStatus {
    PENDING("pending"),
    RETRYING("retrying"),
    COMPLETED("completed"),
    DEAD_LETTER("dead_letter");

    private final String code;

    FailureStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Returns {@code true} for statuses the retry scheduler still picks up.
     */
    public boolean isRetryable() {
        return this == PENDING || this == RETRYING;
    }

    public static FailureStatus fromCode(String code) {
        for (FailureStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown failure status: " + code);
    }
}
