package io.meetflow.model;

public enum MeetingStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    READY("ready"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String code;

    MeetingStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }

    public static MeetingStatus fromCode(String code) {
        for (MeetingStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown meeting status: " + code);
    }
}
