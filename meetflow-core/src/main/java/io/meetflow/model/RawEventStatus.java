package io.meetflow.model;

/**
 * Lifecycle of a stored webhook delivery.
 *
 * <p>Status only moves forward: {@code received -> processing -> processed|failed}.
 * A failed event may still reach {@code processed} when a retry of its processing succeeds.
 */
public enum RawEventStatus {
    RECEIVED("received"),
    PROCESSING("processing"),
    PROCESSED("processed"),
    FAILED("failed");

    private final String code;

    RawEventStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean canTransitionTo(RawEventStatus next) {
        return switch (this) {
            case RECEIVED -> next == PROCESSING;
            case PROCESSING -> next == PROCESSED || next == FAILED;
            case FAILED -> next == PROCESSED;
            case PROCESSED -> false;
        };
    }

    public static RawEventStatus fromCode(String code) {
        for (RawEventStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown raw event status: " + code);
    }
}
