package io.meetflow.model;

/**
 * Meeting platforms that deliver webhooks into the pipeline.
 */
public enum Platform {
    ZOOM("zoom"),
    GOOGLE_MEET("google_meet"),
    MICROSOFT_TEAMS("microsoft_teams");

    private final String code;

    Platform(String code) {
        this.code = code;
    }

    /**
     * Stable identifier persisted in the database.
     */
    public String code() {
        return code;
    }

    public static Platform fromCode(String code) {
        for (Platform platform : values()) {
            if (platform.code.equals(code)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + code);
    }
}
