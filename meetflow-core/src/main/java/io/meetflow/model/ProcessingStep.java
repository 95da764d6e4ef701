package io.meetflow.model;

/**
 * Ordered pipeline steps a meeting passes through.
 *
 * <p>Declaration order is the processing order. {@link #FAILED} sits outside the order and can be
 * entered from any non-terminal step. Each step carries the progress percentage shown once the
 * step is reached, a display label, and the average time the step takes, used for estimates.
 */
public enum ProcessingStep {
    WEBHOOK_RECEIVED("webhook_received", 5, "Webhook received", 500),
    MEETING_FETCHED("meeting_fetched", 10, "Fetching meeting details", 1000),
    MEETING_CREATED("meeting_created", 15, "Meeting record created", 500),
    TRANSCRIPT_DOWNLOAD("transcript_download", 30, "Downloading transcript", 8000),
    TRANSCRIPT_PARSE("transcript_parse", 50, "Parsing transcript", 3000),
    TRANSCRIPT_STORED("transcript_stored", 60, "Transcript stored", 1000),
    DRAFT_GENERATION("draft_generation", 80, "Generating follow-up draft", 12000),
    COMPLETED("completed", 100, "Processing complete", 0),
    FAILED("failed", 0, "Processing failed", 0);

    private final String code;
    private final int progress;
    private final String label;
    private final long avgDurationMs;

    ProcessingStep(String code, int progress, String label, long avgDurationMs) {
        this.code = code;
        this.progress = progress;
        this.label = label;
        this.avgDurationMs = avgDurationMs;
    }

    public String code() {
        return code;
    }

    public int progress() {
        return progress;
    }

    public String label() {
        return label;
    }

    public long avgDurationMs() {
        return avgDurationMs;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns {@code true} if this step comes strictly after {@code other} in the pipeline order.
     * {@link #FAILED} is never "after" anything.
     */
    public boolean isAfter(ProcessingStep other) {
        if (this == FAILED || other == FAILED) {
            return false;
        }
        return ordinal() > other.ordinal();
    }

    public static ProcessingStep fromCode(String code) {
        for (ProcessingStep step : values()) {
            if (step.code.equals(code)) {
                return step;
            }
        }
        throw new IllegalArgumentException("Unknown processing step: " + code);
    }
}
