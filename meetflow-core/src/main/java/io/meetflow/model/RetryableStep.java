package io.meetflow.model;

/**
 * Pipeline steps that can be recorded as a {@link WebhookFailure} and re-executed later.
 *
 * <p>The failure's {@code referenceId} points at a raw event for {@link #EVENT_PROCESSING}
 * and at a meeting for the other steps.
 */
public enum RetryableStep {
    EVENT_PROCESSING("event_processing", null),
    TRANSCRIPT_FETCH("transcript_fetch", ProcessingStep.TRANSCRIPT_DOWNLOAD),
    DRAFT_GENERATION("draft_generation", ProcessingStep.DRAFT_GENERATION);

    private final String code;
    private final ProcessingStep meetingStep;

    RetryableStep(String code, ProcessingStep meetingStep) {
        this.code = code;
        this.meetingStep = meetingStep;
    }

    public String code() {
        return code;
    }

    /**
     * The step a meeting must still be at for a retry of this step to apply, or {@code null}
     * when the step is not meeting-level.
     */
    public ProcessingStep meetingStep() {
        return meetingStep;
    }

    public boolean isMeetingLevel() {
        return meetingStep != null;
    }

    public static RetryableStep fromCode(String code) {
        for (RetryableStep step : values()) {
            if (step.code.equals(code)) {
                return step;
            }
        }
        throw new IllegalArgumentException("Unknown retryable step: " + code);
    }
}
