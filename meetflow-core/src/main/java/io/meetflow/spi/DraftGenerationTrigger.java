package io.meetflow.spi;

/**
 * Requests downstream follow-up generation once a meeting's transcript is stored.
 *
 * <p>Fire-and-forget from the pipeline's point of view; completion is reported elsewhere.
 * Implementations should be idempotent per meeting, since a retried step may call them again.
 */
@FunctionalInterface
public interface DraftGenerationTrigger {

    /**
     * @throws Exception any failure; it is recorded as a retryable step failure
     */
    void requestGeneration(String meetingId) throws Exception;
}
