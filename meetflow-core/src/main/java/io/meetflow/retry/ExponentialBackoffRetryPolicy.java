package io.meetflow.retry;

/**
 * Retry policy using exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}. No jitter is
 * applied, so successive delays never shrink.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelayMs base delay for the first retry (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        if (attempts >= 31) {
            return maxDelayMs;
        }
        long shift = 1L << (attempts - 1);
        // overflow guard
        if (shift > maxDelayMs / baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, baseDelayMs * shift);
    }
}
