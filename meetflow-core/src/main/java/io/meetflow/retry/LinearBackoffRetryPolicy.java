package io.meetflow.retry;

/**
 * Retry policy with linearly growing delays: {@code baseDelay * attempts}.
 *
 * <p>This is the default schedule. With the default base delay of one second the second and
 * third attempts run one and two seconds after the previous failure.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
    public static final long DEFAULT_BASE_DELAY_MS = 1000L;

    private final long baseDelayMs;

    public LinearBackoffRetryPolicy() {
        this(DEFAULT_BASE_DELAY_MS);
    }

    /**
     * @param baseDelayMs delay after the first failed attempt (milliseconds)
     */
    public LinearBackoffRetryPolicy(long baseDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        if (attempts > Long.MAX_VALUE / baseDelayMs) {
            return Long.MAX_VALUE;
        }
        return baseDelayMs * attempts;
    }
}
