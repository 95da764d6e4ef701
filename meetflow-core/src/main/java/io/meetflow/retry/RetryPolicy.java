package io.meetflow.retry;

/**
 * Strategy for computing the delay before the next attempt of a failed pipeline step.
 *
 * <p>Implementations must be monotonically non-decreasing in {@code attempts}.
 *
 * @see LinearBackoffRetryPolicy
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next retry attempt.
     *
     * @param attempts the number of attempts made so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
