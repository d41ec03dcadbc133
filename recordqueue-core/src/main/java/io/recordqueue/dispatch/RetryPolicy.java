package io.recordqueue.dispatch;

/**
 * Computes how long to wait before re-appending a job whose attempt failed transiently.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param failedAttempts number of attempts that have failed so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int failedAttempts);
}
