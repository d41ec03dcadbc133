package io.recordqueue.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubles the delay after every failed attempt, starting at {@code baseDelayMs} and
 * never exceeding {@code maxDelayMs}. A random factor in {@code [1 - jitter, 1 + jitter)}
 * is applied so that jobs failing together do not come back together.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 0.5);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds, &gt; 0)
   * @param maxDelayMs  upper bound for any delay (milliseconds, &ge; baseDelayMs)
   * @param jitter      relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int failedAttempts) {
    if (failedAttempts <= 0) {
      return 0L;
    }
    long delay = baseDelayMs;
    for (int i = 1; i < failedAttempts && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    if (jitter > 0.0) {
      delay = (long) (delay * ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter));
    }
    return Math.max(0L, Math.min(maxDelayMs, delay));
  }
}
