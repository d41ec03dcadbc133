package io.recordqueue;

/**
 * Priority tier requested by the producer of a job.
 *
 * <p>Tiers are ordered {@code LOW < NORMAL < HIGH < CRITICAL}. {@code HIGH} and
 * {@code CRITICAL} share the same lane; the distinction is only kept for callers
 * and for observability.
 */
public enum JobPriority {
  LOW(1),
  NORMAL(2),
  HIGH(3),
  CRITICAL(4);

  private final int level;

  JobPriority(int level) {
    this.level = level;
  }

  public int level() {
    return level;
  }

  /**
   * Returns {@code true} if this tier ranks at or above {@code other}.
   *
   * @param other the tier to compare against
   * @return whether this tier is at least {@code other}
   */
  public boolean isAtLeast(JobPriority other) {
    return level >= other.level;
  }
}
