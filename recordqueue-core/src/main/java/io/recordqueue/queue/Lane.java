package io.recordqueue.queue;

import io.recordqueue.JobPriority;

import java.util.Objects;

/**
 * One of the three FIFO lanes pending jobs wait in. Declaration order is drain order.
 */
public enum Lane {
  HIGH,
  NORMAL,
  LOW;

  /**
   * Routes a priority tier to its lane: {@code HIGH} and above share the high lane.
   *
   * @param priority the requested tier
   * @return the lane for that tier
   */
  public static Lane forPriority(JobPriority priority) {
    Objects.requireNonNull(priority, "priority");
    if (priority.isAtLeast(JobPriority.HIGH)) {
      return HIGH;
    }
    return priority == JobPriority.NORMAL ? NORMAL : LOW;
  }
}
