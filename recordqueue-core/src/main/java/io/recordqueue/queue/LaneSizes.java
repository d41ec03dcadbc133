package io.recordqueue.queue;

/**
 * Point-in-time depth of each lane, taken under the lane lock.
 *
 * @param high   jobs waiting in the high lane
 * @param normal jobs waiting in the normal lane
 * @param low    jobs waiting in the low lane
 */
public record LaneSizes(int high, int normal, int low) {

  public int total() {
    return high + normal + low;
  }

  public int of(Lane lane) {
    return switch (lane) {
      case HIGH -> high;
      case NORMAL -> normal;
      case LOW -> low;
    };
  }
}
