package io.recordqueue.dead;

import io.recordqueue.spi.DeadLetterSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded in-memory {@link DeadLetterSink}. Keeps the most recent {@code capacity} dead
 * jobs and evicts the oldest when full.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryDeadLetterSink implements DeadLetterSink {
  private final int capacity;
  private final Deque<DeadJob> deadJobs = new ArrayDeque<>();
  private long evicted;

  public InMemoryDeadLetterSink(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void accept(DeadJob deadJob) {
    if (deadJobs.size() == capacity) {
      deadJobs.pollFirst();
      evicted++;
    }
    deadJobs.addLast(deadJob);
  }

  /**
   * Returns the retained dead jobs, oldest first.
   *
   * @return a snapshot copy
   */
  public synchronized List<DeadJob> list() {
    return new ArrayList<>(deadJobs);
  }

  public synchronized Optional<DeadJob> find(String jobId) {
    for (DeadJob deadJob : deadJobs) {
      if (deadJob.job().id().equals(jobId)) {
        return Optional.of(deadJob);
      }
    }
    return Optional.empty();
  }

  public synchronized int size() {
    return deadJobs.size();
  }

  /** Number of dead jobs dropped because the sink was full. */
  public synchronized long evictedCount() {
    return evicted;
  }
}
