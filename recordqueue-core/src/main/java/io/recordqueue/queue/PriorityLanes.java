package io.recordqueue.queue;

import io.recordqueue.Job;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The three job lanes behind a single lock.
 *
 * <p>Appends go to the tail of the lane the job's priority routes to; pops take the head
 * of the highest non-empty lane. Because one lock guards all three lanes, a pop sees a
 * consistent view across lanes and no job can be handed out twice.
 *
 * <p>With an aging threshold, a {@code NORMAL} or {@code LOW} head that has waited at
 * least that long is served ahead of the high lane, oldest first. Without one (the
 * default) draining is strict priority and a steady stream of high-priority jobs can
 * starve the other lanes.
 *
 * <p>This class is thread-safe.
 */
public final class PriorityLanes {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Map<Lane, ArrayDeque<Entry>> lanes = new EnumMap<>(Lane.class);
  private final long agingThresholdNanos;
  private int size;
  private boolean closed;

  /**
   * Creates lanes with strict priority draining.
   */
  public PriorityLanes() {
    this(null);
  }

  /**
   * Creates lanes with an optional aging threshold.
   *
   * @param agingThreshold minimum wait after which a lower-lane head overtakes the high
   *                       lane, or {@code null} for strict priority
   */
  public PriorityLanes(Duration agingThreshold) {
    if (agingThreshold != null && (agingThreshold.isNegative() || agingThreshold.isZero())) {
      throw new IllegalArgumentException("agingThreshold must be positive, got: " + agingThreshold);
    }
    this.agingThresholdNanos = agingThreshold == null ? 0L : agingThreshold.toNanos();
    for (Lane lane : Lane.values()) {
      lanes.put(lane, new ArrayDeque<>());
    }
  }

  /**
   * Appends a job to the tail of its lane and wakes one waiting consumer.
   *
   * @param job the job to append
   * @return the lane the job was appended to
   * @throws IllegalStateException if the lanes have been closed
   */
  public Lane append(Job job) {
    Objects.requireNonNull(job, "job");
    Lane lane = Lane.forPriority(job.priority());
    lock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("Lanes are closed");
      }
      lanes.get(lane).addLast(new Entry(job, System.nanoTime()));
      size++;
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
    return lane;
  }

  /**
   * Pops the next job without waiting.
   *
   * @return the next job, or {@code null} if every lane is empty
   */
  public Job poll() {
    lock.lock();
    try {
      return next();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Pops the next job, waiting up to {@code timeout} for one to arrive.
   *
   * @param timeout maximum wait
   * @param unit    unit of {@code timeout}
   * @return the next job, or {@code null} if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  public Job poll(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (size == 0) {
        if (remaining <= 0L) {
          return null;
        }
        remaining = notEmpty.awaitNanos(remaining);
      }
      return next();
    } finally {
      lock.unlock();
    }
  }

  public LaneSizes sizes() {
    lock.lock();
    try {
      return new LaneSizes(lanes.get(Lane.HIGH).size(), lanes.get(Lane.NORMAL).size(),
          lanes.get(Lane.LOW).size());
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    lock.lock();
    try {
      return size == 0;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Rejects further appends. Jobs already queued stay in place until drained.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every queued job, in drain order.
   *
   * @return the removed jobs
   */
  public List<Job> drain() {
    lock.lock();
    try {
      List<Job> drained = new ArrayList<>(size);
      Job job;
      while ((job = next()) != null) {
        drained.add(job);
      }
      return drained;
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock.
  private Job next() {
    if (size == 0) {
      return null;
    }
    ArrayDeque<Entry> source = agingThresholdNanos > 0L ? agedLane(System.nanoTime()) : null;
    if (source == null) {
      for (Lane lane : Lane.values()) {
        ArrayDeque<Entry> candidate = lanes.get(lane);
        if (!candidate.isEmpty()) {
          source = candidate;
          break;
        }
      }
    }
    size--;
    return source.pollFirst().job();
  }

  private ArrayDeque<Entry> agedLane(long now) {
    ArrayDeque<Entry> oldest = null;
    long oldestAppended = 0L;
    for (Lane lane : new Lane[] {Lane.NORMAL, Lane.LOW}) {
      ArrayDeque<Entry> candidate = lanes.get(lane);
      Entry head = candidate.peekFirst();
      if (head == null || now - head.appendedNanos() < agingThresholdNanos) {
        continue;
      }
      if (oldest == null || head.appendedNanos() - oldestAppended < 0L) {
        oldest = candidate;
        oldestAppended = head.appendedNanos();
      }
    }
    return oldest;
  }

  private record Entry(Job job, long appendedNanos) {
  }
}
