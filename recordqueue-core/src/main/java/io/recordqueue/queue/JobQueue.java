package io.recordqueue.queue;

import io.recordqueue.Job;
import io.recordqueue.JobData;
import io.recordqueue.JobPriority;
import io.recordqueue.spi.MetricsExporter;
import io.recordqueue.status.JobStatus;
import io.recordqueue.status.JobStatusTracker;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enqueue/dequeue API over the {@link PriorityLanes}.
 *
 * <p>{@link #enqueue} assigns an identifier, routes the job by priority and returns at
 * once; it never inspects the job data. {@link #dequeue()} pops in strict priority order
 * (high, normal, low), FIFO within a lane.
 *
 * <p>This class is thread-safe.
 */
public final class JobQueue {
  private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

  private final PriorityLanes lanes;
  private final JobStatusTracker statusTracker;
  private final MetricsExporter metrics;

  public JobQueue() {
    this(new PriorityLanes(), JobStatusTracker.NOOP, MetricsExporter.NOOP);
  }

  public JobQueue(PriorityLanes lanes, JobStatusTracker statusTracker, MetricsExporter metrics) {
    this.lanes = Objects.requireNonNull(lanes, "lanes");
    this.statusTracker = Objects.requireNonNull(statusTracker, "statusTracker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Accepts a job and returns its identifier without waiting for processing.
   *
   * @param data     the requested mutation (not validated here)
   * @param priority the requested tier
   * @return the new job's identifier
   * @throws IllegalStateException if the queue has been closed
   */
  public String enqueue(JobData data, JobPriority priority) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(priority, "priority");
    Job job = Job.newJob(data, priority);
    Lane lane = lanes.append(job);
    afterAppend(job, lane, true);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Job queued: jobId=" + job.id() + ", action=" + job.action()
          + ", priority=" + priority + ", lane=" + lane + ", sizes=" + lanes.sizes());
    }
    return job.id();
  }

  /**
   * Pops the next job in priority order without waiting.
   *
   * @return the next job, or empty if every lane is empty
   */
  public Optional<Job> dequeue() {
    Job job = lanes.poll();
    if (job != null) {
      recordDepths();
    }
    return Optional.ofNullable(job);
  }

  /**
   * Pops the next job in priority order, waiting up to {@code timeout} for one.
   *
   * @param timeout maximum wait
   * @return the next job, or empty if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<Job> dequeue(Duration timeout) throws InterruptedException {
    Job job = lanes.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (job != null) {
      recordDepths();
    }
    return Optional.ofNullable(job);
  }

  /**
   * Re-appends a job that is being retried. Keeps the job's identifier.
   *
   * @param job the job for its next attempt
   * @return {@code false} if the queue has been closed and the job was not accepted
   */
  public boolean requeue(Job job) {
    Lane lane;
    try {
      lane = lanes.append(job);
    } catch (IllegalStateException e) {
      return false;
    }
    afterAppend(job, lane, false);
    return true;
  }

  public LaneSizes sizes() {
    return lanes.sizes();
  }

  /**
   * Stops accepting new jobs. Queued jobs are left in place; see {@link #drain()}.
   */
  public void close() {
    lanes.close();
  }

  public boolean isClosed() {
    return lanes.isClosed();
  }

  /**
   * Removes and returns every job still queued.
   *
   * @return the removed jobs, in drain order
   */
  public List<Job> drain() {
    List<Job> drained = lanes.drain();
    recordDepths();
    return drained;
  }

  // The job is already in its lane here; a failing tracker or exporter must not undo that.
  private void afterAppend(Job job, Lane lane, boolean pending) {
    try {
      if (pending) {
        statusTracker.record(job, JobStatus.PENDING, null);
      }
      metrics.incrementEnqueued(lane);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Post-enqueue bookkeeping failed: jobId=" + job.id(), e);
    }
    recordDepths();
  }

  private void recordDepths() {
    try {
      LaneSizes sizes = lanes.sizes();
      metrics.recordLaneDepths(sizes.high(), sizes.normal(), sizes.low());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Recording lane depths failed", e);
    }
  }
}
