package io.recordqueue.dispatch;

import io.recordqueue.Job;
import io.recordqueue.queue.JobQueue;
import io.recordqueue.spi.MetricsExporter;
import io.recordqueue.status.JobStatus;
import io.recordqueue.status.JobStatusTracker;
import io.recordqueue.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Re-appends retried jobs to the {@link JobQueue} once their backoff delay has elapsed.
 *
 * <p>The scheduler thread is started lazily on the first retry. Jobs whose delay has not
 * elapsed when {@link #closeAndDrain()} is called are returned to the caller as dropped.
 * A job whose delay elapses after the queue was closed is marked
 * {@link JobStatus#DROPPED} here.
 *
 * <p>Scheduling and closing are serialized, so a job is either handed to the scheduler
 * thread or reported as not scheduled, never both.
 *
 * <p>This class is thread-safe.
 */
public final class RetryScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetryScheduler.class.getName());

  private final JobQueue jobQueue;
  private final JobStatusTracker statusTracker;
  private final MetricsExporter metrics;
  private final Map<String, Job> waiting = new ConcurrentHashMap<>();
  private ScheduledExecutorService executor;
  private boolean closed;

  public RetryScheduler(JobQueue jobQueue) {
    this(jobQueue, JobStatusTracker.NOOP, MetricsExporter.NOOP);
  }

  public RetryScheduler(JobQueue jobQueue, JobStatusTracker statusTracker, MetricsExporter metrics) {
    this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue");
    this.statusTracker = Objects.requireNonNull(statusTracker, "statusTracker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Schedules {@code job} to be re-appended after {@code delayMs}.
   *
   * @param job     the job for its next attempt
   * @param delayMs delay in milliseconds
   * @return {@code false} if the scheduler is closed and the job was not scheduled
   */
  public synchronized boolean schedule(Job job, long delayMs) {
    if (closed) {
      return false;
    }
    if (executor == null) {
      executor = Executors.newSingleThreadScheduledExecutor(
          new DaemonThreadFactory("recordqueue-retry-"));
    }
    waiting.put(job.id(), job);
    try {
      executor.schedule(() -> release(job), delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      waiting.remove(job.id());
      logger.warning("Retry rejected by scheduler: jobId=" + job.id() + ", action=" + job.action());
      return false;
    }
    return true;
  }

  private void release(Job job) {
    if (waiting.remove(job.id()) == null) {
      return;
    }
    if (!jobQueue.requeue(job)) {
      statusTracker.record(job, JobStatus.DROPPED, "queue closed before retry");
      metrics.incrementDropped(1);
      logger.warning("Retry dropped, queue closed: jobId=" + job.id() + ", action=" + job.action());
    }
  }

  /** Number of jobs waiting for their retry delay to elapse. */
  public int waitingCount() {
    return waiting.size();
  }

  /**
   * Stops the scheduler.
   *
   * @return jobs that were still waiting for their delay and will not be retried
   */
  public List<Job> closeAndDrain() {
    synchronized (this) {
      closed = true;
      if (executor != null) {
        executor.shutdownNow();
      }
    }
    List<Job> dropped = new ArrayList<>();
    for (String id : new ArrayList<>(waiting.keySet())) {
      Job job = waiting.remove(id);
      if (job != null) {
        dropped.add(job);
      }
    }
    return dropped;
  }

  @Override
  public void close() {
    closeAndDrain();
  }
}
