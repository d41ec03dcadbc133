package io.recordqueue.dispatch;

import io.recordqueue.Job;
import io.recordqueue.queue.JobQueue;
import io.recordqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size pool of worker threads draining a {@link JobQueue}.
 *
 * <p>Each worker loops until shutdown is requested: take the next job in priority order,
 * waiting at most the idle interval for one, and hand it to the {@link JobProcessor}.
 * An unexpected error in the loop itself is logged and the worker backs off for the
 * error backoff before resuming. A thread interrupt that arrives while no shutdown is
 * pending is logged and cleared; only the stop signal ends a worker.
 *
 * <p>Shutdown is cooperative. {@link #shutdown()} raises the stop signal and returns a
 * future that completes once every loop has exited and the termination hook has run.
 * A job a worker is processing when the signal is raised runs to completion.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class WorkerPool {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  private final JobQueue jobQueue;
  private final JobProcessor processor;
  private final int workerCount;
  private final Duration idleInterval;
  private final Duration errorBackoff;
  private final Runnable terminationHook;
  private final DaemonThreadFactory threadFactory = new DaemonThreadFactory("recordqueue-worker-");
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicInteger activeWorkers = new AtomicInteger();
  private final List<Thread> workers = new ArrayList<>();

  private boolean started;
  private CompletableFuture<Void> termination;

  private WorkerPool(Builder builder) {
    this.jobQueue = Objects.requireNonNull(builder.jobQueue, "jobQueue");
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    this.idleInterval = Objects.requireNonNull(builder.idleInterval, "idleInterval");
    this.errorBackoff = Objects.requireNonNull(builder.errorBackoff, "errorBackoff");
    this.terminationHook = builder.terminationHook != null ? builder.terminationHook : () -> { };
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1, got: " + builder.workerCount);
    }
    if (idleInterval.isNegative() || idleInterval.isZero()) {
      throw new IllegalArgumentException("idleInterval must be positive, got: " + idleInterval);
    }
    if (errorBackoff.isNegative()) {
      throw new IllegalArgumentException("errorBackoff must not be negative, got: " + errorBackoff);
    }
    this.workerCount = builder.workerCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts all workers. Calling it again while running has no effect.
   *
   * @throws IllegalStateException if the pool has been shut down
   */
  public synchronized void start() {
    if (termination != null) {
      throw new IllegalStateException("Worker pool has been shut down");
    }
    if (started) {
      return;
    }
    started = true;
    for (int i = 0; i < workerCount; i++) {
      Thread worker = threadFactory.newThread(this::workerLoop);
      workers.add(worker);
      activeWorkers.incrementAndGet();
    }
    for (Thread worker : workers) {
      worker.start();
    }
    logger.info("Worker pool started: workers=" + workerCount
        + ", idleIntervalMs=" + idleInterval.toMillis());
  }

  /**
   * Requests shutdown. Returns at once; the future completes after every worker loop has
   * exited and the termination hook has run. Calling it again returns the same future.
   *
   * @return future completed when the pool has fully stopped
   */
  public synchronized CompletableFuture<Void> shutdown() {
    if (termination != null) {
      return termination;
    }
    termination = new CompletableFuture<>();
    stopSignal.countDown();
    List<Thread> toJoin = new ArrayList<>(workers);
    CompletableFuture<Void> future = termination;
    Thread waiter = new Thread(() -> awaitWorkersAndTerminate(toJoin, future), "recordqueue-shutdown");
    waiter.setDaemon(true);
    waiter.start();
    return termination;
  }

  private void awaitWorkersAndTerminate(List<Thread> toJoin, CompletableFuture<Void> future) {
    try {
      for (Thread worker : toJoin) {
        worker.join();
      }
      terminationHook.run();
      logger.info("Worker pool stopped");
      future.complete(null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.completeExceptionally(e);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Worker pool termination hook failed", t);
      future.completeExceptionally(t);
    }
  }

  /**
   * Waits for a requested shutdown to finish.
   *
   * @param timeout maximum wait
   * @return {@code true} if the pool has stopped, {@code false} on timeout or if
   *     shutdown was never requested
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    CompletableFuture<Void> future;
    synchronized (this) {
      future = termination;
    }
    if (future == null) {
      return false;
    }
    try {
      future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      // Workers have exited; only the hook failed and it was logged.
      return true;
    }
  }

  /** Returns {@code true} between {@link #start()} and {@link #shutdown()}. */
  public synchronized boolean isRunning() {
    return started && termination == null;
  }

  /** Number of worker loops that have not exited yet. */
  public int activeWorkers() {
    return activeWorkers.get();
  }

  public int workerCount() {
    return workerCount;
  }

  private void workerLoop() {
    String name = Thread.currentThread().getName();
    try {
      while (stopSignal.getCount() > 0) {
        try {
          Optional<Job> job = jobQueue.dequeue(idleInterval);
          if (job.isPresent()) {
            processor.process(job.get());
          }
        } catch (InterruptedException e) {
          if (stopSignal.getCount() == 0) {
            Thread.currentThread().interrupt();
            break;
          }
          logger.warning("Worker " + name
              + " interrupted outside shutdown, clearing flag and continuing");
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Worker loop error in " + name
              + ", resuming in " + errorBackoff.toMillis() + " ms", t);
          if (backOff()) {
            break;
          }
        }
      }
    } finally {
      activeWorkers.decrementAndGet();
    }
  }

  // Returns true if the worker should exit. Only the stop signal ends a worker.
  private boolean backOff() {
    try {
      return stopSignal.await(errorBackoff.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      if (stopSignal.getCount() == 0) {
        Thread.currentThread().interrupt();
        return true;
      }
      return false;
    }
  }

  /** Builder for {@link WorkerPool}. */
  public static final class Builder {
    private JobQueue jobQueue;
    private JobProcessor processor;
    private int workerCount = 5;
    private Duration idleInterval = Duration.ofMillis(100);
    private Duration errorBackoff = Duration.ofSeconds(1);
    private Runnable terminationHook;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param jobQueue the queue workers drain
     * @return this builder
     */
    public Builder jobQueue(JobQueue jobQueue) {
      this.jobQueue = jobQueue;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param processor processes each dequeued job
     * @return this builder
     */
    public Builder processor(JobProcessor processor) {
      this.processor = processor;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long an idle worker waits for a job before checking the stop signal again.
     *
     * <p>Optional. Defaults to 100 ms.
     *
     * @param idleInterval idle wait bound
     * @return this builder
     */
    public Builder idleInterval(Duration idleInterval) {
      this.idleInterval = idleInterval;
      return this;
    }

    /**
     * Sets how long a worker pauses after an unexpected loop error.
     *
     * <p>Optional. Defaults to 1 s.
     *
     * @param errorBackoff pause after a loop error
     * @return this builder
     */
    public Builder errorBackoff(Duration errorBackoff) {
      this.errorBackoff = errorBackoff;
      return this;
    }

    /**
     * Sets an action run once, after every worker has exited and before the shutdown
     * future completes.
     *
     * @param terminationHook the action
     * @return this builder
     */
    public Builder terminationHook(Runnable terminationHook) {
      this.terminationHook = terminationHook;
      return this;
    }

    public WorkerPool build() {
      return new WorkerPool(this);
    }
  }
}
