package io.recordqueue;

import io.recordqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.recordqueue.dispatch.JobInterceptor;
import io.recordqueue.dispatch.JobProcessor;
import io.recordqueue.dispatch.RetryPolicy;
import io.recordqueue.dispatch.RetryScheduler;
import io.recordqueue.dispatch.WorkerPool;
import io.recordqueue.queue.JobQueue;
import io.recordqueue.queue.LaneSizes;
import io.recordqueue.queue.PriorityLanes;
import io.recordqueue.spi.DeadLetterSink;
import io.recordqueue.spi.MetricsExporter;
import io.recordqueue.spi.RecordStore;
import io.recordqueue.status.InMemoryJobStatusTracker;
import io.recordqueue.status.JobStatus;
import io.recordqueue.status.JobStatusTracker;
import io.recordqueue.status.JobStatusView;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link JobQueue}, {@link JobProcessor} and
 * {@link WorkerPool} around one {@link RecordStore}.
 *
 * <p>Producers call {@link #enqueue(JobData, JobPriority)} and get a job id back at once;
 * the pool applies the job later, in priority order. Each instance owns its own lanes and
 * workers, so several independent queues can live in one process.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (RecordQueue queue = RecordQueue.builder()
 *     .recordStore(JdbcRecordStore.builder().dataSource(dataSource).build())
 *     .workerCount(5)
 *     .build()) {
 *   queue.start();
 *   String jobId = queue.enqueue(JobData.create("user-1", "{\"name\":\"Ayla\"}"), JobPriority.NORMAL);
 *   queue.status(jobId).ifPresent(view -> System.out.println(view.status()));
 * }
 * }</pre>
 *
 * <p>On shutdown, jobs still waiting in a lane or for a retry are not processed: they are
 * marked {@link JobStatus#DROPPED} and logged.
 *
 * @see RecordQueue.Builder
 */
public final class RecordQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RecordQueue.class.getName());

  private final RecordStore recordStore;
  private final MetricsExporter metrics;
  private final JobStatusTracker statusTracker;
  private final JobQueue jobQueue;
  private final RetryScheduler retryScheduler;
  private final JobProcessor processor;
  private final WorkerPool pool;
  private final boolean closeStoreOnShutdown;
  private final Duration shutdownTimeout;

  private RecordQueue(Builder builder) {
    this.recordStore = Objects.requireNonNull(builder.recordStore, "recordStore");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.shutdownTimeout = Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");
    this.closeStoreOnShutdown = builder.closeStoreOnShutdown;
    if (builder.statusRetention < 0) {
      throw new IllegalArgumentException("statusRetention must be >= 0, got: " + builder.statusRetention);
    }
    this.statusTracker = builder.statusRetention == 0
        ? JobStatusTracker.NOOP : new InMemoryJobStatusTracker(builder.statusRetention);

    this.jobQueue = new JobQueue(new PriorityLanes(builder.agingThreshold), statusTracker, metrics);
    this.retryScheduler = new RetryScheduler(jobQueue, statusTracker, metrics);
    this.processor = JobProcessor.builder()
        .recordStore(recordStore)
        .statusTracker(statusTracker)
        .metrics(metrics)
        .deadLetterSink(builder.deadLetterSink)
        .retryPolicy(builder.retryPolicy)
        .retryScheduler(retryScheduler)
        .maxAttempts(builder.maxAttempts)
        .storeCallTimeout(builder.storeCallTimeout)
        .interceptors(builder.interceptors)
        .build();
    this.pool = WorkerPool.builder()
        .jobQueue(jobQueue)
        .processor(processor)
        .workerCount(builder.workerCount)
        .idleInterval(builder.idleInterval)
        .errorBackoff(builder.errorBackoff)
        .terminationHook(this::releaseResources)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Accepts a job and returns its identifier without waiting for it to be processed.
   *
   * <p>The job data is not validated here; a malformed job is accepted and fails during
   * processing.
   *
   * @param data     the requested mutation
   * @param priority the requested tier
   * @return the new job's identifier
   * @throws IllegalStateException if the queue has been shut down
   */
  public String enqueue(JobData data, JobPriority priority) {
    return jobQueue.enqueue(data, priority);
  }

  /**
   * Enqueues with {@link JobPriority#NORMAL}.
   *
   * @param data the requested mutation
   * @return the new job's identifier
   */
  public String enqueue(JobData data) {
    return enqueue(data, JobPriority.NORMAL);
  }

  /**
   * Starts the workers. Idempotent.
   *
   * @throws IllegalStateException if the queue has been shut down
   */
  public void start() {
    pool.start();
  }

  /**
   * Stops accepting jobs and asks the workers to stop. Returns at once.
   *
   * @return future completed once every worker has exited and resources are released;
   *     repeated calls return the same future
   */
  public CompletableFuture<Void> shutdown() {
    jobQueue.close();
    return pool.shutdown();
  }

  /**
   * Shuts down and waits up to the configured shutdown timeout for the workers to exit.
   */
  @Override
  public void close() {
    shutdown();
    try {
      if (!pool.awaitTermination(shutdownTimeout)) {
        logger.warning("Shutdown timeout exceeded after " + shutdownTimeout.toMillis()
            + " ms; active workers: " + pool.activeWorkers());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Looks up a job's latest state.
   *
   * @param jobId the identifier returned by {@code enqueue}
   * @return the snapshot, or empty if the job is unknown, evicted, or tracking is disabled
   */
  public Optional<JobStatusView> status(String jobId) {
    return statusTracker.find(jobId);
  }

  public LaneSizes queueSizes() {
    return jobQueue.sizes();
  }

  public boolean isRunning() {
    return pool.isRunning();
  }

  public int activeWorkers() {
    return pool.activeWorkers();
  }

  private void releaseResources() {
    List<Job> dropped = new ArrayList<>(jobQueue.drain());
    dropped.addAll(retryScheduler.closeAndDrain());
    for (Job job : dropped) {
      statusTracker.record(job, JobStatus.DROPPED, "queue shut down");
      logger.warning("Job dropped at shutdown: jobId=" + job.id() + ", action=" + job.action()
          + ", priority=" + job.priority());
    }
    if (!dropped.isEmpty()) {
      metrics.incrementDropped(dropped.size());
    }
    processor.close();
    if (closeStoreOnShutdown) {
      try {
        recordStore.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close record store", e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close metrics exporter", e);
      }
    }
  }

  /** Builder for {@link RecordQueue}. */
  public static final class Builder {
    private RecordStore recordStore;
    private int workerCount = 5;
    private Duration idleInterval = Duration.ofMillis(100);
    private Duration errorBackoff = Duration.ofSeconds(1);
    private int maxAttempts = 1;
    private RetryPolicy retryPolicy;
    private Duration storeCallTimeout;
    private Duration agingThreshold;
    private MetricsExporter metrics;
    private DeadLetterSink deadLetterSink;
    private int statusRetention = 10_000;
    private final List<JobInterceptor> interceptors = new ArrayList<>();
    private boolean closeStoreOnShutdown = true;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the store jobs are applied against.
     *
     * <p><b>Required.</b>
     *
     * @param recordStore the backing store
     * @return this builder
     */
    public Builder recordStore(RecordStore recordStore) {
      this.recordStore = recordStore;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5}.
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Optional. Defaults to 100 ms.
     *
     * @param idleInterval how long an idle worker waits for a job per loop
     * @return this builder
     */
    public Builder idleInterval(Duration idleInterval) {
      this.idleInterval = idleInterval;
      return this;
    }

    /**
     * Optional. Defaults to 1 s.
     *
     * @param errorBackoff pause after an unexpected worker loop error
     * @return this builder
     */
    public Builder errorBackoff(Duration errorBackoff) {
      this.errorBackoff = errorBackoff;
      return this;
    }

    /**
     * Sets the maximum attempts per job. Only transient store failures are retried.
     *
     * <p>Optional. Defaults to {@code 1}.
     *
     * @param maxAttempts maximum attempts per job
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} from 200 ms to 60 s.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to no timeout.
     *
     * @param storeCallTimeout maximum duration of one store call
     * @return this builder
     */
    public Builder storeCallTimeout(Duration storeCallTimeout) {
      this.storeCallTimeout = storeCallTimeout;
      return this;
    }

    /**
     * Enables aging: a normal or low job that has waited at least this long is served
     * before the high lane.
     *
     * <p>Optional. Defaults to strict priority.
     *
     * @param agingThreshold minimum wait before promotion
     * @return this builder
     */
    public Builder agingThreshold(Duration agingThreshold) {
      this.agingThreshold = agingThreshold;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed at shutdown if it is
     * {@link AutoCloseable}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link DeadLetterSink#NOOP}.
     *
     * @param deadLetterSink destination for terminally failed jobs
     * @return this builder
     */
    public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
      this.deadLetterSink = deadLetterSink;
      return this;
    }

    /**
     * Sets how many job states {@link RecordQueue#status(String)} remembers. {@code 0}
     * disables tracking.
     *
     * <p>Optional. Defaults to {@code 10000}.
     *
     * @param statusRetention maximum tracked jobs
     * @return this builder
     */
    public Builder statusRetention(int statusRetention) {
      this.statusRetention = statusRetention;
      return this;
    }

    public Builder interceptor(JobInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<JobInterceptor> interceptors) {
      for (JobInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Whether the record store is closed after the workers exit.
     *
     * <p>Optional. Defaults to {@code true}. Set to {@code false} when the store's
     * connections are owned by someone else, such as a Spring context.
     *
     * @param closeStoreOnShutdown whether to close the store
     * @return this builder
     */
    public Builder closeStoreOnShutdown(boolean closeStoreOnShutdown) {
      this.closeStoreOnShutdown = closeStoreOnShutdown;
      return this;
    }

    /**
     * Optional. Defaults to 30 s.
     *
     * @param shutdownTimeout how long {@link RecordQueue#close()} waits for workers
     * @return this builder
     */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * Builds the queue. Workers are not started until {@link RecordQueue#start()}.
     *
     * @return a new queue
     * @throws IllegalStateException if build() was already called
     */
    public RecordQueue build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new RecordQueue(this);
    }
  }
}
