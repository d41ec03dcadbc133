package io.recordqueue.dispatch;

import io.recordqueue.EditNotPermittedException;
import io.recordqueue.Job;
import io.recordqueue.JobAction;
import io.recordqueue.JobContext;
import io.recordqueue.JobData;
import io.recordqueue.JobValidationException;
import io.recordqueue.RecordNotFoundException;
import io.recordqueue.RecordStoreException;
import io.recordqueue.StoreTimeoutException;
import io.recordqueue.StoredRecord;
import io.recordqueue.UnrecognizedActionException;
import io.recordqueue.dead.DeadJob;
import io.recordqueue.spi.DeadLetterSink;
import io.recordqueue.spi.MetricsExporter;
import io.recordqueue.spi.RecordStore;
import io.recordqueue.status.JobStatus;
import io.recordqueue.status.JobStatusTracker;
import io.recordqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates a job and applies it against the {@link RecordStore}.
 *
 * <p>Each call to {@link #process(Job)} is one attempt. Validation runs first; a job that
 * is missing a field its action requires never reaches the store. Every exception is
 * caught here and turned into a {@link JobOutcome}, so a failing job can never take a
 * worker down with it.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>validation errors, eligibility rejections and permanent store errors are
 *       terminal: the job is marked {@link JobStatus#FAILED} and handed to the
 *       {@link DeadLetterSink}</li>
 *   <li>a transient {@link RecordStoreException} is retried through the
 *       {@link RetryScheduler} while attempts remain</li>
 * </ul>
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class JobProcessor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobProcessor.class.getName());

  private final RecordStore recordStore;
  private final JobStatusTracker statusTracker;
  private final MetricsExporter metrics;
  private final DeadLetterSink deadLetterSink;
  private final RetryPolicy retryPolicy;
  private final RetryScheduler retryScheduler;
  private final int maxAttempts;
  private final Duration storeCallTimeout;
  private final ExecutorService storeExecutor;
  private final List<JobInterceptor> interceptors;

  private JobProcessor(Builder builder) {
    this.recordStore = Objects.requireNonNull(builder.recordStore, "recordStore");
    this.statusTracker = builder.statusTracker != null ? builder.statusTracker : JobStatusTracker.NOOP;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.deadLetterSink = builder.deadLetterSink != null ? builder.deadLetterSink : DeadLetterSink.NOOP;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(200, 60_000);
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    if (builder.maxAttempts > 1 && builder.retryScheduler == null) {
      throw new IllegalArgumentException("retryScheduler is required when maxAttempts > 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.retryScheduler = builder.retryScheduler;

    Duration timeout = builder.storeCallTimeout;
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("storeCallTimeout must be positive, got: " + timeout);
    }
    this.storeCallTimeout = timeout;
    this.storeExecutor = timeout == null
        ? null : Executors.newCachedThreadPool(new DaemonThreadFactory("recordqueue-store-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one attempt of {@code job}. Every failure, errors included, is recorded and
   * routed like any other; only a {@link VirtualMachineError} is rethrown afterwards.
   *
   * @param job the dequeued job
   * @return what happened to the job
   */
  public JobOutcome process(Job job) {
    long startNanos = System.nanoTime();
    metrics.recordWaitMs(Math.max(0L, Duration.between(job.enqueuedAt(), Instant.now()).toMillis()));
    statusTracker.record(job, JobStatus.PROCESSING, null);
    Job attempted = job.withNextAttempt();
    try {
      StoredRecord record = runWithInterceptors(job);
      statusTracker.record(attempted, JobStatus.SUCCEEDED, null);
      metrics.incrementSucceeded();
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Job succeeded: jobId=" + job.id() + ", action=" + job.action()
            + ", priority=" + job.priority() + ", attempt=" + attempted.attempts()
            + (record != null ? ", recordId=" + record.id() : ""));
      }
      return new JobOutcome.Succeeded(record);
    } catch (Throwable t) {
      JobOutcome outcome = handleFailure(attempted, t);
      if (t instanceof VirtualMachineError) {
        throw (VirtualMachineError) t;
      }
      return outcome;
    } finally {
      metrics.recordProcessingMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }
  }

  private StoredRecord runWithInterceptors(Job job) throws Exception {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeProcess(job);
        completedBefore = i + 1;
      }
      StoredRecord record = apply(job);
      runAfterProcess(job, null, completedBefore);
      return record;
    } catch (Throwable t) {
      runAfterProcess(job, t, completedBefore);
      throw t;
    }
  }

  private void runAfterProcess(Job job, Throwable error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterProcess(job, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterProcess failed: jobId=" + job.id(), ex);
      }
    }
  }

  private StoredRecord apply(Job job) {
    JobData data = job.data();
    JobAction action = JobAction.fromCode(data.action())
        .orElseThrow(() -> new UnrecognizedActionException(data.action()));
    switch (action) {
      case CREATE:
        require(data.ownerId(), "ownerId", action);
        require(data.payloadJson(), "payload", action);
        return callStore("create", () -> recordStore.create(data.ownerId(), data.payloadJson()));
      case UPDATE:
        require(data.ownerId(), "ownerId", action);
        require(data.targetId(), "targetId", action);
        require(data.payloadJson(), "payload", action);
        return callStore("updateIfEditable", () ->
            recordStore.updateIfEditable(data.targetId(), data.ownerId(), data.payloadJson()));
      case DELETE:
        require(data.targetId(), "targetId", action);
        JobContext context = data.context();
        require(context == null ? null : context.actingAdminId(), "context.actingAdminId", action);
        callStore("softDelete", () -> {
          recordStore.softDelete(data.targetId(), context.actingAdminId());
          return null;
        });
        return null;
      default:
        throw new UnrecognizedActionException(data.action());
    }
  }

  private static void require(String value, String field, JobAction action) {
    if (value == null || value.isBlank()) {
      throw new JobValidationException(field + " is required for " + action.code());
    }
  }

  private StoredRecord callStore(String operation, Callable<StoredRecord> call) {
    if (storeExecutor == null) {
      try {
        return call.call();
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new RecordStoreException("Store call " + operation + " failed", e);
      }
    }
    Future<StoredRecord> future = storeExecutor.submit(call);
    try {
      return future.get(storeCallTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new StoreTimeoutException(operation, storeCallTimeout);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new RecordStoreException("Interrupted waiting for store call " + operation, e, true);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new RecordStoreException("Store call " + operation + " failed", cause);
    }
  }

  private JobOutcome handleFailure(Job attempted, Throwable failure) {
    String error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();

    if (isRetryable(failure) && attempted.attempts() < maxAttempts) {
      long delayMs = retryPolicy.computeDelayMs(attempted.attempts());
      if (retryScheduler.schedule(attempted, delayMs)) {
        statusTracker.record(attempted, JobStatus.RETRY_SCHEDULED, error);
        metrics.incrementRetried();
        logger.log(Level.WARNING, "Job attempt failed, retry in " + delayMs + " ms: jobId="
            + attempted.id() + ", action=" + attempted.action() + ", attempt=" + attempted.attempts()
            + "/" + maxAttempts + ", error=" + error);
        return new JobOutcome.RetryScheduled((RecordStoreException) failure, delayMs);
      }
    }

    statusTracker.record(attempted, JobStatus.FAILED, error);
    metrics.incrementFailed();
    logFailure(attempted, failure, error);
    try {
      deadLetterSink.accept(DeadJob.of(attempted, failure));
    } catch (Exception sinkError) {
      logger.log(Level.SEVERE, "Dead-letter sink failed: jobId=" + attempted.id()
          + ", action=" + attempted.action(), sinkError);
    }
    return new JobOutcome.Failed(failure);
  }

  private static boolean isRetryable(Throwable failure) {
    return failure instanceof RecordStoreException && ((RecordStoreException) failure).isTransient();
  }

  private static void logFailure(Job job, Throwable failure, String error) {
    String context = "jobId=" + job.id() + ", action=" + job.action() + ", ownerId="
        + job.data().ownerId() + ", targetId=" + job.data().targetId();
    if (failure instanceof EditNotPermittedException) {
      logger.warning("Update rejected, record not editable: " + context);
    } else if (failure instanceof JobValidationException) {
      logger.warning("Job failed validation: " + context + ", error=" + error);
    } else if (failure instanceof RecordNotFoundException) {
      logger.warning("Job target not found: " + context);
    } else {
      logger.log(failure instanceof Error ? Level.SEVERE : Level.WARNING,
          "Job failed: " + context + ", attempts=" + job.attempts(), failure);
    }
  }

  /**
   * Stops the store-call executor, if one was configured. Calls still running are
   * interrupted.
   */
  @Override
  public void close() {
    if (storeExecutor != null) {
      storeExecutor.shutdownNow();
    }
  }

  /** Builder for {@link JobProcessor}. */
  public static final class Builder {
    private RecordStore recordStore;
    private JobStatusTracker statusTracker;
    private MetricsExporter metrics;
    private DeadLetterSink deadLetterSink;
    private RetryPolicy retryPolicy;
    private RetryScheduler retryScheduler;
    private int maxAttempts = 1;
    private Duration storeCallTimeout;
    private final List<JobInterceptor> interceptors = new ArrayList<>();

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
     * Optional. Defaults to {@link JobStatusTracker#NOOP}.
     *
     * @param statusTracker the tracker receiving state changes
     * @return this builder
     */
    public Builder statusTracker(JobStatusTracker statusTracker) {
      this.statusTracker = statusTracker;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
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
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=200} and {@code maxDelayMs=60000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the scheduler that re-appends retried jobs. Required when
     * {@code maxAttempts > 1}.
     *
     * @param retryScheduler the retry scheduler
     * @return this builder
     */
    public Builder retryScheduler(RetryScheduler retryScheduler) {
      this.retryScheduler = retryScheduler;
      return this;
    }

    /**
     * Sets the maximum number of attempts per job. Only transient store failures are
     * retried.
     *
     * <p>Optional. Defaults to {@code 1} (no retries). Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts per job
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Bounds each store call. A call that takes longer fails the attempt with a
     * {@link StoreTimeoutException}.
     *
     * <p>Optional. Defaults to no timeout.
     *
     * @param storeCallTimeout maximum duration of one store call
     * @return this builder
     */
    public Builder storeCallTimeout(Duration storeCallTimeout) {
      this.storeCallTimeout = storeCallTimeout;
      return this;
    }

    /**
     * Adds an interceptor. Interceptors run in registration order before processing and
     * in reverse order after.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
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

    public JobProcessor build() {
      return new JobProcessor(this);
    }
  }
}
