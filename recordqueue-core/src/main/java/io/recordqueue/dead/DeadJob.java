package io.recordqueue.dead;

import io.recordqueue.Job;

import java.time.Instant;
import java.util.Objects;

/**
 * A job whose processing failed terminally, with the error that ended it.
 *
 * @param job       the job as of its last attempt
 * @param errorType simple class name of the final exception
 * @param error     message of the final exception (may be {@code null})
 * @param failedAt  time the job was given up
 */
public record DeadJob(Job job, String errorType, String error, Instant failedAt) {

  public DeadJob {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(errorType, "errorType");
    Objects.requireNonNull(failedAt, "failedAt");
  }

  public static DeadJob of(Job job, Throwable failure) {
    return new DeadJob(job, failure.getClass().getSimpleName(), failure.getMessage(), Instant.now());
  }
}
