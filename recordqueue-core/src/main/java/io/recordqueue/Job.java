package io.recordqueue;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * A queued job: the producer's {@link JobData} plus the identity, tier and timing
 * assigned at enqueue time.
 *
 * <p>Identifiers are monotonic ULIDs, so they are unique within the process even when
 * many producers enqueue within the same millisecond. A retried job keeps its id; only
 * {@link #attempts()} changes.
 *
 * @param id         unique job identifier
 * @param data       the requested mutation
 * @param priority   tier requested by the producer
 * @param enqueuedAt time the job was first accepted
 * @param attempts   number of processing attempts already made (0 for a fresh job)
 */
public record Job(String id, JobData data, JobPriority priority, Instant enqueuedAt, int attempts) {

  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0, got: " + attempts);
    }
  }

  /**
   * Creates a fresh job with a newly generated identifier.
   *
   * @param data     the requested mutation
   * @param priority the requested tier
   * @return a new job with zero attempts
   */
  public static Job newJob(JobData data, JobPriority priority) {
    return new Job(newJobId(), data, priority, Instant.now(), 0);
  }

  /**
   * Generates a new job identifier.
   *
   * @return a monotonic ULID string
   */
  public static String newJobId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /** Raw action code of the underlying request. */
  public String action() {
    return data.action();
  }

  /**
   * Returns a copy of this job with the attempt counter incremented.
   *
   * @return the job for its next attempt
   */
  public Job withNextAttempt() {
    return new Job(id, data, priority, enqueuedAt, attempts + 1);
  }
}
