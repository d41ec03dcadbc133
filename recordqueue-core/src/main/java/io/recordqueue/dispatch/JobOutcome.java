package io.recordqueue.dispatch;

import io.recordqueue.StoredRecord;

import java.util.Objects;

/**
 * Result of one processing attempt, as returned by {@link JobProcessor#process}.
 *
 * <ul>
 *   <li>{@link Succeeded}: the store call completed.</li>
 *   <li>{@link Failed}: the job failed terminally and was handed to the dead-letter sink.</li>
 *   <li>{@link RetryScheduled}: the attempt failed transiently; the job will be
 *       re-appended to its lane after {@code delayMs}.</li>
 * </ul>
 */
public sealed interface JobOutcome
    permits JobOutcome.Succeeded, JobOutcome.Failed, JobOutcome.RetryScheduled {

  /**
   * @param record the stored record for {@code create} and {@code update}; {@code null} for
   *               {@code delete}
   */
  record Succeeded(StoredRecord record) implements JobOutcome {
  }

  record Failed(Throwable error) implements JobOutcome {
    public Failed {
      Objects.requireNonNull(error, "error");
    }
  }

  record RetryScheduled(Exception error, long delayMs) implements JobOutcome {
    public RetryScheduled {
      Objects.requireNonNull(error, "error");
      if (delayMs < 0) {
        throw new IllegalArgumentException("delayMs must not be negative");
      }
    }
  }
}
