package io.recordqueue;

/**
 * Unchecked exception for failures reported by a {@link io.recordqueue.spi.RecordStore}.
 *
 * <p>A transient failure (lost connection, serialization conflict, timeout) may succeed
 * when tried again and is eligible for retry when the queue is configured with more than
 * one attempt. Everything else is terminal for the job.
 */
public class RecordStoreException extends RuntimeException {
  private final boolean transientFailure;

  public RecordStoreException(String message) {
    this(message, null, false);
  }

  public RecordStoreException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public RecordStoreException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  /**
   * Returns {@code true} if the same call could succeed on a later attempt.
   *
   * @return whether the failure is transient
   */
  public boolean isTransient() {
    return transientFailure;
  }
}
