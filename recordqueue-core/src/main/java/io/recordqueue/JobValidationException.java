package io.recordqueue;

/**
 * Thrown when a job is missing a field its action requires.
 *
 * <p>Raised by the processor before any store call, so a job failing validation has
 * had no effect on stored records. Never retried.
 */
public class JobValidationException extends RuntimeException {
  public JobValidationException(String message) {
    super(message);
  }
}
