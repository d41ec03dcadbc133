package io.recordqueue;

import java.time.Duration;

/**
 * Thrown when a store call exceeds the configured per-call timeout. Always transient.
 */
public final class StoreTimeoutException extends RecordStoreException {
  public StoreTimeoutException(String operation, Duration timeout) {
    super("Store call " + operation + " timed out after " + timeout.toMillis() + " ms", null, true);
  }
}
