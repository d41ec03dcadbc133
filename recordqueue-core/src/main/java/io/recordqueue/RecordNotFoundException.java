package io.recordqueue;

/**
 * Thrown when a store operation targets a record that does not exist.
 */
public final class RecordNotFoundException extends RecordStoreException {
  private final String targetId;

  public RecordNotFoundException(String targetId) {
    super("Record not found: " + targetId);
    this.targetId = targetId;
  }

  public String targetId() {
    return targetId;
  }
}
