package io.recordqueue;

/**
 * Thrown by {@link io.recordqueue.spi.RecordStore#updateIfEditable} when the store's
 * eligibility rule rejects the write: the record is missing, owned by someone else,
 * deleted, or still inside its edit cooldown.
 *
 * <p>This is an expected business outcome, not a fault.
 */
public final class EditNotPermittedException extends RecordStoreException {
  private final String targetId;
  private final String ownerId;

  public EditNotPermittedException(String targetId, String ownerId) {
    super("Edit not permitted for record " + targetId + " by owner " + ownerId);
    this.targetId = targetId;
    this.ownerId = ownerId;
  }

  public String targetId() {
    return targetId;
  }

  public String ownerId() {
    return ownerId;
  }
}
