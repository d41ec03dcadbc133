package io.recordqueue;

/**
 * Thrown when a job's action code does not name a known {@link JobAction}.
 */
public final class UnrecognizedActionException extends JobValidationException {
  private final String action;

  public UnrecognizedActionException(String action) {
    super("Unrecognized action: " + action);
    this.action = action;
  }

  public String action() {
    return action;
  }
}
