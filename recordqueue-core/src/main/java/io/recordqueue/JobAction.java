package io.recordqueue;

import java.util.Locale;
import java.util.Optional;

/**
 * Mutation a job applies to a record.
 *
 * <p>The action travels as a string code inside {@link JobData} so that producers
 * can hand over whatever they received; resolution happens when the job is processed.
 */
public enum JobAction {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete");

  private final String code;

  JobAction(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves an action code case-insensitively.
   *
   * @param code the action code, may be {@code null}
   * @return the matching action, or empty if the code is not recognized
   */
  public static Optional<JobAction> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (JobAction action : values()) {
      if (action.code.equals(normalized)) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }
}
