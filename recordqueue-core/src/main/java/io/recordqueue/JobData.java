package io.recordqueue;

import java.util.Objects;

/**
 * Immutable description of one requested record mutation, as handed to
 * {@link RecordQueue#enqueue(JobData, JobPriority)}.
 *
 * <p>Which of {@code targetId}, {@code payloadJson} and {@code context} are required
 * depends on the action:
 * <ul>
 *   <li>{@code create}: {@code payloadJson}</li>
 *   <li>{@code update}: {@code targetId} and {@code payloadJson}</li>
 *   <li>{@code delete}: {@code targetId} and {@code context.actingAdminId}</li>
 * </ul>
 *
 * <p>None of this is checked here. A malformed request is accepted by the queue and
 * rejected by the {@linkplain io.recordqueue.dispatch.JobProcessor processor} before
 * any store call is made.
 */
public final class JobData {
  private final String action;
  private final String ownerId;
  private final String targetId;
  private final String payloadJson;
  private final JobContext context;

  private JobData(Builder builder) {
    this.action = builder.action;
    this.ownerId = builder.ownerId;
    this.targetId = builder.targetId;
    this.payloadJson = builder.payloadJson;
    this.context = builder.context;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static JobData create(String ownerId, String payloadJson) {
    return builder().action(JobAction.CREATE).ownerId(ownerId).payloadJson(payloadJson).build();
  }

  public static JobData update(String ownerId, String targetId, String payloadJson) {
    return builder().action(JobAction.UPDATE).ownerId(ownerId)
        .targetId(targetId).payloadJson(payloadJson).build();
  }

  public static JobData delete(String ownerId, String targetId, JobContext context) {
    return builder().action(JobAction.DELETE).ownerId(ownerId)
        .targetId(targetId).context(context).build();
  }

  /** Raw action code; see {@link JobAction#fromCode(String)}. */
  public String action() {
    return action;
  }

  public String ownerId() {
    return ownerId;
  }

  public String targetId() {
    return targetId;
  }

  public String payloadJson() {
    return payloadJson;
  }

  public JobContext context() {
    return context;
  }

  @Override
  public String toString() {
    return "JobData{action=" + action + ", ownerId=" + ownerId + ", targetId=" + targetId
        + ", hasPayload=" + (payloadJson != null) + ", context=" + context + "}";
  }

  /** Builder for {@link JobData}. */
  public static final class Builder {
    private String action;
    private String ownerId;
    private String targetId;
    private String payloadJson;
    private JobContext context;

    private Builder() {
    }

    public Builder action(JobAction action) {
      this.action = Objects.requireNonNull(action, "action").code();
      return this;
    }

    /**
     * Sets the action from a raw code. Unknown codes are kept as-is and fail at
     * processing time.
     */
    public Builder action(String action) {
      this.action = action;
      return this;
    }

    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder targetId(String targetId) {
      this.targetId = targetId;
      return this;
    }

    public Builder payloadJson(String payloadJson) {
      this.payloadJson = payloadJson;
      return this;
    }

    public Builder context(JobContext context) {
      this.context = context;
      return this;
    }

    public JobData build() {
      return new JobData(this);
    }
  }
}
