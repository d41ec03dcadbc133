package io.recordqueue.status;

/**
 * Lifecycle state of a job as seen by the {@link JobStatusTracker}.
 */
public enum JobStatus {
  /** Waiting in a lane. */
  PENDING,
  /** Owned by a worker. */
  PROCESSING,
  /** Failed transiently; will be re-appended to its lane after a delay. */
  RETRY_SCHEDULED,
  /** Applied to the record store. */
  SUCCEEDED,
  /** Failed terminally. */
  FAILED,
  /** Still queued when the pool shut down; never processed. */
  DROPPED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == DROPPED;
  }
}
