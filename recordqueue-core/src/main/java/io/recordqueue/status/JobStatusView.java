package io.recordqueue.status;

import io.recordqueue.JobPriority;

import java.time.Instant;

/**
 * Snapshot of a tracked job.
 *
 * @param jobId     job identifier
 * @param action    raw action code
 * @param priority  requested tier
 * @param status    current state
 * @param attempts  attempts made before the current state was entered
 * @param lastError last failure message, or {@code null}
 * @param updatedAt time of the last state change
 */
public record JobStatusView(
    String jobId,
    String action,
    JobPriority priority,
    JobStatus status,
    int attempts,
    String lastError,
    Instant updatedAt) {
}
