package io.recordqueue.status;

import io.recordqueue.Job;

import java.util.Optional;

/**
 * Records job state changes so that callers can look a job up after {@code enqueue}
 * returned.
 *
 * <p>Implementations must be thread-safe and must never let a {@link JobStatus#PENDING}
 * update overwrite a later state: the producer records {@code PENDING} after the job is
 * already visible to workers.
 *
 * @see InMemoryJobStatusTracker
 */
public interface JobStatusTracker {

    /**
     * Tracker that records nothing; {@link #find} is always empty.
     */
    JobStatusTracker NOOP = new JobStatusTracker() {
        @Override
        public void record(Job job, JobStatus status, String error) {
        }

        @Override
        public Optional<JobStatusView> find(String jobId) {
            return Optional.empty();
        }
    };

    /**
     * Records a state change.
     *
     * @param job    the job, as of the attempt the state refers to
     * @param status the new state
     * @param error  failure message for failure states, otherwise {@code null}
     */
    void record(Job job, JobStatus status, String error);

    /**
     * Looks up a job.
     *
     * @param jobId the job identifier
     * @return the latest snapshot, or empty if unknown or evicted
     */
    Optional<JobStatusView> find(String jobId);
}
