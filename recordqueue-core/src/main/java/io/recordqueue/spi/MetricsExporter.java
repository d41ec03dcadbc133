package io.recordqueue.spi;

import io.recordqueue.queue.Lane;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge
 * into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of jobs appended to {@code lane}.
     *
     * @param lane the lane the job was routed to
     */
    void incrementEnqueued(Lane lane);

    /**
     * Increments the count of jobs applied successfully.
     */
    void incrementSucceeded();

    /**
     * Increments the count of jobs that failed terminally.
     */
    void incrementFailed();

    /**
     * Increments the count of failed attempts that were scheduled for retry.
     */
    default void incrementRetried() {
    }

    /**
     * Adds the number of jobs left in the lanes when the pool stopped.
     *
     * @param count dropped job count
     */
    default void incrementDropped(int count) {
    }

    /**
     * Records the current depth of each lane.
     *
     * @param high   jobs in the high lane
     * @param normal jobs in the normal lane
     * @param low    jobs in the low lane
     */
    void recordLaneDepths(int high, int normal, int low);

    /**
     * Records how long a job waited in its lane before a worker picked it up.
     *
     * @param waitMs wait time in milliseconds (always non-negative)
     */
    default void recordWaitMs(long waitMs) {
    }

    /**
     * Records the time spent processing one job, store call included.
     *
     * @param durationMs processing time in milliseconds (always non-negative)
     */
    default void recordProcessingMs(long durationMs) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued(Lane lane) {
        }

        @Override
        public void incrementSucceeded() {
        }

        @Override
        public void incrementFailed() {
        }

        @Override
        public void recordLaneDepths(int high, int normal, int low) {
        }
    }
}
