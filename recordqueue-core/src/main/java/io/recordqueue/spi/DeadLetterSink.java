package io.recordqueue.spi;

import io.recordqueue.dead.DeadJob;

/**
 * Destination for jobs whose failure was terminal.
 *
 * <p>Called from worker threads; implementations must be thread-safe. Exceptions thrown
 * by {@link #accept} are logged by the caller and otherwise ignored.
 *
 * @see io.recordqueue.dead.InMemoryDeadLetterSink
 */
@FunctionalInterface
public interface DeadLetterSink {

    /**
     * Sink that discards dead jobs. Failures are still logged and tracked.
     */
    DeadLetterSink NOOP = deadJob -> {
    };

    /**
     * Records a dead job.
     *
     * @param deadJob the failed job and its last error
     */
    void accept(DeadJob deadJob);
}
