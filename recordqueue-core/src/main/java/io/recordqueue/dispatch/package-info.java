/**
 * Worker pool, job processing and retries.
 *
 * <p>{@link io.recordqueue.dispatch.WorkerPool} runs a fixed number of worker threads that
 * drain the {@link io.recordqueue.queue.JobQueue}. Each job goes through
 * {@link io.recordqueue.dispatch.JobProcessor}, which validates it, applies it against the
 * record store and reports a {@link io.recordqueue.dispatch.JobOutcome}. Transient store
 * failures can be retried with exponential backoff.
 *
 * @see io.recordqueue.dispatch.WorkerPool
 * @see io.recordqueue.dispatch.JobProcessor
 * @see io.recordqueue.dispatch.RetryPolicy
 * @see io.recordqueue.dispatch.JobInterceptor
 */
package io.recordqueue.dispatch;
