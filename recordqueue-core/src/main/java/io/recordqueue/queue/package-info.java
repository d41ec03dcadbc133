/**
 * Priority lanes and the enqueue/dequeue API over them.
 *
 * <p>{@link io.recordqueue.queue.JobQueue} routes {@code HIGH} and {@code CRITICAL} jobs
 * to the high lane, {@code NORMAL} to the normal lane and {@code LOW} to the low lane,
 * and always serves the highest non-empty lane first.
 */
package io.recordqueue.queue;
