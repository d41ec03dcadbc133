/**
 * Extension points: the {@link io.recordqueue.spi.RecordStore} jobs are applied to,
 * the {@link io.recordqueue.spi.DeadLetterSink} terminal failures go to, and the
 * {@link io.recordqueue.spi.MetricsExporter} for counters and gauges.
 */
package io.recordqueue.spi;
