/**
 * Micrometer bridge for queue metrics.
 *
 * @see io.recordqueue.micrometer.MicrometerMetricsExporter
 */
package io.recordqueue.micrometer;
