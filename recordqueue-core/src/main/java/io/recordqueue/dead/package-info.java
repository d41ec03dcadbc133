/**
 * Jobs whose failure was terminal.
 *
 * @see io.recordqueue.spi.DeadLetterSink
 */
package io.recordqueue.dead;
