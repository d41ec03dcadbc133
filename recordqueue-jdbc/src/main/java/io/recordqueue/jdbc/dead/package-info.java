/**
 * Table-backed dead-letter sink.
 *
 * @see io.recordqueue.jdbc.dead.JdbcDeadLetterSink
 */
package io.recordqueue.jdbc.dead;
