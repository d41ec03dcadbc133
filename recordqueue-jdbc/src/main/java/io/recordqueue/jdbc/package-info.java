/**
 * JDBC persistence for record-queue.
 *
 * <p>{@link io.recordqueue.jdbc.JdbcRecordStore} implements the core
 * {@link io.recordqueue.spi.RecordStore} over a {@code record} table, with the SQL
 * dialect chosen from the JDBC URL. {@link io.recordqueue.jdbc.dead.JdbcDeadLetterSink}
 * persists terminally failed jobs. Table definitions ship under {@code schema/}.
 *
 * @see io.recordqueue.jdbc.JdbcRecordStore
 * @see io.recordqueue.jdbc.store.JdbcRecordStores
 * @see io.recordqueue.jdbc.JdbcTemplate
 */
package io.recordqueue.jdbc;
