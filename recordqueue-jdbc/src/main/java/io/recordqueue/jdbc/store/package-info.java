/**
 * Database-specific record store SQL (H2, PostgreSQL), discovered via
 * {@link java.util.ServiceLoader}.
 *
 * @see io.recordqueue.jdbc.store.AbstractJdbcRecordStore
 * @see io.recordqueue.jdbc.store.JdbcRecordStores
 */
package io.recordqueue.jdbc.store;
