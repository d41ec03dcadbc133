package io.recordqueue.jdbc.store;

import io.recordqueue.StoredRecord;
import io.recordqueue.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL record store.
 *
 * <p>Uses {@code RETURNING} so that a conditional update and the read of the updated row
 * are one round trip.
 */
public final class PostgresRecordStore extends AbstractJdbcRecordStore {

  public PostgresRecordStore() {
    super();
  }

  public PostgresRecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcRecordStore withTableName(String tableName) {
    return new PostgresRecordStore(tableName);
  }

  @Override
  public Optional<StoredRecord> updateIfEditable(Connection conn, String targetId, String ownerId,
      String payload, Instant now, Instant editableBefore) {
    String sql = "UPDATE " + tableName() +
        " SET payload=?, last_edited_at=?, is_edited=TRUE" +
        " WHERE id=? AND owner_id=? AND is_deleted=FALSE" +
        " AND (last_edited_at IS NULL OR last_edited_at <= ?)" +
        " RETURNING " + COLUMNS;
    List<StoredRecord> rows = JdbcTemplate.updateReturning(conn, sql, RECORD_ROW_MAPPER,
        payload, now, targetId, ownerId, editableBefore);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
