package io.recordqueue.jdbc.store;

import io.recordqueue.StoredRecord;
import io.recordqueue.jdbc.JdbcTemplate;
import io.recordqueue.jdbc.TableNames;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC record store with standard SQL implementations.
 *
 * <p>Instances are stateless apart from the table name and operate on a caller-supplied
 * connection. {@link io.recordqueue.jdbc.JdbcRecordStore} binds one to a connection
 * source. Subclasses override {@link #updateIfEditable} where the database can return
 * the updated row in the same statement. Register custom implementations via
 * {@code META-INF/services/io.recordqueue.jdbc.store.AbstractJdbcRecordStore}.
 *
 * @see JdbcRecordStores
 */
public abstract class AbstractJdbcRecordStore {
  protected static final String COLUMNS =
      "id, owner_id, payload, created_at, last_edited_at, is_edited, is_deleted, deleted_at, deleted_by";

  protected static final JdbcTemplate.RowMapper<StoredRecord> RECORD_ROW_MAPPER = rs -> new StoredRecord(
      rs.getString("id"),
      rs.getString("owner_id"),
      rs.getString("payload"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "last_edited_at"),
      rs.getBoolean("is_edited"),
      rs.getBoolean("is_deleted"),
      JdbcTemplate.instant(rs, "deleted_at"),
      rs.getString("deleted_by"));

  private final String tableName;

  protected AbstractJdbcRecordStore() {
    this(TableNames.DEFAULT_RECORD_TABLE);
  }

  protected AbstractJdbcRecordStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this record store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this record store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect bound to another table.
   *
   * @param tableName the record table
   * @return a new store instance
   */
  public abstract AbstractJdbcRecordStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  /**
   * Inserts a new, unedited record.
   *
   * @param conn    connection to use
   * @param id      the new record id
   * @param ownerId the owning principal
   * @param payload record data
   * @param now     creation time
   * @return the inserted record
   */
  public StoredRecord insert(Connection conn, String id, String ownerId, String payload, Instant now) {
    Instant createdAt = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") " +
        "VALUES (?,?,?,?,NULL,FALSE,FALSE,NULL,NULL)";
    JdbcTemplate.update(conn, sql, id, ownerId, payload, createdAt);
    return new StoredRecord(id, ownerId, payload, createdAt, null, false, false, null, null);
  }

  /**
   * Replaces the payload if the record is owned by {@code ownerId}, not deleted, and
   * was never edited or last edited at or before {@code editableBefore}. The check and
   * the write are one statement.
   *
   * @param conn           connection to use
   * @param targetId       the record to update
   * @param ownerId        the principal requesting the edit
   * @param payload        new record data
   * @param now            edit time
   * @param editableBefore latest previous edit time that still allows an edit
   * @return the updated record, or empty if the eligibility rule rejected the write
   */
  public Optional<StoredRecord> updateIfEditable(Connection conn, String targetId, String ownerId,
      String payload, Instant now, Instant editableBefore) {
    String sql = "UPDATE " + tableName() +
        " SET payload=?, last_edited_at=?, is_edited=TRUE" +
        " WHERE id=? AND owner_id=? AND is_deleted=FALSE" +
        " AND (last_edited_at IS NULL OR last_edited_at <= ?)";
    int updated = JdbcTemplate.update(conn, sql, payload, now, targetId, ownerId, editableBefore);
    if (updated == 0) {
      return Optional.empty();
    }
    return findById(conn, targetId);
  }

  /**
   * Marks a record deleted. The row is kept.
   *
   * @return rows affected (0 if the record does not exist)
   */
  public int softDelete(Connection conn, String targetId, String deletedBy, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET is_deleted=TRUE, deleted_at=?, deleted_by=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, now, deletedBy, targetId);
  }

  public Optional<StoredRecord> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    List<StoredRecord> rows = JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, id);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public Optional<StoredRecord> findByOwner(Connection conn, String ownerId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE owner_id=?";
    List<StoredRecord> rows = JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, ownerId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
