package io.recordqueue.jdbc.store;

import java.util.List;

/**
 * H2 record store. Primarily for testing.
 *
 * <p>Uses the default update-then-select from {@link AbstractJdbcRecordStore}.
 */
public final class H2RecordStore extends AbstractJdbcRecordStore {

  public H2RecordStore() {
    super();
  }

  public H2RecordStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcRecordStore withTableName(String tableName) {
    return new H2RecordStore(tableName);
  }
}
