package io.recordqueue.jdbc;

import io.recordqueue.EditNotPermittedException;
import io.recordqueue.RecordNotFoundException;
import io.recordqueue.StoredRecord;
import io.recordqueue.jdbc.store.AbstractJdbcRecordStore;
import io.recordqueue.jdbc.store.JdbcRecordStores;
import io.recordqueue.spi.RecordStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RecordStore} over a relational table.
 *
 * <p>Each call borrows one connection in auto-commit mode, so every operation is a single
 * statement transaction. Pooling is left to the {@link ConnectionProvider}; a HikariCP
 * data source is the usual choice.
 *
 * <p>A record may be edited by its owner only if it is not deleted and was never edited
 * or was last edited at least {@code editCooldown} ago (7 days by default). The rule is
 * evaluated inside the UPDATE statement, so two concurrent edits cannot both pass it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RecordStore store = JdbcRecordStore.builder()
 *     .dataSource(hikariDataSource)
 *     .build();
 * }</pre>
 */
public final class JdbcRecordStore implements RecordStore {
  private static final Logger logger = Logger.getLogger(JdbcRecordStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcRecordStore dialect;
  private final Duration editCooldown;

  private JdbcRecordStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.editCooldown = Objects.requireNonNull(builder.editCooldown, "editCooldown");
    if (editCooldown.isNegative()) {
      throw new IllegalArgumentException("editCooldown must not be negative, got: " + editCooldown);
    }
    AbstractJdbcRecordStore resolved = builder.dialect != null ? builder.dialect : detect(connectionProvider);
    this.dialect = builder.tableName != null ? resolved.withTableName(builder.tableName) : resolved;
  }

  public static Builder builder() {
    return new Builder();
  }

  private static AbstractJdbcRecordStore detect(ConnectionProvider provider) {
    try (Connection conn = provider.getConnection()) {
      return JdbcRecordStores.detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect record store dialect", e);
    }
  }

  @Override
  public StoredRecord create(String ownerId, String payloadJson) {
    String id = UUID.randomUUID().toString();
    return withConnection("create", conn -> dialect.insert(conn, id, ownerId, payloadJson, Instant.now()));
  }

  @Override
  public StoredRecord updateIfEditable(String targetId, String ownerId, String payloadJson) {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    Instant editableBefore = now.minus(editCooldown);
    Optional<StoredRecord> updated = withConnection("updateIfEditable", conn ->
        dialect.updateIfEditable(conn, targetId, ownerId, payloadJson, now, editableBefore));
    return updated.orElseThrow(() -> new EditNotPermittedException(targetId, ownerId));
  }

  @Override
  public void softDelete(String targetId, String actingAdminId) {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    int rows = withConnection("softDelete", conn -> dialect.softDelete(conn, targetId, actingAdminId, now));
    if (rows == 0) {
      throw new RecordNotFoundException(targetId);
    }
  }

  /**
   * Reads a record, deleted or not.
   *
   * @param id the record id
   * @return the record, or empty if it does not exist
   */
  public Optional<StoredRecord> findById(String id) {
    return withConnection("findById", conn -> dialect.findById(conn, id));
  }

  public Optional<StoredRecord> findByOwner(String ownerId) {
    return withConnection("findByOwner", conn -> dialect.findByOwner(conn, ownerId));
  }

  public String dialectName() {
    return dialect.name();
  }

  /**
   * Closes the connection provider if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    if (connectionProvider instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close connection provider", e);
      }
    }
  }

  private <T> T withConnection(String operation, Function<Connection, T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException e) {
      throw JdbcTemplate.translate(operation, e);
    }
  }

  /** Builder for {@link JdbcRecordStore}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcRecordStore dialect;
    private String tableName;
    private Duration editCooldown = Duration.ofDays(7);

    private Builder() {}

    /**
     * Sets where connections come from.
     *
     * <p><b>Required</b> (or use {@link #dataSource(DataSource)}).
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Shortcut for a {@link DataSourceConnectionProvider}. The data source is not closed
     * with the store.
     *
     * @param dataSource the data source
     * @return this builder
     */
    public Builder dataSource(DataSource dataSource) {
      this.connectionProvider = new DataSourceConnectionProvider(dataSource);
      return this;
    }

    /**
     * Sets the SQL dialect.
     *
     * <p>Optional. Detected from the connection's JDBC URL by default.
     *
     * @param dialect the dialect store
     * @return this builder
     */
    public Builder dialect(AbstractJdbcRecordStore dialect) {
      this.dialect = dialect;
      return this;
    }

    /**
     * Optional. Defaults to {@code record}.
     *
     * @param tableName the record table
     * @return this builder
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /**
     * Sets the minimum time between two edits of the same record.
     *
     * <p>Optional. Defaults to 7 days. {@link Duration#ZERO} allows any number of edits.
     *
     * @param editCooldown the cooldown
     * @return this builder
     */
    public Builder editCooldown(Duration editCooldown) {
      this.editCooldown = editCooldown;
      return this;
    }

    public JdbcRecordStore build() {
      return new JdbcRecordStore(this);
    }
  }
}
