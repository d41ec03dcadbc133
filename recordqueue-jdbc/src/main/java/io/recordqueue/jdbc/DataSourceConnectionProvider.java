package io.recordqueue.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 * Delegates directly to {@link DataSource#getConnection()}.
 *
 * <p>{@link #close()} closes the data source if it is {@link AutoCloseable} (a HikariCP
 * pool, for example) and this provider was created as its owner.
 *
 * @see ConnectionProvider
 */
public final class DataSourceConnectionProvider implements ConnectionProvider, AutoCloseable {
  private final DataSource dataSource;
  private final boolean ownsDataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this(dataSource, false);
  }

  /**
   * @param dataSource     the data source to draw connections from
   * @param ownsDataSource whether {@link #close()} should close the data source
   */
  public DataSourceConnectionProvider(DataSource dataSource, boolean ownsDataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.ownsDataSource = ownsDataSource;
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public void close() throws Exception {
    if (ownsDataSource && dataSource instanceof AutoCloseable closeable) {
      closeable.close();
    }
  }
}
