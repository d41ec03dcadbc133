package io.recordqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of the SQL dialects registered under
 * {@code META-INF/services/io.recordqueue.jdbc.store.AbstractJdbcRecordStore}.
 *
 * <p>A dialect is matched to a database by the prefix of its JDBC URL, so
 * {@link io.recordqueue.jdbc.JdbcRecordStore} can pick one without configuration:
 * <pre>{@code
 * AbstractJdbcRecordStore dialect = JdbcRecordStores.detect(dataSource);
 * AbstractJdbcRecordStore h2 = JdbcRecordStores.get("h2");
 * }</pre>
 */
public final class JdbcRecordStores {

  private JdbcRecordStores() {
  }

  /** Registered dialects in service-file order. */
  public static List<AbstractJdbcRecordStore> all() {
    return Registry.DIALECTS;
  }

  /**
   * Returns the dialect registered under {@code name}, ignoring case.
   *
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static AbstractJdbcRecordStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcRecordStore dialect = Registry.BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown record store dialect '" + name
          + "', registered: " + Registry.BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Finds the dialect whose URL prefix matches {@code jdbcUrl}, ignoring case.
   *
   * @param jdbcUrl a JDBC URL, may be {@code null}
   * @return the matching dialect, or empty
   */
  public static Optional<AbstractJdbcRecordStore> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return Registry.DIALECTS.stream()
        .filter(d -> d.jdbcUrlPrefixes().stream()
            .anyMatch(prefix -> url.startsWith(prefix.toLowerCase(Locale.ROOT))))
        .findFirst();
  }

  /**
   * Like {@link #find(String)}, but fails when nothing matches.
   *
   * @throws IllegalArgumentException if the URL is blank or no dialect matches it
   */
  public static AbstractJdbcRecordStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("JDBC URL must not be blank");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No record store dialect for " + jdbcUrl + ", known prefixes: "
            + Registry.DIALECTS.stream().flatMap(d -> d.jdbcUrlPrefixes().stream()).toList()));
  }

  /**
   * Opens one connection to read the URL of {@code dataSource} and detects its dialect.
   *
   * @throws IllegalStateException if the connection cannot be opened
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static AbstractJdbcRecordStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Cannot read JDBC URL from DataSource", e);
    }
    return detect(url);
  }

  // Loaded on first use.
  private static final class Registry {
    static final List<AbstractJdbcRecordStore> DIALECTS = ServiceLoader.load(AbstractJdbcRecordStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    static final Map<String, AbstractJdbcRecordStore> BY_NAME = new LinkedHashMap<>();

    static {
      for (AbstractJdbcRecordStore dialect : DIALECTS) {
        BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
      }
    }
  }
}
