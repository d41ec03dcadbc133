package io.recordqueue.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;
import java.util.UUID;

/**
 * Loads the bundled schema scripts into test databases.
 */
public final class TestSchemas {

  private TestSchemas() {}

  public static JdbcDataSource newH2DataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:rq_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
    return ds;
  }

  public static void apply(DataSource dataSource, String resource) throws Exception {
    String schema = load(resource);
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  private static String load(String path) throws IOException {
    try (InputStream is = TestSchemas.class.getResourceAsStream(path)) {
      if (is == null) throw new IOException("Resource not found: " + path);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
