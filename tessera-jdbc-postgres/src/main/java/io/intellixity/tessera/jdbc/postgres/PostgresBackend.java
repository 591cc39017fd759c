package io.intellixity.tessera.jdbc.postgres;

import io.intellixity.tessera.jdbc.JdbcBackend;
import io.intellixity.tessera.jdbc.JdbcBackendConfig;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Postgres backend over pgjdbc.
 * <p>
 * Streaming runs with auto-commit off so the driver fetches {@code blockSize} rows per round trip
 * through a cursor instead of materializing the whole result. The pool restores auto-commit when
 * the connection is returned.
 */
public class PostgresBackend extends JdbcBackend {
  public static final String DRIVER_CLASS = "org.postgresql.Driver";

  static final String PRIVILEGES_SQL =
      "SELECT current_setting('transaction_read_only') <> 'on' AND (r.rolsuper OR EXISTS ("
          + "SELECT 1 FROM information_schema.table_privileges p WHERE p.grantee = current_user "
          + "AND p.privilege_type IN ('INSERT', 'UPDATE', 'DELETE', 'TRUNCATE'))) "
          + "FROM pg_roles r WHERE r.rolname = current_user";

  public PostgresBackend(JdbcBackendConfig config) {
    super(config, new PostgresDialect());
  }

  /** Backend for {@code host:port/database}, {@code postgres://host/db} or a full {@code jdbc:postgresql:} url. */
  public static PostgresBackend fromUrl(String url, String username, String password) {
    JdbcBackendConfig cfg = new JdbcBackendConfig();
    cfg.setJdbcUrl(jdbcUrl(url));
    cfg.setDriverClassName(DRIVER_CLASS);
    cfg.setUsername(username);
    cfg.setPassword(password);
    cfg.setPoolName("tessera-postgres");
    return new PostgresBackend(cfg);
  }

  static String jdbcUrl(String url) {
    if (url == null || url.isBlank()) throw new IllegalArgumentException("Postgres url is required");
    String u = url.trim();
    if (u.startsWith("jdbc:")) return u;
    if (u.startsWith("postgres://") || u.startsWith("postgresql://")) u = u.substring(u.indexOf("://") + 3);
    return "jdbc:postgresql://" + u;
  }

  @Override
  protected boolean hasWriteAccess(Connection c) throws SQLException {
    try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(PRIVILEGES_SQL)) {
      // no pg_roles row for the session user: assume the worst
      return !rs.next() || rs.getBoolean(1);
    }
  }

  @Override
  protected void prepareStreaming(Connection c) throws SQLException {
    c.setAutoCommit(false);
  }
}
