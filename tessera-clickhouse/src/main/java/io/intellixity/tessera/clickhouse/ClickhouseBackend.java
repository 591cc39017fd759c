package io.intellixity.tessera.clickhouse;

import io.intellixity.tessera.jdbc.JdbcBackend;
import io.intellixity.tessera.jdbc.JdbcBackendConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;

/**
 * ClickHouse backend over the ClickHouse JDBC driver (HTTP interface).
 * <p>
 * Session privileges come from {@code system.settings}: a session is treated as writable unless
 * {@code readonly} is {@code 1} or {@code allow_ddl} is {@code 0}.
 */
public class ClickhouseBackend extends JdbcBackend {
  private static final Logger log = LoggerFactory.getLogger(ClickhouseBackend.class);

  public static final String DRIVER_CLASS = "com.clickhouse.jdbc.ClickHouseDriver";
  static final String SETTINGS_SQL = "SELECT name, value FROM system.settings WHERE name IN ('readonly', 'allow_ddl')";

  public ClickhouseBackend(JdbcBackendConfig config) {
    super(config, new ClickhouseDialect());
  }

  /**
   * Backend for {@code host:port/database} or a full {@code jdbc:clickhouse:} url.
   * The pool connects lazily; a bad address fails on first use.
   */
  public static ClickhouseBackend fromUrl(String url) {
    JdbcBackendConfig cfg = new JdbcBackendConfig();
    cfg.setJdbcUrl(jdbcUrl(url));
    cfg.setDriverClassName(DRIVER_CLASS);
    cfg.setPoolName("tessera-clickhouse");
    return new ClickhouseBackend(cfg);
  }

  static String jdbcUrl(String url) {
    if (url == null || url.isBlank()) throw new IllegalArgumentException("ClickHouse url is required");
    String u = url.trim();
    if (u.startsWith("jdbc:")) return u;
    if (u.startsWith("tcp://") || u.startsWith("http://")) u = u.substring(u.indexOf("://") + 3);
    return "jdbc:clickhouse://" + u;
  }

  @Override
  protected boolean hasWriteAccess(Connection c) throws SQLException {
    Map<String, String> settings = new HashMap<>();
    try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(SETTINGS_SQL)) {
      while (rs.next()) settings.put(rs.getString(1), rs.getString(2));
    }
    log.debug("tessera.clickhouse session settings={}", settings);
    return writable(settings);
  }

  static boolean writable(Map<String, String> settings) {
    String readonly = settings.get("readonly");
    String allowDdl = settings.get("allow_ddl");
    if (readonly == null || allowDdl == null) return true;
    return !"1".equals(readonly.trim()) && !"0".equals(allowDdl.trim());
  }
}
