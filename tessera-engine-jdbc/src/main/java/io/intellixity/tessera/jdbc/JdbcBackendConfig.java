package io.intellixity.tessera.jdbc;

import com.zaxxer.hikari.HikariConfig;

/** Connection settings for a pooled JDBC backend. */
public class JdbcBackendConfig {
  /** Longest wait for a pooled connection (the ping timeout). */
  public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 100_000;
  public static final int DEFAULT_BLOCK_SIZE = 65_536;

  private String jdbcUrl;
  private String driverClassName;
  private String username;
  private String password;
  private String poolName;
  private int maximumPoolSize = 10;
  private long connectionTimeoutMs = DEFAULT_CONNECTION_TIMEOUT_MS;
  private int blockSize = DEFAULT_BLOCK_SIZE;
  private boolean readOnly;

  public String getJdbcUrl() { return jdbcUrl; }
  public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
  public String getDriverClassName() { return driverClassName; }
  public void setDriverClassName(String driverClassName) { this.driverClassName = driverClassName; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public String getPoolName() { return poolName; }
  public void setPoolName(String poolName) { this.poolName = poolName; }
  public int getMaximumPoolSize() { return maximumPoolSize; }
  public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
  public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }
  /** Rows per streamed frame; also used as the JDBC fetch size. */
  public int getBlockSize() { return blockSize; }
  public void setBlockSize(int blockSize) { this.blockSize = blockSize; }
  public boolean isReadOnly() { return readOnly; }
  public void setReadOnly(boolean readOnly) { this.readOnly = readOnly; }

  public HikariConfig toHikariConfig() {
    if (jdbcUrl == null || jdbcUrl.isBlank()) throw new IllegalArgumentException("Missing jdbcUrl");
    if (blockSize <= 0) throw new IllegalArgumentException("blockSize must be > 0");
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(jdbcUrl);
    if (driverClassName != null && !driverClassName.isBlank()) hc.setDriverClassName(driverClassName);
    hc.setUsername(username);
    hc.setPassword(password);
    hc.setMaximumPoolSize(maximumPoolSize);
    hc.setConnectionTimeout(connectionTimeoutMs);
    hc.setReadOnly(readOnly);
    // pool starts without a live database; failures surface on first use
    hc.setInitializationFailTimeout(-1);
    if (poolName != null && !poolName.isBlank()) hc.setPoolName(poolName);
    return hc;
  }
}
