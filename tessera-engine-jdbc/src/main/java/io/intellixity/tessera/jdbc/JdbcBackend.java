package io.intellixity.tessera.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.tessera.dataframe.DataFrame;
import io.intellixity.tessera.engine.sql.SqlDialect;
import io.intellixity.tessera.exec.Backend;
import io.intellixity.tessera.exec.ConnectionException;
import io.intellixity.tessera.exec.FrameStream;
import io.intellixity.tessera.exec.SqlExecutionException;
import io.intellixity.tessera.ir.QueryIr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * {@link Backend} over a HikariCP pool.
 * <p>
 * One instance per database; share the reference. Database-specific backends override
 * {@link #hasWriteAccess(Connection)} and {@link #prepareStreaming(Connection)}.
 */
public class JdbcBackend implements Backend {
  private static final Logger log = LoggerFactory.getLogger(JdbcBackend.class);

  private final SqlDialect dialect;
  private final HikariDataSource ds;
  private final int blockSize;

  public JdbcBackend(JdbcBackendConfig config, SqlDialect dialect) {
    this(new HikariDataSource(Objects.requireNonNull(config, "config").toHikariConfig()), dialect, config.getBlockSize());
  }

  public JdbcBackend(HikariDataSource ds, SqlDialect dialect, int blockSize) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    if (blockSize <= 0) throw new IllegalArgumentException("blockSize must be > 0");
    this.blockSize = blockSize;
  }

  /** Dialect key this backend renders SQL for (e.g. {@code clickhouse}); used in log lines. */
  public String id() { return dialect.id(); }
  public HikariDataSource dataSource() { return ds; }
  public int blockSize() { return blockSize; }

  @Override
  public String generateSql(QueryIr ir) {
    return dialect.render(ir);
  }

  @Override
  public DataFrame execSql(String sql) {
    long start = System.nanoTime();
    debugSql("execSql", sql);
    try (Connection c = connection()) {
      try (Statement st = c.createStatement()) {
        st.setFetchSize(blockSize);
        try (ResultSet rs = st.executeQuery(sql)) {
          DataFrame df = new JdbcFrameReader(rs.getMetaData()).readAll(rs);
          log.info("tessera.jdbc op=execSql backend={} durationMs={} rows={}",
              id(), (System.nanoTime() - start) / 1_000_000.0, df.rowCount());
          return df;
        }
      }
    } catch (SQLException e) {
      throw new SqlExecutionException(e.getMessage(), e);
    }
  }

  @Override
  public FrameStream execSqlStream(String sql) {
    debugSql("execSqlStream", sql);
    Connection c = connection();
    Statement st = null;
    try {
      prepareStreaming(c);
      st = c.createStatement();
      st.setFetchSize(blockSize);
      ResultSet rs = st.executeQuery(sql);
      return new JdbcFrameStream(c, st, rs, blockSize);
    } catch (SQLException e) {
      SqlExecutionException ex = new SqlExecutionException(e.getMessage(), e);
      release(st, c, ex);
      throw ex;
    } catch (RuntimeException e) {
      release(st, c, e);
      throw e;
    }
  }

  @Override
  public void checkUser() {
    try (Connection c = connection()) {
      if (hasWriteAccess(c)) {
        log.warn("tessera.jdbc checkUser backend={}: database connection has write access; users may be able to modify data", id());
      } else {
        log.debug("tessera.jdbc checkUser backend={} read-only", id());
      }
    } catch (SQLException | RuntimeException e) {
      log.warn("tessera.jdbc checkUser backend={} could not inspect session privileges: {}", id(), e.toString());
    }
  }

  @Override
  public void close() {
    if (!ds.isClosed()) {
      log.info("tessera.jdbc closing pool backend={} pool={}", id(), ds.getPoolName());
      ds.close();
    }
  }

  /** True when the session can modify data. */
  protected boolean hasWriteAccess(Connection c) throws SQLException {
    return !(c.isReadOnly() || c.getMetaData().isReadOnly());
  }

  /** Called on the connection before a streaming query; e.g. to enable cursor-based fetching. */
  protected void prepareStreaming(Connection c) throws SQLException {
  }

  protected final Connection connection() {
    try {
      return ds.getConnection();
    } catch (SQLException e) {
      throw new ConnectionException(e.getMessage(), e);
    }
  }

  private static void release(Statement st, Connection c, Exception cause) {
    try {
      if (st != null) st.close();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
    try {
      c.close();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private void debugSql(String op, String sql) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessera.jdbc op={} backend={} blockSize={} sql={}", op, id(), blockSize, sql);
  }
}
