package io.intellixity.tessera.jdbc;

import io.intellixity.tessera.dataframe.DataFrame;
import io.intellixity.tessera.exec.FrameStream;
import io.intellixity.tessera.exec.SqlExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.NoSuchElementException;

/**
 * Frames read lazily from an open result set, {@code blockSize} rows at a time.
 * <p>
 * Owns the connection: it is returned to the pool when the rows run out, a read fails, or
 * {@link #close()} is called, whichever comes first. Not thread-safe.
 */
public final class JdbcFrameStream implements FrameStream {
  private static final Logger log = LoggerFactory.getLogger(JdbcFrameStream.class);

  private final Connection conn;
  private final Statement stmt;
  private final ResultSet rs;
  private final JdbcFrameReader reader;
  private final int blockSize;

  private DataFrame pending;
  private boolean closed;
  private int frames;

  JdbcFrameStream(Connection conn, Statement stmt, ResultSet rs, int blockSize) throws SQLException {
    this.conn = conn;
    this.stmt = stmt;
    this.rs = rs;
    this.reader = new JdbcFrameReader(rs.getMetaData());
    this.blockSize = blockSize;
  }

  @Override
  public boolean hasNext() {
    if (pending != null) return true;
    if (closed) return false;
    DataFrame block;
    try {
      block = reader.readBlock(rs, blockSize);
    } catch (SQLException | RuntimeException e) {
      closeQuietlyAfter(e);
      if (e instanceof SQLException se) throw new SqlExecutionException(se.getMessage(), se);
      throw (RuntimeException) e;
    }
    if (block.rowCount() == 0) {
      close();
      return false;
    }
    pending = block;
    return true;
  }

  @Override
  public DataFrame next() {
    if (!hasNext()) throw new NoSuchElementException("Frame stream exhausted");
    DataFrame out = pending;
    pending = null;
    frames++;
    return out;
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    pending = null;
    SQLException failure = null;
    try {
      rs.close();
    } catch (SQLException e) {
      failure = e;
    }
    try {
      stmt.close();
    } catch (SQLException e) {
      if (failure == null) failure = e; else failure.addSuppressed(e);
    }
    try {
      conn.close();
    } catch (SQLException e) {
      if (failure == null) failure = e; else failure.addSuppressed(e);
    }
    log.debug("tessera.jdbc stream closed frames={}", frames);
    if (failure != null) throw new SqlExecutionException(failure.getMessage(), failure);
  }

  private void closeQuietlyAfter(Exception cause) {
    try {
      close();
    } catch (SqlExecutionException e) {
      cause.addSuppressed(e);
    }
  }
}
