package io.intellixity.tessera.exec;

import io.intellixity.tessera.dataframe.DataFrame;
import io.intellixity.tessera.ir.QueryIr;

/**
 * Database capability used by request handlers.
 * <p>
 * Implementations are thread-safe and shared; every holder of a reference uses the same connection pool.
 */
public interface Backend extends AutoCloseable {
  String generateSql(QueryIr ir);

  /** Runs {@code sql} and materializes the whole result. */
  DataFrame execSql(String sql);

  /**
   * Runs {@code sql} and yields the result lazily, one frame per block. The connection is held until the
   * stream is exhausted, fails or is closed.
   */
  FrameStream execSqlStream(String sql);

  /** Inspects the session's privileges; logs a warning on write access and never throws. */
  void checkUser();

  /** Releases the connection pool. */
  @Override
  void close();
}
