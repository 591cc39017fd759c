package io.intellixity.tessera.engine.sql;

import io.intellixity.tessera.ir.QueryIr;

/** Renders a resolved query into the SQL text of one database family. */
public interface SqlDialect {
  /** Registry key, e.g. {@code clickhouse} or {@code postgres}. */
  String id();

  String render(QueryIr ir);
}
