package io.intellixity.tessera.jdbc.postgres;

import io.intellixity.tessera.engine.sql.AbstractSqlDialect;
import io.intellixity.tessera.ir.LimitSql;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides.
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final String ID = "postgres";

  @Override public String id() { return ID; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyLimit(String sql, LimitSql limit) {
    return sql + " LIMIT " + limit.n() + " OFFSET " + limit.offset();
  }
}
