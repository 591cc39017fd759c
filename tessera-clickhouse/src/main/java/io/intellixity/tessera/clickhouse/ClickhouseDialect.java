package io.intellixity.tessera.clickhouse;

import io.intellixity.tessera.engine.sql.AbstractSqlDialect;
import io.intellixity.tessera.ir.QueryIr;
import io.intellixity.tessera.ir.TopSql;

import java.util.List;

/**
 * ClickHouse SQL.
 * <p>
 * Keeps only ClickHouse-specific overrides: backtick identifiers, backslash-escaped literals,
 * {@code lagInFrame} for growth, {@code LIMIT n BY} for top and {@code join_use_nulls} for dense queries.
 * Generic rendering lives in {@link AbstractSqlDialect}.
 */
public final class ClickhouseDialect extends AbstractSqlDialect {
  public static final String ID = "clickhouse";

  @Override public String id() { return ID; }

  @Override
  protected String quoteIdent(String ident) {
    return "`" + ident.replace("\\", "\\\\").replace("`", "\\`") + "`";
  }

  @Override
  protected String quoteLiteral(String s) {
    return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }

  @Override
  protected String lag(String expr, List<String> partitionBy, String orderBy) {
    // toNullable: the first row of a partition lags to NULL instead of the type default
    return "lagInFrame(toNullable(" + expr + ")) OVER (" + window(partitionBy, orderBy)
        + " ROWS BETWEEN UNBOUNDED PRECEDING AND UNBOUNDED FOLLOWING)";
  }

  @Override
  protected String toFloat(String expr) {
    return "toFloat64(" + expr + ")";
  }

  @Override
  protected String applyTop(String rel, String alias, TopSql top, String partitionBy, String rankBy) {
    return "SELECT " + alias + ".* FROM (" + rel + ") AS " + alias
        + " ORDER BY " + orderTerm(alias + "." + rankBy, top.direction())
        + " LIMIT " + top.n() + " BY " + alias + "." + partitionBy;
  }

  @Override
  protected String finish(QueryIr ir, String sql) {
    // unmatched LEFT JOIN rows carry NULL measures, not zeros
    return dense(ir) ? sql + " SETTINGS join_use_nulls = 1" : sql;
  }
}
