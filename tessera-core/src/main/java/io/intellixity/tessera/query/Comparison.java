package io.intellixity.tessera.query;

import java.util.Locale;

/** Comparison operators accepted by {@code filters} and {@code top_where}. */
public enum Comparison {
  GT("gt", ">"),
  GTE("gte", ">="),
  LT("lt", "<"),
  LTE("lte", "<="),
  EQ("eq", "="),
  NEQ("neq", "<>");

  private final String token;
  private final String sql;

  Comparison(String token, String sql) {
    this.token = token;
    this.sql = sql;
  }

  public String token() { return token; }
  public String sql() { return sql; }

  public static Comparison parse(String s) {
    String t = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    for (Comparison c : values()) {
      if (c.token.equals(t)) return c;
    }
    throw new QueryValidationException("Unknown comparison '" + s + "'; expected one of gt, gte, lt, lte, eq, neq");
  }
}
