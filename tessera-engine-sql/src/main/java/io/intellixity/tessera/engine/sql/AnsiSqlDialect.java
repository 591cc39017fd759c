package io.intellixity.tessera.engine.sql;

/** Standard SQL with double-quoted identifiers; used for H2 and other window-capable databases. */
public final class AnsiSqlDialect extends AbstractSqlDialect {
  public static final String ID = "ansi";

  @Override public String id() { return ID; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
