package io.intellixity.tessera.ir;

/** A table as it is written in FROM/JOIN clauses ({@code schema.name} or {@code name}). */
public record TableSql(String name) {
  public TableSql {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("table name is blank");
  }
}
