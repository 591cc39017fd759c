package io.intellixity.tessera.schema;

/** Physical table; {@code schema} and {@code primaryKey} are optional. */
public record Table(String name, String schema, String primaryKey) {
  public Table {
    if (name == null || name.isBlank()) throw new SchemaException("Table name is blank");
  }

  public Table(String name) {
    this(name, null, null);
  }

  /** {@code schema.name}, or {@code name} when no schema is set. */
  public String fullName() {
    return schema == null || schema.isBlank() ? name : schema + "." + name;
  }
}
