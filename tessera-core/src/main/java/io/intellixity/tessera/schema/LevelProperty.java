package io.intellixity.tessera.schema;

public record LevelProperty(String name, String column) {
  public LevelProperty {
    if (name == null || name.isBlank()) throw new SchemaException("Property name is blank");
    if (column == null || column.isBlank()) throw new SchemaException("Property '" + name + "' has no column");
  }
}
