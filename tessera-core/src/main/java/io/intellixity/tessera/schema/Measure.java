package io.intellixity.tessera.schema;

import java.util.Objects;

public record Measure(String name, String column, Aggregator aggregator) {
  public Measure {
    if (name == null || name.isBlank()) throw new SchemaException("Measure name is blank");
    if (column == null || column.isBlank()) throw new SchemaException("Measure '" + name + "' has no column");
    Objects.requireNonNull(aggregator, "aggregator");
  }
}
