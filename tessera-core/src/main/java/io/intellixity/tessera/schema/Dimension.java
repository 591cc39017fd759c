package io.intellixity.tessera.schema;

import java.util.List;
import java.util.Optional;

public record Dimension(String name, String foreignKey, List<Hierarchy> hierarchies, String defaultHierarchy) {
  public Dimension {
    if (name == null || name.isBlank()) throw new SchemaException("Dimension name is blank");
    if (hierarchies == null || hierarchies.isEmpty()) throw new SchemaException("Dimension '" + name + "' has no hierarchies");
    hierarchies = List.copyOf(hierarchies);
    for (Hierarchy h : hierarchies) {
      if (!h.inline() && (foreignKey == null || foreignKey.isBlank())) {
        throw new SchemaException("Dimension '" + name + "' joins table " + h.table().fullName() + " but has no foreign_key");
      }
    }
  }

  public Optional<Hierarchy> hierarchy(String hierarchyName) {
    for (Hierarchy h : hierarchies) {
      if (h.name().equals(hierarchyName)) return Optional.of(h);
    }
    return Optional.empty();
  }
}
