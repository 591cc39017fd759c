package io.intellixity.tessera.schema;

import java.util.List;
import java.util.Optional;

/**
 * Ordered levels, root first. Without a {@code table} the level columns live in the fact table.
 */
public record Hierarchy(String name, Table table, String primaryKey, List<Level> levels) {
  public Hierarchy {
    if (name == null || name.isBlank()) throw new SchemaException("Hierarchy name is blank");
    if (levels == null || levels.isEmpty()) throw new SchemaException("Hierarchy '" + name + "' has no levels");
    levels = List.copyOf(levels);
    if ((primaryKey == null || primaryKey.isBlank()) && table != null) {
      primaryKey = table.primaryKey() != null ? table.primaryKey() : levels.get(0).keyColumn();
    }
  }

  public boolean inline() { return table == null; }

  public Optional<Level> level(String levelName) {
    for (Level l : levels) {
      if (l.name().equals(levelName)) return Optional.of(l);
    }
    return Optional.empty();
  }

  public int indexOf(String levelName) {
    for (int i = 0; i < levels.size(); i++) {
      if (levels.get(i).name().equals(levelName)) return i;
    }
    return -1;
  }
}
