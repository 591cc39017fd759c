package io.intellixity.tessera.schema;

import java.util.List;
import java.util.Optional;

public record Level(String name, String keyColumn, String nameColumn, KeyType keyType,
                    List<LevelProperty> properties, List<String> defaultMembers) {
  public Level {
    if (name == null || name.isBlank()) throw new SchemaException("Level name is blank");
    if (keyColumn == null || keyColumn.isBlank()) throw new SchemaException("Level '" + name + "' has no key column");
    keyType = keyType == null ? KeyType.TEXT : keyType;
    properties = properties == null ? List.of() : List.copyOf(properties);
    defaultMembers = defaultMembers == null ? List.of() : List.copyOf(defaultMembers);
    for (String m : defaultMembers) {
      if (!keyType.accepts(m)) {
        throw new SchemaException("Default member '" + m + "' of level '" + name + "' is not a valid " + keyType);
      }
    }
  }

  public Optional<LevelProperty> property(String propertyName) {
    for (LevelProperty p : properties) {
      if (p.name().equals(propertyName)) return Optional.of(p);
    }
    return Optional.empty();
  }
}
