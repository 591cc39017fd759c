package io.intellixity.tessera.names;

import java.util.Objects;

/** {@code dimension.hierarchy.level.property}: a property column attached to a level. */
public record PropertyName(LevelName levelName, String property) {
  public PropertyName {
    Objects.requireNonNull(levelName, "levelName");
    if (property == null || property.isBlank()) throw new NameParseException("Property name is blank");
  }

  public static PropertyName parse(String s) {
    if (s == null) throw new NameParseException("Could not parse property from null");
    int idx = s.lastIndexOf('.');
    if (idx <= 0 || idx == s.length() - 1) {
      throw new NameParseException("Could not parse a property from '" + s + "': expected dimension.hierarchy.level.property");
    }
    return new PropertyName(LevelName.parse(s.substring(0, idx)), s.substring(idx + 1).trim());
  }

  @Override
  public String toString() {
    return levelName + "." + property;
  }
}
