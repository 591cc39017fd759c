package io.intellixity.tessera.names;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Canonical {@code dimension.hierarchy.level} path identifying a level within a cube.
 * <p>
 * Equality and hashing use the three segments only.
 */
public record LevelName(String dimension, String hierarchy, String level) {
  public LevelName {
    Objects.requireNonNull(dimension, "dimension");
    Objects.requireNonNull(hierarchy, "hierarchy");
    Objects.requireNonNull(level, "level");
  }

  public static LevelName parse(String s) {
    if (s == null) throw new NameParseException("Could not parse level name from null");
    return fromList(Arrays.asList(s.split("\\.", -1)), s);
  }

  public static LevelName fromList(List<String> segments) {
    return fromList(segments, segments == null ? "null" : String.join(".", segments));
  }

  private static LevelName fromList(List<String> segments, String raw) {
    if (segments == null || segments.size() != 3) {
      throw new NameParseException("Could not parse a level name from '" + raw + "': expected dimension.hierarchy.level");
    }
    for (String seg : segments) {
      if (seg == null || seg.isBlank()) {
        throw new NameParseException("Could not parse a level name from '" + raw + "': empty segment");
      }
    }
    return new LevelName(segments.get(0).trim(), segments.get(1).trim(), segments.get(2).trim());
  }

  @Override
  public String toString() {
    return dimension + "." + hierarchy + "." + level;
  }
}
