package io.intellixity.tessera.query;

import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;

import java.util.Objects;

/**
 * Revealed comparative advantage of {@code level1} members over {@code level2} members.
 * Form: {@code level1,level2,measure}.
 */
public record RcaQuery(LevelName level1, LevelName level2, MeasureName measure) {
  public RcaQuery {
    Objects.requireNonNull(level1, "level1");
    Objects.requireNonNull(level2, "level2");
    Objects.requireNonNull(measure, "measure");
    if (level1.equals(level2)) throw new QueryValidationException("rca requires two different levels");
  }

  public static RcaQuery parse(String s) {
    String[] parts = s == null ? new String[0] : s.split(",");
    if (parts.length != 3) {
      throw new QueryValidationException("Could not parse rca '" + s + "': expected level1,level2,measure");
    }
    return new RcaQuery(LevelName.parse(parts[0].trim()), LevelName.parse(parts[1].trim()), MeasureName.parse(parts[2]));
  }
}
