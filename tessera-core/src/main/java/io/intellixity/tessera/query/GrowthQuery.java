package io.intellixity.tessera.query;

import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;

import java.util.Objects;

/** Period-over-period growth of a measure along a time level. Form: {@code dimension.hierarchy.level,measure}. */
public record GrowthQuery(LevelName timeLevel, MeasureName measure) {
  public GrowthQuery {
    Objects.requireNonNull(timeLevel, "timeLevel");
    Objects.requireNonNull(measure, "measure");
  }

  public static GrowthQuery parse(String s) {
    String[] parts = s == null ? new String[0] : s.split(",");
    if (parts.length != 2) {
      throw new QueryValidationException("Could not parse growth '" + s + "': expected level,measure");
    }
    return new GrowthQuery(LevelName.parse(parts[0].trim()), MeasureName.parse(parts[1]));
  }
}
