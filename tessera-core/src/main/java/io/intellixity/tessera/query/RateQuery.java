package io.intellixity.tessera.query;

import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;

import java.util.Objects;

/** Growth expressed as a percentage. Same form as {@link GrowthQuery}. */
public record RateQuery(LevelName timeLevel, MeasureName measure) {
  public RateQuery {
    Objects.requireNonNull(timeLevel, "timeLevel");
    Objects.requireNonNull(measure, "measure");
  }

  public static RateQuery parse(String s) {
    GrowthQuery g;
    try {
      g = GrowthQuery.parse(s);
    } catch (QueryValidationException e) {
      throw new QueryValidationException("Could not parse rate '" + s + "': expected level,measure", e);
    }
    return new RateQuery(g.timeLevel(), g.measure());
  }
}
