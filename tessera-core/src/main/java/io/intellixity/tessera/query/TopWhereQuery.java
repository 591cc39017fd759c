package io.intellixity.tessera.query;

import io.intellixity.tessera.names.MeasureName;

import java.util.Objects;

/** Predicate on an aggregated measure evaluated before top ranking. Form: {@code measure,op,value}. */
public record TopWhereQuery(MeasureName measure, Constraint constraint) {
  public TopWhereQuery {
    Objects.requireNonNull(measure, "measure");
    Objects.requireNonNull(constraint, "constraint");
  }

  public static TopWhereQuery parse(String s) {
    String[] parts = s == null ? new String[0] : s.split(",");
    if (parts.length != 3) {
      throw new QueryValidationException("Could not parse top_where '" + s + "': expected measure,op,value");
    }
    Comparison op = Comparison.parse(parts[1]);
    double v = Constraint.parseNumber(parts[2], "top_where");
    return new TopWhereQuery(MeasureName.parse(parts[0]), new Constraint(op, v));
  }
}
