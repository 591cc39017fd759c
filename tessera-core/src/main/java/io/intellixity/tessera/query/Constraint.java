package io.intellixity.tessera.query;

import java.util.Objects;

/** A single {@code <op> <number>} predicate on an aggregated value. */
public record Constraint(Comparison comparison, double value) {
  public Constraint {
    Objects.requireNonNull(comparison, "comparison");
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new QueryValidationException("Constraint value must be finite");
    }
  }

  static double parseNumber(String raw, String what) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException e) {
      throw new QueryValidationException("Could not parse number '" + raw + "' in " + what, e);
    }
  }
}
