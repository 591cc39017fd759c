package io.intellixity.tessera.schema;

import java.util.Locale;

public enum Aggregator {
  SUM, COUNT, AVG, MAX, MIN, COUNT_DISTINCT;

  public static Aggregator parse(String s) {
    if (s == null || s.isBlank()) throw new SchemaException("Measure aggregator is missing");
    String t = s.trim().toLowerCase(Locale.ROOT);
    return switch (t) {
      case "sum" -> SUM;
      case "count" -> COUNT;
      case "avg", "average" -> AVG;
      case "max" -> MAX;
      case "min" -> MIN;
      case "count_distinct", "distinct_count", "basic_distinct_count" -> COUNT_DISTINCT;
      default -> throw new SchemaException("Unknown aggregator '" + s + "'");
    };
  }

  /** Wraps an already-qualified column expression in this aggregate. */
  public String sql(String column) {
    return switch (this) {
      case SUM -> "SUM(" + column + ")";
      case COUNT -> "COUNT(" + column + ")";
      case AVG -> "AVG(" + column + ")";
      case MAX -> "MAX(" + column + ")";
      case MIN -> "MIN(" + column + ")";
      case COUNT_DISTINCT -> "COUNT(DISTINCT " + column + ")";
    };
  }
}
