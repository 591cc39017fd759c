package io.intellixity.tessera.query;

import java.util.Locale;

public enum SortDirection {
  ASC, DESC;

  public static SortDirection parse(String s) {
    if (s == null) throw new QueryValidationException("Sort direction is null");
    return switch (s.trim().toLowerCase(Locale.ROOT)) {
      case "asc" -> ASC;
      case "desc" -> DESC;
      default -> throw new QueryValidationException("Unknown sort direction '" + s + "'; expected asc or desc");
    };
  }

  public String sql() { return this == ASC ? "ASC" : "DESC"; }
}
