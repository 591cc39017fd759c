package io.intellixity.tessera.query;

import java.util.Objects;

/**
 * Sort on a measure, a drilldown level or an output header. Form: {@code name.asc|desc}.
 */
public record SortQuery(String column, SortDirection direction) {
  public SortQuery {
    if (column == null || column.isBlank()) throw new QueryValidationException("Sort column is blank");
    Objects.requireNonNull(direction, "direction");
  }

  public static SortQuery parse(String s) {
    int idx = s == null ? -1 : s.lastIndexOf('.');
    if (idx <= 0) throw new QueryValidationException("Could not parse sort '" + s + "': expected column.asc|desc");
    return new SortQuery(s.substring(0, idx).trim(), SortDirection.parse(s.substring(idx + 1)));
  }
}
