package io.intellixity.tessera.query;

import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;

import java.util.Objects;

/**
 * Keep the first {@code n} rows per member of {@code level}, ranked by {@code measure}.
 * <p>
 * Textual form: {@code n,dimension.hierarchy.level,measure[,asc|desc]}; direction defaults to desc.
 */
public record TopQuery(int n, LevelName level, MeasureName measure, SortDirection direction) {
  public TopQuery {
    if (n <= 0) throw new QueryValidationException("top requires n > 0, got " + n);
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(measure, "measure");
    direction = direction == null ? SortDirection.DESC : direction;
  }

  public static TopQuery parse(String s) {
    String[] parts = s == null ? new String[0] : s.split(",");
    if (parts.length != 3 && parts.length != 4) {
      throw new QueryValidationException("Could not parse top '" + s + "': expected n,level,measure[,asc|desc]");
    }
    int n;
    try {
      n = Integer.parseInt(parts[0].trim());
    } catch (NumberFormatException e) {
      throw new QueryValidationException("Could not parse top '" + s + "': n is not an integer", e);
    }
    SortDirection dir = parts.length == 4 ? SortDirection.parse(parts[3]) : SortDirection.DESC;
    return new TopQuery(n, LevelName.parse(parts[1].trim()), MeasureName.parse(parts[2]), dir);
  }
}
