package io.intellixity.tessera.query;

import io.intellixity.tessera.names.MeasureName;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-aggregation filter on a measure.
 * <p>
 * Form: {@code measure.op.value} or {@code measure.op.value.and|or.op.value}, e.g.
 * {@code Population.gt.1000.and.lte.5000.5}.
 */
public record FilterQuery(MeasureName measure, Constraint first, Conjunction conjunction, Constraint second) {
  private static final String OP = "(gt|gte|lt|lte|eq|neq)";
  private static final String NUM = "(-?[0-9]+(?:\\.[0-9]+)?)";
  private static final Pattern FORM = Pattern.compile(
      "^(.+?)\\." + OP + "\\." + NUM + "(?:\\.(and|or)\\." + OP + "\\." + NUM + ")?$");

  public FilterQuery {
    Objects.requireNonNull(measure, "measure");
    Objects.requireNonNull(first, "first");
    if ((conjunction == null) != (second == null)) {
      throw new QueryValidationException("Filter conjunction and second constraint must be given together");
    }
  }

  public FilterQuery(MeasureName measure, Constraint only) {
    this(measure, only, null, null);
  }

  public static FilterQuery parse(String s) {
    Matcher m = FORM.matcher(s == null ? "" : s.trim());
    if (!m.matches()) {
      throw new QueryValidationException("Could not parse filter '" + s + "': expected measure.op.value[.and|or.op.value]");
    }
    MeasureName measure = MeasureName.parse(m.group(1));
    Constraint first = new Constraint(Comparison.parse(m.group(2)), Constraint.parseNumber(m.group(3), "filter"));
    if (m.group(4) == null) return new FilterQuery(measure, first);
    Constraint second = new Constraint(Comparison.parse(m.group(5)), Constraint.parseNumber(m.group(6), "filter"));
    return new FilterQuery(measure, first, Conjunction.parse(m.group(4)), second);
  }
}
