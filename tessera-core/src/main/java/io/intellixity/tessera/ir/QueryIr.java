package io.intellixity.tessera.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fully resolved query: every identifier bound to a physical column, every derived operation bound to
 * drilldown/measure positions. Dialects render this into SQL; they never look at the schema.
 * <p>
 * Internal aliases are stable: drilldown {@code i} column {@code n} is {@code d<i>_<n>}, measure
 * {@code k} is {@code m<k>}. {@link #projection()} lists output columns in header order.
 */
public record QueryIr(TableSql table,
                      List<CutSql> cuts,
                      List<DrilldownSql> drills,
                      List<MeasureSql> measures,
                      List<ConstraintSql> filters,
                      ConstraintSql topWhere,
                      TopSql top,
                      SortSql sort,
                      LimitSql limit,
                      GrowthSql growth,
                      GrowthSql rate,
                      RcaSql rca,
                      boolean sparse) {
  public static final String GROWTH_VALUE_ALIAS = "gv";
  public static final String GROWTH_ALIAS = "gr";
  public static final String RATE_ALIAS = "rt";
  public static final String RCA_ALIAS = "rca";

  public QueryIr {
    Objects.requireNonNull(table, "table");
    cuts = List.copyOf(cuts);
    drills = List.copyOf(drills);
    measures = List.copyOf(measures);
    filters = filters == null ? List.of() : List.copyOf(filters);
    if (measures.isEmpty()) throw new IllegalArgumentException("QueryIr requires at least one measure");
  }

  public static String drillAlias(int drill, int column) { return "d" + drill + "_" + column; }
  public static String measureAlias(int measure) { return "m" + measure; }

  public String drillKeyAlias(int drill) {
    return drillAlias(drill, drills.get(drill).keyIndex());
  }

  public boolean hasDerived() {
    return growth != null || rate != null || rca != null;
  }

  /** Output columns in header order: drilldown columns, measures, then derived measures. */
  public List<ProjectedColumn> projection() {
    List<ProjectedColumn> out = new ArrayList<>();
    for (int i = 0; i < drills.size(); i++) {
      List<String> headers = drills.get(i).headers();
      for (int n = 0; n < headers.size(); n++) {
        out.add(new ProjectedColumn(drillAlias(i, n), headers.get(n)));
      }
    }
    for (int k = 0; k < measures.size(); k++) {
      out.add(new ProjectedColumn(measureAlias(k), measures.get(k).name()));
    }
    if (growth != null) {
      String m = measures.get(growth.measureIndex()).name();
      out.add(new ProjectedColumn(GROWTH_VALUE_ALIAS, m + " Growth Value"));
      out.add(new ProjectedColumn(GROWTH_ALIAS, m + " Growth"));
    }
    if (rate != null) {
      out.add(new ProjectedColumn(RATE_ALIAS, measures.get(rate.measureIndex()).name() + " Rate"));
    }
    if (rca != null) {
      out.add(new ProjectedColumn(RCA_ALIAS, measures.get(rca.measureIndex()).name() + " RCA"));
    }
    return out;
  }

  public List<String> headers() {
    List<String> out = new ArrayList<>();
    for (ProjectedColumn c : projection()) out.add(c.header());
    return out;
  }

  public QueryIr withSort(SortSql sort) {
    return new QueryIr(table, cuts, drills, measures, filters, topWhere, top, sort, limit, growth, rate, rca, sparse);
  }
}
