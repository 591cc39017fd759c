package io.intellixity.tessera.schema;

import io.intellixity.tessera.ir.ConstraintSql;
import io.intellixity.tessera.ir.CutSql;
import io.intellixity.tessera.ir.DrilldownSql;
import io.intellixity.tessera.ir.GrowthSql;
import io.intellixity.tessera.ir.LevelColumn;
import io.intellixity.tessera.ir.LimitSql;
import io.intellixity.tessera.ir.MeasureSql;
import io.intellixity.tessera.ir.ProjectedColumn;
import io.intellixity.tessera.ir.PropertyColumn;
import io.intellixity.tessera.ir.QueryIr;
import io.intellixity.tessera.ir.QueryIrHeaders;
import io.intellixity.tessera.ir.RcaSql;
import io.intellixity.tessera.ir.SortSql;
import io.intellixity.tessera.ir.TableSql;
import io.intellixity.tessera.ir.TopSql;
import io.intellixity.tessera.names.Cut;
import io.intellixity.tessera.names.Drilldown;
import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;
import io.intellixity.tessera.names.PropertyName;
import io.intellixity.tessera.query.FilterQuery;
import io.intellixity.tessera.query.Query;
import io.intellixity.tessera.query.QueryValidationException;
import io.intellixity.tessera.query.SortDirection;
import io.intellixity.tessera.query.SortQuery;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Validates a {@link Query} against one cube and binds it to a {@link QueryIr}. */
final class QueryResolver {
  private final Cube cube;
  private final Query query;

  QueryResolver(Cube cube, Query query) {
    this.cube = cube;
    this.query = query;
  }

  /** Checks that need no cube; run before the cube is looked up. */
  static void checkShape(Query query) {
    if (query.measures().isEmpty()) {
      throw new QueryValidationException("No measure found; please specify at least one");
    }
    if (query.drilldowns().isEmpty() && query.cuts().isEmpty()) {
      throw new QueryValidationException("Either a drilldown or cut is required");
    }
  }

  QueryIrHeaders resolve() {
    checkShape(query);

    List<MeasureSql> meas = meaCols(cube, query.measures());
    List<DrilldownSql> drills = drillCols(cube, query.drilldowns(), query.properties(), query.captions(), query.parents());
    List<CutSql> cuts = new ArrayList<>(cutCols(cube, query.cuts()));
    if (query.excludeDefaultMembers()) cuts.addAll(defaultMemberCuts());

    List<ConstraintSql> filters = new ArrayList<>();
    for (FilterQuery f : query.filters()) {
      String alias = QueryIr.measureAlias(measureIndex(f.measure(), "filters"));
      filters.add(new ConstraintSql(alias, f.first(), f.conjunction(), f.second()));
    }

    ConstraintSql topWhere = null;
    if (query.topWhere() != null) {
      String alias = QueryIr.measureAlias(measureIndex(query.topWhere().measure(), "top_where"));
      topWhere = new ConstraintSql(alias, query.topWhere().constraint());
    }

    TopSql top = null;
    if (query.top() != null) {
      top = new TopSql(query.top().n(),
          drillIndex(query.top().level(), "top"),
          measureIndex(query.top().measure(), "top"),
          query.top().direction());
    }

    GrowthSql growth = null;
    if (query.growth() != null) {
      growth = new GrowthSql(drillIndex(query.growth().timeLevel(), "growth"), measureIndex(query.growth().measure(), "growth"));
    }
    GrowthSql rate = null;
    if (query.rate() != null) {
      rate = new GrowthSql(drillIndex(query.rate().timeLevel(), "rate"), measureIndex(query.rate().measure(), "rate"));
    }
    RcaSql rca = null;
    if (query.rca() != null) {
      rca = new RcaSql(drillIndex(query.rca().level1(), "rca"),
          drillIndex(query.rca().level2(), "rca"),
          measureIndex(query.rca().measure(), "rca"));
    }

    LimitSql limit = query.limit() == null ? null : new LimitSql(query.limit().offset(), query.limit().n());

    QueryIr ir = new QueryIr(new TableSql(cube.table().fullName()), cuts, drills, meas, filters,
        topWhere, top, null, limit, growth, rate, rca, query.sparse());
    ir = ir.withSort(sort(ir, query.sort()));
    return new QueryIrHeaders(ir, ir.headers());
  }

  private SortSql sort(QueryIr ir, SortQuery sort) {
    if (sort == null) return new SortSql(QueryIr.measureAlias(0), SortDirection.DESC);
    String col = sort.column();
    for (int k = 0; k < ir.measures().size(); k++) {
      if (ir.measures().get(k).name().equals(col)) return new SortSql(QueryIr.measureAlias(k), sort.direction());
    }
    for (ProjectedColumn pc : ir.projection()) {
      if (pc.header().equals(col)) return new SortSql(pc.alias(), sort.direction());
    }
    for (int i = 0; i < ir.drills().size(); i++) {
      if (ir.drills().get(i).levelName().toString().equals(col)) return new SortSql(ir.drillKeyAlias(i), sort.direction());
    }
    throw new QueryValidationException("Sort column '" + col + "' is neither a query measure, an output header nor a drilldown");
  }

  private List<CutSql> defaultMemberCuts() {
    Set<LevelName> cut = new HashSet<>();
    for (Cut c : query.cuts()) cut.add(c.levelName());
    List<CutSql> out = new ArrayList<>();
    for (Drilldown d : query.drilldowns()) {
      LevelRef ref = cube.level(d.levelName());
      List<String> defaults = ref.level().defaultMembers();
      if (defaults.isEmpty() || cut.contains(d.levelName())) continue;
      out.add(cutSql(ref, defaults, true));
    }
    return out;
  }

  private int measureIndex(MeasureName mn, String option) {
    for (int k = 0; k < query.measures().size(); k++) {
      if (query.measures().get(k).equals(mn)) return k;
    }
    cube.measure(mn);
    throw new QueryValidationException("Measure '" + mn + "' used by " + option + " must also be requested in measures");
  }

  private int drillIndex(LevelName ln, String option) {
    for (int i = 0; i < query.drilldowns().size(); i++) {
      if (query.drilldowns().get(i).levelName().equals(ln)) return i;
    }
    cube.level(ln);
    throw new QueryValidationException("Level '" + ln + "' used by " + option + " must also be a drilldown");
  }

  static List<MeasureSql> meaCols(Cube cube, List<MeasureName> measures) {
    List<MeasureSql> out = new ArrayList<>();
    for (MeasureName mn : measures) {
      Measure m = cube.measure(mn);
      out.add(new MeasureSql(m.name(), m.column(), m.aggregator()));
    }
    return out;
  }

  static List<CutSql> cutCols(Cube cube, List<Cut> cuts) {
    List<CutSql> out = new ArrayList<>();
    for (Cut c : cuts) {
      LevelRef ref = cube.level(c.levelName());
      for (String m : c.members()) {
        if (!ref.level().keyType().accepts(m)) {
          throw new QueryValidationException("Cut member '" + m + "' on '" + c.levelName() + "' is not a valid " + ref.level().keyType());
        }
      }
      out.add(cutSql(ref, c.members(), c.exclude()));
    }
    return out;
  }

  static List<PropertyColumn> propertyCols(Cube cube, List<PropertyName> properties) {
    List<PropertyColumn> out = new ArrayList<>();
    for (PropertyName pn : properties) {
      LevelProperty p = property(cube, pn);
      out.add(new PropertyColumn(p.name(), p.column()));
    }
    return out;
  }

  static List<DrilldownSql> drillCols(Cube cube, List<Drilldown> drilldowns, List<PropertyName> properties,
                                      List<PropertyName> captions, boolean parents) {
    Set<LevelName> drilled = new HashSet<>();
    for (Drilldown d : drilldowns) {
      if (!drilled.add(d.levelName())) throw new QueryValidationException("Duplicate drilldown '" + d.levelName() + "'");
    }
    for (PropertyName p : properties) {
      property(cube, p);
      if (!drilled.contains(p.levelName())) {
        throw new QueryValidationException("Property '" + p + "' requires a drilldown on '" + p.levelName() + "'");
      }
    }
    for (PropertyName c : captions) {
      property(cube, c);
      if (!drilled.contains(c.levelName()) && !(parents && isParentOfDrilled(cube, c.levelName(), drilled))) {
        throw new QueryValidationException("Caption '" + c + "' requires a drilldown on '" + c.levelName() + "'");
      }
    }

    List<DrilldownSql> out = new ArrayList<>();
    for (Drilldown d : drilldowns) {
      LevelRef ref = cube.level(d.levelName());
      List<LevelColumn> levelCols = new ArrayList<>();
      if (parents) {
        for (int i = 0; i < ref.depth(); i++) {
          Level parent = ref.hierarchy().levels().get(i);
          LevelName pn = new LevelName(d.levelName().dimension(), d.levelName().hierarchy(), parent.name());
          levelCols.add(levelColumn(cube, pn, parent, captions));
        }
      }
      levelCols.add(levelColumn(cube, d.levelName(), ref.level(), captions));

      List<PropertyColumn> props = new ArrayList<>();
      for (PropertyName p : properties) {
        if (!p.levelName().equals(d.levelName())) continue;
        LevelProperty lp = property(cube, p);
        props.add(new PropertyColumn(lp.name(), lp.column()));
      }
      out.add(new DrilldownSql(d.levelName(), tableOf(ref), ref.dimension().foreignKey(), ref.hierarchy().primaryKey(),
          levelCols, props));
    }
    return out;
  }

  private static boolean isParentOfDrilled(Cube cube, LevelName ln, Set<LevelName> drilled) {
    LevelRef ref = cube.level(ln);
    for (LevelName d : drilled) {
      LevelRef dr = cube.level(d);
      if (dr.sameHierarchy(ref) && ref.depth() < dr.depth()) return true;
    }
    return false;
  }

  private static LevelColumn levelColumn(Cube cube, LevelName ln, Level level, List<PropertyName> captions) {
    String display = level.nameColumn();
    for (PropertyName c : captions) {
      if (c.levelName().equals(ln)) display = property(cube, c).column();
    }
    return new LevelColumn(level.name(), level.keyColumn(), display);
  }

  private static LevelProperty property(Cube cube, PropertyName pn) {
    LevelRef ref = cube.level(pn.levelName());
    return ref.level().property(pn.property())
        .orElseThrow(() -> new NotFoundException("Property '" + pn + "' not found in cube '" + cube.name() + "'"));
  }

  private static CutSql cutSql(LevelRef ref, List<String> members, boolean exclude) {
    return new CutSql(ref.name(), tableOf(ref), ref.dimension().foreignKey(), ref.hierarchy().primaryKey(),
        ref.level().keyColumn(), ref.level().keyType(), members, exclude);
  }

  private static TableSql tableOf(LevelRef ref) {
    return ref.hierarchy().inline() ? null : new TableSql(ref.hierarchy().table().fullName());
  }
}
