package io.intellixity.tessera.engine.sql;

import io.intellixity.tessera.ir.ConstraintSql;
import io.intellixity.tessera.ir.CutSql;
import io.intellixity.tessera.ir.DrilldownSql;
import io.intellixity.tessera.ir.GrowthSql;
import io.intellixity.tessera.ir.LimitSql;
import io.intellixity.tessera.ir.MeasureSql;
import io.intellixity.tessera.ir.ProjectedColumn;
import io.intellixity.tessera.ir.QueryIr;
import io.intellixity.tessera.ir.RcaSql;
import io.intellixity.tessera.ir.TopSql;
import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.query.Constraint;
import io.intellixity.tessera.query.QueryValidationException;
import io.intellixity.tessera.query.SortDirection;
import io.intellixity.tessera.schema.KeyType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic SQL rendering of a {@link QueryIr}.
 * <p>
 * The statement is built as nested stages, each wrapping the previous one as a derived table:
 * <ol>
 *   <li>aggregate: fact table {@code f} joined to hierarchy tables {@code h0..hn}, cuts, GROUP BY</li>
 *   <li>dense (unless sparse): cross product of member rows, one per hierarchy, LEFT JOIN the aggregate</li>
 *   <li>derived: growth, rate and rca window expressions</li>
 *   <li>predicates: filters and top_where</li>
 *   <li>top: per-level ranking</li>
 *   <li>final: header aliases, ORDER BY, LIMIT</li>
 * </ol>
 * Dialects override the hooks for quoting, lag, ranking and paging.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  protected static final String FACT_ALIAS = "f";
  protected static final String RANK_ALIAS = "top_rank";

  @Override
  public final String render(QueryIr ir) {
    Joins joins = Joins.of(ir);
    String rel = dense(ir) ? renderDense(ir, joins) : renderAggregate(ir, joins, false);
    if (ir.hasDerived()) rel = renderDerived(ir, rel, "t1");
    rel = renderPredicates(ir, rel, "t2");
    if (ir.top() != null) rel = renderTop(ir, ir.top(), rel, "t3");
    return finish(ir, renderFinal(ir, rel, "t"));
  }

  protected abstract String quoteIdent(String ident);

  protected String quoteLiteral(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  /** Member id as a literal of the level's key type. Numeric members are emitted unquoted. */
  protected String renderMember(String member, KeyType keyType) {
    try {
      return switch (keyType) {
        case TEXT -> quoteLiteral(member);
        case INTEGER -> Long.toString(Long.parseLong(member.trim()));
        case FLOAT -> new BigDecimal(member.trim()).toPlainString();
      };
    } catch (NumberFormatException e) {
      throw new QueryValidationException("Member '" + member + "' is not a valid " + keyType, e);
    }
  }

  protected String renderNumber(double v) {
    return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
  }

  /** Value of {@code expr} on the previous row of the window. */
  protected String lag(String expr, List<String> partitionBy, String orderBy) {
    return "LAG(" + expr + ") OVER (" + window(partitionBy, orderBy) + ")";
  }

  protected String toFloat(String expr) {
    return "CAST(" + expr + " AS DOUBLE PRECISION)";
  }

  /** Keeps the first {@code top.n()} rows of {@code rel} per value of {@code partitionBy}. */
  protected String applyTop(String rel, String alias, TopSql top, String partitionBy, String rankBy) {
    String inner = "SELECT " + alias + "_r.*, ROW_NUMBER() OVER (PARTITION BY " + alias + "_r." + partitionBy
        + " ORDER BY " + orderTerm(alias + "_r." + rankBy, top.direction()) + ") AS " + RANK_ALIAS
        + " FROM (" + rel + ") AS " + alias + "_r";
    return "SELECT " + alias + ".* FROM (" + inner + ") AS " + alias + " WHERE " + alias + "." + RANK_ALIAS + " <= " + top.n();
  }

  /** Missing values sort last in both directions. */
  protected String orderTerm(String expr, SortDirection direction) {
    return expr + " " + direction.sql() + " NULLS LAST";
  }

  protected String applyLimit(String sql, LimitSql limit) {
    String out = sql + " LIMIT " + limit.n();
    return limit.offset() > 0 ? out + " OFFSET " + limit.offset() : out;
  }

  /** Last chance to append statement-level settings. */
  protected String finish(QueryIr ir, String sql) {
    return sql;
  }

  protected String window(List<String> partitionBy, String orderBy) {
    StringBuilder sb = new StringBuilder();
    if (!partitionBy.isEmpty()) sb.append("PARTITION BY ").append(String.join(", ", partitionBy));
    if (orderBy != null) {
      if (sb.length() > 0) sb.append(' ');
      sb.append("ORDER BY ").append(orderBy);
    }
    return sb.toString();
  }

  private String renderAggregate(QueryIr ir, Joins joins, boolean keysOnly) {
    List<String> select = new ArrayList<>();
    List<String> groupBy = new ArrayList<>();
    for (int i = 0; i < ir.drills().size(); i++) {
      DrilldownSql d = ir.drills().get(i);
      String q = joins.qualifier(d.levelName());
      List<String> cols = d.columns();
      for (int n = 0; n < cols.size(); n++) {
        if (keysOnly && n != d.keyIndex()) continue;
        String expr = q + "." + cols.get(n);
        select.add(expr + " AS " + (keysOnly ? keyAlias(i) : QueryIr.drillAlias(i, n)));
        if (!groupBy.contains(expr)) groupBy.add(expr);
      }
    }
    for (int k = 0; k < ir.measures().size(); k++) {
      MeasureSql m = ir.measures().get(k);
      select.add(m.aggregator().sql(FACT_ALIAS + "." + m.column()) + " AS " + QueryIr.measureAlias(k));
    }

    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", select))
        .append(" FROM ").append(ir.table().name()).append(" AS ").append(FACT_ALIAS);
    for (Joins.Join j : joins.all()) {
      sql.append(" INNER JOIN ").append(j.table()).append(" AS ").append(j.alias())
          .append(" ON ").append(FACT_ALIAS).append('.').append(j.foreignKey())
          .append(" = ").append(j.alias()).append('.').append(j.primaryKey());
    }
    List<String> where = new ArrayList<>();
    for (CutSql c : ir.cuts()) where.add(cutPredicate(c, joins.qualifier(c.levelName())));
    if (!where.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", where));
    if (!groupBy.isEmpty()) sql.append(" GROUP BY ").append(String.join(", ", groupBy));
    return sql.toString();
  }

  private String renderDense(QueryIr ir, Joins joins) {
    Map<String, List<Integer>> byHierarchy = new LinkedHashMap<>();
    for (int i = 0; i < ir.drills().size(); i++) {
      byHierarchy.computeIfAbsent(Joins.key(ir.drills().get(i).levelName()), k -> new ArrayList<>()).add(i);
    }
    String[] memOf = new String[ir.drills().size()];
    StringBuilder from = new StringBuilder();
    int g = 0;
    for (List<Integer> group : byHierarchy.values()) {
      String mem = "mem" + g++;
      if (from.length() > 0) from.append(" CROSS JOIN ");
      from.append('(').append(renderMembers(ir, group)).append(") AS ").append(mem);
      for (int i : group) memOf[i] = mem;
    }

    List<String> select = new ArrayList<>();
    List<String> on = new ArrayList<>();
    for (int i = 0; i < ir.drills().size(); i++) {
      DrilldownSql d = ir.drills().get(i);
      for (int n = 0; n < d.columns().size(); n++) {
        select.add(memOf[i] + "." + QueryIr.drillAlias(i, n) + " AS " + QueryIr.drillAlias(i, n));
      }
      on.add(memOf[i] + "." + QueryIr.drillAlias(i, d.keyIndex()) + " = agg." + keyAlias(i));
    }
    for (int k = 0; k < ir.measures().size(); k++) {
      select.add("agg." + QueryIr.measureAlias(k) + " AS " + QueryIr.measureAlias(k));
    }
    return "SELECT " + String.join(", ", select) + " FROM " + from
        + " LEFT JOIN (" + renderAggregate(ir, joins, true) + ") AS agg ON " + String.join(" AND ", on);
  }

  /**
   * Distinct member rows of one hierarchy, projecting every drilled level of that hierarchy from the
   * same row so only combinations present in the hierarchy come out. Narrowed by cuts on the hierarchy.
   */
  private String renderMembers(QueryIr ir, List<Integer> group) {
    DrilldownSql first = ir.drills().get(group.get(0));
    String q = first.inline() ? FACT_ALIAS : "h";
    List<String> select = new ArrayList<>();
    for (int i : group) {
      List<String> cols = ir.drills().get(i).columns();
      for (int n = 0; n < cols.size(); n++) select.add(q + "." + cols.get(n) + " AS " + QueryIr.drillAlias(i, n));
    }
    String source = first.inline() ? ir.table().name() : first.table().name();
    StringBuilder sql = new StringBuilder("SELECT DISTINCT ").append(String.join(", ", select))
        .append(" FROM ").append(source).append(" AS ").append(q);
    List<String> where = new ArrayList<>();
    for (CutSql c : ir.cuts()) {
      if (sameHierarchy(c.levelName(), first.levelName())) where.add(cutPredicate(c, q));
    }
    if (!where.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", where));
    return sql.toString();
  }

  private String renderDerived(QueryIr ir, String rel, String t) {
    List<String> select = new ArrayList<>();
    select.add(t + ".*");
    if (ir.growth() != null) {
      String cur = t + "." + QueryIr.measureAlias(ir.growth().measureIndex());
      String prev = lagOf(ir, ir.growth(), t);
      select.add("(" + cur + " - " + prev + ") AS " + QueryIr.GROWTH_VALUE_ALIAS);
      select.add(growthRatio(cur, prev) + " AS " + QueryIr.GROWTH_ALIAS);
    }
    if (ir.rate() != null) {
      String cur = t + "." + QueryIr.measureAlias(ir.rate().measureIndex());
      select.add("(100 * " + growthRatio(cur, lagOf(ir, ir.rate(), t)) + ") AS " + QueryIr.RATE_ALIAS);
    }
    if (ir.rca() != null) select.add(rca(ir, ir.rca(), t) + " AS " + QueryIr.RCA_ALIAS);
    return "SELECT " + String.join(", ", select) + " FROM (" + rel + ") AS " + t;
  }

  private String lagOf(QueryIr ir, GrowthSql g, String t) {
    String m = t + "." + QueryIr.measureAlias(g.measureIndex());
    return lag(m, otherKeys(ir, t, g.timeDrillIndex()), t + "." + ir.drillKeyAlias(g.timeDrillIndex()));
  }

  private String growthRatio(String cur, String prev) {
    return "(" + toFloat(cur + " - " + prev) + " / NULLIF(" + toFloat(prev) + ", 0))";
  }

  private String rca(QueryIr ir, RcaSql rca, String t) {
    String m = t + "." + QueryIr.measureAlias(rca.measureIndex());
    List<String> rest = otherKeys(ir, t, rca.drillIndex1(), rca.drillIndex2());
    List<String> byA = new ArrayList<>(rest);
    byA.add(t + "." + ir.drillKeyAlias(rca.drillIndex1()));
    List<String> byB = new ArrayList<>(rest);
    byB.add(t + "." + ir.drillKeyAlias(rca.drillIndex2()));
    String sumA = toFloat("SUM(" + m + ") OVER (" + window(byA, null) + ")");
    String sumB = toFloat("SUM(" + m + ") OVER (" + window(byB, null) + ")");
    String sumAll = toFloat("SUM(" + m + ") OVER (" + window(rest, null) + ")");
    return "((" + toFloat(m) + " / NULLIF(" + sumA + ", 0)) / NULLIF(" + sumB + " / NULLIF(" + sumAll + ", 0), 0))";
  }

  private String renderPredicates(QueryIr ir, String rel, String t) {
    List<String> where = new ArrayList<>();
    for (ConstraintSql f : ir.filters()) where.add(constraint(f, t));
    if (ir.topWhere() != null) where.add(constraint(ir.topWhere(), t));
    if (where.isEmpty()) return rel;
    return "SELECT " + t + ".* FROM (" + rel + ") AS " + t + " WHERE " + String.join(" AND ", where);
  }

  private String renderTop(QueryIr ir, TopSql top, String rel, String t) {
    return applyTop(rel, t, top, ir.drillKeyAlias(top.drillIndex()), QueryIr.measureAlias(top.measureIndex()));
  }

  private String renderFinal(QueryIr ir, String rel, String t) {
    List<String> select = new ArrayList<>();
    for (ProjectedColumn c : ir.projection()) select.add(t + "." + c.alias() + " AS " + quoteIdent(c.header()));
    String sql = "SELECT " + String.join(", ", select) + " FROM (" + rel + ") AS " + t;
    if (ir.sort() != null) sql += " ORDER BY " + orderTerm(t + "." + ir.sort().alias(), ir.sort().direction());
    if (ir.limit() != null) sql = applyLimit(sql, ir.limit());
    return sql;
  }

  private String cutPredicate(CutSql c, String qualifier) {
    List<String> lits = new ArrayList<>(c.members().size());
    for (String m : c.members()) lits.add(renderMember(m, c.keyType()));
    return qualifier + "." + c.column() + (c.exclude() ? " NOT IN (" : " IN (") + String.join(", ", lits) + ")";
  }

  private String constraint(ConstraintSql c, String t) {
    String col = t + "." + c.alias();
    String first = comparison(col, c.first());
    if (c.second() == null) return first;
    return "(" + first + " " + c.conjunction().name() + " " + comparison(col, c.second()) + ")";
  }

  private String comparison(String col, Constraint c) {
    return col + " " + c.comparison().sql() + " " + renderNumber(c.value());
  }

  private static List<String> otherKeys(QueryIr ir, String t, int... excluded) {
    List<String> out = new ArrayList<>();
    outer:
    for (int i = 0; i < ir.drills().size(); i++) {
      for (int x : excluded) {
        if (x == i) continue outer;
      }
      out.add(t + "." + ir.drillKeyAlias(i));
    }
    return out;
  }

  private static String keyAlias(int drill) {
    return "k" + drill;
  }

  /** Dense queries left-join the aggregate onto every combination of drilldown members. */
  protected static boolean dense(QueryIr ir) {
    return !ir.sparse() && !ir.drills().isEmpty();
  }

  private static boolean sameHierarchy(LevelName a, LevelName b) {
    return a.dimension().equals(b.dimension()) && a.hierarchy().equals(b.hierarchy());
  }

  /** Hierarchy tables joined to the fact table, one alias per (dimension, hierarchy). */
  static final class Joins {
    record Join(String alias, String table, String foreignKey, String primaryKey) {}

    private final Map<String, Join> byHierarchy = new LinkedHashMap<>();

    static Joins of(QueryIr ir) {
      Joins j = new Joins();
      for (DrilldownSql d : ir.drills()) {
        if (!d.inline()) j.add(d.levelName(), d.table().name(), d.foreignKey(), d.primaryKey());
      }
      for (CutSql c : ir.cuts()) {
        if (!c.inline()) j.add(c.levelName(), c.table().name(), c.foreignKey(), c.primaryKey());
      }
      return j;
    }

    private void add(LevelName ln, String table, String fk, String pk) {
      byHierarchy.computeIfAbsent(key(ln), k -> new Join("h" + byHierarchy.size(), table, fk, pk));
    }

    String qualifier(LevelName ln) {
      Join j = byHierarchy.get(key(ln));
      return j == null ? FACT_ALIAS : j.alias();
    }

    List<Join> all() {
      return List.copyOf(byHierarchy.values());
    }

    private static String key(LevelName ln) {
      return ln.dimension() + "." + ln.hierarchy();
    }
  }
}
