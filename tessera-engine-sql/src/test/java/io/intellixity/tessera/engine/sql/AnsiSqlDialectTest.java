package io.intellixity.tessera.engine.sql;

import io.intellixity.tessera.ir.QueryIr;
import io.intellixity.tessera.query.FilterQuery;
import io.intellixity.tessera.query.GrowthQuery;
import io.intellixity.tessera.query.LimitQuery;
import io.intellixity.tessera.query.Query;
import io.intellixity.tessera.query.RcaQuery;
import io.intellixity.tessera.query.TopQuery;
import io.intellixity.tessera.query.TopWhereQuery;
import io.intellixity.tessera.schema.Schema;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AnsiSqlDialectTest {
  private static final Schema SCHEMA = load();
  private final AnsiSqlDialect dialect = new AnsiSqlDialect();

  private static Schema load() {
    InputStream in = AnsiSqlDialectTest.class.getClassLoader().getResourceAsStream("schema/sales.json");
    return Schema.fromJson(in);
  }

  private String render(Query q) {
    QueryIr ir = SCHEMA.sqlQuery("sales", q).queryIr();
    return dialect.render(ir);
  }

  @Test
  void sparseAggregateJoinsGroupsAndAliasesHeaders() {
    String sql = render(new Query().drilldown("geo.country.state").measure("revenue").withSparse(true));
    String agg = "SELECT h0.state_id AS d0_0, SUM(f.revenue) AS m0 FROM db.sales_fact AS f"
        + " INNER JOIN geo_dim AS h0 ON f.state_id = h0.state_id GROUP BY h0.state_id";
    assertEquals("SELECT t.d0_0 AS \"state\", t.m0 AS \"revenue\" FROM (" + agg + ") AS t ORDER BY t.m0 DESC NULLS LAST", sql);
  }

  @Test
  void denseModeLeftJoinsAggregateOntoMembers() {
    String sql = render(new Query().drilldown("geo.country.country").drilldown("time.time.year").measure("revenue"));
    assertTrue(sql.contains("SELECT DISTINCT h.country_id AS d0_0, h.country_name AS d0_1 FROM geo_dim AS h"), sql);
    assertTrue(sql.contains("SELECT DISTINCT f.year AS d1_0 FROM db.sales_fact AS f"), sql);
    assertTrue(sql.contains(" CROSS JOIN "), sql);
    assertTrue(sql.contains("LEFT JOIN (SELECT h0.country_id AS k0, f.year AS k1, SUM(f.revenue) AS m0"), sql);
    assertTrue(sql.contains("ON mem0.d0_0 = agg.k0 AND mem1.d1_0 = agg.k1"), sql);
  }

  @Test
  void denseLevelsOfOneHierarchyShareMemberRows() {
    String sql = render(new Query().drilldown("geo.country.country").drilldown("geo.country.state").measure("revenue"));
    assertTrue(sql.contains("SELECT DISTINCT h.country_id AS d0_0, h.country_name AS d0_1, h.state_id AS d1_0 FROM geo_dim AS h"), sql);
    assertFalse(sql.contains(" CROSS JOIN "), sql);
    assertTrue(sql.contains("ON mem0.d0_0 = agg.k0 AND mem0.d1_0 = agg.k1"), sql);
  }

  @Test
  void cutsRenderTypedLiterals() {
    String sql = render(new Query()
        .cut("geo.country.country.1,2")
        .cut("~product.product.category.o'neil")
        .cut("time.time.year.2020")
        .measure("revenue"));
    assertTrue(sql.contains("h0.country_id IN (1, 2)"), sql);
    assertTrue(sql.contains("h1.category_id NOT IN ('o''neil')"), sql);
    assertTrue(sql.contains("f.year IN (2020)"), sql);
    assertTrue(sql.contains("INNER JOIN db.product_dim AS h1 ON f.product_id = h1.category_id"), sql);
    assertFalse(sql.contains("GROUP BY"), sql);
  }

  @Test
  void cutsNarrowDenseMembersOfTheSameHierarchy() {
    String sql = render(new Query().drilldown("geo.country.state").measure("revenue").withExcludeDefaultMembers(true));
    assertTrue(sql.contains("SELECT DISTINCT h.state_id AS d0_0 FROM geo_dim AS h WHERE h.state_id NOT IN ('0')"), sql);
    assertTrue(sql.contains("WHERE h0.state_id NOT IN ('0') GROUP BY h0.state_id"), sql);
  }

  @Test
  void growthUsesLagOverOtherDrilldowns() {
    String sql = render(new Query()
        .drilldown("time.time.year")
        .drilldown("geo.country.state")
        .measure("revenue")
        .withSparse(true)
        .withGrowth(GrowthQuery.parse("time.time.year,revenue")));
    assertTrue(sql.contains("LAG(t1.m0) OVER (PARTITION BY t1.d1_0 ORDER BY t1.d0_0)"), sql);
    assertTrue(sql.contains("AS gv"), sql);
    assertTrue(sql.contains("NULLIF(CAST(LAG(t1.m0)"), sql);
    assertTrue(sql.contains("t.gr AS \"revenue Growth\""), sql);
  }

  @Test
  void rcaUsesWindowSums() {
    String sql = render(new Query()
        .drilldown("geo.country.state")
        .drilldown("product.product.category")
        .measure("revenue")
        .withSparse(true)
        .withRca(RcaQuery.parse("geo.country.state,product.product.category,revenue")));
    assertTrue(sql.contains("SUM(t1.m0) OVER (PARTITION BY t1.d0_0)"), sql);
    assertTrue(sql.contains("SUM(t1.m0) OVER (PARTITION BY t1.d1_0)"), sql);
    assertTrue(sql.contains("SUM(t1.m0) OVER ()"), sql);
    assertTrue(sql.contains("t.rca AS \"revenue RCA\""), sql);
  }

  @Test
  void filtersTopWhereTopAndLimit() {
    Query q = new Query()
        .drilldown("time.time.year")
        .drilldown("geo.country.state")
        .measure("revenue")
        .measure("quantity")
        .withSparse(true)
        .withFilters(List.of(FilterQuery.parse("revenue.gt.1000.5.and.lte.9000")))
        .withTopWhere(TopWhereQuery.parse("quantity,gte,10"))
        .withTop(TopQuery.parse("3,time.time.year,revenue"))
        .withLimit(LimitQuery.parse("20,10"));
    String sql = render(q);
    assertTrue(sql.contains("WHERE (t2.m0 > 1000.5 AND t2.m0 <= 9000) AND t2.m1 >= 10"), sql);
    assertTrue(sql.contains("ROW_NUMBER() OVER (PARTITION BY t3_r.d0_0 ORDER BY t3_r.m0 DESC NULLS LAST) AS top_rank"), sql);
    assertTrue(sql.contains("WHERE t3.top_rank <= 3"), sql);
    assertTrue(sql.endsWith("ORDER BY t.m0 DESC NULLS LAST LIMIT 10 OFFSET 20"), sql);
  }
}
