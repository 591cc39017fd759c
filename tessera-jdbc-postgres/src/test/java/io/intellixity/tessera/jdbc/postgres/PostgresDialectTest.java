package io.intellixity.tessera.jdbc.postgres;

import io.intellixity.tessera.engine.sql.SqlDialects;
import io.intellixity.tessera.query.FilterQuery;
import io.intellixity.tessera.query.LimitQuery;
import io.intellixity.tessera.query.Query;
import io.intellixity.tessera.query.RateQuery;
import io.intellixity.tessera.query.TopQuery;
import io.intellixity.tessera.query.TopWhereQuery;
import io.intellixity.tessera.schema.Schema;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private static final Schema SCHEMA = load();
  private final PostgresDialect d = new PostgresDialect();

  private static Schema load() {
    InputStream in = PostgresDialectTest.class.getClassLoader().getResourceAsStream("schema/sales.json");
    return Schema.fromJson(in);
  }

  private String render(Query q) {
    return d.render(SCHEMA.sqlQuery("sales", q).queryIr());
  }

  @Test
  void quotesHeadersWithDoubleQuotes() {
    String sql = render(new Query().drilldown("geo.country.country").measure("revenue").withSparse(true));
    assertTrue(sql.startsWith("SELECT t.d0_0 AS \"country ID\", t.d0_1 AS \"country\", t.m0 AS \"revenue\" FROM ("), sql);
    assertEquals("\"a\"\"b\"", d.quoteIdent("a\"b"));
  }

  @Test
  void alwaysRendersOffset() {
    String sql = render(new Query().drilldown("geo.country.state").measure("revenue").withLimit(LimitQuery.parse("20")));
    assertTrue(sql.endsWith(" LIMIT 20 OFFSET 0"), sql);
  }

  @Test
  void topRanksWithRowNumber() {
    String sql = render(new Query()
        .drilldown("time.time.year")
        .drilldown("geo.country.state")
        .measure("revenue")
        .withSparse(true)
        .withTop(TopQuery.parse("3,time.time.year,revenue,asc")));
    assertTrue(sql.contains("ROW_NUMBER() OVER (PARTITION BY t3_r.d0_0 ORDER BY t3_r.m0 ASC NULLS LAST) AS top_rank"), sql);
    assertTrue(sql.contains("WHERE t3.top_rank <= 3"), sql);
  }

  @Test
  void rateIsPercentOfPreviousPeriod() {
    String sql = render(new Query()
        .drilldown("time.time.year")
        .measure("revenue")
        .withSparse(true)
        .withRate(RateQuery.parse("time.time.year,revenue")));
    assertTrue(sql.contains("(100 * "), sql);
    assertTrue(sql.contains("LAG(t1.m0) OVER (ORDER BY t1.d0_0)"), sql);
    assertTrue(sql.contains("AS \"revenue Rate\""), sql);
  }

  @Test
  void predicatesWrapAggregate() {
    String sql = render(new Query()
        .drilldown("geo.country.state")
        .measure("revenue")
        .measure("quantity")
        .withSparse(true)
        .withFilters(List.of(FilterQuery.parse("quantity.gte.10.and.lt.20.5")))
        .withTopWhere(TopWhereQuery.parse("revenue,gt,1000")));
    assertTrue(sql.contains("WHERE (t2.m1 >= 10 AND t2.m1 < 20.5) AND t2.m0 > 1000"), sql);
  }

  @Test
  void registeredThroughFactories() {
    assertInstanceOf(PostgresDialect.class, new SqlDialects().get(PostgresDialect.ID));
  }
}
