package io.intellixity.tessera.schema;

import io.intellixity.tessera.ir.CutSql;
import io.intellixity.tessera.ir.DrilldownSql;
import io.intellixity.tessera.ir.MeasureSql;
import io.intellixity.tessera.ir.PropertyColumn;
import io.intellixity.tessera.names.Cut;
import io.intellixity.tessera.names.Drilldown;
import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;
import io.intellixity.tessera.names.PropertyName;
import io.intellixity.tessera.support.TestSchemas;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaTest {
  private final Schema schema = TestSchemas.sales();

  @Test
  void loadsCubesInDeclarationOrder() {
    assertEquals("retail", schema.name());
    assertEquals(List.of("sales", "inventory"), schema.cubes().stream().map(Cube::name).toList());

    Cube sales = schema.cubeMetadata("sales").orElseThrow();
    assertEquals("db.sales_fact", sales.table().fullName());
    assertEquals(0, sales.minAuthLevel());
    assertEquals(Aggregator.COUNT_DISTINCT, sales.measure(new MeasureName("orders")).aggregator());
    assertTrue(schema.cubeMetadata("nope").isEmpty());
  }

  @Test
  void hierarchyPrimaryKeyDefaultsToFirstLevelKey() {
    Cube sales = schema.cube("sales");
    LevelRef product = sales.level(LevelName.parse("product.product.product"));
    assertEquals("category_id", product.hierarchy().primaryKey());
    assertEquals("db.product_dim", product.hierarchy().table().fullName());

    LevelRef year = sales.level(LevelName.parse("time.time.year"));
    assertTrue(year.hierarchy().inline());
    assertEquals(KeyType.INTEGER, year.level().keyType());
  }

  @Test
  void enumeratesLevelsAndMeasures() {
    Cube sales = schema.cube("sales");
    assertEquals(List.of(
        LevelName.parse("geo.country.country"),
        LevelName.parse("geo.country.state"),
        LevelName.parse("time.time.year"),
        LevelName.parse("time.time.month"),
        LevelName.parse("product.product.category"),
        LevelName.parse("product.product.product")), List.copyOf(sales.allLevelNames()));
    assertEquals(3, sales.allMeasureNames().size());
  }

  @Test
  void levelParentsAreRootFirst() {
    Cube sales = schema.cube("sales");
    assertEquals(List.of(LevelName.parse("time.time.year")), sales.levelParents(LevelName.parse("time.time.month")));
    assertTrue(sales.levelParents(LevelName.parse("geo.country.country")).isEmpty());
  }

  @Test
  void resolvesColumnsInRequestOrder() {
    List<MeasureSql> meas = schema.cubeMeaCols("sales", List.of(new MeasureName("quantity"), new MeasureName("revenue")));
    assertEquals(List.of("quantity", "revenue"), meas.stream().map(MeasureSql::column).toList());

    List<DrilldownSql> drills = schema.cubeDrillCols("sales", List.of(Drilldown.parse("geo.country.country")));
    assertEquals(List.of("country_id", "country_name"), drills.get(0).columns());
    assertEquals("geo_dim", drills.get(0).table().name());
    assertEquals("state_id", drills.get(0).foreignKey());

    List<CutSql> cuts = schema.cubeCutCols("sales", List.of(Cut.parse("time.time.year.2020,2021")));
    assertTrue(cuts.get(0).inline());
    assertEquals("year", cuts.get(0).column());

    List<PropertyColumn> props = schema.cubePropertyCols("sales", List.of(PropertyName.parse("geo.country.state.Abbrev")));
    assertEquals("abbrev", props.get(0).column());
  }

  @Test
  void unknownIdentifiersAreNotFound() {
    NotFoundException e = assertThrows(NotFoundException.class,
        () -> schema.cubeMeaCols("sales", List.of(new MeasureName("profit"))));
    assertTrue(e.getMessage().contains("profit"));
    assertThrows(NotFoundException.class,
        () -> schema.cubeDrillCols("sales", List.of(Drilldown.parse("geo.country.city"))));
    assertThrows(NotFoundException.class,
        () -> schema.cubePropertyCols("sales", List.of(PropertyName.parse("geo.country.state.Nope"))));
    assertThrows(NotFoundException.class, () -> schema.cubeMeaCols("nope", List.of()));
  }

  @Test
  void sourceDataSummarizesCube() {
    CubeSourceData sd = schema.cube("sales").sourceData();
    assertEquals("sales", sd.name());
    assertEquals(List.of("revenue", "quantity", "orders"), sd.measures());
    assertEquals(Map.of("source", "x", "topic", "retail"), sd.annotations());
  }

  @Test
  void duplicateCubeNamesResolveToFirst() {
    String json = """
        {"cubes": [
          {"name": "c", "table": {"name": "t1"}, "measures": [{"name": "m", "column": "a", "aggregator": "sum"}]},
          {"name": "c", "table": {"name": "t2"}, "measures": [{"name": "m", "column": "b", "aggregator": "sum"}]}
        ]}
        """;
    Schema s = Schema.fromJson(json);
    assertEquals(2, s.cubes().size());
    assertEquals("t1", s.cube("c").table().name());
  }

  @Test
  void rejectsInvalidDocuments() {
    assertThrows(SchemaException.class, () -> Schema.fromJson("{not json"));
    assertThrows(SchemaException.class, () -> Schema.fromJson(
        "{\"cubes\":[{\"name\":\"c\",\"table\":{\"name\":\"t\"},\"measures\":[{\"name\":\"m\",\"column\":\"a\",\"aggregator\":\"median\"}]}]}"));
    assertThrows(SchemaException.class, () -> Schema.fromJson("""
        {"cubes":[{"name":"c","table":{"name":"t"},"dimensions":[{"name":"d","hierarchies":[{"name":"h",
          "levels":[{"name":"l","key_column":"k","key_type":"integer","default_members":["x"]}]}]}]}]}
        """));
  }

  @Test
  void registrySwapsSnapshots() {
    SchemaRegistry registry = new SchemaRegistry(schema);
    Schema before = registry.current();
    Schema next = Schema.fromJson("{\"cubes\":[]}");
    assertSame(before, registry.reload(next));
    assertSame(next, registry.current());
    assertTrue(before.cubeMetadata("sales").isPresent());
  }
}
