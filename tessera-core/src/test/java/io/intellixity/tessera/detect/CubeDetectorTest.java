package io.intellixity.tessera.detect;

import io.intellixity.tessera.query.QueryOptions;
import io.intellixity.tessera.schema.NotFoundException;
import io.intellixity.tessera.schema.Schema;
import io.intellixity.tessera.support.TestSchemas;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CubeDetectorTest {
  private final Schema schema = TestSchemas.sales();

  private static QueryOptions options(List<String> drilldowns, List<String> cuts, List<String> measures) {
    QueryOptions o = new QueryOptions();
    o.setDrilldowns(drilldowns);
    o.setCuts(cuts);
    o.setMeasures(measures);
    return o;
  }

  @Test
  void firstCubeContainingAllLevelsWins() {
    QueryOptions o = options(List.of("geo.country.state"), List.of(), List.of("stock"));
    assertEquals("sales", CubeDetector.detectCube(schema, o));
  }

  @Test
  void cutLevelsNarrowTheChoice() {
    QueryOptions o = options(List.of("geo.country.state"), List.of("~warehouse.warehouse.warehouse.w1,w2"), List.of("stock"));
    assertEquals("inventory", CubeDetector.detectCube(schema, o));
  }

  @Test
  void malformedEntriesAreSkipped() {
    QueryOptions o = options(List.of("geo.country", "warehouse.warehouse.warehouse"), List.of("bad.cut"), List.of());
    assertEquals("inventory", CubeDetector.detectCube(schema, o));
  }

  @Test
  void missingMeasureDoesNotRejectCube() {
    QueryOptions o = options(List.of("time.time.year"), List.of(), List.of("nonexistent"));
    assertEquals("sales", CubeDetector.detectCube(schema, o));
  }

  @Test
  void noMatch() {
    QueryOptions o = options(List.of("geo.country.city"), List.of(), List.of("revenue"));
    NotFoundException e = assertThrows(NotFoundException.class, () -> CubeDetector.detectCube(schema, o));
    assertEquals("No cubes found with the requested drilldowns/cuts/measures.", e.getMessage());
  }

  @Test
  void deterministic() {
    QueryOptions o = options(List.of("geo.country.country"), List.of("geo.country.state.1"), List.of("revenue"));
    String first = CubeDetector.detectCube(schema, o);
    for (int i = 0; i < 10; i++) assertEquals(first, CubeDetector.detectCube(schema, o));
  }

  @Test
  void cutLevelPathDropsMembersAndPrefix() {
    assertEquals("a.b.c", CubeDetector.cutLevelPath("~a.b.c.1,2"));
    assertNull(CubeDetector.cutLevelPath("a.b"));
  }
}
