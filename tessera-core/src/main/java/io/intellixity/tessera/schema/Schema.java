package io.intellixity.tessera.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessera.ir.CutSql;
import io.intellixity.tessera.ir.DrilldownSql;
import io.intellixity.tessera.ir.MeasureSql;
import io.intellixity.tessera.ir.PropertyColumn;
import io.intellixity.tessera.ir.QueryIrHeaders;
import io.intellixity.tessera.names.Cut;
import io.intellixity.tessera.names.Drilldown;
import io.intellixity.tessera.names.MeasureName;
import io.intellixity.tessera.names.PropertyName;
import io.intellixity.tessera.query.Query;
import io.intellixity.tessera.schema.config.CubeConfig;
import io.intellixity.tessera.schema.config.DimensionConfig;
import io.intellixity.tessera.schema.config.HierarchyConfig;
import io.intellixity.tessera.schema.config.LevelConfig;
import io.intellixity.tessera.schema.config.MeasureConfig;
import io.intellixity.tessera.schema.config.PropertyConfig;
import io.intellixity.tessera.schema.config.SchemaConfig;
import io.intellixity.tessera.schema.config.TableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered set of cubes. Lookups by cube name return the first match.
 */
public final class Schema {
  private static final Logger log = LoggerFactory.getLogger(Schema.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String name;
  private final List<Cube> cubes;

  public Schema(String name, List<Cube> cubes) {
    this.name = name;
    this.cubes = List.copyOf(cubes);
    Set<String> seen = new HashSet<>();
    for (Cube c : this.cubes) {
      if (!seen.add(c.name())) {
        log.warn("tessera.schema duplicate cube name={}; lookups resolve to the first declaration", c.name());
      }
    }
  }

  public String name() { return name; }
  public List<Cube> cubes() { return cubes; }

  public Optional<Cube> cubeMetadata(String cubeName) {
    for (Cube c : cubes) {
      if (c.name().equals(cubeName)) return Optional.of(c);
    }
    return Optional.empty();
  }

  public Cube cube(String cubeName) {
    return cubeMetadata(cubeName).orElseThrow(() -> new NotFoundException("No cube found with name " + cubeName));
  }

  public List<CutSql> cubeCutCols(String cubeName, List<Cut> cuts) {
    return QueryResolver.cutCols(cube(cubeName), cuts);
  }

  public List<DrilldownSql> cubeDrillCols(String cubeName, List<Drilldown> drilldowns) {
    return QueryResolver.drillCols(cube(cubeName), drilldowns, List.of(), List.of(), false);
  }

  public List<MeasureSql> cubeMeaCols(String cubeName, List<MeasureName> measures) {
    return QueryResolver.meaCols(cube(cubeName), measures);
  }

  public List<PropertyColumn> cubePropertyCols(String cubeName, List<PropertyName> properties) {
    return QueryResolver.propertyCols(cube(cubeName), properties);
  }

  /** Validates {@code query} against cube {@code cubeName} and binds it to physical columns. */
  public QueryIrHeaders sqlQuery(String cubeName, Query query) {
    QueryResolver.checkShape(query);
    Cube cube = cube(cubeName);
    return new QueryResolver(cube, query).resolve();
  }

  public static Schema fromJson(String json) {
    try {
      return fromConfig(MAPPER.readValue(json, SchemaConfig.class));
    } catch (IOException e) {
      throw new SchemaException("Could not read schema JSON: " + e.getMessage(), e);
    }
  }

  public static Schema fromJson(InputStream in) {
    try (InputStream is = in) {
      return fromConfig(MAPPER.readValue(is, SchemaConfig.class));
    } catch (IOException e) {
      throw new SchemaException("Could not read schema JSON: " + e.getMessage(), e);
    }
  }

  public static Schema fromConfig(SchemaConfig config) {
    if (config == null || config.cubes() == null) throw new SchemaException("Schema has no cubes");
    List<Cube> cubes = new ArrayList<>();
    for (CubeConfig cc : config.cubes()) cubes.add(cube(cc));
    log.info("tessera.schema loaded name={} cubes={}", config.name(), cubes.size());
    return new Schema(config.name(), cubes);
  }

  private static Cube cube(CubeConfig cc) {
    if (cc.table() == null) throw new SchemaException("Cube '" + cc.name() + "' has no table");
    List<Dimension> dims = new ArrayList<>();
    if (cc.dimensions() != null) {
      for (DimensionConfig dc : cc.dimensions()) dims.add(dimension(dc));
    }
    List<Measure> measures = new ArrayList<>();
    if (cc.measures() != null) {
      for (MeasureConfig mc : cc.measures()) {
        measures.add(new Measure(mc.name(), mc.column(), Aggregator.parse(mc.aggregator())));
      }
    }
    int auth = cc.minAuthLevel() == null ? 0 : cc.minAuthLevel();
    return new Cube(cc.name(), table(cc.table()), dims, measures, auth, cc.annotations());
  }

  private static Dimension dimension(DimensionConfig dc) {
    List<Hierarchy> hs = new ArrayList<>();
    if (dc.hierarchies() != null) {
      for (HierarchyConfig hc : dc.hierarchies()) {
        List<Level> levels = new ArrayList<>();
        if (hc.levels() != null) {
          for (LevelConfig lc : hc.levels()) levels.add(level(lc));
        }
        Table t = hc.table() == null ? null : table(hc.table());
        hs.add(new Hierarchy(hc.name(), t, hc.primaryKey(), levels));
      }
    }
    return new Dimension(dc.name(), dc.foreignKey(), hs, dc.defaultHierarchy());
  }

  private static Level level(LevelConfig lc) {
    List<LevelProperty> props = new ArrayList<>();
    if (lc.properties() != null) {
      for (PropertyConfig pc : lc.properties()) props.add(new LevelProperty(pc.name(), pc.column()));
    }
    return new Level(lc.name(), lc.keyColumn(), lc.nameColumn(), KeyType.parse(lc.keyType()), props, lc.defaultMembers());
  }

  private static Table table(TableConfig tc) {
    return new Table(tc.name(), tc.schema(), tc.primaryKey());
  }
}
