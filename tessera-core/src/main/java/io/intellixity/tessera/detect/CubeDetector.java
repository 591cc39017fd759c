package io.intellixity.tessera.detect;

import io.intellixity.tessera.names.Cut;
import io.intellixity.tessera.names.LevelName;
import io.intellixity.tessera.names.MeasureName;
import io.intellixity.tessera.names.NameParseException;
import io.intellixity.tessera.query.QueryOptions;
import io.intellixity.tessera.schema.Cube;
import io.intellixity.tessera.schema.NotFoundException;
import io.intellixity.tessera.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Picks the cube a request targets when the caller did not name one.
 * <p>
 * Cubes are tried in declaration order; the first whose level set contains every drilldown and cut level
 * wins. Malformed drilldown or cut entries are skipped.
 */
public final class CubeDetector {
  private static final Logger log = LoggerFactory.getLogger(CubeDetector.class);

  private CubeDetector() {}

  public static String detectCube(Schema schema, QueryOptions options) {
    List<LevelName> levels = new ArrayList<>();
    for (String d : nullToEmpty(options.getDrilldowns())) {
      LevelName ln = levelOrNull(d);
      if (ln != null) levels.add(ln);
    }
    for (String c : nullToEmpty(options.getCuts())) {
      LevelName ln = levelOrNull(cutLevelPath(c));
      if (ln != null) levels.add(ln);
    }
    List<MeasureName> measures = new ArrayList<>();
    for (String m : nullToEmpty(options.getMeasures())) {
      if (m != null && !m.isBlank()) measures.add(new MeasureName(m.trim()));
    }

    for (Cube cube : schema.cubes()) {
      Set<LevelName> cubeLevels = cube.allLevelNames();
      if (!cubeLevels.containsAll(levels)) continue;

      // A missing measure stops the measure scan but does not disqualify the cube.
      Set<MeasureName> cubeMeasures = cube.allMeasureNames();
      for (MeasureName m : measures) {
        if (!cubeMeasures.contains(m)) {
          log.debug("tessera.detect cube={} lacks measure={}; accepted on levels", cube.name(), m);
          break;
        }
      }
      return cube.name();
    }
    throw new NotFoundException("No cubes found with the requested drilldowns/cuts/measures.");
  }

  /** {@code [~]dim.hier.level.members} to {@code dim.hier.level}. */
  static String cutLevelPath(String cut) {
    if (cut == null) return null;
    String raw = cut.trim();
    if (!raw.isEmpty() && raw.charAt(0) == Cut.EXCLUDE_PREFIX) raw = raw.substring(1);
    String[] parts = raw.split("\\.", 4);
    if (parts.length < 4) return null;
    return String.join(".", Arrays.asList(parts).subList(0, 3));
  }

  private static LevelName levelOrNull(String s) {
    if (s == null) return null;
    try {
      return LevelName.parse(s.trim());
    } catch (NameParseException e) {
      log.debug("tessera.detect skipping malformed level '{}': {}", s, e.getMessage());
      return null;
    }
  }

  private static List<String> nullToEmpty(List<String> in) {
    return in == null ? List.of() : in;
  }
}
