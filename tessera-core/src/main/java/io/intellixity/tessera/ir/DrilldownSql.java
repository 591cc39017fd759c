package io.intellixity.tessera.ir;

import io.intellixity.tessera.names.LevelName;

import java.util.ArrayList;
import java.util.List;

/**
 * A drilldown bound to its physical columns.
 * <p>
 * {@code levelColumns} holds the requested parents (root first) followed by the drilled level itself.
 * Projection order: for each level column its key then its display column, then the properties.
 */
public record DrilldownSql(LevelName levelName, TableSql table, String foreignKey, String primaryKey,
                           List<LevelColumn> levelColumns, List<PropertyColumn> properties) {
  public DrilldownSql {
    if (levelColumns == null || levelColumns.isEmpty()) throw new IllegalArgumentException("levelColumns is empty");
    levelColumns = List.copyOf(levelColumns);
    properties = properties == null ? List.of() : List.copyOf(properties);
  }

  public boolean inline() { return table == null; }

  public List<String> columns() {
    List<String> out = new ArrayList<>();
    for (LevelColumn lc : levelColumns) {
      out.add(lc.keyColumn());
      if (lc.hasDisplay()) out.add(lc.displayColumn());
    }
    for (PropertyColumn p : properties) out.add(p.column());
    return out;
  }

  public List<String> headers() {
    List<String> out = new ArrayList<>();
    for (LevelColumn lc : levelColumns) {
      if (lc.hasDisplay()) {
        out.add(lc.levelName() + " ID");
        out.add(lc.levelName());
      } else {
        out.add(lc.levelName());
      }
    }
    for (PropertyColumn p : properties) out.add(p.propertyName());
    return out;
  }

  /** Position of the drilled level's key among {@link #columns()}. */
  public int keyIndex() {
    int idx = 0;
    for (int i = 0; i < levelColumns.size() - 1; i++) {
      idx += levelColumns.get(i).hasDisplay() ? 2 : 1;
    }
    return idx;
  }

  public LevelColumn level() {
    return levelColumns.get(levelColumns.size() - 1);
  }
}
