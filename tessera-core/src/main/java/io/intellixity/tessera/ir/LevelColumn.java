package io.intellixity.tessera.ir;

/**
 * Columns of one level in a drilldown projection. {@code displayColumn} is the name column or the
 * caption property column, or null when the level only has a key.
 */
public record LevelColumn(String levelName, String keyColumn, String displayColumn) {
  public boolean hasDisplay() { return displayColumn != null; }
}
