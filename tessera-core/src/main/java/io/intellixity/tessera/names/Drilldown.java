package io.intellixity.tessera.names;

import java.util.Objects;

/** Request to group results by a level. */
public record Drilldown(LevelName levelName) {
  public Drilldown {
    Objects.requireNonNull(levelName, "levelName");
  }

  public static Drilldown parse(String s) {
    return new Drilldown(LevelName.parse(s));
  }

  @Override
  public String toString() {
    return levelName.toString();
  }
}
