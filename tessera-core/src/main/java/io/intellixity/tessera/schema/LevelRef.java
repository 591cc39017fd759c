package io.intellixity.tessera.schema;

import io.intellixity.tessera.names.LevelName;

/** A level resolved inside a cube, with its owning dimension and hierarchy. */
public record LevelRef(LevelName name, Dimension dimension, Hierarchy hierarchy, Level level, int depth) {
  public boolean sameHierarchy(LevelRef other) {
    return dimension.name().equals(other.dimension.name()) && hierarchy.name().equals(other.hierarchy.name());
  }
}
