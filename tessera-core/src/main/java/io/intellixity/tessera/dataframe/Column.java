package io.intellixity.tessera.dataframe;

import java.util.Objects;

public record Column(String name, ColumnData data) {
  public Column {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(data, "data");
  }

  public int size() { return data.size(); }
}
