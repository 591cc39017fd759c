package io.intellixity.tessera.dataframe;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Ordered, named, typed columns of equal length. */
public final class DataFrame {
  private final List<Column> columns;
  private final int rowCount;

  public DataFrame(List<Column> columns) {
    this.columns = List.copyOf(columns);
    int n = this.columns.isEmpty() ? 0 : this.columns.get(0).size();
    for (Column c : this.columns) {
      if (c.size() != n) {
        throw new IllegalArgumentException("Column '" + c.name() + "' has " + c.size() + " rows; expected " + n);
      }
    }
    this.rowCount = n;
  }

  public static DataFrame empty() {
    return new DataFrame(List.of());
  }

  public List<Column> columns() { return columns; }
  public int rowCount() { return rowCount; }
  public int columnCount() { return columns.size(); }

  public List<String> columnNames() {
    List<String> out = new ArrayList<>(columns.size());
    for (Column c : columns) out.add(c.name());
    return out;
  }

  public Optional<Column> column(String name) {
    for (Column c : columns) {
      if (c.name().equals(name)) return Optional.of(c);
    }
    return Optional.empty();
  }

  public Object value(int row, int column) {
    return columns.get(column).data().get(row);
  }

  @Override
  public String toString() {
    return "DataFrame{columns=" + columnNames() + ", rows=" + rowCount + "}";
  }
}
