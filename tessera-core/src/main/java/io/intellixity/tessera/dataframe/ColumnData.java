package io.intellixity.tessera.dataframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Values of one column. Non-nullable variants hold primitive arrays; nullable variants hold boxed lists
 * where {@code null} marks a missing value.
 */
public interface ColumnData {
  ColumnType type();
  boolean nullable();
  int size();

  /** Boxed value at {@code row}; null only for nullable variants. */
  Object get(int row);

  static ColumnData of(ColumnType type, boolean nullable, List<?> values) {
    Objects.requireNonNull(type, "type");
    if (nullable) {
      return switch (type) {
        case INT32 -> new NullableInt32(cast(values));
        case INT64 -> new NullableInt64(cast(values));
        case FLOAT32 -> new NullableFloat32(cast(values));
        case FLOAT64 -> new NullableFloat64(cast(values));
        case BOOL -> new NullableBool(cast(values));
        case TEXT -> new NullableText(cast(values));
      };
    }
    int n = values.size();
    switch (type) {
      case INT32 -> {
        int[] a = new int[n];
        for (int i = 0; i < n; i++) a[i] = ((Number) nonNull(values, i)).intValue();
        return new Int32(a);
      }
      case INT64 -> {
        long[] a = new long[n];
        for (int i = 0; i < n; i++) a[i] = ((Number) nonNull(values, i)).longValue();
        return new Int64(a);
      }
      case FLOAT32 -> {
        float[] a = new float[n];
        for (int i = 0; i < n; i++) a[i] = ((Number) nonNull(values, i)).floatValue();
        return new Float32(a);
      }
      case FLOAT64 -> {
        double[] a = new double[n];
        for (int i = 0; i < n; i++) a[i] = ((Number) nonNull(values, i)).doubleValue();
        return new Float64(a);
      }
      case BOOL -> {
        boolean[] a = new boolean[n];
        for (int i = 0; i < n; i++) a[i] = (Boolean) nonNull(values, i);
        return new Bool(a);
      }
      default -> {
        String[] a = new String[n];
        for (int i = 0; i < n; i++) a[i] = nonNull(values, i).toString();
        return new Text(a);
      }
    }
  }

  private static Object nonNull(List<?> values, int i) {
    Object v = values.get(i);
    if (v == null) throw new TypeConversionException("Null value at row " + i + " of a non-nullable column");
    return v;
  }

  @SuppressWarnings("unchecked")
  private static <T> List<T> cast(List<?> values) {
    return Collections.unmodifiableList(new ArrayList<>((List<T>) values));
  }

  record Int32(int[] values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.INT32; }
    @Override public boolean nullable() { return false; }
    @Override public int size() { return values.length; }
    @Override public Object get(int row) { return values[row]; }
  }

  record Int64(long[] values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.INT64; }
    @Override public boolean nullable() { return false; }
    @Override public int size() { return values.length; }
    @Override public Object get(int row) { return values[row]; }
  }

  record Float32(float[] values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.FLOAT32; }
    @Override public boolean nullable() { return false; }
    @Override public int size() { return values.length; }
    @Override public Object get(int row) { return values[row]; }
  }

  record Float64(double[] values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.FLOAT64; }
    @Override public boolean nullable() { return false; }
    @Override public int size() { return values.length; }
    @Override public Object get(int row) { return values[row]; }
  }

  record Bool(boolean[] values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.BOOL; }
    @Override public boolean nullable() { return false; }
    @Override public int size() { return values.length; }
    @Override public Object get(int row) { return values[row]; }
  }

  record Text(String[] values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.TEXT; }
    @Override public boolean nullable() { return false; }
    @Override public int size() { return values.length; }
    @Override public Object get(int row) { return values[row]; }
  }

  record NullableInt32(List<Integer> values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.INT32; }
    @Override public boolean nullable() { return true; }
    @Override public int size() { return values.size(); }
    @Override public Object get(int row) { return values.get(row); }
  }

  record NullableInt64(List<Long> values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.INT64; }
    @Override public boolean nullable() { return true; }
    @Override public int size() { return values.size(); }
    @Override public Object get(int row) { return values.get(row); }
  }

  record NullableFloat32(List<Float> values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.FLOAT32; }
    @Override public boolean nullable() { return true; }
    @Override public int size() { return values.size(); }
    @Override public Object get(int row) { return values.get(row); }
  }

  record NullableFloat64(List<Double> values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.FLOAT64; }
    @Override public boolean nullable() { return true; }
    @Override public int size() { return values.size(); }
    @Override public Object get(int row) { return values.get(row); }
  }

  record NullableBool(List<Boolean> values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.BOOL; }
    @Override public boolean nullable() { return true; }
    @Override public int size() { return values.size(); }
    @Override public Object get(int row) { return values.get(row); }
  }

  record NullableText(List<String> values) implements ColumnData {
    @Override public ColumnType type() { return ColumnType.TEXT; }
    @Override public boolean nullable() { return true; }
    @Override public int size() { return values.size(); }
    @Override public Object get(int row) { return values.get(row); }
  }
}
