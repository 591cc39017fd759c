package io.intellixity.tessera.jdbc;

import io.intellixity.tessera.dataframe.Column;
import io.intellixity.tessera.dataframe.ColumnData;
import io.intellixity.tessera.dataframe.ColumnType;
import io.intellixity.tessera.dataframe.DataFrame;
import io.intellixity.tessera.dataframe.TypeConversionException;

import java.sql.JDBCType;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts rows of a {@link ResultSet} into {@link DataFrame} blocks, column by column.
 * Column types are fixed from the result metadata when the reader is created.
 */
public final class JdbcFrameReader {
  private record Spec(String label, ColumnType type, boolean nullable) {}

  private final List<Spec> specs;

  public JdbcFrameReader(ResultSetMetaData md) throws SQLException {
    List<Spec> s = new ArrayList<>();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      String label = md.getColumnLabel(i);
      ColumnType type = columnType(label, md.getColumnType(i), md.getColumnTypeName(i));
      s.add(new Spec(label, type, md.isNullable(i) != ResultSetMetaData.columnNoNulls));
    }
    this.specs = List.copyOf(s);
  }

  static ColumnType columnType(String label, int jdbcType, String nativeName) {
    return switch (jdbcType) {
      case Types.TINYINT, Types.SMALLINT, Types.INTEGER -> ColumnType.INT32;
      case Types.BIGINT -> ColumnType.INT64;
      case Types.REAL -> ColumnType.FLOAT32;
      case Types.FLOAT, Types.DOUBLE, Types.NUMERIC, Types.DECIMAL -> ColumnType.FLOAT64;
      case Types.BOOLEAN, Types.BIT -> ColumnType.BOOL;
      case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR,
           Types.DATE, Types.TIMESTAMP -> ColumnType.TEXT;
      default -> throw new TypeConversionException("Column '" + label + "' has unsupported type "
          + nativeName + " (" + jdbcTypeName(jdbcType) + ")");
    };
  }

  private static String jdbcTypeName(int jdbcType) {
    try {
      return JDBCType.valueOf(jdbcType).getName();
    } catch (IllegalArgumentException e) {
      return "jdbcType=" + jdbcType;
    }
  }

  public int columnCount() { return specs.size(); }

  /** Reads every remaining row into one frame. */
  public DataFrame readAll(ResultSet rs) throws SQLException {
    return readBlock(rs, Integer.MAX_VALUE);
  }

  /** Reads up to {@code maxRows} rows; an empty frame means the result set is exhausted. */
  public DataFrame readBlock(ResultSet rs, int maxRows) throws SQLException {
    List<List<Object>> values = new ArrayList<>(specs.size());
    for (int c = 0; c < specs.size(); c++) values.add(new ArrayList<>());
    int rows = 0;
    while (rows < maxRows && rs.next()) {
      for (int c = 0; c < specs.size(); c++) values.get(c).add(read(rs, c + 1, specs.get(c).type()));
      rows++;
    }
    List<Column> cols = new ArrayList<>(specs.size());
    for (int c = 0; c < specs.size(); c++) {
      Spec s = specs.get(c);
      cols.add(new Column(s.label(), ColumnData.of(s.type(), s.nullable(), values.get(c))));
    }
    return new DataFrame(cols);
  }

  private static Object read(ResultSet rs, int idx, ColumnType type) throws SQLException {
    Object v = switch (type) {
      case INT32 -> rs.getInt(idx);
      case INT64 -> rs.getLong(idx);
      case FLOAT32 -> rs.getFloat(idx);
      case FLOAT64 -> rs.getDouble(idx);
      case BOOL -> rs.getBoolean(idx);
      case TEXT -> rs.getString(idx);
    };
    return rs.wasNull() ? null : v;
  }
}
