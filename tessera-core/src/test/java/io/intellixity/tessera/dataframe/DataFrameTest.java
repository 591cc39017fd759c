package io.intellixity.tessera.dataframe;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DataFrameTest {

  @Test
  void buildsTypedColumns() {
    ColumnData ints = ColumnData.of(ColumnType.INT32, false, List.of(1, 2, 3));
    ColumnData text = ColumnData.of(ColumnType.TEXT, true, Arrays.asList("a", null, "c"));
    DataFrame df = new DataFrame(List.of(new Column("id", ints), new Column("name", text)));

    assertEquals(3, df.rowCount());
    assertEquals(2, df.columnCount());
    assertEquals(List.of("id", "name"), df.columnNames());
    assertTrue(ints instanceof ColumnData.Int32);
    assertTrue(text instanceof ColumnData.NullableText);
    assertEquals(2, df.value(1, 0));
    assertNull(df.value(1, 1));
    assertEquals("c", df.column("name").orElseThrow().data().get(2));
  }

  @Test
  void widensNumbersToColumnType() {
    ColumnData longs = ColumnData.of(ColumnType.INT64, false, List.of(1, 2L));
    assertArrayEquals(new long[]{1L, 2L}, ((ColumnData.Int64) longs).values());
    ColumnData doubles = ColumnData.of(ColumnType.FLOAT64, true, Arrays.asList(1.5, null));
    assertEquals(Arrays.asList(1.5, null), ((ColumnData.NullableFloat64) doubles).values());
  }

  @Test
  void rejectsNullInNonNullableColumn() {
    assertThrows(TypeConversionException.class,
        () -> ColumnData.of(ColumnType.BOOL, false, Arrays.asList(true, null)));
  }

  @Test
  void rejectsRaggedColumns() {
    ColumnData a = ColumnData.of(ColumnType.INT32, false, List.of(1, 2));
    ColumnData b = ColumnData.of(ColumnType.INT32, false, List.of(1));
    assertThrows(IllegalArgumentException.class, () -> new DataFrame(List.of(new Column("a", a), new Column("b", b))));
  }
}
