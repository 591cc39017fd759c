package io.intellixity.tessera.dataframe;

public enum ColumnType {
  INT32, INT64, FLOAT32, FLOAT64, BOOL, TEXT
}
