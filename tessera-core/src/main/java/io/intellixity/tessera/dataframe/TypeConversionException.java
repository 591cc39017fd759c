package io.intellixity.tessera.dataframe;

import io.intellixity.tessera.TesseraException;

/** A native result column has a type with no {@link ColumnData} variant. */
public final class TypeConversionException extends TesseraException {
  public TypeConversionException(String message) {
    super(message);
  }
}
