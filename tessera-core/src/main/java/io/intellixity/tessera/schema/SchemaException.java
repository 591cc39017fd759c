package io.intellixity.tessera.schema;

import io.intellixity.tessera.TesseraException;

/** Raised when a schema document cannot be turned into a consistent model. */
public final class SchemaException extends TesseraException {
  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
