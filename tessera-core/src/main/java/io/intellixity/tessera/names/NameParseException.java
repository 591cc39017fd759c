package io.intellixity.tessera.names;

import io.intellixity.tessera.TesseraException;

/** Raised when a dotted identifier string does not match its expected shape. */
public final class NameParseException extends TesseraException {
  public NameParseException(String message) {
    super(message);
  }

  public NameParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
