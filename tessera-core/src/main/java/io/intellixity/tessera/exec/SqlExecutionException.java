package io.intellixity.tessera.exec;

import io.intellixity.tessera.TesseraException;

/** The backend rejected or failed a statement; the message is the backend's own. */
public final class SqlExecutionException extends TesseraException {
  public SqlExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
