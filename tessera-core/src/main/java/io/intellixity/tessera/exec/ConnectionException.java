package io.intellixity.tessera.exec;

import io.intellixity.tessera.TesseraException;

/** The backend could not be reached or no connection became available in time. */
public final class ConnectionException extends TesseraException {
  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
