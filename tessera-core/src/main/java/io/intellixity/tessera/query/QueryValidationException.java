package io.intellixity.tessera.query;

import io.intellixity.tessera.TesseraException;

/**
 * Raised when a Query is incomplete or references identifiers the target cube cannot resolve.
 * <p>
 * Always thrown before any backend is contacted.
 */
public class QueryValidationException extends TesseraException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
