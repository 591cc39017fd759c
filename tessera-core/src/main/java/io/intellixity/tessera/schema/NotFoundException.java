package io.intellixity.tessera.schema;

import io.intellixity.tessera.query.QueryValidationException;

/** A cube, level, measure or property named by a request does not exist. */
public final class NotFoundException extends QueryValidationException {
  public NotFoundException(String message) {
    super(message);
  }
}
