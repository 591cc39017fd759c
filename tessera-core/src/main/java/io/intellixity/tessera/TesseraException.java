package io.intellixity.tessera;

/**
 * Root of the engine's failure taxonomy.
 * <p>
 * Every core operation reports recoverable failures through a subclass; callers decide what to expose.
 */
public class TesseraException extends RuntimeException {
  public TesseraException(String message) {
    super(message);
  }

  public TesseraException(String message, Throwable cause) {
    super(message, cause);
  }
}
