package org.devolia.konfig.exception;

/**
 * Common base for every error raised by konfig.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class KonfigException extends RuntimeException {

  public KonfigException(String message) {
    super(message);
  }

  public KonfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
