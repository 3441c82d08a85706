package org.devolia.konfig.exception;

/**
 * A configuration option is not declared in any reachable source.
 *
 * <p>Also raised when a Vault path holds no data and when Vault credentials cannot be resolved.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class MissingOptionException extends KonfigException {

  public MissingOptionException(String message) {
    super(message);
  }

  public MissingOptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
