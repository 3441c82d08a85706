package org.devolia.konfig.exception;

/**
 * The secret path exists in Vault, but its payload does not contain the requested key path.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretKeyMissingException extends MissingOptionException {

  public SecretKeyMissingException(String message) {
    super(message);
  }
}
