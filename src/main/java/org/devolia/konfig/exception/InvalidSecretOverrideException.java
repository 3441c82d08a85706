package org.devolia.konfig.exception;

/** The environment variable overriding a secret does not hold a JSON-encoded object. */
public class InvalidSecretOverrideException extends KonfigException {

  public InvalidSecretOverrideException(String message) {
    super(message);
  }
}
