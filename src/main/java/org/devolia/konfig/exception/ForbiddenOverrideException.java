package org.devolia.konfig.exception;

/**
 * An override names an option that is not declared in the settings source while strict override
 * mode is on.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ForbiddenOverrideException extends KonfigException {

  public ForbiddenOverrideException(String message) {
    super(message);
  }
}
