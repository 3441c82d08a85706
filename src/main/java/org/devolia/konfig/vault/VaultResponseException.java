package org.devolia.konfig.vault;

import org.devolia.konfig.exception.KonfigException;

/**
 * The Vault server answered with a non-success HTTP status.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class VaultResponseException extends KonfigException {

  private final int statusCode;

  public VaultResponseException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * Gets the HTTP status returned by Vault.
   *
   * @return the status code
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Checks if the token used for the request was rejected.
   *
   * @return true for HTTP 403
   */
  public boolean isForbidden() {
    return statusCode == 403;
  }
}
