package org.devolia.konfig.vault;

import org.devolia.konfig.exception.KonfigException;

/**
 * The Vault server could not be reached or did not answer in time.
 *
 * <p>This is the transient failure class that the secrets client retries.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class VaultConnectionException extends KonfigException {

  public VaultConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
