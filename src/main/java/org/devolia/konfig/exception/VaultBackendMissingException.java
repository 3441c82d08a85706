package org.devolia.konfig.exception;

/** A secret variable was accessed, but no Vault backend is configured. */
public class VaultBackendMissingException extends KonfigException {

  public VaultBackendMissingException(String message) {
    super(message);
  }
}
