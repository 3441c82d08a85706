package org.devolia.konfig.exception;

/** Access to Vault is switched off process-wide. */
public class SecretsDisabledException extends KonfigException {

  public SecretsDisabledException(String message) {
    super(message);
  }
}
