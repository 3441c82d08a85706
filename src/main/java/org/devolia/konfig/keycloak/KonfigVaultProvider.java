package org.devolia.konfig.keycloak;

import org.devolia.konfig.Konfig;
import org.devolia.konfig.exception.KonfigException;
import org.devolia.konfig.exception.MissingOptionException;
import org.devolia.konfig.resilience.ExceptionClassifier;
import org.keycloak.vault.VaultProvider;
import org.keycloak.vault.VaultRawSecret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keycloak vault provider backed by a {@link Konfig}.
 *
 * <p>A vault expression such as <code>${vault.SMTP_PASSWORD}</code> resolves the option {@code
 * SMTP_PASSWORD} through the usual chain: overrides, settings, environment variables and Vault
 * secrets.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class KonfigVaultProvider implements VaultProvider {

  private static final Logger logger = LoggerFactory.getLogger(KonfigVaultProvider.class);

  private final Konfig konfig;

  public KonfigVaultProvider(Konfig konfig) {
    this.konfig = konfig;
  }

  /**
   * Resolves an option.
   *
   * @param vaultSecretId the option name
   * @return the option value, or null if the option or the secret key is missing
   * @throws RuntimeException carrying the error category for any other failure
   */
  @Override
  public VaultRawSecret obtainSecret(String vaultSecretId) {
    if (vaultSecretId == null || vaultSecretId.trim().isEmpty()) {
      logger.warn("Attempted to retrieve secret with null or empty ID");
      return null;
    }

    try {
      return DefaultVaultRawSecret.of(konfig.get(vaultSecretId));
    } catch (MissingOptionException e) {
      logger.debug("Option not found: {} ({})", vaultSecretId, e.getMessage());
      return null;
    } catch (KonfigException e) {
      String errorCategory = ExceptionClassifier.getErrorCategory(e);
      logger.error(
          "Failed to resolve option: {} (category: {})", vaultSecretId, errorCategory, e);
      throw new RuntimeException("Error retrieving secret from Vault: " + errorCategory, e);
    }
  }

  /** Nothing to release; the shared backend is closed by the factory. */
  @Override
  public void close() {}
}
