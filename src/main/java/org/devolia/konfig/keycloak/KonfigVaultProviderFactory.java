package org.devolia.konfig.keycloak;

import java.nio.file.Path;
import java.time.Duration;
import org.devolia.konfig.Konfig;
import org.devolia.konfig.source.SettingsLoaders;
import org.devolia.konfig.vault.SyncVaultBackend;
import org.devolia.konfig.vault.VaultBackend;
import org.devolia.konfig.vault.VaultBackendConfig;
import org.keycloak.Config;
import org.keycloak.models.KeycloakSession;
import org.keycloak.models.KeycloakSessionFactory;
import org.keycloak.vault.VaultProvider;
import org.keycloak.vault.VaultProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers {@link KonfigVaultProvider} with Keycloak.
 *
 * <p>One {@link Konfig} and one blocking Vault backend are built at startup and shared by all
 * providers, so the secret cache and the Vault session token survive across requests.
 *
 * <pre>
 * spi-vault-konfig-settings=/opt/keycloak/conf/settings.json   # Required: JSON settings file
 * spi-vault-konfig-prefix=team                                # Optional: Vault path prefix
 * spi-vault-konfig-cache-ttl=60                               # Optional: cache TTL in seconds
 * spi-vault-konfig-try-env-first=true                         # Optional (default: true)
 * spi-vault-konfig-max-retries=3                              # Optional (default: 3)
 * </pre>
 *
 * <p>Secrets are declared in the settings file with the descriptor form read by {@link
 * org.devolia.konfig.source.JsonSettingsSource}, for example {@code "SMTP_PASSWORD": {"vault":
 * "smtp", "key": "password"}}. The file also carries {@code VAULT_ADDR} and the credentials, or
 * declares them as {@code {"env": "VAULT_TOKEN"}}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class KonfigVaultProviderFactory implements VaultProviderFactory {

  private static final Logger logger = LoggerFactory.getLogger(KonfigVaultProviderFactory.class);

  /** The provider ID; configuration keys are read from <code>spi-vault-konfig-*</code>. */
  public static final String PROVIDER_ID = "konfig";

  // Configuration keys
  private static final String CONFIG_SETTINGS = "settings";
  private static final String CONFIG_PREFIX = "prefix";
  private static final String CONFIG_CACHE_TTL = "cache-ttl";
  private static final String CONFIG_TRY_ENV_FIRST = "try-env-first";
  private static final String CONFIG_MAX_RETRIES = "max-retries";

  private VaultBackend backend;
  private Konfig konfig;

  @Override
  public VaultProvider create(KeycloakSession session) {
    if (konfig == null) {
      throw new IllegalStateException("Konfig vault provider factory is not initialized");
    }
    return new KonfigVaultProvider(konfig);
  }

  /**
   * Builds the shared configuration.
   *
   * @param config the configuration scope for this provider
   * @throws IllegalStateException if the settings file is not configured or an option is invalid
   */
  @Override
  public void init(Config.Scope config) {
    String settings = config.get(CONFIG_SETTINGS);
    if (settings == null || settings.trim().isEmpty()) {
      logger.error("Required configuration 'spi-vault-konfig-settings' is missing or empty");
      throw new IllegalStateException(
          "Settings file is required."
              + " Please configure 'spi-vault-konfig-settings' in keycloak.conf");
    }

    VaultBackendConfig backendConfig;
    try {
      backendConfig = createBackendConfig(config);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid Konfig vault provider configuration", e);
    }

    this.backend = new SyncVaultBackend(backendConfig);
    this.konfig =
        Konfig.builder()
            .loader(SettingsLoaders.fromJson(Path.of(settings)))
            .vaultBackend(backend)
            .build();

    logger.info("Konfig vault provider configured with settings: {}", settings);
  }

  @Override
  public void postInit(KeycloakSessionFactory factory) {
    // No additional initialization needed
  }

  @Override
  public void close() {
    logger.debug("Closing Konfig vault provider factory");
    if (backend != null) {
      backend.close();
    }
  }

  @Override
  public String getId() {
    return PROVIDER_ID;
  }

  @Override
  public int order() {
    return 100;
  }

  Konfig getKonfig() {
    return konfig;
  }

  private VaultBackendConfig createBackendConfig(Config.Scope config) {
    String prefix = config.get(CONFIG_PREFIX);
    Integer cacheTtl = config.getInt(CONFIG_CACHE_TTL);
    boolean tryEnvFirst =
        config.getBoolean(CONFIG_TRY_ENV_FIRST, VaultBackendConfig.DEFAULT_TRY_ENV_FIRST);
    int maxRetries = config.getInt(CONFIG_MAX_RETRIES, VaultBackendConfig.DEFAULT_MAX_RETRIES);

    logger.debug(
        "Configuration - prefix: {}, cache TTL: {}s, try env first: {}, max retries: {}",
        prefix,
        cacheTtl,
        tryEnvFirst,
        maxRetries);

    return VaultBackendConfig.builder()
        .prefix(prefix)
        .cacheTtl(cacheTtl != null ? Duration.ofSeconds(cacheTtl) : null)
        .tryEnvFirst(tryEnvFirst)
        .maxRetries(maxRetries)
        .build();
  }
}
