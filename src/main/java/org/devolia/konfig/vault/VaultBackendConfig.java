package org.devolia.konfig.vault;

import io.github.resilience4j.retry.Retry;
import java.time.Duration;
import org.devolia.konfig.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for a Vault secrets client.
 *
 * <p>This class manages:
 *
 * <ul>
 *   <li>The path prefix joined in front of every secret path
 *   <li>The optional cache TTL (no cache when unset)
 *   <li>Whether environment overrides are consulted before Vault
 *   <li>The retry policy: attempt count, wall-clock budget and wait between attempts, or a custom
 *       resilience4j {@link Retry}
 *   <li>The HTTP request timeout
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class VaultBackendConfig {

  private static final Logger logger = LoggerFactory.getLogger(VaultBackendConfig.class);

  // Default values
  public static final boolean DEFAULT_TRY_ENV_FIRST = true;
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_MAX_RETRY_DURATION = Duration.ofSeconds(15);
  public static final Duration DEFAULT_RETRY_WAIT = Duration.ofMillis(500);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final String prefix;
  private final Duration cacheTtl;
  private final boolean tryEnvFirst;
  private final int maxRetries;
  private final Duration maxRetryDuration;
  private final Duration retryWait;
  private final Duration requestTimeout;
  private final Retry retry;

  private VaultBackendConfig(Builder builder) {
    this.prefix = builder.prefix;
    this.cacheTtl = builder.cacheTtl;
    this.tryEnvFirst = builder.tryEnvFirst;
    this.maxRetries = builder.maxRetries;
    this.maxRetryDuration = builder.maxRetryDuration;
    this.retryWait = builder.retryWait;
    this.requestTimeout = builder.requestTimeout;
    this.retry = builder.retry;
  }

  /**
   * Creates configuration with default values: no prefix, no cache.
   *
   * @return default configuration
   */
  public static VaultBackendConfig defaultConfig() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets the path prefix.
   *
   * @return the prefix, or null if unset
   */
  public String getPrefix() {
    return prefix;
  }

  /**
   * Gets the cache TTL.
   *
   * @return the TTL, or null when responses are not cached
   */
  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public boolean isTryEnvFirst() {
    return tryEnvFirst;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public Duration getMaxRetryDuration() {
    return maxRetryDuration;
  }

  public Duration getRetryWait() {
    return retryWait;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  /**
   * Gets the custom retry policy.
   *
   * @return the injected retry, or null to use the default policy
   */
  public Retry getRetry() {
    return retry;
  }

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    TtlCache.validateTtl(cacheTtl);

    if (maxRetries < 1) {
      throw new IllegalArgumentException("Max retries must be at least 1: " + maxRetries);
    }

    if (maxRetryDuration == null || retryWait == null || requestTimeout == null) {
      throw new IllegalArgumentException(
          "Max retry duration, retry wait and request timeout cannot be null");
    }

    if (maxRetryDuration.isNegative() || maxRetryDuration.isZero()) {
      throw new IllegalArgumentException(
          "Max retry duration must be positive: " + maxRetryDuration);
    }

    if (retryWait.isNegative()) {
      throw new IllegalArgumentException("Retry wait cannot be negative: " + retryWait);
    }

    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeout);
    }

    logger.debug("Vault backend configuration validation passed");
  }

  /** Builder for {@link VaultBackendConfig}. */
  public static final class Builder {

    private String prefix;
    private Duration cacheTtl;
    private boolean tryEnvFirst = DEFAULT_TRY_ENV_FIRST;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Duration maxRetryDuration = DEFAULT_MAX_RETRY_DURATION;
    private Duration retryWait = DEFAULT_RETRY_WAIT;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private Retry retry;

    private Builder() {}

    public Builder prefix(String prefix) {
      this.prefix = prefix;
      return this;
    }

    public Builder cacheTtl(Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder tryEnvFirst(boolean tryEnvFirst) {
      this.tryEnvFirst = tryEnvFirst;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder maxRetryDuration(Duration maxRetryDuration) {
      this.maxRetryDuration = maxRetryDuration;
      return this;
    }

    public Builder retryWait(Duration retryWait) {
      this.retryWait = retryWait;
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /** Replaces the default retry policy; attempts, budget and wait are then ignored. */
    public Builder retry(Retry retry) {
      this.retry = retry;
      return this;
    }

    /**
     * Builds and validates the configuration.
     *
     * @return the configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public VaultBackendConfig build() {
      VaultBackendConfig config = new VaultBackendConfig(this);
      config.validate();
      logger.debug(
          "Vault backend configuration initialized - prefix: {}, cache TTL: {}, tryEnvFirst: {};"
              + " Retry: max={}, budget={}ms, wait={}ms, custom={}",
          config.prefix,
          config.cacheTtl,
          config.tryEnvFirst,
          config.maxRetries,
          config.maxRetryDuration.toMillis(),
          config.retryWait.toMillis(),
          config.retry != null);
      return config;
    }
  }
}
