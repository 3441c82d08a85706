package org.devolia.konfig.vault;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.devolia.konfig.cache.TtlCache;
import org.devolia.konfig.exception.MissingOptionException;
import org.devolia.konfig.metrics.VaultMetrics;
import org.devolia.konfig.resilience.ExceptionClassifier;
import org.devolia.konfig.resilience.RetryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for Vault secrets clients.
 *
 * <p>Holds everything the blocking and the non-blocking client share:
 *
 * <ul>
 *   <li>Path resolution against the configured prefix
 *   <li>The optional TTL cache of secret payloads, keyed by full path
 *   <li>The session token obtained through userpass login, kept for the client lifetime and only
 *       replaced when Vault rejects it
 *   <li>Retry policy creation and metrics
 * </ul>
 *
 * <p>Subclasses decide how a load is scheduled. Callers that do not know which variant they hold
 * go through {@link #loadAndApply(String, VaultCredentials, Function)} and {@link
 * #completed(Object)}, which return either a plain value or a {@link
 * java.util.concurrent.CompletableFuture} depending on {@link #isAsync()}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public abstract class VaultBackend implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(VaultBackend.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  protected final VaultBackendConfig config;
  protected final VaultTransport transport;
  protected final VaultMetrics metrics;

  private final TtlCache<Map<String, Object>> cache;
  private final AtomicReference<String> sessionToken = new AtomicReference<>();

  protected VaultBackend(
      VaultBackendConfig config, VaultTransport transport, VaultMetrics metrics, Clock clock) {
    this.config = config;
    this.transport = transport;
    this.metrics = metrics;
    this.cache = config.getCacheTtl() != null ? new TtlCache<>(config.getCacheTtl(), clock) : null;

    logger.info(
        "Initialized {} Vault backend (prefix: {}, cache TTL: {})",
        isAsync() ? "async" : "sync",
        config.getPrefix(),
        config.getCacheTtl());
  }

  /**
   * Tells whether loads complete asynchronously.
   *
   * @return true for the non-blocking client
   */
  public abstract boolean isAsync();

  /**
   * Loads the payload at the given path and applies a function to it.
   *
   * @param path the secret path, without prefix
   * @param credentials the server address and credentials
   * @param callback function applied to the loaded payload
   * @return the callback result, or a future of it for the async client
   */
  public abstract Object loadAndApply(
      String path, VaultCredentials credentials, Function<Map<String, Object>, Object> callback);

  /**
   * Wraps an already known value the way this client returns results.
   *
   * @param value the value
   * @return the value itself, or a completed future of it for the async client
   */
  public abstract Object completed(Object value);

  /**
   * Joins the prefix and the path and strips leading and trailing slashes.
   *
   * @param path the secret path
   * @return the full path sent to Vault
   */
  public String fullPath(String path) {
    String prefix = config.getPrefix();
    if (prefix == null) {
      return strip(path);
    }
    return strip(prefix) + "/" + strip(path);
  }

  public boolean isTryEnvFirst() {
    return config.isTryEnvFirst();
  }

  public VaultBackendConfig getConfig() {
    return config;
  }

  public VaultMetrics getMetrics() {
    return metrics;
  }

  /**
   * Gets the payload cache.
   *
   * @return the cache, or empty when no cache TTL is configured
   */
  public Optional<TtlCache<Map<String, Object>>> getCache() {
    return Optional.ofNullable(cache);
  }

  /** Clears the entire payload cache. Useful for cache management and testing. */
  public void clearCache() {
    if (cache != null) {
      cache.clear();
      logger.debug("Cleared all secrets from cache");
    }
  }

  /**
   * Invalidates the cached payload of a single path.
   *
   * @param path the secret path, without prefix
   */
  public void invalidate(String path) {
    if (cache != null && path != null) {
      cache.invalidate(fullPath(path));
      logger.debug("Invalidated secret from cache: {}", path);
    }
  }

  /** Releases client resources. The blocking client holds none. */
  @Override
  public void close() {
    logger.debug("Closing Vault backend");
  }

  protected Optional<Map<String, Object>> fromCache(String fullPath) {
    if (cache == null) {
      return Optional.empty();
    }
    Optional<Map<String, Object>> cached = cache.get(fullPath);
    if (cached.isPresent()) {
      logger.debug("Secret found in cache: {}", fullPath);
      metrics.incrementCacheHit();
    } else {
      metrics.incrementCacheMiss();
    }
    return cached;
  }

  protected void toCache(String fullPath, Map<String, Object> data) {
    if (cache != null) {
      cache.set(fullPath, data);
    }
  }

  protected Retry retryFor(String fullPath) {
    return RetryFactory.create("vault-" + fullPath, config, metrics);
  }

  protected Optional<String> getSessionToken() {
    return Optional.ofNullable(sessionToken.get());
  }

  protected void replaceSessionToken(String token) {
    sessionToken.set(token);
    metrics.incrementAuthentication();
  }

  /**
   * Takes the <code>data</code> object out of a read response.
   *
   * @throws MissingOptionException if the response carries no data
   */
  protected Map<String, Object> extractData(String fullPath, Map<String, Object> content) {
    Object data = content.get("data");
    if (!(data instanceof Map)) {
      throw new MissingOptionException(
          String.format(
              "Option `%s` is not present in Vault (%s)",
              fullPath, config.getPrefix() != null ? config.getPrefix() : "no prefix"));
    }
    return Collections.unmodifiableMap(MAPPER.convertValue(data, JSON_OBJECT));
  }

  protected void recordSuccess(String fullPath, long startTime) {
    metrics.recordSuccess(System.nanoTime() - startTime);
    logger.debug("Successfully retrieved secret: {}", fullPath);
  }

  protected void recordFailure(String fullPath, long startTime, Throwable error) {
    long latency = System.nanoTime() - startTime;
    if (error instanceof MissingOptionException) {
      metrics.recordNotFound(latency);
      logger.debug("Secret not found in Vault: {}", fullPath);
      return;
    }
    String errorCategory = ExceptionClassifier.getErrorCategory(error);
    metrics.recordError(latency, errorCategory);
    logger.warn(
        "Failed to retrieve secret from Vault: {} (category: {})", fullPath, errorCategory);
  }

  private static String strip(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '/') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '/') {
      end--;
    }
    return value.substring(start, end);
  }
}
