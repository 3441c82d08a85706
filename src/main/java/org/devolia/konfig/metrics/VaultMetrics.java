package org.devolia.konfig.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics collector for Vault secret reads.
 *
 * <p>Exposed meters:
 *
 * <ul>
 *   <li><strong>konfig_vault_requests_total</strong> - Counter of Vault reads by status
 *   <li><strong>konfig_vault_latency_seconds</strong> - Timer of Vault read latencies
 *   <li><strong>konfig_vault_cache_operations_total</strong> - Counter of cache hits and misses
 *   <li><strong>konfig_vault_retry_attempts_total</strong> - Counter of retries by error category
 *   <li><strong>konfig_vault_authentications_total</strong> - Counter of userpass logins
 * </ul>
 *
 * <p>All meters carry a <code>backend</code> tag naming the client instance.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class VaultMetrics {

  private static final Logger logger = LoggerFactory.getLogger(VaultMetrics.class);

  // Metric names
  private static final String REQUESTS_TOTAL = "konfig_vault_requests_total";
  private static final String LATENCY_SECONDS = "konfig_vault_latency_seconds";
  private static final String CACHE_OPERATIONS_TOTAL = "konfig_vault_cache_operations_total";
  private static final String RETRY_ATTEMPTS_TOTAL = "konfig_vault_retry_attempts_total";
  private static final String AUTHENTICATIONS_TOTAL = "konfig_vault_authentications_total";

  // Status tags
  private static final String STATUS_SUCCESS = "success";
  private static final String STATUS_ERROR = "error";
  private static final String STATUS_NOT_FOUND = "not_found";

  private final MeterRegistry meterRegistry;
  private final String backendName;

  private final Counter successCounter;
  private final Counter notFoundCounter;
  private final Counter cacheHitCounter;
  private final Counter cacheMissCounter;
  private final Counter authenticationCounter;
  private final Timer requestTimer;

  /**
   * Creates metrics backed by the given registry.
   *
   * @param meterRegistry the Micrometer meter registry
   * @param backendName the backend name for tagging metrics
   */
  public VaultMetrics(MeterRegistry meterRegistry, String backendName) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");
    this.backendName = backendName != null ? backendName : "unknown";

    this.successCounter = requestCounter(STATUS_SUCCESS);
    this.notFoundCounter = requestCounter(STATUS_NOT_FOUND);

    this.cacheHitCounter =
        Counter.builder(CACHE_OPERATIONS_TOTAL)
            .description("Total number of secret cache operations")
            .tag("operation", "cache_hit")
            .tag("backend", this.backendName)
            .register(meterRegistry);

    this.cacheMissCounter =
        Counter.builder(CACHE_OPERATIONS_TOTAL)
            .description("Total number of secret cache operations")
            .tag("operation", "cache_miss")
            .tag("backend", this.backendName)
            .register(meterRegistry);

    this.authenticationCounter =
        Counter.builder(AUTHENTICATIONS_TOTAL)
            .description("Total number of Vault userpass logins")
            .tag("backend", this.backendName)
            .register(meterRegistry);

    this.requestTimer =
        Timer.builder(LATENCY_SECONDS)
            .description("Latency of Vault secret reads")
            .tag("backend", this.backendName)
            .register(meterRegistry);

    logger.debug("Initialized Vault metrics for backend: {}", this.backendName);
  }

  /**
   * Creates metrics backed by a private {@link SimpleMeterRegistry}.
   *
   * @param backendName the backend name for tagging metrics
   * @return new metrics collector
   */
  public static VaultMetrics standalone(String backendName) {
    return new VaultMetrics(new SimpleMeterRegistry(), backendName);
  }

  private Counter requestCounter(String status) {
    return Counter.builder(REQUESTS_TOTAL)
        .description("Total number of Vault secret reads")
        .tag("status", status)
        .tag("backend", backendName)
        .register(meterRegistry);
  }

  /**
   * Records a successful secret read.
   *
   * @param latencyNanos the request latency in nanoseconds
   */
  public void recordSuccess(long latencyNanos) {
    successCounter.increment();
    requestTimer.record(Duration.ofNanos(latencyNanos));
  }

  /**
   * Records a read of a path that holds no data.
   *
   * @param latencyNanos the request latency in nanoseconds
   */
  public void recordNotFound(long latencyNanos) {
    notFoundCounter.increment();
    requestTimer.record(Duration.ofNanos(latencyNanos));
  }

  /**
   * Records a failed read with its error category.
   *
   * @param latencyNanos the request latency in nanoseconds
   * @param errorCategory the error category (e.g., "network", "forbidden")
   */
  public void recordError(long latencyNanos, String errorCategory) {
    Counter.builder(REQUESTS_TOTAL)
        .description("Total number of Vault secret reads")
        .tag("status", STATUS_ERROR)
        .tag("error_category", errorCategory != null ? errorCategory : "unknown")
        .tag("backend", backendName)
        .register(meterRegistry)
        .increment();

    requestTimer.record(Duration.ofNanos(latencyNanos));
    logger.debug(
        "Recorded failed Vault read - category: {}, latency: {}ms",
        errorCategory,
        latencyNanos / 1_000_000);
  }

  /** Records a cache hit. */
  public void incrementCacheHit() {
    cacheHitCounter.increment();
  }

  /** Records a cache miss. */
  public void incrementCacheMiss() {
    cacheMissCounter.increment();
  }

  /** Records a userpass login against Vault. */
  public void incrementAuthentication() {
    authenticationCounter.increment();
  }

  /**
   * Records a retry attempt.
   *
   * @param attemptNumber the attempt number (1, 2, 3, etc.)
   * @param errorCategory the error category that triggered the retry
   */
  public void recordRetryAttempt(int attemptNumber, String errorCategory) {
    Counter.builder(RETRY_ATTEMPTS_TOTAL)
        .description("Total number of Vault retry attempts")
        .tag("attempt", String.valueOf(attemptNumber))
        .tag("error_category", errorCategory != null ? errorCategory : "unknown")
        .tag("backend", backendName)
        .register(meterRegistry)
        .increment();
  }

  public double getSuccessCount() {
    return successCounter.count();
  }

  public double getNotFoundCount() {
    return notFoundCounter.count();
  }

  public double getCacheHitCount() {
    return cacheHitCounter.count();
  }

  public double getCacheMissCount() {
    return cacheMissCounter.count();
  }

  public double getAuthenticationCount() {
    return authenticationCounter.count();
  }

  /**
   * Gets the total number of retries across all attempts and categories.
   *
   * @return retry count
   */
  public double getRetryCount() {
    return meterRegistry.find(RETRY_ATTEMPTS_TOTAL).tag("backend", backendName).counters().stream()
        .mapToDouble(Counter::count)
        .sum();
  }

  /**
   * Gets the mean request latency in milliseconds.
   *
   * @return mean latency in milliseconds
   */
  public double getMeanLatencyMs() {
    return requestTimer.mean(TimeUnit.MILLISECONDS);
  }
}
