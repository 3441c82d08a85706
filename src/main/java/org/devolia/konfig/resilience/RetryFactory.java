package org.devolia.konfig.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.devolia.konfig.metrics.VaultMetrics;
import org.devolia.konfig.vault.VaultBackendConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the retry policy wrapped around a single secret load.
 *
 * <p>The default policy retries transient failures only, and stops at whichever comes first: the
 * configured number of attempts or the wall-clock budget measured from the first attempt. The last
 * failure is rethrown when the policy gives up. A {@link Retry} injected through {@link
 * VaultBackendConfig.Builder#retry(Retry)} is used as is.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class RetryFactory {

  private static final Logger logger = LoggerFactory.getLogger(RetryFactory.class);

  private RetryFactory() {}

  /**
   * Creates the retry policy for one load call.
   *
   * @param name the retry name, used in events and logs
   * @param config the backend configuration
   * @param metrics metrics collector for retry events
   * @return a retry whose wall-clock budget starts now
   */
  public static Retry create(String name, VaultBackendConfig config, VaultMetrics metrics) {
    if (config.getRetry() != null) {
      return config.getRetry();
    }

    long deadline = System.nanoTime() + config.getMaxRetryDuration().toNanos();
    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(config.getMaxRetries())
            .waitDuration(config.getRetryWait())
            .retryOnException(
                e -> ExceptionClassifier.isTransientFailure(e) && System.nanoTime() < deadline)
            .build();

    Retry retry = Retry.of(name, retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              String errorCategory = ExceptionClassifier.getErrorCategory(event.getLastThrowable());
              metrics.recordRetryAttempt(event.getNumberOfRetryAttempts(), errorCategory);
              logger.debug(
                  "Retry attempt {} for {}, error: {}",
                  event.getNumberOfRetryAttempts(),
                  name,
                  errorCategory);
            });
    return retry;
  }
}
