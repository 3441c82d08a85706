package org.devolia.konfig.vault;

import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.devolia.konfig.metrics.VaultMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-blocking Vault secrets client.
 *
 * <p>Same flow as {@link SyncVaultBackend}, but network calls use the asynchronous HTTP client and
 * the wait between retries is scheduled instead of slept, so no thread is parked while a load is in
 * progress. Results are delivered as {@link CompletableFuture}s.
 *
 * <p>Concurrent loads of the same cold path are not merged; each may reach Vault.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class AsyncVaultBackend extends VaultBackend {

  private static final Logger logger = LoggerFactory.getLogger(AsyncVaultBackend.class);

  private final ScheduledExecutorService scheduler;

  public AsyncVaultBackend(VaultBackendConfig config) {
    this(
        config,
        new VaultTransport(config.getRequestTimeout()),
        VaultMetrics.standalone("async"),
        Clock.systemUTC());
  }

  public AsyncVaultBackend(
      VaultBackendConfig config, VaultTransport transport, VaultMetrics metrics, Clock clock) {
    super(config, transport, metrics, clock);
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread thread = new Thread(r, "konfig-vault-retry");
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public boolean isAsync() {
    return true;
  }

  /**
   * Loads the secret payload at the given path.
   *
   * @param path the secret path, without prefix
   * @param credentials the server address and credentials
   * @return a future of the payload stored under <code>data</code>; it fails with the same errors
   *     as {@link SyncVaultBackend#load(String, VaultCredentials)}
   */
  public CompletableFuture<Map<String, Object>> load(String path, VaultCredentials credentials) {
    String fullPath = fullPath(path);
    Retry retry = retryFor(fullPath);
    return retry
        .executeCompletionStage(scheduler, () -> cachedCall(fullPath, credentials))
        .toCompletableFuture();
  }

  @Override
  public Object loadAndApply(
      String path, VaultCredentials credentials, Function<Map<String, Object>, Object> callback) {
    return load(path, credentials).thenApply(callback);
  }

  @Override
  public Object completed(Object value) {
    return CompletableFuture.completedFuture(value);
  }

  /** Stops the retry scheduler. Loads still waiting for a retry are abandoned. */
  @Override
  public void close() {
    super.close();
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private CompletionStage<Map<String, Object>> cachedCall(
      String fullPath, VaultCredentials credentials) {
    Optional<Map<String, Object>> cached = fromCache(fullPath);
    if (cached.isPresent()) {
      return CompletableFuture.completedFuture(cached.get());
    }
    return call(fullPath, credentials)
        .thenApply(
            data -> {
              toCache(fullPath, data);
              return data;
            });
  }

  private CompletableFuture<Map<String, Object>> call(
      String fullPath, VaultCredentials credentials) {
    logger.debug("Access \"{}\" in Vault", fullPath);
    long startTime = System.nanoTime();

    CompletableFuture<Map<String, Object>> result;
    try {
      result =
          resolveToken(credentials)
              .thenCompose(token -> read(fullPath, credentials, token))
              .thenApply(content -> extractData(fullPath, content));
    } catch (RuntimeException e) {
      result = CompletableFuture.failedFuture(e);
    }

    return result.whenComplete(
        (data, error) -> {
          if (error != null) {
            recordFailure(fullPath, startTime, unwrap(error));
          } else {
            recordSuccess(fullPath, startTime);
          }
        });
  }

  private CompletableFuture<Map<String, Object>> read(
      String fullPath, VaultCredentials credentials, String token) {
    return transport
        .readAsync(credentials.getAddress(), fullPath, token)
        .exceptionallyCompose(
            error -> {
              Throwable cause = unwrap(error);
              if (cause instanceof VaultResponseException responseException
                  && responseException.isForbidden()
                  && credentials.hasUserpass()) {
                logger.debug("Token is invalid. Retrieving a new token");
                return authenticate(credentials)
                    .thenCompose(
                        renewed ->
                            transport.readAsync(credentials.getAddress(), fullPath, renewed));
              }
              return CompletableFuture.failedFuture(cause);
            });
  }

  private CompletableFuture<String> resolveToken(VaultCredentials credentials) {
    if (credentials.hasToken() || !credentials.hasUserpass()) {
      return CompletableFuture.completedFuture(credentials.getToken());
    }
    Optional<String> session = getSessionToken();
    if (session.isPresent()) {
      return CompletableFuture.completedFuture(session.get());
    }
    logger.debug("Retrieving a new token");
    return authenticate(credentials);
  }

  private CompletableFuture<String> authenticate(VaultCredentials credentials) {
    return transport
        .loginAsync(credentials.getAddress(), credentials.getUsername(), credentials.getPassword())
        .thenApply(
            token -> {
              replaceSessionToken(token);
              return token;
            });
  }

  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
