package org.devolia.konfig.vault;

import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.devolia.konfig.metrics.VaultMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking Vault secrets client.
 *
 * <p>A load follows this flow, all of it inside the retry policy:
 *
 * <ol>
 *   <li>Return the cached payload if the full path is cached and not expired
 *   <li>Pick the token: the explicit one, else the session token, else log in with userpass
 *   <li>Read the path; if the token is rejected and userpass is available, log in again and read
 *       once more
 *   <li>Fail with a missing-option error if the response has no data
 *   <li>Cache and return the payload
 * </ol>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SyncVaultBackend extends VaultBackend {

  private static final Logger logger = LoggerFactory.getLogger(SyncVaultBackend.class);

  public SyncVaultBackend(VaultBackendConfig config) {
    this(
        config,
        new VaultTransport(config.getRequestTimeout()),
        VaultMetrics.standalone("sync"),
        Clock.systemUTC());
  }

  public SyncVaultBackend(
      VaultBackendConfig config, VaultTransport transport, VaultMetrics metrics, Clock clock) {
    super(config, transport, metrics, clock);
  }

  @Override
  public boolean isAsync() {
    return false;
  }

  /**
   * Loads the secret payload at the given path.
   *
   * @param path the secret path, without prefix
   * @param credentials the server address and credentials
   * @return the payload stored under <code>data</code>
   * @throws org.devolia.konfig.exception.MissingOptionException if the path holds no data
   * @throws VaultResponseException if Vault rejects the request
   * @throws VaultConnectionException if Vault stays unreachable after all retries
   */
  public Map<String, Object> load(String path, VaultCredentials credentials) {
    String fullPath = fullPath(path);
    Retry retry = retryFor(fullPath);
    return retry.executeSupplier(() -> cachedCall(fullPath, credentials));
  }

  @Override
  public Object loadAndApply(
      String path, VaultCredentials credentials, Function<Map<String, Object>, Object> callback) {
    return callback.apply(load(path, credentials));
  }

  @Override
  public Object completed(Object value) {
    return value;
  }

  private Map<String, Object> cachedCall(String fullPath, VaultCredentials credentials) {
    Optional<Map<String, Object>> cached = fromCache(fullPath);
    if (cached.isPresent()) {
      return cached.get();
    }
    Map<String, Object> data = call(fullPath, credentials);
    toCache(fullPath, data);
    return data;
  }

  private Map<String, Object> call(String fullPath, VaultCredentials credentials) {
    logger.debug("Access \"{}\" in Vault", fullPath);
    long startTime = System.nanoTime();
    try {
      Map<String, Object> content = read(fullPath, credentials, resolveToken(credentials));
      Map<String, Object> data = extractData(fullPath, content);
      recordSuccess(fullPath, startTime);
      return data;
    } catch (RuntimeException e) {
      recordFailure(fullPath, startTime, e);
      throw e;
    }
  }

  private Map<String, Object> read(String fullPath, VaultCredentials credentials, String token) {
    try {
      return transport.read(credentials.getAddress(), fullPath, token);
    } catch (VaultResponseException e) {
      if (e.isForbidden() && credentials.hasUserpass()) {
        logger.debug("Token is invalid. Retrieving a new token");
        String renewed = authenticate(credentials);
        return transport.read(credentials.getAddress(), fullPath, renewed);
      }
      throw e;
    }
  }

  private String resolveToken(VaultCredentials credentials) {
    if (credentials.hasToken() || !credentials.hasUserpass()) {
      return credentials.getToken();
    }
    Optional<String> session = getSessionToken();
    if (session.isPresent()) {
      return session.get();
    }
    logger.debug("Retrieving a new token");
    return authenticate(credentials);
  }

  private String authenticate(VaultCredentials credentials) {
    String token =
        transport.login(
            credentials.getAddress(), credentials.getUsername(), credentials.getPassword());
    replaceSessionToken(token);
    return token;
  }
}
