package org.devolia.konfig.resilience;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import org.devolia.konfig.exception.MissingOptionException;
import org.devolia.konfig.vault.VaultConnectionException;
import org.devolia.konfig.vault.VaultResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for classifying secrets backend failures.
 *
 * <p>Only connectivity-class failures are transient and retried. Rejected tokens, missing paths and
 * any other HTTP error status fail immediately; a rejected token is handled separately by a single
 * re-authentication inside the client.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class ExceptionClassifier {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionClassifier.class);

  private ExceptionClassifier() {}

  /**
   * Determines if an exception represents a transient failure that should be retried.
   *
   * <p>Transient failures include:
   *
   * <ul>
   *   <li>{@link VaultConnectionException} raised by the transport
   *   <li>Network timeouts, refused connections and unknown hosts
   *   <li>SSL handshake failures
   * </ul>
   *
   * @param exception the exception to classify
   * @return true if the exception represents a transient failure
   */
  public static boolean isTransientFailure(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof VaultResponseException
        || exception instanceof MissingOptionException) {
      logger.debug("Classified as permanent failure: {}", exception.getClass().getSimpleName());
      return false;
    }

    if (exception instanceof VaultConnectionException
        || exception instanceof ConnectException
        || exception instanceof SocketTimeoutException
        || exception instanceof HttpTimeoutException
        || exception instanceof TimeoutException
        || exception instanceof UnknownHostException
        || exception instanceof SSLException) {
      logger.debug("Classified as transient failure: {}", exception.getClass().getSimpleName());
      return true;
    }

    // Check nested causes
    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return isTransientFailure(cause);
    }

    logger.debug("Classified as permanent failure: {}", exception.getClass().getSimpleName());
    return false;
  }

  /**
   * Gets a human-readable error category for logging and metrics.
   *
   * @param exception the exception to categorize
   * @return error category string
   */
  public static String getErrorCategory(Throwable exception) {
    if (exception == null) {
      return "unknown";
    }

    if (exception instanceof MissingOptionException) {
      return "not_found";
    }

    if (exception instanceof VaultResponseException responseException) {
      int statusCode = responseException.getStatusCode();
      return switch (statusCode) {
        case 400 -> "bad_request";
        case 401 -> "unauthorized";
        case 403 -> "forbidden";
        case 404 -> "not_found";
        case 429 -> "rate_limited";
        case 503 -> "service_unavailable";
        default -> statusCode >= 500 ? "server_error" : "client_error";
      };
    }

    if (exception instanceof SocketTimeoutException
        || exception instanceof HttpTimeoutException
        || exception instanceof TimeoutException) {
      return "timeout";
    }

    if (exception instanceof UnknownHostException || exception instanceof ConnectException) {
      return "network";
    }

    if (exception instanceof SSLException) {
      return "ssl";
    }

    if (exception instanceof VaultConnectionException || exception instanceof IOException) {
      Throwable cause = exception.getCause();
      if (cause != null && cause != exception) {
        String nested = getErrorCategory(cause);
        if (!"unknown".equals(nested)) {
          return nested;
        }
      }
      return "network";
    }

    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return getErrorCategory(cause);
    }

    return "unknown";
  }
}
