package org.devolia.konfig.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP access to the Vault API.
 *
 * <p>Two endpoints are used:
 *
 * <ul>
 *   <li><code>GET {address}/v1/{path}</code> with the <code>X-Vault-Token</code> header
 *   <li><code>POST {address}/v1/auth/userpass/login/{username}</code> with a <code>password
 *       </code> body, answering <code>{"auth": {"client_token": ...}}</code>
 * </ul>
 *
 * <p>A 404 on read is not an error: the parsed body is returned as is and the caller reports the
 * missing <code>data</code>. Other non-success statuses raise {@link VaultResponseException};
 * I/O failures raise {@link VaultConnectionException}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class VaultTransport {

  private static final Logger logger = LoggerFactory.getLogger(VaultTransport.class);

  static final String TOKEN_HEADER = "X-Vault-Token";

  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeout;

  public VaultTransport(Duration requestTimeout) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build(),
        new ObjectMapper(),
        requestTimeout);
  }

  public VaultTransport(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.requestTimeout = requestTimeout;
  }

  /**
   * Reads a secret path.
   *
   * @param address the Vault server address
   * @param path the full secret path
   * @param token the client token
   * @return the parsed response body
   * @throws VaultResponseException on a non-success status other than 404
   * @throws VaultConnectionException if the server cannot be reached
   */
  public Map<String, Object> read(String address, String path, String token) {
    HttpRequest request = readRequest(address, path, token);
    return handleRead(path, send(request));
  }

  /** Asynchronous variant of {@link #read(String, String, String)}. */
  public CompletableFuture<Map<String, Object>> readAsync(
      String address, String path, String token) {
    HttpRequest request = readRequest(address, path, token);
    return sendAsync(request).thenApply(response -> handleRead(path, response));
  }

  /**
   * Logs in with username and password.
   *
   * @param address the Vault server address
   * @param username the userpass username
   * @param password the userpass password
   * @return the issued client token
   */
  public String login(String address, String username, String password) {
    HttpRequest request = loginRequest(address, username, password);
    return handleLogin(username, send(request));
  }

  /** Asynchronous variant of {@link #login(String, String, String)}. */
  public CompletableFuture<String> loginAsync(String address, String username, String password) {
    HttpRequest request = loginRequest(address, username, password);
    return sendAsync(request).thenApply(response -> handleLogin(username, response));
  }

  /**
   * Joins the server address with an API path.
   *
   * @param address the Vault server address, with or without a trailing slash
   * @param path the API path below <code>/v1/</code>
   * @return the absolute endpoint URI
   */
  static URI endpoint(String address, String path) {
    String base = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    String relative = path.startsWith("/") ? path.substring(1) : path;
    return URI.create(base + "/v1/" + relative);
  }

  private HttpRequest readRequest(String address, String path, String token) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(endpoint(address, path)).timeout(requestTimeout).GET();
    if (token != null) {
      builder.header(TOKEN_HEADER, token);
    }
    return builder.build();
  }

  private HttpRequest loginRequest(String address, String username, String password) {
    String body;
    try {
      body = objectMapper.writeValueAsString(Collections.singletonMap("password", password));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode Vault login request", e);
    }
    return HttpRequest.newBuilder(endpoint(address, "auth/userpass/login/" + username))
        .timeout(requestTimeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
  }

  private HttpResponse<String> send(HttpRequest request) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new VaultConnectionException("Unable to reach Vault at " + request.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while calling Vault at " + request.uri(), e);
    }
  }

  private CompletableFuture<HttpResponse<String>> sendAsync(HttpRequest request) {
    return httpClient
        .sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .exceptionally(
            error -> {
              Throwable cause = error instanceof CompletionException ? error.getCause() : error;
              throw new CompletionException(
                  new VaultConnectionException("Unable to reach Vault at " + request.uri(), cause));
            });
  }

  private Map<String, Object> handleRead(String path, HttpResponse<String> response) {
    int status = response.statusCode();
    logger.debug("Vault read of \"{}\" answered with status {}", path, status);
    if (status >= 400 && status != 404) {
      throw new VaultResponseException(
          "Vault rejected read of `" + path + "` with status " + status, status);
    }
    return parse(response.body(), status);
  }

  private String handleLogin(String username, HttpResponse<String> response) {
    int status = response.statusCode();
    if (status >= 400) {
      throw new VaultResponseException(
          "Vault rejected userpass login for `" + username + "` with status " + status, status);
    }
    Object auth = parse(response.body(), status).get("auth");
    if (auth instanceof Map<?, ?> authMap && authMap.get("client_token") instanceof String token) {
      return token;
    }
    throw new VaultResponseException(
        "Vault login response for `" + username + "` does not contain a client token", status);
  }

  private Map<String, Object> parse(String body, int status) {
    if (body == null || body.isBlank()) {
      return Collections.emptyMap();
    }
    try {
      return objectMapper.readValue(body, JSON_OBJECT);
    } catch (JsonProcessingException e) {
      throw new VaultResponseException(
          "Vault answered with a malformed JSON body (status " + status + ")", status);
    }
  }
}
