package org.devolia.konfig;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import org.devolia.konfig.exception.InvalidSecretOverrideException;
import org.devolia.konfig.exception.MissingOptionException;
import org.devolia.konfig.exception.SecretKeyMissingException;
import org.devolia.konfig.exception.SecretsDisabledException;
import org.devolia.konfig.vault.VaultBackend;
import org.devolia.konfig.vault.VaultCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An option stored in Vault.
 *
 * <p>A variable points to a secret path and, optionally, to a key path inside the secret payload:
 *
 * <pre>
 * SecretVariable.vault("path/to").key("db").key("password")
 * </pre>
 *
 * <p>Instances are immutable; {@link #key(String)}, {@link #withCast(Function)} and {@link
 * #withDefault(Object)} return new variables, so a partially built variable can be shared safely.
 *
 * <p>Before Vault is contacted, the environment variable named by {@link #overrideVariableName()}
 * is checked. When set, it must hold a JSON object, and the value is taken from it instead.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class SecretVariable {

  private static final Logger logger = LoggerFactory.getLogger(SecretVariable.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  private static final String SEPARATOR = "__";
  private static final String EXAMPLE_VALUE = "example_value";

  private final String path;
  private final List<String> keys;
  private final Function<Object, ?> cast;
  private final Object defaultValue;
  private final boolean hasDefault;

  private SecretVariable(
      String path,
      List<String> keys,
      Function<Object, ?> cast,
      Object defaultValue,
      boolean hasDefault) {
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("Secret path cannot be null or empty");
    }
    this.path = path;
    this.keys = Collections.unmodifiableList(keys);
    this.cast = cast;
    this.defaultValue = defaultValue;
    this.hasDefault = hasDefault;
  }

  /** A secret value from Vault. */
  public static SecretVariable vault(String path) {
    return new SecretVariable(path, List.of(), null, null, false);
  }

  /** A secret value from Vault, exposed as an {@link java.io.InputStream} of its UTF-8 bytes. */
  public static SecretVariable vaultFile(String path) {
    return vault(path)
        .withCast(
            value ->
                new ByteArrayInputStream(String.valueOf(value).getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Selects a nested key of the secret payload.
   *
   * @param key the key, applied after the keys already selected
   * @return a new variable with the extended key path
   */
  public SecretVariable key(String key) {
    List<String> extended = new ArrayList<>(keys);
    extended.add(key);
    return new SecretVariable(path, extended, cast, defaultValue, hasDefault);
  }

  public SecretVariable withCast(Function<Object, ?> cast) {
    return new SecretVariable(path, keys, cast, defaultValue, hasDefault);
  }

  /** Value returned when the key path is absent from the payload. Does not apply to the path. */
  public SecretVariable withDefault(Object defaultValue) {
    return new SecretVariable(path, keys, cast, defaultValue, true);
  }

  public String getPath() {
    return path;
  }

  public List<String> getKeys() {
    return keys;
  }

  /**
   * Name of the environment variable that overrides this secret.
   *
   * <p>Leading and trailing slashes are stripped, slashes become double underscores and the result
   * is upper-cased: {@code "path/to"} gives {@code "PATH__TO"}.
   */
  public String overrideVariableName() {
    String stripped = path.replaceAll("^/+|/+$", "");
    return stripped.replace("/", SEPARATOR).toUpperCase(Locale.ROOT);
  }

  /**
   * Example of how to override this secret through the environment.
   *
   * @return a single entry mapping the override variable name to a sample JSON value
   */
  public Map<String, String> overrideExample() {
    String value;
    if (keys.isEmpty()) {
      value = "{}";
    } else {
      Map<String, Object> example = new LinkedHashMap<>();
      Map<String, Object> level = example;
      for (String key : keys.subList(0, keys.size() - 1)) {
        Map<String, Object> next = new LinkedHashMap<>();
        level.put(key, next);
        level = next;
      }
      level.put(keys.get(keys.size() - 1), EXAMPLE_VALUE);
      try {
        value = MAPPER.writeValueAsString(example);
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Unable to serialize override example", e);
      }
    }
    return Map.of(overrideVariableName(), value);
  }

  /**
   * Resolves the value.
   *
   * <p>The environment override is consulted first when the backend allows it, and it is honoured
   * even when secrets are disabled. Otherwise the credentials are resolved, the payload is loaded
   * and the key path is applied.
   *
   * @param backend the Vault client
   * @param credentials supplies the address and credentials; may throw {@link
   *     MissingOptionException}
   * @param context evaluation flags
   * @return the value, or a {@link java.util.concurrent.CompletableFuture} of it for an async
   *     backend
   * @throws InvalidSecretOverrideException if the override variable is not a JSON object
   * @throws SecretsDisabledException if secrets are disabled and no override is set
   * @throws MissingOptionException if the credentials cannot be resolved
   */
  public Object evaluate(
      VaultBackend backend, Supplier<VaultCredentials> credentials, ResolutionContext context) {
    if (backend.isTryEnvFirst()) {
      String override = context.getEnvironment().get(overrideVariableName());
      if (override != null) {
        logger.debug("Secret \"{}\" is overridden by `{}`", path, overrideVariableName());
        return backend.completed(extractValue(parseOverride(override), context));
      }
    }

    if (context.isSecretsDisabled()) {
      throw new SecretsDisabledException(
          String.format(
              "Access to vault is disabled. Unset `%s` environment variable to enable it.",
              ResolutionContext.SECRETS_DISABLED_VARIABLE));
    }

    VaultCredentials resolved;
    try {
      resolved = credentials.get();
    } catch (MissingOptionException e) {
      throw new MissingOptionException(
          String.format("Can't access secret `%s` due to failing to load Vault config", path), e);
    }

    return backend.loadAndApply(path, resolved, data -> extractValue(data, context));
  }

  private Map<String, Object> parseOverride(String raw) {
    JsonNode node;
    try {
      node = MAPPER.readTree(raw);
    } catch (JsonProcessingException e) {
      node = null;
    }
    if (node == null || !node.isObject()) {
      throw new InvalidSecretOverrideException(
          String.format(
              "`%s` variable should be a JSON-encoded dictionary, got: `%s`",
              overrideVariableName(), raw));
    }
    return MAPPER.convertValue(node, JSON_OBJECT);
  }

  private Object extractValue(Map<String, Object> data, ResolutionContext context) {
    Object current = data;
    for (String key : keys) {
      if (current instanceof Map<?, ?> level && level.containsKey(key)) {
        current = level.get(key);
        continue;
      }
      if (hasDefault && !context.isDefaultsDisabled()) {
        return defaultValue;
      }
      throw new SecretKeyMissingException(
          String.format(
              "Path `%s` exists in Vault but does not contain given key path - `%s`",
              path, String.join(".", keys)));
    }
    return cast != null ? cast.apply(current) : current;
  }

  @Override
  public String toString() {
    return "SecretVariable{path=" + path + ", keys=" + keys + "}";
  }
}
