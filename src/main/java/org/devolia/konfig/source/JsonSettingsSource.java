package org.devolia.konfig.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.devolia.konfig.Casts;
import org.devolia.konfig.EnvVariable;
import org.devolia.konfig.SecretVariable;
import org.devolia.konfig.exception.SettingsNotLoadableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings read from a JSON file whose top level is an object.
 *
 * <p>Nested objects become nested maps, which {@link org.devolia.konfig.Konfig} returns as
 * immutable copies. Two object shapes are read as option descriptors instead:
 *
 * <pre>
 * {"vault": "path/to", "key": ["db", "password"], "default": "x", "cast": "integer"}
 * {"env": "NAME", "default": "x", "cast": "boolean"}
 * </pre>
 *
 * <p>{@code key} may also be a single string. {@code default} and {@code cast} are optional, and
 * {@code cast} is one of {@code boolean}, {@code integer} or {@code decimal}. An object with any
 * other field is a plain nested map.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class JsonSettingsSource extends MapSettingsSource {

  private static final Logger logger = LoggerFactory.getLogger(JsonSettingsSource.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final String VAULT = "vault";
  private static final String ENV = "env";
  private static final String KEY = "key";
  private static final String DEFAULT = "default";
  private static final String CAST = "cast";

  private static final Set<String> SECRET_FIELDS = Set.of(VAULT, KEY, DEFAULT, CAST);
  private static final Set<String> ENV_FIELDS = Set.of(ENV, DEFAULT, CAST);

  private static final Map<String, Function<Object, ?>> CASTS =
      Map.of("boolean", Casts::toBoolean, "integer", Casts::toInteger, "decimal", Casts::toDecimal);

  /**
   * Reads the file.
   *
   * @param path the JSON file
   * @throws SettingsNotLoadableException if the file cannot be read, is not a JSON object or holds
   *     an invalid descriptor
   */
  public JsonSettingsSource(Path path) {
    super(path.toString(), read(path));
  }

  private static Map<String, Object> read(Path path) {
    JsonNode root;
    try (InputStream input = Files.newInputStream(path)) {
      root = MAPPER.readTree(input);
    } catch (IOException e) {
      throw new SettingsNotLoadableException(
          String.format("Unable to load configuration file `%s`", path), e);
    }
    if (root == null || !root.isObject()) {
      throw new SettingsNotLoadableException(
          String.format("Unable to load configuration file `%s`", path), null);
    }
    Map<String, Object> values;
    try {
      values = toMap(root);
    } catch (IllegalArgumentException e) {
      throw new SettingsNotLoadableException(
          String.format("Invalid option in configuration file `%s`: %s", path, e.getMessage()), e);
    }
    logger.debug("Loaded {} options from {}", values.size(), path);
    return values;
  }

  private static Object toValue(JsonNode node) {
    if (node.isObject()) {
      if (isDescriptor(node, VAULT, SECRET_FIELDS)) {
        return toSecret(node);
      }
      if (isDescriptor(node, ENV, ENV_FIELDS)) {
        return toEnv(node);
      }
      return toMap(node);
    }
    if (node.isArray()) {
      List<Object> items = new ArrayList<>();
      node.forEach(item -> items.add(toValue(item)));
      return items;
    }
    return MAPPER.convertValue(node, Object.class);
  }

  private static Map<String, Object> toMap(JsonNode node) {
    Map<String, Object> map = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      map.put(field.getKey(), toValue(field.getValue()));
    }
    return map;
  }

  private static boolean isDescriptor(JsonNode node, String marker, Set<String> allowed) {
    if (!node.path(marker).isTextual()) {
      return false;
    }
    Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      if (!allowed.contains(names.next())) {
        return false;
      }
    }
    return true;
  }

  private static SecretVariable toSecret(JsonNode node) {
    SecretVariable variable = SecretVariable.vault(node.get(VAULT).asText());
    JsonNode keys = node.path(KEY);
    if (keys.isTextual()) {
      variable = variable.key(keys.asText());
    } else if (keys.isArray()) {
      for (JsonNode key : keys) {
        if (!key.isTextual()) {
          throw new IllegalArgumentException("Secret key should be a string, got: " + key);
        }
        variable = variable.key(key.asText());
      }
    } else if (!keys.isMissingNode()) {
      throw new IllegalArgumentException(
          "Secret key should be a string or a list of strings, got: " + keys);
    }
    if (node.has(DEFAULT)) {
      variable = variable.withDefault(toValue(node.get(DEFAULT)));
    }
    if (node.has(CAST)) {
      variable = variable.withCast(cast(node.get(CAST)));
    }
    return variable;
  }

  private static EnvVariable toEnv(JsonNode node) {
    EnvVariable variable = EnvVariable.env(node.get(ENV).asText());
    if (node.has(DEFAULT)) {
      variable = variable.withDefault(toValue(node.get(DEFAULT)));
    }
    if (node.has(CAST)) {
      variable = variable.withCast(cast(node.get(CAST)));
    }
    return variable;
  }

  private static Function<Object, ?> cast(JsonNode node) {
    Function<Object, ?> cast = CASTS.get(node.asText());
    if (cast == null) {
      throw new IllegalArgumentException(
          "Unknown cast `" + node.asText() + "`, expected one of boolean, integer, decimal");
    }
    return cast;
  }
}
