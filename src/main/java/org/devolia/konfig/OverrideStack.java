package org.devolia.konfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.devolia.konfig.exception.ForbiddenOverrideException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named override layers applied on top of the settings.
 *
 * <p>Lookups scan layers from the most recently activated to the oldest. Layers are removed by id,
 * so they do not need to be removed in reverse order. A layer value of {@code null} means "not
 * overridden": the lookup stops there and falls back to the settings.
 *
 * <p>The stack is not synchronized. Activation and deactivation are expected to happen on one
 * logical thread of control.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class OverrideStack {

  private static final Logger logger = LoggerFactory.getLogger(OverrideStack.class);

  private final Map<String, Map<String, Object>> layers = new LinkedHashMap<>();
  private final boolean strict;
  private final Supplier<Set<String>> declaredNames;

  /**
   * Creates an empty stack.
   *
   * @param strict reject overrides of undeclared options
   * @param declaredNames supplies the declared option names; called on every strict activation
   */
  public OverrideStack(boolean strict, Supplier<Set<String>> declaredNames) {
    this.strict = strict;
    this.declaredNames = declaredNames;
  }

  /**
   * Pushes a layer.
   *
   * @param id the layer id, unique among active layers
   * @param values the overridden options
   * @throws ForbiddenOverrideException in strict mode, if a key is not a declared option; the stack
   *     is left unchanged
   * @throws IllegalStateException if a layer with this id is already active
   */
  public void activate(String id, Map<String, ?> values) {
    logger.debug("Start overriding with {}", values.keySet());
    if (strict) {
      validate(values.keySet());
    }
    if (layers.containsKey(id)) {
      throw new IllegalStateException("Override `" + id + "` is already active");
    }
    layers.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
  }

  /**
   * Removes a layer.
   *
   * @param id the layer id
   * @throws IllegalStateException if no layer with this id is active
   */
  public void deactivate(String id) {
    Map<String, Object> removed = layers.remove(id);
    if (removed == null) {
      throw new IllegalStateException("Override `" + id + "` is not active");
    }
    logger.debug("Stop overriding with {}", removed.keySet());
  }

  /** Removes every layer. */
  public void deactivateAll() {
    logger.debug("Stop overriding");
    layers.clear();
  }

  /**
   * Looks an option up in the layers, newest first.
   *
   * @param name the option name
   * @return the overriding value, or empty to fall back to the settings
   */
  public Optional<Object> resolve(String name) {
    if (layers.isEmpty()) {
      return Optional.empty();
    }
    List<Map<String, Object>> ordered = new ArrayList<>(layers.values());
    for (int i = ordered.size() - 1; i >= 0; i--) {
      Map<String, Object> layer = ordered.get(i);
      if (layer.containsKey(name)) {
        return Optional.ofNullable(layer.get(name));
      }
    }
    return Optional.empty();
  }

  public boolean isActive(String id) {
    return layers.containsKey(id);
  }

  public boolean isEmpty() {
    return layers.isEmpty();
  }

  public int size() {
    return layers.size();
  }

  private void validate(Set<String> keys) {
    Set<String> declared = declaredNames.get();
    List<String> invalid =
        keys.stream().filter(key -> !declared.contains(key)).collect(Collectors.toList());
    if (invalid.isEmpty()) {
      return;
    }
    if (invalid.size() == 1) {
      throw new ForbiddenOverrideException(
          String.format(
              "Can't override `%s` config option, because it is not defined in the config module",
              invalid.get(0)));
    }
    throw new ForbiddenOverrideException(
        String.format(
            "Can't override %s config options, because they are not defined in the config module",
            invalid.stream().map(key -> "`" + key + "`").collect(Collectors.joining(", "))));
  }
}
