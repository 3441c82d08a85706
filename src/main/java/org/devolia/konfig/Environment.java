package org.devolia.konfig;

import java.util.Map;

/**
 * Read access to environment variables.
 *
 * <p>Everything that consults the process environment goes through this interface, so tests can
 * provide a fixed map instead of mutating the real environment.
 *
 * @author Devolia
 * @since 1.0.0
 */
@FunctionalInterface
public interface Environment {

  /**
   * Looks up a variable.
   *
   * @param name the variable name
   * @return the value, or null if the variable is not set
   */
  String get(String name);

  /** The real process environment. */
  static Environment system() {
    return System::getenv;
  }

  /** A fixed environment, copied from the given map. */
  static Environment of(Map<String, String> values) {
    Map<String, String> copy = Map.copyOf(values);
    return copy::get;
  }
}
