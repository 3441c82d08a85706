package org.devolia.konfig.source;

import java.util.Set;

/**
 * A named set of declared configuration options.
 *
 * <p>Values are returned raw: descriptors such as {@link org.devolia.konfig.SecretVariable} are
 * evaluated by {@link org.devolia.konfig.Konfig}, not by the source.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface SettingsSource {

  /** Identifies the source in error messages. */
  String getName();

  /**
   * Gets every name declared by this source.
   *
   * @return declared names, including ones that are not upper-case option names
   */
  Set<String> getNames();

  boolean contains(String name);

  /**
   * Gets the raw value of a declared name.
   *
   * @param name the name
   * @return the value, or null if the name is not declared or holds null
   */
  Object get(String name);
}
