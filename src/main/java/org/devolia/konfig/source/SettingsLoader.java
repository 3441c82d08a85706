package org.devolia.konfig.source;

/**
 * Produces a settings source on first access.
 *
 * @author Devolia
 * @since 1.0.0
 */
@FunctionalInterface
public interface SettingsLoader {

  /**
   * Loads the source. Called at most once per {@link LayeredSettings} layer.
   *
   * @return the loaded source
   * @throws org.devolia.konfig.exception.KonfigException if loading fails
   */
  SettingsSource load();
}
