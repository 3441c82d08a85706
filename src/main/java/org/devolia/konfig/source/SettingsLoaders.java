package org.devolia.konfig.source;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.devolia.konfig.Environment;
import org.devolia.konfig.exception.SettingsNotLoadableException;
import org.devolia.konfig.exception.SettingsNotSpecifiedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factories for the usual kinds of {@link SettingsLoader}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class SettingsLoaders {

  private static final Logger logger = LoggerFactory.getLogger(SettingsLoaders.class);

  private SettingsLoaders() {}

  /**
   * Loads the settings class named by an environment variable.
   *
   * @param variable the variable holding a fully qualified class name
   * @param environment where to read the variable
   * @return a loader; the variable is read when the loader runs
   */
  public static SettingsLoader fromEnvironment(String variable, Environment environment) {
    return () -> {
      String className = environment.get(variable);
      if (className == null || className.isEmpty()) {
        throw new SettingsNotSpecifiedException(
            String.format(
                "The environment variable `%s` is not set or empty and as such configuration"
                    + " could not be loaded. Set this variable and make it point to a"
                    + " configuration class",
                variable));
      }
      return fromClassName(className).load();
    };
  }

  /**
   * Loads the public static fields of a class.
   *
   * @param className fully qualified class name
   * @return a loader failing with {@link SettingsNotLoadableException} if the class is not found
   */
  public static SettingsLoader fromClassName(String className) {
    return () -> {
      Class<?> settingsClass;
      try {
        settingsClass = Class.forName(className, true, classLoader());
      } catch (ClassNotFoundException | LinkageError e) {
        throw new SettingsNotLoadableException(
            String.format("Unable to load configuration file `%s`", className), e);
      }
      logger.debug("Loading settings from class {}", className);
      return new ClassSettingsSource(settingsClass);
    };
  }

  public static SettingsLoader fromJson(Path path) {
    return () -> new JsonSettingsSource(path);
  }

  /**
   * Picks a loader for an arbitrary settings object.
   *
   * @param settings a class name, a {@link Class}, a {@link Map}, a {@link SettingsSource} or any
   *     object with public fields
   * @return the matching loader
   */
  public static SettingsLoader forObject(Object settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings object cannot be null");
    }
    if (settings instanceof String className) {
      return fromClassName(className);
    }
    if (settings instanceof Class<?> settingsClass) {
      return () -> new ClassSettingsSource(settingsClass);
    }
    if (settings instanceof Map<?, ?> map) {
      return () -> new MapSettingsSource("Config", toStringKeys(map));
    }
    if (settings instanceof SettingsSource source) {
      return () -> source;
    }
    return () -> new ClassSettingsSource(settings);
  }

  private static Map<String, Object> toStringKeys(Map<?, ?> map) {
    Map<String, Object> result = new LinkedHashMap<>();
    map.forEach((key, value) -> result.put(String.valueOf(key), value));
    return result;
  }

  private static ClassLoader classLoader() {
    ClassLoader context = Thread.currentThread().getContextClassLoader();
    return context != null ? context : SettingsLoaders.class.getClassLoader();
  }
}
