package org.devolia.konfig.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered stack of settings sources. Newer layers take precedence.
 *
 * <p>Each layer is loaded on first access and memoized, so a settings class or file is read at
 * most once.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class LayeredSettings implements SettingsSource {

  private static final Logger logger = LoggerFactory.getLogger(LayeredSettings.class);

  private final List<Layer> layers = new CopyOnWriteArrayList<>();

  public LayeredSettings(SettingsLoader loader) {
    append(loader);
  }

  /**
   * Adds a layer on top of the existing ones.
   *
   * @param loader loads the layer on first access
   */
  public void append(SettingsLoader loader) {
    layers.add(new Layer(loader));
  }

  /**
   * Checks if a name is a configuration option name: it has at least one letter and no lower-case
   * letter.
   */
  public static boolean isOptionName(String name) {
    boolean hasLetter = false;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isLowerCase(c)) {
        return false;
      }
      if (Character.isUpperCase(c)) {
        hasLetter = true;
      }
    }
    return hasLetter;
  }

  /**
   * Gets the declared option names of all layers.
   *
   * @return upper-case names, sorted
   */
  public Set<String> getOptionNames() {
    return getNames().stream()
        .filter(LayeredSettings::isOptionName)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  @Override
  public String getName() {
    return newestFirst().stream().map(SettingsSource::getName).collect(Collectors.joining(", "));
  }

  @Override
  public Set<String> getNames() {
    Set<String> names = new TreeSet<>();
    for (SettingsSource source : newestFirst()) {
      names.addAll(source.getNames());
    }
    return names;
  }

  @Override
  public boolean contains(String name) {
    for (SettingsSource source : newestFirst()) {
      if (source.contains(name)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Object get(String name) {
    for (SettingsSource source : newestFirst()) {
      if (source.contains(name)) {
        return source.get(name);
      }
    }
    return null;
  }

  private List<SettingsSource> newestFirst() {
    List<SettingsSource> sources = new ArrayList<>(layers.size());
    for (int i = layers.size() - 1; i >= 0; i--) {
      sources.add(layers.get(i).get());
    }
    return sources;
  }

  private static final class Layer {

    private final SettingsLoader loader;
    private volatile SettingsSource source;

    private Layer(SettingsLoader loader) {
      this.loader = loader;
    }

    private SettingsSource get() {
      SettingsSource result = source;
      if (result == null) {
        synchronized (this) {
          result = source;
          if (result == null) {
            result = loader.load();
            source = result;
            logger.info("Configuration loaded from {}", result.getName());
          }
        }
      }
      return result;
    }
  }
}
