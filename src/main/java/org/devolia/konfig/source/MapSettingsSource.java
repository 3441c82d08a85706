package org.devolia.konfig.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Settings held in a map. The map is copied when the source is created. */
public class MapSettingsSource implements SettingsSource {

  private final String name;
  private final Map<String, Object> values;

  public MapSettingsSource(String name, Map<String, ?> values) {
    this.name = name;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Set<String> getNames() {
    return values.keySet();
  }

  @Override
  public boolean contains(String name) {
    return values.containsKey(name);
  }

  @Override
  public Object get(String name) {
    return values.get(name);
  }

  @Override
  public String toString() {
    return "MapSettingsSource{name=" + name + ", names=" + values.keySet() + "}";
  }
}
