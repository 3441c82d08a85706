package org.devolia.konfig.source;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings declared as public fields.
 *
 * <p>For a {@link Class}, its public static fields are read. For any other object, its public
 * fields are read, static or not. Values are captured once, when the source is created.
 *
 * <pre>
 * public final class ProductionSettings {
 *   public static final String DEBUG = "false";
 *   public static final SecretVariable SECRET = SecretVariable.vault("path/to").key("SECRET");
 * }
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClassSettingsSource extends MapSettingsSource {

  public ClassSettingsSource(Class<?> settingsClass) {
    super(settingsClass.getName(), readFields(settingsClass, null));
  }

  public ClassSettingsSource(Object settings) {
    super(settings.getClass().getName(), readFields(settings.getClass(), settings));
  }

  private static Map<String, Object> readFields(Class<?> type, Object instance) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (Field field : type.getFields()) {
      boolean isStatic = Modifier.isStatic(field.getModifiers());
      if (!isStatic && instance == null) {
        continue;
      }
      try {
        values.put(field.getName(), field.get(isStatic ? null : instance));
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Cannot read settings field " + field, e);
      }
    }
    return values;
  }
}
