package org.devolia.konfig;

import java.util.function.Function;
import java.util.function.Supplier;
import org.devolia.konfig.exception.MissingOptionException;

/**
 * An option read from an environment variable.
 *
 * <p>Instances are immutable. The default may be a {@link Supplier}, in which case it is called
 * each time the variable is absent. The cast is applied to present values only.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class EnvVariable {

  private static final Object NOT_SET = new Object();

  private final String name;
  private final Object defaultValue;
  private final Function<Object, ?> cast;

  private EnvVariable(String name, Object defaultValue, Function<Object, ?> cast) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Environment variable name should not be an empty string");
    }
    if (name.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("Environment variable name contains null bytes");
    }
    this.name = name;
    this.defaultValue = defaultValue;
    this.cast = cast;
  }

  public static EnvVariable env(String name) {
    return new EnvVariable(name, NOT_SET, null);
  }

  public static EnvVariable env(String name, Object defaultValue) {
    return new EnvVariable(name, defaultValue, null);
  }

  public EnvVariable withDefault(Object defaultValue) {
    return new EnvVariable(name, defaultValue, cast);
  }

  public EnvVariable withCast(Function<Object, ?> cast) {
    return new EnvVariable(name, defaultValue, cast);
  }

  public String getName() {
    return name;
  }

  /**
   * Reads the variable.
   *
   * @param environment where to look the variable up
   * @return the cast value, or the default when the variable is not set
   * @throws MissingOptionException if the variable is not set and there is no default
   */
  public Object evaluate(Environment environment) {
    String value = environment.get(name);
    if (value == null) {
      if (defaultValue == NOT_SET) {
        throw new MissingOptionException(
            String.format("Variable `%s` is not found and has no `default` specified", name));
      }
      if (defaultValue instanceof Supplier<?> supplier) {
        return supplier.get();
      }
      return defaultValue;
    }
    return cast != null ? cast.apply(value) : value;
  }

  @Override
  public String toString() {
    return "EnvVariable{name=" + name + "}";
  }
}
