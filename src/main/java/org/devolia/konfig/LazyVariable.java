package org.devolia.konfig;

import java.util.function.Function;
import java.util.function.Supplier;
import org.devolia.konfig.exception.MissingOptionException;

/**
 * An option computed at access time from other options.
 *
 * <p>The function receives the {@link Konfig} it is evaluated in, so it can read the options it
 * depends on. If one of them is missing, the default is used instead.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class LazyVariable {

  private static final Object NOT_SET = new Object();

  private final Function<Konfig, ?> function;
  private final Object defaultValue;
  private final Function<Object, ?> cast;

  private LazyVariable(
      Function<Konfig, ?> function, Object defaultValue, Function<Object, ?> cast) {
    if (function == null) {
      throw new IllegalArgumentException("Lazy option function cannot be null");
    }
    this.function = function;
    this.defaultValue = defaultValue;
    this.cast = cast;
  }

  public static LazyVariable lazy(Function<Konfig, ?> function) {
    return new LazyVariable(function, NOT_SET, null);
  }

  public LazyVariable withDefault(Object defaultValue) {
    return new LazyVariable(function, defaultValue, cast);
  }

  public LazyVariable withCast(Function<Object, ?> cast) {
    return new LazyVariable(function, defaultValue, cast);
  }

  /**
   * Computes the value.
   *
   * @param konfig the configuration to read dependencies from
   * @return the cast result, or the default if a dependency is missing
   * @throws MissingOptionException if a dependency is missing and there is no default
   */
  public Object evaluate(Konfig konfig) {
    try {
      Object result = function.apply(konfig);
      return cast != null ? cast.apply(result) : result;
    } catch (MissingOptionException e) {
      if (defaultValue == NOT_SET) {
        throw e;
      }
      if (defaultValue instanceof Supplier<?> supplier) {
        return supplier.get();
      }
      return defaultValue;
    }
  }
}
