package org.devolia.konfig;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Value conversions for option descriptors.
 *
 * <p>Every conversion accepts the raw value as it arrives from the environment or from a secret
 * payload, so they can be passed directly as a cast:
 * {@code env("DEBUG").withCast(Casts::toBoolean)}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class Casts {

  private static final Map<String, Boolean> BOOLEANS =
      Map.of(
          "1", true,
          "yes", true,
          "true", true,
          "on", true,
          "0", false,
          "no", false,
          "false", false,
          "off", false,
          "", false);

  private Casts() {}

  /**
   * Converts a value to a boolean. Accepts 1/yes/true/on and 0/no/false/off or an empty string,
   * case-insensitive.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static Boolean toBoolean(Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    Boolean result = BOOLEANS.get(String.valueOf(value).toLowerCase(Locale.ROOT));
    if (result == null) {
      throw new IllegalArgumentException("Not a boolean: `" + value + "`");
    }
    return result;
  }

  public static Integer toInteger(Object value) {
    if (value instanceof Integer integer) {
      return integer;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    return Integer.valueOf(String.valueOf(value).trim());
  }

  /**
   * Converts a value to a decimal. Floating point numbers go through their string form, so {@code
   * 1.3} becomes {@code 1.3} and not its binary approximation.
   */
  public static BigDecimal toDecimal(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    return new BigDecimal(String.valueOf(value).trim());
  }
}
