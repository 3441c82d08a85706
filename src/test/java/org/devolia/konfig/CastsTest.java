package org.devolia.konfig;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Casts.
 *
 * @author Devolia
 * @since 1.0.0
 */
class CastsTest {

  @Test
  void testToBoolean() {
    for (String value : List.of("1", "yes", "true", "on", "TRUE", "Yes")) {
      assertTrue(Casts.toBoolean(value), value);
    }
    for (String value : List.of("0", "no", "false", "off", "", "OFF")) {
      assertFalse(Casts.toBoolean(value), value);
    }
    assertTrue(Casts.toBoolean(true));
    assertFalse(Casts.toBoolean(0));

    IllegalArgumentException exception =
        assertThrows(IllegalArgumentException.class, () -> Casts.toBoolean("maybe"));
    assertEquals("Not a boolean: `maybe`", exception.getMessage());
  }

  @Test
  void testToInteger() {
    assertEquals(42, Casts.toInteger("42"));
    assertEquals(42, Casts.toInteger(" 42 "));
    assertEquals(42, Casts.toInteger(42L));
    assertThrows(NumberFormatException.class, () -> Casts.toInteger("4.2"));
  }

  @Test
  void testToDecimal() {
    assertEquals(new BigDecimal("1.3"), Casts.toDecimal("1.3"));
    assertEquals(new BigDecimal("1.3"), Casts.toDecimal(1.3));
    assertThrows(NumberFormatException.class, () -> Casts.toDecimal("abc"));
  }
}
