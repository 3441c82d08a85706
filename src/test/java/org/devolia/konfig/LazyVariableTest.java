package org.devolia.konfig;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.devolia.konfig.exception.MissingOptionException;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LazyVariable.
 *
 * @author Devolia
 * @since 1.0.0
 */
class LazyVariableTest {

  private final Konfig konfig =
      Konfig.builder()
          .settings(Map.of("HOST", "localhost", "PORT", 5432))
          .environment(Environment.of(Map.of()))
          .build();

  @Test
  void testComputedFromOtherOptions() {
    LazyVariable variable = LazyVariable.lazy(c -> c.get("HOST") + ":" + c.get("PORT"));

    assertEquals("localhost:5432", variable.evaluate(konfig));
  }

  @Test
  void testCast() {
    LazyVariable variable = LazyVariable.lazy(c -> c.get("PORT")).withCast(String::valueOf);

    assertEquals("5432", variable.evaluate(konfig));
  }

  @Test
  void testMissingDependencyUsesDefault() {
    LazyVariable variable = LazyVariable.lazy(c -> c.get("MISSING")).withDefault("fallback");

    assertEquals("fallback", variable.evaluate(konfig));
  }

  @Test
  void testMissingDependencyWithoutDefault() {
    LazyVariable variable = LazyVariable.lazy(c -> c.get("MISSING"));

    assertThrows(MissingOptionException.class, () -> variable.evaluate(konfig));
  }

  @Test
  void testOtherFailuresPropagate() {
    LazyVariable variable =
        LazyVariable.lazy(
                c -> {
                  throw new IllegalStateException("boom");
                })
            .withDefault("fallback");

    assertThrows(IllegalStateException.class, () -> variable.evaluate(konfig));
  }
}
