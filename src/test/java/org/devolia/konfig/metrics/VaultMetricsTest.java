package org.devolia.konfig.metrics;

import static org.junit.jupiter.api.Assertions.*;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for VaultMetrics.
 *
 * @author Devolia
 * @since 1.0.0
 */
class VaultMetricsTest {

  private MeterRegistry registry;
  private VaultMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new VaultMetrics(registry, "team");
  }

  @Test
  void testRequestCounters() {
    metrics.recordSuccess(2_000_000);
    metrics.recordSuccess(4_000_000);
    metrics.recordNotFound(1_000_000);
    metrics.recordError(1_000_000, "forbidden");

    assertEquals(2.0, metrics.getSuccessCount());
    assertEquals(1.0, metrics.getNotFoundCount());
    assertEquals(
        1.0,
        registry
            .get("konfig_vault_requests_total")
            .tag("status", "error")
            .tag("error_category", "forbidden")
            .counter()
            .count());
    assertEquals(2.0, metrics.getMeanLatencyMs(), 0.001);
  }

  @Test
  void testCacheAndAuthenticationCounters() {
    metrics.incrementCacheHit();
    metrics.incrementCacheHit();
    metrics.incrementCacheMiss();
    metrics.incrementAuthentication();

    assertEquals(2.0, metrics.getCacheHitCount());
    assertEquals(1.0, metrics.getCacheMissCount());
    assertEquals(1.0, metrics.getAuthenticationCount());
  }

  @Test
  void testRetryCountSumsAllAttempts() {
    metrics.recordRetryAttempt(1, "network");
    metrics.recordRetryAttempt(2, "network");
    metrics.recordRetryAttempt(1, "timeout");

    assertEquals(3.0, metrics.getRetryCount());
  }

  @Test
  void testBackendsAreTaggedSeparately() {
    VaultMetrics other = new VaultMetrics(registry, "other");
    other.recordRetryAttempt(1, "network");

    assertEquals(0.0, metrics.getRetryCount());
    assertEquals(1.0, other.getRetryCount());
  }

  @Test
  void testNullArguments() {
    assertThrows(NullPointerException.class, () -> new VaultMetrics(null, "team"));
    assertDoesNotThrow(() -> new VaultMetrics(registry, null).recordError(1, null));
    assertNotNull(VaultMetrics.standalone("standalone"));
  }
}
