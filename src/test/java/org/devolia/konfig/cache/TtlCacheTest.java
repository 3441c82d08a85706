package org.devolia.konfig.cache;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TtlCache.
 *
 * @author Devolia
 * @since 1.0.0
 */
class TtlCacheTest {

  private MutableClock clock;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
  }

  @Test
  void testValueVisibleUntilTtlElapses() {
    TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(1), clock);
    cache.set("key", "value");

    clock.advance(Duration.ofMillis(500));
    assertEquals("value", cache.get("key").orElseThrow());
    assertTrue(cache.contains("key"));

    clock.advance(Duration.ofMillis(600));
    assertTrue(cache.get("key").isEmpty());
    assertFalse(cache.contains("key"));
  }

  @Test
  void testEntryExpiresExactlyAtTtl() {
    TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(1), clock);
    cache.set("key", "value");

    clock.advance(Duration.ofMillis(999));
    assertTrue(cache.contains("key"));

    clock.advance(Duration.ofMillis(1));
    assertFalse(cache.contains("key"));
  }

  @Test
  void testExpiredEntryIsDeletedOnRead() {
    TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(1), clock);
    cache.set("key", "value");
    assertEquals(1, cache.size());

    clock.advance(Duration.ofSeconds(2));
    // Still stored until something reads it
    assertEquals(1, cache.size());

    assertTrue(cache.get("key").isEmpty());
    assertEquals(0, cache.size());

    // A second read of the removed entry is harmless
    assertTrue(cache.get("key").isEmpty());
    assertFalse(cache.contains("key"));
  }

  @Test
  void testSetResetsExpiry() {
    TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(1), clock);
    cache.set("key", "first");

    clock.advance(Duration.ofMillis(800));
    cache.set("key", "second");

    clock.advance(Duration.ofMillis(800));
    assertEquals("second", cache.get("key").orElseThrow());
  }

  @Test
  void testNoTtlNeverExpires() {
    TtlCache<Map<String, Object>> cache = new TtlCache<>(null, clock);
    Map<String, Object> payload = Map.of("SECRET", "value");
    cache.set("path/to", payload);

    clock.advance(Duration.ofDays(365 * 100));

    assertSame(payload, cache.get("path/to").orElseThrow());
    assertTrue(cache.contains("path/to"));
    assertTrue(cache.ttl().isEmpty());
  }

  @Test
  void testMissingKey() {
    TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(1), clock);

    assertTrue(cache.get("missing").isEmpty());
    assertFalse(cache.contains("missing"));
  }

  @Test
  void testClearAndInvalidate() {
    TtlCache<String> cache = new TtlCache<>(Duration.ofMinutes(1), clock);
    cache.set("a", "1");
    cache.set("b", "2");
    cache.set("c", "3");

    cache.invalidate("a");
    assertFalse(cache.contains("a"));
    assertTrue(cache.contains("b"));

    cache.clear();
    assertFalse(cache.contains("b"));
    assertFalse(cache.contains("c"));
    assertEquals(0, cache.size());
  }

  @Test
  void testNullValueRejected() {
    TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(1), clock);

    assertThrows(IllegalArgumentException.class, () -> cache.set("key", null));
    assertFalse(cache.contains("key"));
    assertTrue(cache.get("key").isEmpty());
  }

  @Test
  void testTtlValidation() {
    assertThrows(IllegalArgumentException.class, () -> new TtlCache<>(Duration.ZERO, clock));
    assertThrows(
        IllegalArgumentException.class, () -> new TtlCache<>(Duration.ofSeconds(-1), clock));
    assertThrows(
        IllegalArgumentException.class,
        () -> new TtlCache<>(Duration.ofSeconds(TtlCache.MAX_TTL_SECONDS + 1), clock));

    assertDoesNotThrow(() -> new TtlCache<>(Duration.ofSeconds(TtlCache.MAX_TTL_SECONDS), clock));
    assertDoesNotThrow(() -> new TtlCache<>(Duration.ofMillis(1), clock));
    assertEquals(
        Duration.ofSeconds(5), new TtlCache<>(Duration.ofSeconds(5), clock).ttl().orElseThrow());
  }

  @Test
  void testCacheEntryExpiry() {
    Instant insertedAt = Instant.parse("2024-01-01T00:00:00Z");
    CacheEntry<String> entry = new CacheEntry<>("value", insertedAt);

    assertFalse(entry.isExpired(Duration.ofSeconds(1), insertedAt.plusMillis(999)));
    assertTrue(entry.isExpired(Duration.ofSeconds(1), insertedAt.plusSeconds(1)));
    assertFalse(entry.isExpired(null, insertedAt.plusSeconds(1000)));

    CacheEntry<String> forever = new CacheEntry<>("value", null);
    assertFalse(forever.isExpired(Duration.ofSeconds(1), insertedAt.plusSeconds(1000)));
    assertNull(forever.getInsertedAt());
  }
}
