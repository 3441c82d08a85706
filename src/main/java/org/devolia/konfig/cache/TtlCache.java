package org.devolia.konfig.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory cache with an optional time-to-live.
 *
 * <p>Entries are kept in an unbounded Caffeine cache and expired lazily: every read path checks
 * the entry age against the configured TTL and deletes the entry before reporting it as absent.
 * Without a TTL entries are kept until they are overwritten or the cache is cleared.
 *
 * <p>Deletion of an expired entry is a conditional remove on the Caffeine map view, so a reader
 * that loses the race against a concurrent reader or writer treats it as a no-op.
 *
 * @param <V> the cached value type
 * @author Devolia
 * @since 1.0.0
 */
public class TtlCache<V> {

  private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

  /** Upper bound for the TTL, in seconds. */
  public static final long MAX_TTL_SECONDS = 999_999_999L;

  private final Duration ttl;
  private final Clock clock;
  private final Cache<String, CacheEntry<V>> entries;

  /**
   * Creates a cache that uses the system clock.
   *
   * @param ttl time-to-live for entries, or null to keep entries forever
   */
  public TtlCache(Duration ttl) {
    this(ttl, Clock.systemUTC());
  }

  /**
   * Creates a cache.
   *
   * @param ttl time-to-live for entries, or null to keep entries forever
   * @param clock the clock used to stamp and expire entries
   * @throws IllegalArgumentException if the TTL is out of range
   */
  public TtlCache(Duration ttl, Clock clock) {
    validateTtl(ttl);
    this.ttl = ttl;
    this.clock = clock;
    this.entries = Caffeine.newBuilder().build();

    if (ttl != null) {
      logger.debug("Built TTL cache with TTL: {}", ttl);
    } else {
      logger.debug("Built cache without expiry");
    }
  }

  /**
   * Validates a TTL value.
   *
   * @param ttl the TTL to check, null is allowed
   * @throws IllegalArgumentException if the TTL is not in (0, 999999999] seconds
   */
  public static void validateTtl(Duration ttl) {
    if (ttl == null) {
      return;
    }
    if (ttl.isZero()
        || ttl.isNegative()
        || ttl.compareTo(Duration.ofSeconds(MAX_TTL_SECONDS)) > 0) {
      throw new IllegalArgumentException(
          "Cache TTL should be in range (0, " + MAX_TTL_SECONDS + "] seconds: " + ttl);
    }
  }

  /**
   * Gets a cached value.
   *
   * @param key the cache key
   * @return the value, or empty if absent or expired
   */
  public Optional<V> get(String key) {
    CacheEntry<V> entry = entries.getIfPresent(key);
    if (entry == null || deleteIfExpired(key, entry)) {
      return Optional.empty();
    }
    return Optional.of(entry.getValue());
  }

  /**
   * Stores a value, resetting its expiry clock.
   *
   * @param key the cache key
   * @param value the value to cache
   * @throws IllegalArgumentException if the value is null
   */
  public void set(String key, V value) {
    if (value == null) {
      throw new IllegalArgumentException("Cannot cache a null value for \"" + key + "\"");
    }
    Instant insertedAt;
    if (ttl != null) {
      insertedAt = clock.instant();
      logger.debug("Add \"{}\" to cache for {}", key, ttl);
    } else {
      insertedAt = null;
      logger.debug("Add \"{}\" to cache forever", key);
    }
    entries.put(key, new CacheEntry<>(value, insertedAt));
  }

  /**
   * Checks if a live entry exists for the key.
   *
   * @param key the cache key
   * @return true if the key is cached and not expired
   */
  public boolean contains(String key) {
    CacheEntry<V> entry = entries.getIfPresent(key);
    return entry != null && !deleteIfExpired(key, entry);
  }

  /** Removes a single entry. */
  public void invalidate(String key) {
    entries.invalidate(key);
  }

  /** Removes all entries. */
  public void clear() {
    entries.invalidateAll();
    logger.debug("Cleared cache");
  }

  /**
   * Gets the number of stored entries, including expired ones not read since they expired.
   *
   * @return number of entries
   */
  public long size() {
    return entries.estimatedSize();
  }

  /**
   * Gets the configured TTL.
   *
   * @return the TTL, or empty when entries never expire
   */
  public Optional<Duration> ttl() {
    return Optional.ofNullable(ttl);
  }

  private boolean deleteIfExpired(String key, CacheEntry<V> entry) {
    if (!entry.isExpired(ttl, clock.instant())) {
      return false;
    }
    logger.debug("Delete expired \"{}\" cache entry", key);
    // Conditional remove: a concurrent reader may already have dropped or replaced it
    entries.asMap().remove(key, entry);
    return true;
  }
}
