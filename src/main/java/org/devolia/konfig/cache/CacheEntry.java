package org.devolia.konfig.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Wrapper for a cached value that records when it was inserted.
 *
 * <p>The insertion time is {@code null} when the owning cache has no TTL, meaning the value never
 * expires.
 *
 * @param <V> the cached value type
 * @author Devolia
 * @since 1.0.0
 */
public class CacheEntry<V> {

  private final V value;
  private final Instant insertedAt;

  /**
   * Constructor for a cache entry.
   *
   * @param value the cached value
   * @param insertedAt when the value was cached (null if it never expires)
   */
  public CacheEntry(V value, Instant insertedAt) {
    this.value = value;
    this.insertedAt = insertedAt;
  }

  /**
   * Gets the cached value.
   *
   * @return the cached value
   */
  public V getValue() {
    return value;
  }

  /**
   * Gets when this value was cached.
   *
   * @return the insertion timestamp, or null for entries that never expire
   */
  public Instant getInsertedAt() {
    return insertedAt;
  }

  /**
   * Checks if the entry has outlived the given TTL.
   *
   * @param ttl the cache TTL, or null for no expiry
   * @param now the current time
   * @return true if the entry is expired
   */
  public boolean isExpired(Duration ttl, Instant now) {
    if (ttl == null || insertedAt == null) {
      return false;
    }
    return !now.isBefore(insertedAt.plus(ttl));
  }
}
