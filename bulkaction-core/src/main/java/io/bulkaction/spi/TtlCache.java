package io.bulkaction.spi;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Best-effort key/value cache with per-entry expiry. Holds progress checkpoints,
 * cooldown timers and cancellation flags; nothing stored here is authoritative.
 *
 * @see io.bulkaction.cache.InMemoryTtlCache
 */
public interface TtlCache {

  <T> Optional<T> get(String key, Class<T> type);

  void put(String key, Object value, Duration ttl);

  void remove(String key);

  /**
   * Atomically replaces the entry with {@code fn(current)}, where {@code current} is
   * {@code null} if absent or expired. A {@code null} result removes the entry.
   */
  <T> T compute(String key, Class<T> type, Duration ttl, UnaryOperator<T> fn);
}
