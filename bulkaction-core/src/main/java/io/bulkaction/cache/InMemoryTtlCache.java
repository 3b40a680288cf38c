package io.bulkaction.cache;

import io.bulkaction.spi.TtlCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * {@link ConcurrentHashMap}-backed {@link TtlCache} for single-node deployments.
 *
 * <p>Expired entries are invisible to readers and are swept every 1024 writes.
 */
public final class InMemoryTtlCache implements TtlCache {
  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final AtomicInteger writeCounter = new AtomicInteger();
  private final Clock clock;

  public InMemoryTtlCache() {
    this(Clock.systemUTC());
  }

  public InMemoryTtlCache(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) {
    Entry entry = entries.get(key);
    if (entry == null || entry.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(type.cast(entry.value));
  }

  @Override
  public void put(String key, Object value, Duration ttl) {
    Objects.requireNonNull(value, "value");
    entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    maybeSweep();
  }

  @Override
  public void remove(String key) {
    entries.remove(key);
  }

  @Override
  public <T> T compute(String key, Class<T> type, Duration ttl, UnaryOperator<T> fn) {
    Instant now = clock.instant();
    Entry result = entries.compute(key, (k, existing) -> {
      T current = existing == null || existing.isExpired(now) ? null : type.cast(existing.value);
      T next = fn.apply(current);
      return next == null ? null : new Entry(next, now.plus(ttl));
    });
    maybeSweep();
    return result == null ? null : type.cast(result.value);
  }

  int size() {
    return entries.size();
  }

  private void maybeSweep() {
    if ((writeCounter.incrementAndGet() & 0x3FF) != 0) {
      return;
    }
    Instant now = clock.instant();
    entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
  }

  private static final class Entry {
    final Object value;
    final Instant expiresAt;

    Entry(Object value, Instant expiresAt) {
      this.value = value;
      this.expiresAt = expiresAt;
    }

    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
