package io.bulkaction.dispatch;

import io.bulkaction.spi.TtlCache;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-execution cancel flags, read by workers before every record.
 */
public final class CancellationFlags {
  static final String PREFIX = "bulkaction:cancel:";

  private final TtlCache cache;
  private final Duration ttl;

  public CancellationFlags(TtlCache cache, Duration ttl) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
  }

  public void cancel(String executionId) {
    cache.put(PREFIX + executionId, Boolean.TRUE, ttl);
  }

  public boolean isCancelled(String executionId) {
    return cache.get(PREFIX + executionId, Boolean.class).orElse(Boolean.FALSE);
  }

  public void clear(String executionId) {
    cache.remove(PREFIX + executionId);
  }
}
