package io.bulkaction.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay}, scaled by a random jitter
 * in {@code [0.5, 1.5)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long exponential;
    if (attempts >= 63) {
      exponential = Long.MAX_VALUE;
    } else {
      long factor = 1L << (attempts - 1);
      exponential = factor > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * factor;
    }
    long capped = Math.min(maxDelayMs, exponential);
    long jittered = (long) (capped * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, Math.max(0L, jittered));
  }
}
