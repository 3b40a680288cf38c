package io.bulkaction.dispatch;

/**
 * Computes how long a batch waits before its next attempt after a transient failure.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * @param attempts attempts made so far (1-based)
   * @return delay in milliseconds, non-negative
   */
  long computeDelayMs(int attempts);
}
