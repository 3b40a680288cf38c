package io.bulkaction.dispatch;

/**
 * Keeps a node from working on the same batch twice at once when it arrives through both
 * the hot queue and the poller.
 */
public interface InFlightTracker {
  boolean tryAcquire(String batchKey);

  void release(String batchKey);
}
