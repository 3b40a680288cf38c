package io.bulkaction.dispatch;

/**
 * Reference to a batch waiting in a dispatcher queue. Workers load the row itself when they
 * pick it up.
 */
public record QueuedBatch(String executionId, int batchNumber, Source source) {

  public enum Source {
    /** Enqueued right after dispatch or a retry delay. */
    HOT,
    /** Found by the poller. */
    COLD
  }

  public String key() {
    return executionId + "#" + batchNumber;
  }
}
