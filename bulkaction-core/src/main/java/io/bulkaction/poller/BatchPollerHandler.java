package io.bulkaction.poller;

import io.bulkaction.dispatch.QueuedBatch;

/**
 * Receives batches found by a {@link BatchPoller}.
 */
public interface BatchPollerHandler {

  /**
   * @return {@code false} when the batch could not be accepted; polling stops for this cycle
   */
  boolean handle(QueuedBatch batch);

  int availableCapacity();
}
