package io.bulkaction.poller;

import io.bulkaction.dispatch.BatchDispatcher;
import io.bulkaction.dispatch.QueuedBatch;

import java.util.Objects;

/**
 * Hands polled batches to a {@link BatchDispatcher}'s cold queue.
 */
public final class DispatcherPollerHandler implements BatchPollerHandler {
  private final BatchDispatcher dispatcher;

  public DispatcherPollerHandler(BatchDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  @Override
  public boolean handle(QueuedBatch batch) {
    return dispatcher.enqueueCold(batch);
  }

  @Override
  public int availableCapacity() {
    return dispatcher.coldQueueRemainingCapacity();
  }
}
