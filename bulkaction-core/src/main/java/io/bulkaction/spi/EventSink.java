package io.bulkaction.spi;

import io.bulkaction.event.LifecycleEvent;

/**
 * Fire-and-forget receiver of execution lifecycle notifications. Exceptions thrown by a sink
 * are logged and discarded.
 */
@FunctionalInterface
public interface EventSink {

  EventSink NOOP = event -> {
  };

  void publish(LifecycleEvent event);
}
