package io.bulkaction.event;

import io.bulkaction.spi.EventSink;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wraps an {@link EventSink} so a misbehaving sink never breaks the caller.
 */
public final class EventPublisher {
  private static final Logger logger = Logger.getLogger(EventPublisher.class.getName());

  private final EventSink sink;

  public EventPublisher(EventSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  public void publish(LifecycleEvent event) {
    try {
      sink.publish(event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Event sink failed for " + event.type()
          + " executionId=" + event.executionId(), e);
    }
  }
}
