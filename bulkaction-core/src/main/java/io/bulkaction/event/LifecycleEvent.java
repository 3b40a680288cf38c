package io.bulkaction.event;

import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;

import java.time.Instant;

/**
 * Notification about one execution, published to an {@link io.bulkaction.spi.EventSink}.
 *
 * @param percentage progress in {@code [0, 100]}
 * @param detail     error detail or other free text, may be {@code null}
 */
public record LifecycleEvent(
    Type type,
    String executionId,
    String actor,
    ExecutionStatus status,
    long totalRecords,
    long processedRecords,
    long failedRecords,
    double percentage,
    String detail,
    Instant occurredAt
) {

  public enum Type {
    SUBMITTED,
    SCHEDULED,
    STARTED,
    PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED,
    UNDONE
  }

  public static LifecycleEvent of(Type type, Execution execution, double percentage,
      String detail, Instant occurredAt) {
    return new LifecycleEvent(type, execution.id(), execution.actor(), execution.status(),
        execution.totalRecords(), execution.processedRecords(), execution.failedRecords(),
        percentage, detail, occurredAt);
  }
}
