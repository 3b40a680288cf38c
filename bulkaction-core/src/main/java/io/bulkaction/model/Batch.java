package io.bulkaction.model;

import java.time.Instant;
import java.util.List;

/**
 * One unit of work of an {@link Execution}.
 *
 * <p>{@code cursor} is the index into {@code recordIds} of the next record to process, so a
 * retried or reclaimed batch resumes where the previous attempt stopped instead of applying
 * the action twice.
 */
public record Batch(
    String executionId,
    int batchNumber,
    List<String> recordIds,
    BatchStatus status,
    int processedCount,
    int failedCount,
    int cursor,
    int attempts,
    String errorDetail,
    Instant availableAt,
    Instant createdAt,
    Instant completedAt
) {
  public Batch {
    recordIds = List.copyOf(recordIds);
  }

  public int size() {
    return recordIds.size();
  }

  public String key() {
    return executionId + "#" + batchNumber;
  }
}
