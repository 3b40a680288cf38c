package io.bulkaction.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of one row of the execution ledger.
 *
 * <p>Counters satisfy {@code processedRecords + failedRecords <= totalRecords} at all times;
 * the stores only apply increments that keep it true. A dry run is recorded {@code COMPLETED}
 * with its match count as total and no batches.
 */
public record Execution(
    String id,
    String entityType,
    FilterSpec filter,
    String actionName,
    Map<String, Object> parameters,
    int batchSize,
    long totalRecords,
    long processedRecords,
    long failedRecords,
    ExecutionStatus status,
    boolean undoEnabled,
    Instant undoExpiresAt,
    Instant undoneAt,
    Instant scheduledFor,
    String actor,
    String errorDetail,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant updatedAt,
    boolean dryRun
) {

  /** An execution that really runs. */
  public Execution(String id, String entityType, FilterSpec filter, String actionName,
      Map<String, Object> parameters, int batchSize, long totalRecords, long processedRecords,
      long failedRecords, ExecutionStatus status, boolean undoEnabled, Instant undoExpiresAt,
      Instant undoneAt, Instant scheduledFor, String actor, String errorDetail, Instant createdAt,
      Instant startedAt, Instant completedAt, Instant updatedAt) {
    this(id, entityType, filter, actionName, parameters, batchSize, totalRecords,
        processedRecords, failedRecords, status, undoEnabled, undoExpiresAt, undoneAt,
        scheduledFor, actor, errorDetail, createdAt, startedAt, completedAt, updatedAt, false);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public long remainingRecords() {
    return Math.max(0, totalRecords - processedRecords - failedRecords);
  }

  public Execution withStatus(ExecutionStatus newStatus) {
    return new Execution(id, entityType, filter, actionName, parameters, batchSize, totalRecords,
        processedRecords, failedRecords, newStatus, undoEnabled, undoExpiresAt, undoneAt,
        scheduledFor, actor, errorDetail, createdAt, startedAt, completedAt, updatedAt, dryRun);
  }

  public Execution withTotalRecords(long newTotal) {
    return new Execution(id, entityType, filter, actionName, parameters, batchSize, newTotal,
        processedRecords, failedRecords, status, undoEnabled, undoExpiresAt, undoneAt,
        scheduledFor, actor, errorDetail, createdAt, startedAt, completedAt, updatedAt, dryRun);
  }
}
