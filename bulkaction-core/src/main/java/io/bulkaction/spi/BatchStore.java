package io.bulkaction.spi;

import io.bulkaction.model.Batch;
import io.bulkaction.model.BatchStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for batches. Same conventions as {@link ExecutionStore}: conditional writes,
 * caller-owned connections.
 */
public interface BatchStore {

  void insert(Connection conn, Batch batch);

  Optional<Batch> find(Connection conn, String executionId, int batchNumber);

  List<Batch> findByExecution(Connection conn, String executionId);

  /**
   * Claims a batch for processing. Succeeds for {@code PENDING} and {@code RETRY} batches
   * that are available, and for {@code PROCESSING} batches whose lock has expired.
   *
   * @return {@code true} if this caller now owns the batch
   */
  boolean claim(Connection conn, String executionId, int batchNumber, String owner,
      Instant now, Instant lockedUntil);

  /**
   * Advances the cursor by one record and adds to the batch counters.
   *
   * @param error message recorded as the batch's last error, or {@code null}
   */
  void recordOutcome(Connection conn, String executionId, int batchNumber, int processedDelta,
      int failedDelta, String error);

  boolean complete(Connection conn, String executionId, int batchNumber, Instant now);

  /**
   * Returns a claimed batch to {@code RETRY}, increments its attempt count and defers it
   * until {@code availableAt}.
   */
  boolean retry(Connection conn, String executionId, int batchNumber, Instant availableAt,
      String error);

  /**
   * Marks a batch {@code FAILED} and counts every record past its cursor as failed.
   *
   * @return number of records newly counted as failed, or {@code -1} if the batch was not
   *     in a non-terminal state
   */
  int failRemaining(Connection conn, String executionId, int batchNumber, String error,
      Instant now);

  boolean cancel(Connection conn, String executionId, int batchNumber, Instant now);

  /**
   * Cancels every batch of the execution that no worker has claimed yet.
   */
  int cancelUnclaimed(Connection conn, String executionId, Instant now);

  long countOutstanding(Connection conn, String executionId);

  Map<BatchStatus, Integer> countByStatus(Connection conn, String executionId);

  /**
   * Returns batches a poller may hand to workers: pending or retry batches that are available,
   * plus processing batches whose lock expired.
   */
  List<Batch> findAvailable(Connection conn, Instant now, int limit);

  int deleteByExecution(Connection conn, String executionId);
}
