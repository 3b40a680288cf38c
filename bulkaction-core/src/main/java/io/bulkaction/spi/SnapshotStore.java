package io.bulkaction.spi;

import io.bulkaction.model.SnapshotRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Persistence for pre-mutation snapshots.
 */
public interface SnapshotStore {

  /**
   * Stores a snapshot unless a non-undone one already exists for the same execution and record.
   *
   * @return {@code true} if the snapshot was stored
   */
  boolean insert(Connection conn, SnapshotRecord snapshot);

  /**
   * Pages through non-undone snapshots in id order.
   */
  List<SnapshotRecord> findPending(Connection conn, String executionId, long afterId, int limit);

  boolean markUndone(Connection conn, long snapshotId, Instant undoneAt, String undoneBy);

  long countPending(Connection conn, String executionId);

  /**
   * Deletes up to {@code limit} non-undone snapshots of the execution.
   */
  int deletePending(Connection conn, String executionId, int limit);

  int deleteByExecution(Connection conn, String executionId);
}
