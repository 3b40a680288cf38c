package io.bulkaction.spi;

import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for the execution ledger.
 *
 * <p>Every mutating method is conditional: it names the state it expects and returns
 * {@code false} (or {@code 0}) without writing when the row is not in that state. Counter
 * updates are single-statement increments so concurrent batches never lose an update.
 *
 * <p>All methods use the caller's connection and never commit or roll back.
 */
public interface ExecutionStore {

  void insert(Connection conn, Execution execution);

  Optional<Execution> find(Connection conn, String executionId);

  /**
   * Moves an execution from {@code expected} to {@code target}. Moving to
   * {@code PROCESSING} stamps {@code started_at}; moving to a terminal status stamps
   * {@code completed_at}.
   *
   * @param errorDetail human-readable reason stored with the row, or {@code null} to keep the current one
   * @return {@code true} if the row was in {@code expected} and is now in {@code target}
   */
  boolean transition(Connection conn, String executionId, ExecutionStatus expected,
      ExecutionStatus target, String errorDetail, Instant now);

  /**
   * Atomically adds to the processed and failed counters, but only while the execution is
   * {@code PROCESSING} and the result keeps {@code processed + failed <= total}.
   *
   * @return {@code true} if the increment was applied
   */
  boolean incrementCounters(Connection conn, String executionId, long processedDelta,
      long failedDelta, Instant now);

  /**
   * Replaces the total while the execution is still in {@code expected}.
   */
  boolean updateTotal(Connection conn, String executionId, long totalRecords,
      ExecutionStatus expected, Instant now);

  /**
   * Counts the actor's non-terminal executions.
   */
  int countActiveByActor(Connection conn, String actor);

  /**
   * Returns scheduled executions whose activation time is at or before {@code now},
   * oldest first.
   */
  List<Execution> findDueScheduled(Connection conn, Instant now, int limit);

  /**
   * Returns scheduled executions, soonest first.
   *
   * @param actor  restricts to one actor, or {@code null} for all
   * @param before restricts to activations strictly before this instant, or {@code null}
   */
  List<Execution> findScheduled(Connection conn, String actor, Instant before);

  boolean reschedule(Connection conn, String executionId, Instant scheduledFor,
      Instant undoExpiresAt, Instant now);

  /**
   * One-shot undo claim: clears the undo flag and stamps {@code undone_at} if the flag is
   * still set. Exactly one concurrent caller wins.
   */
  boolean claimUndo(Connection conn, String executionId, Instant now);

  /**
   * Clears the undo flag without marking the execution undone. Used when the window lapses.
   */
  boolean disableUndo(Connection conn, String executionId, Instant now);

  /**
   * Returns ids of executions whose undo flag is set but whose window ended before {@code now}.
   */
  List<String> findExpiredUndo(Connection conn, Instant now, int limit);

  /**
   * Returns ids of terminal executions completed before {@code cutoff} that are not undo-eligible.
   */
  List<String> findPurgeable(Connection conn, Instant cutoff, int limit);

  int delete(Connection conn, String executionId);
}
