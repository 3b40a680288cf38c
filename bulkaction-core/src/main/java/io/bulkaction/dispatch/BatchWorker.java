package io.bulkaction.dispatch;

import io.bulkaction.action.ActionContext;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionRegistry;
import io.bulkaction.action.ActionResult;
import io.bulkaction.model.Batch;
import io.bulkaction.model.EntityRegistry;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.model.TargetRecord;
import io.bulkaction.progress.ProgressTracker;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.MetricsExporter;
import io.bulkaction.spi.RecordStore;
import io.bulkaction.undo.UndoManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Processes one batch, one transaction per record.
 *
 * <p>Each record's transaction holds its snapshot, the mutation, the batch cursor advance and
 * the execution counter increment, so a crash or retry resumes exactly after the last
 * committed record. A failing record is rolled back and counted in a separate transaction.
 * The cancel flag is read before every record.
 *
 * <p>Transient failures are rethrown as {@link TransientBatchException} for the dispatcher
 * to retry.
 */
public final class BatchWorker {
  private static final Logger logger = Logger.getLogger(BatchWorker.class.getName());

  static final int MAX_ERROR_LENGTH = 4000;

  /** How a call to {@link #process} ended. */
  public enum Outcome {
    COMPLETED,
    CANCELLED,
    ABORTED,
    SKIPPED
  }

  private enum RecordStep {
    SUCCEEDED,
    FAILED,
    STOPPED
  }

  private final ConnectionProvider connectionProvider;
  private final ExecutionStore executionStore;
  private final BatchStore batchStore;
  private final RecordStore recordStore;
  private final ActionRegistry actions;
  private final EntityRegistry entities;
  private final UndoManager undoManager;
  private final ProgressTracker tracker;
  private final ExecutionFinalizer finalizer;
  private final CancellationFlags cancellation;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final FailurePolicy failurePolicy;
  private final Duration batchTimeout;
  private final String ownerId;

  private BatchWorker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.batchStore = Objects.requireNonNull(builder.batchStore, "batchStore");
    this.recordStore = Objects.requireNonNull(builder.recordStore, "recordStore");
    this.actions = Objects.requireNonNull(builder.actions, "actions");
    this.entities = Objects.requireNonNull(builder.entities, "entities");
    this.undoManager = Objects.requireNonNull(builder.undoManager, "undoManager");
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.finalizer = Objects.requireNonNull(builder.finalizer, "finalizer");
    this.cancellation = Objects.requireNonNull(builder.cancellation, "cancellation");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.failurePolicy = builder.failurePolicy != null ? builder.failurePolicy : FailurePolicy.CONTINUE;
    if (builder.batchTimeout.isZero() || builder.batchTimeout.isNegative()) {
      throw new IllegalArgumentException("batchTimeout must be > 0");
    }
    this.batchTimeout = builder.batchTimeout;
    this.ownerId = builder.ownerId != null ? builder.ownerId : "worker-" + UUID.randomUUID();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String ownerId() {
    return ownerId;
  }

  public ExecutionFinalizer finalizer() {
    return finalizer;
  }

  /**
   * @throws TransientBatchException on a retryable failure; records committed before it stay counted
   */
  public Outcome process(QueuedBatch queued) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return process(conn, queued);
    } catch (SQLException e) {
      throw new TransientBatchException("Database unavailable for batch " + queued.key(), e);
    }
  }

  private Outcome process(Connection conn, QueuedBatch queued) throws SQLException {
    Optional<Execution> found = executionStore.find(conn, queued.executionId());
    Optional<Batch> row = batchStore.find(conn, queued.executionId(), queued.batchNumber());
    if (found.isEmpty() || row.isEmpty()) {
      logger.log(Level.WARNING, "Batch " + queued.key() + " no longer exists; skipping");
      return Outcome.SKIPPED;
    }
    Execution execution = found.get();
    Batch batch = row.get();
    if (batch.status().isTerminal()) {
      return Outcome.SKIPPED;
    }
    if (execution.status() != ExecutionStatus.PROCESSING || cancellation.isCancelled(execution.id())) {
      batchStore.cancel(conn, execution.id(), batch.batchNumber(), clock.instant());
      return Outcome.CANCELLED;
    }
    Instant claimedAt = clock.instant();
    if (!batchStore.claim(conn, execution.id(), batch.batchNumber(), ownerId, claimedAt,
        claimedAt.plus(batchTimeout))) {
      return Outcome.SKIPPED;
    }

    EntityType entity = entities.find(execution.entityType()).orElse(null);
    ActionHandler handler = actions.handlerFor(execution.actionName());
    if (entity == null || handler == null) {
      String error = entity == null
          ? "Unknown entity type " + execution.entityType()
          : "No handler registered for action " + execution.actionName();
      logger.log(Level.SEVERE, error + "; failing batch " + batch.key());
      finalizer.failRemaining(conn, execution.id(), batch.batchNumber(), error);
      metrics.incrementBatchFailed();
      finalizer.finishIfDone(conn, execution.id());
      return Outcome.ABORTED;
    }

    Set<String> undoFields = execution.undoEnabled()
        ? handler.declareUndoFields(entity, execution.parameters()) : Set.of();
    long startedMs = clock.millis();
    List<String> ids = batch.recordIds();
    for (int i = batch.cursor(); i < ids.size(); i++) {
      if (cancellation.isCancelled(execution.id())) {
        batchStore.cancel(conn, execution.id(), batch.batchNumber(), clock.instant());
        logger.log(Level.FINE, "Batch " + batch.key() + " stopped by cancellation at record " + i);
        return Outcome.CANCELLED;
      }
      if (clock.millis() - startedMs > batchTimeout.toMillis()) {
        throw new BatchTimeoutException(batch.key(), batchTimeout);
      }
      String recordId = ids.get(i);
      RecordStep step = processRecord(conn, execution, entity, handler, undoFields, batch, recordId);
      if (step == RecordStep.STOPPED) {
        batchStore.cancel(conn, execution.id(), batch.batchNumber(), clock.instant());
        return Outcome.CANCELLED;
      }
      if (step == RecordStep.FAILED && failurePolicy == FailurePolicy.ABORT) {
        String reason = "Aborted after record " + recordId + " failed in batch " + batch.batchNumber();
        finalizer.failRemaining(conn, execution.id(), batch.batchNumber(), reason);
        finalizer.abort(conn, execution.id(), reason);
        return Outcome.ABORTED;
      }
    }

    batchStore.complete(conn, execution.id(), batch.batchNumber(), clock.instant());
    metrics.recordBatchDurationMs(Math.max(0L, clock.millis() - startedMs));
    finalizer.finishIfDone(conn, execution.id());
    return Outcome.COMPLETED;
  }

  private RecordStep processRecord(Connection conn, Execution execution, EntityType entity,
      ActionHandler handler, Set<String> undoFields, Batch batch, String recordId)
      throws SQLException {
    String error;
    conn.setAutoCommit(false);
    try {
      Optional<TargetRecord> record = recordStore.find(conn, entity, recordId);
      if (record.isEmpty()) {
        error = "Record " + recordId + " not found";
      } else {
        if (execution.undoEnabled()) {
          undoManager.captureSnapshot(conn, execution, record.get(), handler.undoOperationType(),
              undoFields);
        }
        ActionResult result = handler.execute(new ActionContext(execution.id(), execution.actor(),
            entity, record.get(), execution.parameters(), conn, recordStore, clock.instant()));
        if (result.success()) {
          return commitOutcome(conn, execution, batch, recordId, true, null);
        }
        error = result.error();
      }
      conn.rollback();
    } catch (Exception e) {
      rollbackQuietly(conn);
      if (TransientBatchException.isTransient(e)) {
        throw e instanceof TransientBatchException t
            ? t : new TransientBatchException("Transient failure on record " + recordId, e);
      }
      error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      logger.log(Level.WARNING, "Record " + recordId + " of execution " + execution.id()
          + " failed", e);
    } finally {
      conn.setAutoCommit(true);
    }
    return recordFailure(conn, execution, batch, recordId, error);
  }

  private RecordStep recordFailure(Connection conn, Execution execution, Batch batch,
      String recordId, String error) throws SQLException {
    conn.setAutoCommit(false);
    try {
      return commitOutcome(conn, execution, batch, recordId, false, error);
    } catch (RuntimeException e) {
      rollbackQuietly(conn);
      throw new TransientBatchException("Failed to record failure of record " + recordId, e);
    } finally {
      conn.setAutoCommit(true);
    }
  }

  private RecordStep commitOutcome(Connection conn, Execution execution, Batch batch,
      String recordId, boolean success, String error) throws SQLException {
    int processed = success ? 1 : 0;
    int failed = success ? 0 : 1;
    batchStore.recordOutcome(conn, execution.id(), batch.batchNumber(), processed, failed,
        truncate(error));
    Optional<Execution> after = tracker.update(conn, execution.id(), processed, failed,
        List.of(recordId));
    if (after.isEmpty()) {
      conn.rollback();
      return RecordStep.STOPPED;
    }
    conn.commit();
    if (success) {
      metrics.incrementRecordsProcessed(1);
    } else {
      metrics.incrementRecordsFailed(1);
    }
    tracker.notifyProgress(after.get());
    return success ? RecordStep.SUCCEEDED : RecordStep.FAILED;
  }

  static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }

  private static void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionStore executionStore;
    private BatchStore batchStore;
    private RecordStore recordStore;
    private ActionRegistry actions;
    private EntityRegistry entities;
    private UndoManager undoManager;
    private ProgressTracker tracker;
    private ExecutionFinalizer finalizer;
    private CancellationFlags cancellation;
    private MetricsExporter metrics;
    private Clock clock;
    private FailurePolicy failurePolicy;
    private Duration batchTimeout = Duration.ofHours(1);
    private String ownerId;

    private Builder() {
    }

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder executionStore(ExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    public Builder batchStore(BatchStore batchStore) {
      this.batchStore = batchStore;
      return this;
    }

    public Builder recordStore(RecordStore recordStore) {
      this.recordStore = recordStore;
      return this;
    }

    public Builder actions(ActionRegistry actions) {
      this.actions = actions;
      return this;
    }

    public Builder entities(EntityRegistry entities) {
      this.entities = entities;
      return this;
    }

    public Builder undoManager(UndoManager undoManager) {
      this.undoManager = undoManager;
      return this;
    }

    public Builder tracker(ProgressTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    public Builder finalizer(ExecutionFinalizer finalizer) {
      this.finalizer = finalizer;
      return this;
    }

    public Builder cancellation(CancellationFlags cancellation) {
      this.cancellation = cancellation;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@link FailurePolicy#CONTINUE}. */
    public Builder failurePolicy(FailurePolicy failurePolicy) {
      this.failurePolicy = failurePolicy;
      return this;
    }

    /** Optional. Longest a single attempt at a batch may run. Defaults to one hour. */
    public Builder batchTimeout(Duration batchTimeout) {
      this.batchTimeout = Objects.requireNonNull(batchTimeout, "batchTimeout");
      return this;
    }

    /** Optional. Identifies this node in batch locks. Defaults to a random id. */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public BatchWorker build() {
      return new BatchWorker(this);
    }
  }
}
