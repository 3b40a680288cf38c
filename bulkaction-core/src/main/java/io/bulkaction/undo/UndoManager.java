package io.bulkaction.undo;

import io.bulkaction.BulkActionException;
import io.bulkaction.ExecutionNotFoundException;
import io.bulkaction.UndoUnavailableException;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.event.EventPublisher;
import io.bulkaction.event.LifecycleEvent;
import io.bulkaction.model.EntityRegistry;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.model.MutationType;
import io.bulkaction.model.SnapshotRecord;
import io.bulkaction.model.TargetRecord;
import io.bulkaction.model.UndoOperation;
import io.bulkaction.progress.ProgressTracker;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.MetricsExporter;
import io.bulkaction.spi.RecordStore;
import io.bulkaction.spi.SnapshotStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Captures pre-mutation snapshots and replays them to reverse an execution.
 *
 * <p>Undo is one-shot: the first caller atomically clears the execution's undo flag and
 * every later call fails with {@link UndoUnavailableException.Reason#ALREADY_UNDONE}.
 * Restoration is best-effort. Each snapshot is restored in its own transaction; one that
 * fails is logged, counted and left non-undone while the rest carry on. This holds whatever
 * failure policy forward processing uses.
 */
public final class UndoManager {
  private static final Logger logger = Logger.getLogger(UndoManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionStore executionStore;
  private final SnapshotStore snapshotStore;
  private final RecordStore recordStore;
  private final EntityRegistry entities;
  private final EventPublisher events;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int pageSize;

  private UndoManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.snapshotStore = Objects.requireNonNull(builder.snapshotStore, "snapshotStore");
    this.recordStore = Objects.requireNonNull(builder.recordStore, "recordStore");
    this.entities = Objects.requireNonNull(builder.entities, "entities");
    this.events = Objects.requireNonNull(builder.events, "events");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0");
    }
    this.pageSize = builder.pageSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static UndoOperation undoOperationFor(MutationType mutation) {
    return mutation.undoOperation();
  }

  /**
   * Picks the columns to keep from {@code record}: every column for
   * {@link ActionHandler#ALL_FIELDS}, otherwise the declared columns the record has.
   */
  public static Map<String, Object> selectFields(TargetRecord record, Set<String> declared) {
    if (declared.equals(ActionHandler.ALL_FIELDS)) {
      return new LinkedHashMap<>(record.fields());
    }
    Map<String, Object> selected = new LinkedHashMap<>();
    for (String column : declared) {
      String key = column.toLowerCase(Locale.ROOT);
      if (record.fields().containsKey(key)) {
        selected.put(key, record.fields().get(key));
      }
    }
    return selected;
  }

  /**
   * Stores the pre-mutation state of {@code record} inside the caller's transaction.
   *
   * @return {@code false} if a non-undone snapshot for this record already existed
   */
  public boolean captureSnapshot(Connection conn, Execution execution, TargetRecord record,
      UndoOperation operation, Set<String> fields) {
    SnapshotRecord snapshot = new SnapshotRecord(0L, execution.id(), record.id(),
        execution.entityType(), selectFields(record, fields), operation, false, null, null,
        clock.instant());
    return snapshotStore.insert(conn, snapshot);
  }

  /**
   * Returns why {@code execution} cannot be undone without consulting snapshots, or empty if
   * it passes the flag, window and status checks.
   */
  public Optional<UndoUnavailableException.Reason> checkEligibility(Execution execution) {
    if (execution.undoneAt() != null) {
      return Optional.of(UndoUnavailableException.Reason.ALREADY_UNDONE);
    }
    if (!execution.undoEnabled()) {
      return Optional.of(execution.undoExpiresAt() == null
          ? UndoUnavailableException.Reason.NEVER_ENABLED
          : UndoUnavailableException.Reason.EXPIRED);
    }
    if (execution.undoExpiresAt() == null || !clock.instant().isBefore(execution.undoExpiresAt())) {
      return Optional.of(UndoUnavailableException.Reason.EXPIRED);
    }
    if (execution.status() != ExecutionStatus.COMPLETED) {
      return Optional.of(UndoUnavailableException.Reason.NOT_COMPLETED);
    }
    return Optional.empty();
  }

  public boolean canUndo(Connection conn, Execution execution) {
    return checkEligibility(execution).isEmpty()
        && snapshotStore.countPending(conn, execution.id()) > 0;
  }

  /**
   * Time left in the undo window; {@link Duration#ZERO} when the execution cannot be undone.
   */
  public Duration getTimeRemaining(Execution execution) {
    if (checkEligibility(execution).isPresent()) {
      return Duration.ZERO;
    }
    Duration left = Duration.between(clock.instant(), execution.undoExpiresAt());
    return left.isNegative() ? Duration.ZERO : left;
  }

  /**
   * Reverses every non-undone snapshot of the execution.
   *
   * @throws UndoUnavailableException if the execution is not eligible
   * @throws ExecutionNotFoundException if it does not exist
   */
  public UndoResult undo(String executionId, String actor) {
    Execution execution;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      execution = executionStore.find(conn, executionId)
          .orElseThrow(() -> new ExecutionNotFoundException(executionId));
      Optional<UndoUnavailableException.Reason> reason = checkEligibility(execution);
      if (reason.isPresent()) {
        throw new UndoUnavailableException(executionId, reason.get());
      }
      if (snapshotStore.countPending(conn, executionId) == 0) {
        throw new UndoUnavailableException(executionId,
            UndoUnavailableException.Reason.NOTHING_TO_UNDO);
      }
      if (!executionStore.claimUndo(conn, executionId, clock.instant())) {
        Execution latest = executionStore.find(conn, executionId).orElse(execution);
        throw new UndoUnavailableException(executionId, checkEligibility(latest)
            .orElse(UndoUnavailableException.Reason.ALREADY_UNDONE));
      }
    } catch (SQLException e) {
      throw new BulkActionException("Undo failed for executionId=" + executionId, e);
    }

    EntityType entity = entities.require(execution.entityType());
    long restored = 0;
    long failed = 0;
    long afterId = 0;
    while (true) {
      List<SnapshotRecord> page = loadPage(executionId, afterId);
      if (page.isEmpty()) {
        break;
      }
      for (SnapshotRecord snapshot : page) {
        afterId = snapshot.id();
        if (restoreOne(entity, snapshot, actor)) {
          restored++;
        } else {
          failed++;
        }
      }
      if (page.size() < pageSize) {
        break;
      }
    }

    metrics.incrementUndone(restored, failed);
    Execution after = reload(executionId).orElse(execution);
    events.publish(LifecycleEvent.of(LifecycleEvent.Type.UNDONE, after,
        ProgressTracker.getProgress(after),
        failed == 0 ? null : failed + " record(s) could not be restored", clock.instant()));
    logger.log(Level.INFO, "Undo of executionId=" + executionId + " restored=" + restored
        + " failed=" + failed);
    return new UndoResult(executionId, restored, failed);
  }

  private List<SnapshotRecord> loadPage(String executionId, long afterId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return snapshotStore.findPending(conn, executionId, afterId, pageSize);
    } catch (SQLException e) {
      throw new BulkActionException(
          "Failed to load snapshots for executionId=" + executionId, e);
    }
  }

  private Optional<Execution> reload(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return executionStore.find(conn, executionId);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to reload executionId=" + executionId, e);
      return Optional.empty();
    }
  }

  private boolean restoreOne(EntityType entity, SnapshotRecord snapshot, String actor) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        restore(conn, entity, snapshot);
        snapshotStore.markUndone(conn, snapshot.id(), clock.instant(), actor);
        conn.commit();
        return true;
      } catch (Exception e) {
        rollbackQuietly(conn);
        logger.log(Level.WARNING, "Failed to restore recordId=" + snapshot.recordId()
            + " of executionId=" + snapshot.executionId(), e);
        return false;
      }
    } catch (SQLException e) {
      logger.log(Level.WARNING, "No connection to restore recordId=" + snapshot.recordId()
          + " of executionId=" + snapshot.executionId(), e);
      return false;
    }
  }

  private void restore(Connection conn, EntityType entity, SnapshotRecord snapshot) {
    switch (snapshot.undoOperation()) {
      case REINSTATE_DELETED, DELETE_AGAIN, REVERT_FIELDS -> {
        if (snapshot.fields().isEmpty()) {
          return;
        }
        if (!recordStore.update(conn, entity, snapshot.recordId(), snapshot.fields())) {
          throw new IllegalStateException("Record " + snapshot.recordId() + " no longer exists");
        }
      }
      case RECREATE_FROM_SCRATCH -> {
        if (recordStore.find(conn, entity, snapshot.recordId()).isPresent()) {
          throw new IllegalStateException("Record " + snapshot.recordId() + " already exists");
        }
        recordStore.insert(conn, entity, snapshot.fields());
      }
    }
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
    private SnapshotStore snapshotStore;
    private RecordStore recordStore;
    private EntityRegistry entities;
    private EventPublisher events;
    private MetricsExporter metrics;
    private Clock clock;
    private int pageSize = 200;

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

    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    public Builder recordStore(RecordStore recordStore) {
      this.recordStore = recordStore;
      return this;
    }

    public Builder entities(EntityRegistry entities) {
      this.entities = entities;
      return this;
    }

    public Builder events(EventPublisher events) {
      this.events = events;
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

    /** Snapshots loaded per page while restoring. Defaults to {@code 200}. */
    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public UndoManager build() {
      return new UndoManager(this);
    }
  }
}
