package io.bulkaction.dispatch;

import io.bulkaction.event.EventPublisher;
import io.bulkaction.event.LifecycleEvent;
import io.bulkaction.gate.SubmissionGate;
import io.bulkaction.model.Batch;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.progress.ProgressTracker;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves executions into their terminal status and announces it.
 *
 * <p>An execution completes once none of its batches is outstanding. It ends {@code FAILED}
 * instead when its failed share strictly exceeds the failure threshold.
 */
public final class ExecutionFinalizer {
  private static final Logger logger = Logger.getLogger(ExecutionFinalizer.class.getName());

  private final ExecutionStore executionStore;
  private final BatchStore batchStore;
  private final ProgressTracker tracker;
  private final EventPublisher events;
  private final MetricsExporter metrics;
  private final CancellationFlags cancellation;
  private final Clock clock;
  private final double failureThreshold;
  private final SubmissionGate gate;
  private final long cooldownThreshold;

  private ExecutionFinalizer(Builder builder) {
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.batchStore = Objects.requireNonNull(builder.batchStore, "batchStore");
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.events = Objects.requireNonNull(builder.events, "events");
    this.cancellation = Objects.requireNonNull(builder.cancellation, "cancellation");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.failureThreshold < 0.0 || builder.failureThreshold > 1.0) {
      throw new IllegalArgumentException("failureThreshold must be in [0, 1]");
    }
    this.failureThreshold = builder.failureThreshold;
    this.gate = builder.gate;
    this.cooldownThreshold = builder.cooldownThreshold;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Finishes the execution if it is processing and no batch is outstanding. Expects an
   * auto-commit connection.
   *
   * @return the execution in its terminal status if this call finished it
   */
  public Optional<Execution> finishIfDone(Connection conn, String executionId) {
    if (batchStore.countOutstanding(conn, executionId) > 0) {
      return Optional.empty();
    }
    Optional<Execution> current = executionStore.find(conn, executionId);
    if (current.isEmpty() || current.get().status() != ExecutionStatus.PROCESSING) {
      return Optional.empty();
    }
    Execution execution = current.get();
    double failedShare = execution.totalRecords() == 0
        ? 0.0 : (double) execution.failedRecords() / execution.totalRecords();
    ExecutionStatus target = failedShare > failureThreshold
        ? ExecutionStatus.FAILED : ExecutionStatus.COMPLETED;
    String detail = describeOutcome(execution, target, failedShare);
    if (!executionStore.transition(conn, executionId, ExecutionStatus.PROCESSING, target, detail,
        clock.instant())) {
      return Optional.empty();
    }
    Optional<Execution> finished = executionStore.find(conn, executionId);
    finished.ifPresent(this::announce);
    return finished;
  }

  /**
   * Fails every record of the batch past its cursor and adds them to the execution's failed
   * count, in one transaction.
   *
   * @return number of records newly counted as failed
   */
  public int failRemaining(Connection conn, String executionId, int batchNumber, String error)
      throws SQLException {
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      Optional<Batch> batch = batchStore.find(conn, executionId, batchNumber);
      int failed = batchStore.failRemaining(conn, executionId, batchNumber, error, clock.instant());
      if (failed > 0 && batch.isPresent()) {
        Batch b = batch.get();
        tracker.update(conn, executionId, 0, failed,
            b.recordIds().subList(b.cursor(), b.recordIds().size()));
      }
      conn.commit();
      if (failed > 0) {
        metrics.incrementRecordsFailed(failed);
      }
      return Math.max(0, failed);
    } catch (SQLException | RuntimeException e) {
      conn.rollback();
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }

  /**
   * Stops an execution after a record failure under {@link FailurePolicy#ABORT}: unclaimed
   * batches are cancelled and the execution fails with {@code reason}.
   */
  public boolean abort(Connection conn, String executionId, String reason) {
    batchStore.cancelUnclaimed(conn, executionId, clock.instant());
    if (!executionStore.transition(conn, executionId, ExecutionStatus.PROCESSING,
        ExecutionStatus.FAILED, reason, clock.instant())) {
      return false;
    }
    executionStore.find(conn, executionId).ifPresent(this::announce);
    return true;
  }

  /**
   * Publishes the terminal event for {@code execution} and releases its tracking state. Arms
   * the actor's cooldown after a successful large execution.
   */
  public void announce(Execution execution) {
    tracker.finish(execution.id());
    cancellation.clear(execution.id());
    metrics.incrementExecutionFinished(execution.status());
    LifecycleEvent.Type type = switch (execution.status()) {
      case COMPLETED -> LifecycleEvent.Type.COMPLETED;
      case FAILED -> LifecycleEvent.Type.FAILED;
      default -> LifecycleEvent.Type.CANCELLED;
    };
    events.publish(LifecycleEvent.of(type, execution, ProgressTracker.getProgress(execution),
        execution.errorDetail(), clock.instant()));
    if (gate != null && execution.actor() != null
        && execution.status() == ExecutionStatus.COMPLETED
        && execution.totalRecords() >= cooldownThreshold) {
      gate.setCooldown(execution.actor());
    }
    logger.log(Level.INFO, "Execution " + execution.id() + " finished " + execution.status()
        + " processed=" + execution.processedRecords() + " failed=" + execution.failedRecords()
        + " total=" + execution.totalRecords());
  }

  private String describeOutcome(Execution execution, ExecutionStatus target, double failedShare) {
    if (execution.failedRecords() == 0) {
      return null;
    }
    String counts = execution.failedRecords() + " of " + execution.totalRecords()
        + " records failed, " + execution.processedRecords() + " processed";
    if (target == ExecutionStatus.FAILED) {
      return counts + String.format(Locale.ROOT, " (%.1f%% failed, above the %.1f%% threshold)",
          failedShare * 100.0, failureThreshold * 100.0);
    }
    return counts;
  }

  public static final class Builder {
    private ExecutionStore executionStore;
    private BatchStore batchStore;
    private ProgressTracker tracker;
    private EventPublisher events;
    private MetricsExporter metrics;
    private CancellationFlags cancellation;
    private Clock clock;
    private double failureThreshold = 0.5;
    private SubmissionGate gate;
    private long cooldownThreshold = 10_000;

    private Builder() {
    }

    public Builder executionStore(ExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    public Builder batchStore(BatchStore batchStore) {
      this.batchStore = batchStore;
      return this;
    }

    public Builder tracker(ProgressTracker tracker) {
      this.tracker = tracker;
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

    public Builder cancellation(CancellationFlags cancellation) {
      this.cancellation = cancellation;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Failed share above which an execution ends FAILED. Defaults to {@code 0.5}. */
    public Builder failureThreshold(double failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /** Optional. When set, completed executions of at least {@code cooldownThreshold} records arm a cooldown. */
    public Builder gate(SubmissionGate gate) {
      this.gate = gate;
      return this;
    }

    /** Optional. Defaults to {@code 10000}. */
    public Builder cooldownThreshold(long cooldownThreshold) {
      this.cooldownThreshold = cooldownThreshold;
      return this;
    }

    public ExecutionFinalizer build() {
      return new ExecutionFinalizer(this);
    }
  }
}
