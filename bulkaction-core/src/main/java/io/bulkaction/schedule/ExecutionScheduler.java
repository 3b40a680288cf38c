package io.bulkaction.schedule;

import io.bulkaction.BulkActionException;
import io.bulkaction.ExecutionNotFoundException;
import io.bulkaction.SchedulingConflictException;
import io.bulkaction.SpecInvalidException;
import io.bulkaction.dispatch.BatchDispatcher;
import io.bulkaction.dispatch.ExecutionFinalizer;
import io.bulkaction.model.EntityRegistry;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.TargetResolver;
import io.bulkaction.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds deferred executions and promotes them when due.
 *
 * <p>Promotion is guarded by a conditional {@code SCHEDULED -> PENDING} transition, so running
 * {@link #processDue()} again, or on several nodes, never dispatches an execution twice.
 */
public final class ExecutionScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ExecutionScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionStore executionStore;
  private final TargetResolver targetResolver;
  private final EntityRegistry entities;
  private final BatchDispatcher dispatcher;
  private final ExecutionFinalizer finalizer;
  private final Clock clock;
  private final long maxRecordsPerAction;
  private final Duration maxHorizon;
  private final int batchLimit;
  private final long intervalSeconds;

  private ScheduledExecutorService timer;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private ExecutionScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.targetResolver = Objects.requireNonNull(builder.targetResolver, "targetResolver");
    this.entities = Objects.requireNonNull(builder.entities, "entities");
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.finalizer = Objects.requireNonNull(builder.finalizer, "finalizer");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.batchLimit <= 0) {
      throw new IllegalArgumentException("batchLimit must be > 0");
    }
    if (builder.intervalSeconds <= 0) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.maxRecordsPerAction = builder.maxRecordsPerAction;
    this.maxHorizon = builder.maxHorizon;
    this.batchLimit = builder.batchLimit;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ExecutionScheduler has been closed");
    }
    if (task != null) {
      return;
    }
    timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("bulkaction-scheduler-"));
    task = timer.scheduleWithFixedDelay(this::runSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  private void runSafely() {
    try {
      processDue();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduler cycle failed", t);
    }
  }

  /**
   * Promotes every due scheduled execution and dispatches it.
   *
   * @return number of executions this call promoted
   */
  public int processDue() {
    if (closed) {
      return 0;
    }
    int promoted = 0;
    while (true) {
      List<Execution> due;
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        due = executionStore.findDueScheduled(conn, clock.instant(), batchLimit);
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to load due executions", e);
        return promoted;
      }
      int promotedThisRound = 0;
      for (Execution execution : due) {
        if (promote(execution)) {
          promotedThisRound++;
        }
      }
      promoted += promotedThisRound;
      if (due.size() < batchLimit || promotedThisRound == 0) {
        break;
      }
    }
    return promoted;
  }

  private boolean promote(Execution execution) {
    Execution pending;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      EntityType entity = entities.require(execution.entityType());
      long count = targetResolver.count(conn, entity, execution.filter());
      Instant now = clock.instant();
      if (!executionStore.updateTotal(conn, execution.id(), count, ExecutionStatus.SCHEDULED, now)
          || !executionStore.transition(conn, execution.id(), ExecutionStatus.SCHEDULED,
          ExecutionStatus.PENDING, null, now)) {
        return false;
      }
      if (count > maxRecordsPerAction) {
        String reason = "Target set grew to " + count + " records, above the limit of "
            + maxRecordsPerAction;
        failPending(conn, execution.id(), reason);
        return true;
      }
      pending = executionStore.find(conn, execution.id()).orElseThrow(
          () -> new ExecutionNotFoundException(execution.id()));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to promote scheduled execution " + execution.id(), e);
      failQuietly(execution.id(), "Activation failed: " + e.getMessage());
      return false;
    }
    logger.log(Level.FINE, "Promoting scheduled execution " + pending.id() + " with "
        + pending.totalRecords() + " records");
    dispatcher.dispatch(pending);
    return true;
  }

  private void failPending(Connection conn, String executionId, String reason) {
    if (executionStore.transition(conn, executionId, ExecutionStatus.PENDING,
        ExecutionStatus.FAILED, reason, clock.instant())) {
      executionStore.find(conn, executionId).ifPresent(finalizer::announce);
    }
  }

  private void failQuietly(String executionId, String reason) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      failPending(conn, executionId, reason);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark execution " + executionId + " FAILED", e);
    }
  }

  /**
   * Cancels a scheduled execution before it is ever dispatched.
   *
   * @throws SchedulingConflictException if it is no longer scheduled
   */
  public Execution cancel(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Execution execution = require(conn, executionId);
      if (!executionStore.transition(conn, executionId, ExecutionStatus.SCHEDULED,
          ExecutionStatus.CANCELLED, null, clock.instant())) {
        throw new SchedulingConflictException(executionId, "cancel",
            reload(conn, execution).status());
      }
      Execution cancelled = reload(conn, execution);
      finalizer.announce(cancelled);
      return cancelled;
    } catch (SQLException e) {
      throw new BulkActionException("Failed to cancel execution " + executionId, e);
    }
  }

  /**
   * Moves the activation time of a scheduled execution. The undo window keeps its length and
   * moves with it.
   *
   * @throws SpecInvalidException if {@code scheduledFor} is not in the future or beyond the horizon
   * @throws SchedulingConflictException if the execution is no longer scheduled
   */
  public Execution reschedule(String executionId, Instant scheduledFor) {
    validateActivation(scheduledFor);
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Execution execution = require(conn, executionId);
      if (execution.status() != ExecutionStatus.SCHEDULED) {
        throw new SchedulingConflictException(executionId, "reschedule", execution.status());
      }
      Instant undoExpiresAt = null;
      if (execution.undoExpiresAt() != null && execution.scheduledFor() != null) {
        undoExpiresAt = scheduledFor.plus(
            Duration.between(execution.scheduledFor(), execution.undoExpiresAt()));
      }
      if (!executionStore.reschedule(conn, executionId, scheduledFor, undoExpiresAt,
          clock.instant())) {
        throw new SchedulingConflictException(executionId, "reschedule",
            reload(conn, execution).status());
      }
      return reload(conn, execution);
    } catch (SQLException e) {
      throw new BulkActionException("Failed to reschedule execution " + executionId, e);
    }
  }

  /**
   * @throws SpecInvalidException if {@code scheduledFor} is not in the future or beyond the horizon
   */
  public void validateActivation(Instant scheduledFor) {
    Instant now = clock.instant();
    if (!scheduledFor.isAfter(now)) {
      throw new SpecInvalidException("Scheduled time must be in the future: " + scheduledFor);
    }
    if (scheduledFor.isAfter(now.plus(maxHorizon))) {
      throw new SpecInvalidException("Scheduled time is more than " + maxHorizon.toDays()
          + " days ahead: " + scheduledFor);
    }
  }

  /**
   * Scheduled executions, soonest first.
   *
   * @param actor restricts the list to one actor, or {@code null} for all
   */
  public List<Execution> listScheduled(String actor) {
    return findScheduled(actor, null);
  }

  /**
   * Scheduled executions due within {@code window} from now.
   */
  public List<Execution> listUpcoming(Duration window, String actor) {
    return findScheduled(actor, clock.instant().plus(window));
  }

  private List<Execution> findScheduled(String actor, Instant before) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return executionStore.findScheduled(conn, actor, before);
    } catch (SQLException e) {
      throw new BulkActionException("Failed to list scheduled executions", e);
    }
  }

  private Execution require(Connection conn, String executionId) {
    return executionStore.find(conn, executionId)
        .orElseThrow(() -> new ExecutionNotFoundException(executionId));
  }

  private Execution reload(Connection conn, Execution fallback) {
    return executionStore.find(conn, fallback.id()).orElse(fallback);
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (timer != null) {
      timer.shutdownNow();
      try {
        timer.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionStore executionStore;
    private TargetResolver targetResolver;
    private EntityRegistry entities;
    private BatchDispatcher dispatcher;
    private ExecutionFinalizer finalizer;
    private Clock clock;
    private long maxRecordsPerAction = 100_000;
    private Duration maxHorizon = Duration.ofDays(365);
    private int batchLimit = 100;
    private long intervalSeconds = 60;

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

    public Builder targetResolver(TargetResolver targetResolver) {
      this.targetResolver = targetResolver;
      return this;
    }

    public Builder entities(EntityRegistry entities) {
      this.entities = entities;
      return this;
    }

    public Builder dispatcher(BatchDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    public Builder finalizer(ExecutionFinalizer finalizer) {
      this.finalizer = finalizer;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@code 100000}. */
    public Builder maxRecordsPerAction(long maxRecordsPerAction) {
      this.maxRecordsPerAction = maxRecordsPerAction;
      return this;
    }

    /** Optional. Furthest an activation may lie ahead. Defaults to 365 days. */
    public Builder maxHorizon(Duration maxHorizon) {
      this.maxHorizon = Objects.requireNonNull(maxHorizon, "maxHorizon");
      return this;
    }

    /** Optional. Due executions loaded per round. Defaults to {@code 100}. */
    public Builder batchLimit(int batchLimit) {
      this.batchLimit = batchLimit;
      return this;
    }

    /** Optional. Defaults to {@code 60} seconds. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public ExecutionScheduler build() {
      return new ExecutionScheduler(this);
    }
  }
}
