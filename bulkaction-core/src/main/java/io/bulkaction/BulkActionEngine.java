package io.bulkaction;

import com.github.f4b6a3.ulid.UlidCreator;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionRegistry;
import io.bulkaction.action.DefaultActionRegistry;
import io.bulkaction.cache.InMemoryTtlCache;
import io.bulkaction.dispatch.BatchDispatcher;
import io.bulkaction.dispatch.BatchSizer;
import io.bulkaction.dispatch.BatchWorker;
import io.bulkaction.dispatch.CancellationFlags;
import io.bulkaction.dispatch.ExecutionFinalizer;
import io.bulkaction.dispatch.ExponentialBackoffRetryPolicy;
import io.bulkaction.event.EventPublisher;
import io.bulkaction.event.LifecycleEvent;
import io.bulkaction.gate.SubmissionGate;
import io.bulkaction.model.EntityRegistry;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.model.FilterSpec;
import io.bulkaction.poller.BatchPoller;
import io.bulkaction.poller.DispatcherPollerHandler;
import io.bulkaction.progress.ProgressTracker;
import io.bulkaction.purge.PurgeSummary;
import io.bulkaction.purge.RetentionPurgeScheduler;
import io.bulkaction.schedule.ExecutionScheduler;
import io.bulkaction.spi.AuthorizationPolicy;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.EventSink;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.MetricsExporter;
import io.bulkaction.spi.RecordStore;
import io.bulkaction.spi.SnapshotStore;
import io.bulkaction.spi.TargetResolver;
import io.bulkaction.spi.TtlCache;
import io.bulkaction.undo.UndoManager;
import io.bulkaction.undo.UndoResult;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the engine: accepts bulk actions, reports on them and reverses them.
 *
 * <p>Wires the submission gate, dispatcher, workers, progress tracker, undo manager, scheduler,
 * batch poller and retention purge into one {@link AutoCloseable} unit. Batch workers start
 * when the engine is built; {@link #start()} additionally starts the periodic background
 * loops (poller, scheduler, purge).
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (BulkActionEngine engine = BulkActionEngine.builder()
 *     .connectionProvider(connections)
 *     .executionStore(executions)
 *     .batchStore(batches)
 *     .snapshotStore(snapshots)
 *     .recordStore(records)
 *     .targetResolver(resolver)
 *     .entities(entities)
 *     .build()) {
 *   engine.start();
 *   Execution execution = engine.submit(BulkActionRequest.builder("customer", "delete")
 *       .filter(FilterSpec.where(Predicate.lt("last_login", cutoff)))
 *       .actor("alice")
 *       .build());
 * }
 * }</pre>
 */
public final class BulkActionEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BulkActionEngine.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionStore executionStore;
  private final BatchStore batchStore;
  private final TargetResolver targetResolver;
  private final EntityRegistry entities;
  private final ActionRegistry actions;
  private final AuthorizationPolicy authorization;
  private final MetricsExporter metrics;
  private final EventPublisher events;
  private final Clock clock;
  private final BulkActionConfig config;

  private final BatchSizer batchSizer;
  private final CancellationFlags cancellation;
  private final ProgressTracker tracker;
  private final SubmissionGate gate;
  private final UndoManager undoManager;
  private final ExecutionFinalizer finalizer;
  private final BatchDispatcher dispatcher;
  private final BatchPoller poller;
  private final ExecutionScheduler scheduler;
  private final RetentionPurgeScheduler purgeScheduler;
  private final AtomicBoolean started = new AtomicBoolean(false);

  private BulkActionEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.batchStore = Objects.requireNonNull(builder.batchStore, "batchStore");
    SnapshotStore snapshotStore = Objects.requireNonNull(builder.snapshotStore, "snapshotStore");
    RecordStore recordStore = Objects.requireNonNull(builder.recordStore, "recordStore");
    this.targetResolver = Objects.requireNonNull(builder.targetResolver, "targetResolver");
    this.entities = Objects.requireNonNull(builder.entities, "entities");
    this.actions = builder.actions != null ? builder.actions : DefaultActionRegistry.withBuiltIns();
    this.authorization = builder.authorization != null
        ? builder.authorization : AuthorizationPolicy.ALLOW_ALL;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.events = new EventPublisher(builder.eventSink != null ? builder.eventSink : EventSink.NOOP);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.config = builder.config != null ? builder.config : new BulkActionConfig();
    TtlCache cache = builder.cache != null ? builder.cache : new InMemoryTtlCache(clock);

    if (config.getDefaultUndoWindow().compareTo(config.getMaxUndoWindow()) > 0) {
      throw new IllegalArgumentException("defaultUndoWindow must not exceed maxUndoWindow");
    }
    if (config.getPreviewLimitCap() <= 0) {
      throw new IllegalArgumentException("previewLimitCap must be > 0");
    }
    this.batchSizer = new BatchSizer(config.getMinBatchSize(), config.getMaxBatchSize(),
        config.getMemoryPressureThreshold(),
        builder.memoryProbe != null ? builder.memoryProbe : BatchSizer.MemoryProbe.runtime());
    if (!batchSizer.accepts(config.getDefaultBatchSize())) {
      throw new IllegalArgumentException("defaultBatchSize must lie within [minBatchSize, maxBatchSize]");
    }
    this.cancellation = new CancellationFlags(cache, config.getCheckpointTtl());

    this.tracker = ProgressTracker.builder()
        .executionStore(executionStore)
        .cache(cache)
        .events(events)
        .clock(clock)
        .checkpointCapacity(config.getCheckpointCapacity())
        .checkpointTtl(config.getCheckpointTtl())
        .notifyInterval(config.getProgressNotifyInterval())
        .build();
    this.gate = SubmissionGate.builder()
        .connectionProvider(connectionProvider)
        .executionStore(executionStore)
        .cache(cache)
        .clock(clock)
        .maxConcurrentPerActor(config.getMaxConcurrentPerActor())
        .cooldown(config.getCooldown())
        .build();
    this.undoManager = UndoManager.builder()
        .connectionProvider(connectionProvider)
        .executionStore(executionStore)
        .snapshotStore(snapshotStore)
        .recordStore(recordStore)
        .entities(entities)
        .events(events)
        .metrics(metrics)
        .clock(clock)
        .pageSize(config.getUndoPageSize())
        .build();
    this.finalizer = ExecutionFinalizer.builder()
        .executionStore(executionStore)
        .batchStore(batchStore)
        .tracker(tracker)
        .events(events)
        .metrics(metrics)
        .cancellation(cancellation)
        .clock(clock)
        .failureThreshold(config.getFailureThreshold())
        .gate(gate)
        .cooldownThreshold(config.getCooldownThreshold())
        .build();
    BatchWorker worker = BatchWorker.builder()
        .connectionProvider(connectionProvider)
        .executionStore(executionStore)
        .batchStore(batchStore)
        .recordStore(recordStore)
        .actions(actions)
        .entities(entities)
        .undoManager(undoManager)
        .tracker(tracker)
        .finalizer(finalizer)
        .cancellation(cancellation)
        .metrics(metrics)
        .clock(clock)
        .failurePolicy(config.getFailurePolicy())
        .batchTimeout(config.getBatchTimeout())
        .ownerId(builder.ownerId)
        .build();
    this.dispatcher = BatchDispatcher.builder()
        .connectionProvider(connectionProvider)
        .executionStore(executionStore)
        .batchStore(batchStore)
        .targetResolver(targetResolver)
        .entities(entities)
        .worker(worker)
        .tracker(tracker)
        .events(events)
        .batchSizer(batchSizer)
        .retryPolicy(new ExponentialBackoffRetryPolicy(config.getRetryBaseDelayMs(),
            config.getRetryMaxDelayMs()))
        .metrics(metrics)
        .clock(clock)
        .maxAttempts(config.getRetryMaxAttempts())
        .workerCount(config.getDispatcherWorkers())
        .hotQueueCapacity(config.getHotQueueCapacity())
        .coldQueueCapacity(config.getColdQueueCapacity())
        .build();

    try {
      this.poller = BatchPoller.builder()
          .connectionProvider(connectionProvider)
          .batchStore(batchStore)
          .handler(new DispatcherPollerHandler(dispatcher))
          .clock(clock)
          .batchSize(config.getPollerBatchSize())
          .intervalMs(config.getPollerIntervalMs())
          .build();
      this.scheduler = ExecutionScheduler.builder()
          .connectionProvider(connectionProvider)
          .executionStore(executionStore)
          .targetResolver(targetResolver)
          .entities(entities)
          .dispatcher(dispatcher)
          .finalizer(finalizer)
          .clock(clock)
          .maxRecordsPerAction(config.getMaxRecordsPerAction())
          .maxHorizon(config.getMaxScheduleHorizon())
          .intervalSeconds(config.getSchedulerIntervalSeconds())
          .build();
      this.purgeScheduler = RetentionPurgeScheduler.builder()
          .connectionProvider(connectionProvider)
          .executionStore(executionStore)
          .batchStore(batchStore)
          .snapshotStore(snapshotStore)
          .clock(clock)
          .retention(config.getRetention())
          .batchSize(config.getPurgeBatchSize())
          .intervalSeconds(config.getPurgeIntervalSeconds())
          .build();
    } catch (RuntimeException e) {
      dispatcher.close();
      throw e;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the batch poller, the scheduler and the retention purge, as enabled in the config.
   * Subsequent calls are no-ops.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (config.isPollerEnabled()) {
      poller.start();
    }
    scheduler.start();
    if (config.isPurgeEnabled()) {
      purgeScheduler.start();
    }
    logger.log(Level.INFO, "Bulk action engine started");
  }

  /**
   * Validates, authorizes and admits a request, records it in the ledger and either dispatches
   * it right away or keeps it scheduled.
   *
   * <p>Nothing is written when any check fails. A {@linkplain BulkActionRequest#dryRun() dry
   * run} passes the same checks, then is recorded already {@code COMPLETED} without batches.
   *
   * @return the execution as recorded after dispatch, in {@code SCHEDULED} state, or the
   *         completed dry run
   * @throws SpecInvalidException   if the entity, action, filter, parameters, batch size,
   *                                undo window or schedule are invalid
   * @throws UnauthorizedException  if the authorization policy refuses the actor
   * @throws RateLimitedException   if the actor has too many active executions, is cooling
   *                                down, or the filter matches too many records
   */
  public Execution submit(BulkActionRequest request) {
    Objects.requireNonNull(request, "request");
    EntityType entity;
    ActionHandler handler;
    Duration undoWindow;
    int batchSize;
    try {
      entity = entities.require(request.entityType());
      handler = actions.handlerFor(request.actionName());
      if (handler == null) {
        throw new SpecInvalidException("Unknown action: " + request.actionName());
      }
      request.filter().validate();
      handler.validateParameters(entity, request.parameters());
      batchSize = request.batchSize() != null ? request.batchSize() : config.getDefaultBatchSize();
      if (!batchSizer.accepts(batchSize)) {
        throw new SpecInvalidException("Batch size " + batchSize + " outside ["
            + batchSizer.minSize() + ", " + batchSizer.maxSize() + "]");
      }
      undoWindow = request.dryRun() ? null : resolveUndoWindow(request);
      if (request.scheduledFor() != null && !request.dryRun()) {
        scheduler.validateActivation(request.scheduledFor());
      }
    } catch (SpecInvalidException e) {
      metrics.incrementRejected("spec_invalid");
      throw e;
    }

    if (!authorization.isAllowed(request.actor(), request.actionName(), request.entityType())) {
      metrics.incrementRejected("unauthorized");
      throw new UnauthorizedException(request.actor(), request.actionName(), request.entityType());
    }
    try {
      gate.attempt(request.actor()).throwIfDenied();
    } catch (RateLimitedException e) {
      metrics.incrementRejected("rate_limited");
      throw e;
    }

    Execution execution;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      long count;
      try {
        targetResolver.validate(conn, entity, request.filter());
        targetResolver.validateValues(conn, entity,
            handler.writtenValues(entity, request.parameters()));
        count = targetResolver.count(conn, entity, request.filter());
      } catch (SpecInvalidException e) {
        metrics.incrementRejected("spec_invalid");
        throw e;
      }
      if (count > config.getMaxRecordsPerAction()) {
        metrics.incrementRejected("rate_limited");
        throw RateLimitedException.tooManyRecords(count, config.getMaxRecordsPerAction());
      }
      execution = request.dryRun()
          ? newDryRun(request, batchSize, count)
          : newExecution(request, batchSize, count, undoWindow);
      executionStore.insert(conn, execution);
    } catch (SQLException e) {
      throw new BulkActionException("Failed to record execution for " + request, e);
    }

    if (execution.dryRun()) {
      logger.log(Level.INFO, "Dry run " + execution.id() + ": " + request.actionName() + " on "
          + request.entityType() + " would touch " + execution.totalRecords() + " records");
      return execution;
    }

    metrics.incrementSubmitted();
    if (execution.status() == ExecutionStatus.SCHEDULED) {
      events.publish(LifecycleEvent.of(LifecycleEvent.Type.SCHEDULED, execution, 0.0, null,
          clock.instant()));
      logger.log(Level.FINE, "Execution " + execution.id() + " scheduled for "
          + execution.scheduledFor());
      return execution;
    }
    events.publish(LifecycleEvent.of(LifecycleEvent.Type.SUBMITTED, execution, 0.0, null,
        clock.instant()));
    return dispatcher.dispatch(execution);
  }

  private Duration resolveUndoWindow(BulkActionRequest request) {
    if (!request.undoEnabled()) {
      return null;
    }
    Duration window = request.undoWindow() != null
        ? request.undoWindow() : config.getDefaultUndoWindow();
    if (window.isZero() || window.isNegative()) {
      throw new SpecInvalidException("Undo window must be positive: " + window);
    }
    if (window.compareTo(config.getMaxUndoWindow()) > 0) {
      throw new SpecInvalidException("Undo window " + window + " exceeds the maximum of "
          + config.getMaxUndoWindow());
    }
    return window;
  }

  private Execution newExecution(BulkActionRequest request, int batchSize, long count,
      Duration undoWindow) {
    Instant now = clock.instant();
    boolean scheduled = request.scheduledFor() != null;
    Instant anchor = scheduled ? request.scheduledFor() : now;
    return new Execution(
        UlidCreator.getMonotonicUlid().toString(),
        request.entityType(),
        request.filter(),
        request.actionName(),
        request.parameters(),
        batchSize,
        count,
        0,
        0,
        scheduled ? ExecutionStatus.SCHEDULED : ExecutionStatus.PENDING,
        undoWindow != null,
        undoWindow != null ? anchor.plus(undoWindow) : null,
        null,
        request.scheduledFor(),
        request.actor(),
        null,
        now,
        null,
        null,
        now);
  }

  private Execution newDryRun(BulkActionRequest request, int batchSize, long count) {
    Instant now = clock.instant();
    return new Execution(
        UlidCreator.getMonotonicUlid().toString(),
        request.entityType(),
        request.filter(),
        request.actionName(),
        request.parameters(),
        batchSize,
        count,
        0,
        0,
        ExecutionStatus.COMPLETED,
        false,
        null,
        null,
        null,
        request.actor(),
        null,
        now,
        now,
        now,
        now,
        true);
  }

  /**
   * @throws ExecutionNotFoundException if no execution has this id
   */
  public ExecutionProgress getStatus(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Execution execution = require(conn, executionId);
      return new ExecutionProgress(execution, ProgressTracker.getProgress(execution),
          tracker.getEstimatedTimeRemaining(execution).orElse(null),
          batchStore.countByStatus(conn, executionId));
    } catch (SQLException e) {
      throw new BulkActionException("Failed to read execution " + executionId, e);
    }
  }

  /**
   * Stops an execution that has not finished.
   *
   * <p>A scheduled or pending execution is cancelled without processing any record. A running
   * execution is flagged: workers stop before their next record and batches nobody picked up
   * are cancelled. Records already processed stay processed.
   *
   * @throws SchedulingConflictException if the execution is already terminal
   */
  public Execution cancel(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Execution execution = require(conn, executionId);
      switch (execution.status()) {
        case SCHEDULED:
          return scheduler.cancel(executionId);
        case PENDING:
          if (executionStore.transition(conn, executionId, ExecutionStatus.PENDING,
              ExecutionStatus.CANCELLED, null, clock.instant())) {
            return announceCancelled(conn, executionId);
          }
          break;
        case PROCESSING:
          cancellation.cancel(executionId);
          if (executionStore.transition(conn, executionId, ExecutionStatus.PROCESSING,
              ExecutionStatus.CANCELLED, null, clock.instant())) {
            int dropped = batchStore.cancelUnclaimed(conn, executionId, clock.instant());
            logger.log(Level.FINE, "Cancelled " + dropped + " unclaimed batches of " + executionId);
            return announceCancelled(conn, executionId);
          }
          break;
        default:
          break;
      }
      Execution latest = require(conn, executionId);
      if (latest.status() == execution.status() || latest.isTerminal()) {
        throw new SchedulingConflictException(executionId, "cancel", latest.status());
      }
    } catch (SQLException e) {
      throw new BulkActionException("Failed to cancel execution " + executionId, e);
    }
    // status moved on between read and write; act on the new one
    return cancel(executionId);
  }

  private Execution announceCancelled(Connection conn, String executionId) {
    Execution cancelled = require(conn, executionId);
    finalizer.announce(cancelled);
    return cancelled;
  }

  /**
   * Reverses a completed execution within its undo window. One-shot.
   *
   * @throws UndoUnavailableException with the reason the execution cannot be undone
   */
  public UndoResult undo(String executionId, String actor) {
    return undoManager.undo(executionId, actor);
  }

  public boolean canUndo(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return undoManager.canUndo(conn, require(conn, executionId));
    } catch (SQLException e) {
      throw new BulkActionException("Failed to read execution " + executionId, e);
    }
  }

  /** {@link Duration#ZERO} when the execution cannot be undone. */
  public Duration undoTimeRemaining(String executionId) {
    return undoManager.getTimeRemaining(getStatus(executionId).execution());
  }

  /**
   * Counts the records a filter matches and returns up to {@code limit} of them. The limit is
   * capped by {@link BulkActionConfig#getPreviewLimitCap()}. Nothing is written.
   */
  public Preview preview(String entityType, FilterSpec filter, int limit) {
    EntityType entity = entities.require(entityType);
    Objects.requireNonNull(filter, "filter").validate();
    if (limit < 0) {
      throw new SpecInvalidException("Preview limit must be >= 0: " + limit);
    }
    int capped = Math.min(limit, config.getPreviewLimitCap());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      targetResolver.validate(conn, entity, filter);
      long count = targetResolver.count(conn, entity, filter);
      return new Preview(count, capped == 0 ? List.of()
          : targetResolver.sample(conn, entity, filter, capped));
    } catch (SQLException e) {
      throw new BulkActionException("Preview failed for " + entityType, e);
    }
  }

  /** Scheduled executions of {@code actor}, or of everyone when {@code null}, soonest first. */
  public List<Execution> listScheduled(String actor) {
    return scheduler.listScheduled(actor);
  }

  public List<Execution> listUpcoming(Duration window, String actor) {
    return scheduler.listUpcoming(Objects.requireNonNull(window, "window"), actor);
  }

  public Execution reschedule(String executionId, Instant scheduledFor) {
    return scheduler.reschedule(executionId, Objects.requireNonNull(scheduledFor, "scheduledFor"));
  }

  /**
   * Promotes due scheduled executions now instead of waiting for the next scheduler cycle.
   *
   * @return number of executions promoted
   */
  public int processDueSchedules() {
    return scheduler.processDue();
  }

  /** Runs one retention purge cycle now. */
  public PurgeSummary purgeNow() {
    return purgeScheduler.runOnce();
  }

  /** Offers batches waiting in the database to the workers now. */
  public int pollBatchesNow() {
    return poller.poll();
  }

  public int remainingSlots(String actor) {
    return gate.remainingSlots(actor);
  }

  private Execution require(Connection conn, String executionId) {
    return executionStore.find(conn, executionId)
        .orElseThrow(() -> new ExecutionNotFoundException(executionId));
  }

  /**
   * Shuts down components in order: purge, scheduler, poller, dispatcher. A metrics exporter
   * that is {@link AutoCloseable} is closed last.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    List<AutoCloseable> components = new ArrayList<>(
        List.of(purgeScheduler, scheduler, poller, dispatcher));
    if (metrics instanceof AutoCloseable closeable) {
      components.add(closeable);
    }
    for (AutoCloseable component : components) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) {
          first = re;
        } else {
          first.addSuppressed(re);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link BulkActionEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionStore executionStore;
    private BatchStore batchStore;
    private SnapshotStore snapshotStore;
    private RecordStore recordStore;
    private TargetResolver targetResolver;
    private EntityRegistry entities;
    private ActionRegistry actions;
    private AuthorizationPolicy authorization;
    private EventSink eventSink;
    private MetricsExporter metrics;
    private TtlCache cache;
    private Clock clock;
    private BulkActionConfig config;
    private BatchSizer.MemoryProbe memoryProbe;
    private String ownerId;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder executionStore(ExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder batchStore(BatchStore batchStore) {
      this.batchStore = batchStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    /** <b>Required.</b> Reads and writes the target records themselves. */
    public Builder recordStore(RecordStore recordStore) {
      this.recordStore = recordStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder targetResolver(TargetResolver targetResolver) {
      this.targetResolver = targetResolver;
      return this;
    }

    /** <b>Required.</b> Entity types actions may target. */
    public Builder entities(EntityRegistry entities) {
      this.entities = entities;
      return this;
    }

    /** Optional. Defaults to {@link DefaultActionRegistry#withBuiltIns()}. */
    public Builder actions(ActionRegistry actions) {
      this.actions = actions;
      return this;
    }

    /** Optional. Defaults to {@link AuthorizationPolicy#ALLOW_ALL}. */
    public Builder authorization(AuthorizationPolicy authorization) {
      this.authorization = authorization;
      return this;
    }

    /** Optional. Defaults to {@link EventSink#NOOP}. */
    public Builder eventSink(EventSink eventSink) {
      this.eventSink = eventSink;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Cache for progress checkpoints, cooldowns and cancellation flags.
     *
     * <p>Optional. Defaults to a per-engine {@link InMemoryTtlCache}. Share one across nodes to
     * make cooldowns and cancellation visible cluster-wide.
     */
    public Builder cache(TtlCache cache) {
      this.cache = cache;
      return this;
    }

    /** Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@code new BulkActionConfig()}. */
    public Builder config(BulkActionConfig config) {
      this.config = config;
      return this;
    }

    /** Optional. Defaults to the JVM heap. */
    public Builder memoryProbe(BatchSizer.MemoryProbe memoryProbe) {
      this.memoryProbe = memoryProbe;
      return this;
    }

    /** Optional. Identifies this node in batch locks. Defaults to a random id. */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public BulkActionEngine build() {
      return new BulkActionEngine(this);
    }
  }
}
