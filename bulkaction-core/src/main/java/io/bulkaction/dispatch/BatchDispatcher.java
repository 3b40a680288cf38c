package io.bulkaction.dispatch;

import io.bulkaction.event.EventPublisher;
import io.bulkaction.event.LifecycleEvent;
import io.bulkaction.model.Batch;
import io.bulkaction.model.BatchStatus;
import io.bulkaction.model.EntityRegistry;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.progress.ProgressTracker;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.MetricsExporter;
import io.bulkaction.spi.TargetResolver;
import io.bulkaction.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Splits executions into batches and runs them on a worker pool.
 *
 * <p>{@link #dispatch(Execution)} streams the target ids, writes one batch row per chunk and
 * moves the execution to {@code PROCESSING} in a single transaction, then offers the batches
 * to the <em>hot queue</em>. Batches that do not fit stay pending in the database until a
 * {@link io.bulkaction.poller.BatchPoller} offers them to the <em>cold queue</em>. Workers
 * drain both queues 2:1 in favour of the hot one.
 *
 * <p>A batch failing transiently is put back to {@code RETRY} with exponential backoff and
 * re-offered after the delay. Once {@code maxAttempts} is reached its remaining records are
 * counted as failed.
 */
public final class BatchDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<QueuedBatch> hotQueue;
  private final BlockingQueue<QueuedBatch> coldQueue;
  private final ExecutorService workers;
  private final ScheduledExecutorService retryTimer;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicInteger pollCounter = new AtomicInteger(0);

  private final ConnectionProvider connectionProvider;
  private final ExecutionStore executionStore;
  private final BatchStore batchStore;
  private final TargetResolver targetResolver;
  private final EntityRegistry entities;
  private final BatchWorker worker;
  private final ProgressTracker tracker;
  private final EventPublisher events;
  private final InFlightTracker inFlightTracker;
  private final RetryPolicy retryPolicy;
  private final BatchSizer batchSizer;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int maxAttempts;
  private final long drainTimeoutMs;

  private BatchDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.batchStore = Objects.requireNonNull(builder.batchStore, "batchStore");
    this.targetResolver = Objects.requireNonNull(builder.targetResolver, "targetResolver");
    this.entities = Objects.requireNonNull(builder.entities, "entities");
    this.worker = Objects.requireNonNull(builder.worker, "worker");
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    this.events = Objects.requireNonNull(builder.events, "events");
    this.batchSizer = Objects.requireNonNull(builder.batchSizer, "batchSizer");
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 60_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.hotQueueCapacity <= 0 || builder.coldQueueCapacity <= 0) {
      throw new IllegalArgumentException("Queue capacities must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.hotQueue = new ArrayBlockingQueue<>(builder.hotQueueCapacity);
    this.coldQueue = new ArrayBlockingQueue<>(builder.coldQueueCapacity);
    this.retryTimer = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("bulkaction-retry-"));

    if (builder.workerCount > 0) {
      this.workers = Executors.newFixedThreadPool(builder.workerCount,
          new DaemonThreadFactory("bulkaction-worker-"));
      for (int i = 0; i < builder.workerCount; i++) {
        workers.submit(this::workerLoop);
      }
      logger.log(Level.INFO, "Started " + builder.workerCount + " batch workers");
    } else {
      logger.warning("workerCount=0: no batch workers started; batches will stay queued");
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("bulkaction-worker-"));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the batches of a {@code PENDING} execution and queues them.
   *
   * <p>An execution whose target set is empty completes immediately without batches. If the
   * execution left {@code PENDING} in the meantime (cancelled) nothing is written. An
   * infrastructure failure marks the execution {@code FAILED} with the error as its reason.
   * Batches are written as the ids stream in, so only one batch's ids are held at a time.
   *
   * @return the execution as it stands after dispatch
   */
  public Execution dispatch(Execution execution) {
    try (Connection conn = connectionProvider.getConnection()) {
      int batchCount = createBatches(conn, execution);
      if (batchCount < 0) {
        return reload(conn, execution);
      }
      Execution current = reload(conn, execution);
      if (batchCount == 0) {
        worker.finalizer().announce(current);
        return current;
      }
      tracker.initialize(current, batchCount);
      events.publish(LifecycleEvent.of(LifecycleEvent.Type.STARTED, current,
          ProgressTracker.getProgress(current), null, clock.instant()));
      int deferred = 0;
      for (int number = 1; number <= batchCount; number++) {
        if (!enqueueHot(new QueuedBatch(current.id(), number, QueuedBatch.Source.HOT))) {
          deferred++;
        }
      }
      if (deferred > 0) {
        logger.log(Level.FINE, deferred + " batch(es) of execution " + execution.id()
            + " left for the poller");
      }
      return current;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Dispatch failed for execution " + execution.id(), e);
      return markDispatchFailed(execution, e);
    }
  }

  /**
   * @return the number of batches written, or -1 if the execution is no longer {@code PENDING}
   */
  private int createBatches(Connection conn, Execution execution) throws SQLException {
    EntityType entity = entities.require(execution.entityType());
    conn.setAutoCommit(false);
    try {
      Instant now = clock.instant();
      int requested = execution.batchSize();
      int size = batchSizer.nextSize(requested, requested);
      Iterator<String> ids = targetResolver.streamIds(conn, entity, execution.filter(),
          Math.max(size, 500));
      int batchCount = 0;
      List<String> chunk = new ArrayList<>(size);
      long total = 0;
      while (ids.hasNext()) {
        chunk.add(ids.next());
        total++;
        if (chunk.size() >= size) {
          insertBatch(conn, execution.id(), ++batchCount, chunk, now);
          chunk = new ArrayList<>(size);
          size = batchSizer.nextSize(size, requested);
        }
      }
      if (!chunk.isEmpty()) {
        insertBatch(conn, execution.id(), ++batchCount, chunk, now);
      }
      if (!executionStore.updateTotal(conn, execution.id(), total, ExecutionStatus.PENDING, now)) {
        conn.rollback();
        return -1;
      }
      ExecutionStatus target = batchCount == 0
          ? ExecutionStatus.COMPLETED : ExecutionStatus.PROCESSING;
      if (!executionStore.transition(conn, execution.id(), ExecutionStatus.PENDING, target, null,
          now)) {
        conn.rollback();
        return -1;
      }
      conn.commit();
      logger.log(Level.FINE, "Execution " + execution.id() + " split into " + batchCount
          + " batches, " + total + " records");
      return batchCount;
    } catch (SQLException | RuntimeException e) {
      conn.rollback();
      throw e;
    } finally {
      conn.setAutoCommit(true);
    }
  }

  private void insertBatch(Connection conn, String executionId, int number, List<String> ids,
      Instant now) {
    batchStore.insert(conn, new Batch(executionId, number, ids, BatchStatus.PENDING, 0, 0, 0, 0,
        null, now, now, null));
  }

  private Execution reload(Connection conn, Execution fallback) {
    return executionStore.find(conn, fallback.id()).orElse(fallback);
  }

  private Execution markDispatchFailed(Execution execution, Exception failure) {
    String reason = "Dispatch failed: " + (failure.getMessage() != null
        ? failure.getMessage() : failure.getClass().getName());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (executionStore.transition(conn, execution.id(), ExecutionStatus.PENDING,
          ExecutionStatus.FAILED, BatchWorker.truncate(reason), clock.instant())) {
        Execution failed = reload(conn, execution);
        worker.finalizer().announce(failed);
        return failed;
      }
      return reload(conn, execution);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to mark execution " + execution.id() + " FAILED", e);
      return execution;
    }
  }

  /**
   * Offers a batch to the hot queue. Returns {@code false} if the queue is full or the
   * dispatcher is closing; the batch then waits for the poller.
   */
  public boolean enqueueHot(QueuedBatch batch) {
    if (!accepting.get()) {
      return false;
    }
    boolean enqueued = hotQueue.offer(batch);
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  /**
   * Offers a batch found by the poller to the cold queue.
   */
  public boolean enqueueCold(QueuedBatch batch) {
    if (!accepting.get()) {
      return false;
    }
    boolean enqueued = coldQueue.offer(batch);
    metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
    return enqueued;
  }

  public int coldQueueRemainingCapacity() {
    return coldQueue.remainingCapacity();
  }

  private QueuedBatch pollFairly() throws InterruptedException {
    int cycle = pollCounter.getAndIncrement();
    BlockingQueue<QueuedBatch> primary;
    BlockingQueue<QueuedBatch> secondary;
    if ((cycle & 0x7FFFFFFF) % 3 == 2) {
      primary = coldQueue;
      secondary = hotQueue;
    } else {
      primary = hotQueue;
      secondary = coldQueue;
    }
    QueuedBatch batch = primary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    if (batch == null) {
      batch = secondary.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
    }
    return batch;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && hotQueue.isEmpty() && coldQueue.isEmpty()) {
          break;
        }
        QueuedBatch batch = pollFairly();
        if (batch == null) {
          if (!running.get()) {
            break;
          }
          continue;
        }
        runBatch(batch);
        metrics.recordQueueDepths(hotQueue.size(), coldQueue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Batch worker loop error", t);
      }
    }
  }

  void runBatch(QueuedBatch batch) {
    if (!inFlightTracker.tryAcquire(batch.key())) {
      return;
    }
    try {
      worker.process(batch);
    } catch (RuntimeException e) {
      handleFailure(batch, e);
    } finally {
      inFlightTracker.release(batch.key());
    }
  }

  private void handleFailure(QueuedBatch queued, RuntimeException failure) {
    String error = BatchWorker.truncate(failure.getMessage() != null
        ? failure.getMessage() : failure.getClass().getName());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<Batch> row = batchStore.find(conn, queued.executionId(), queued.batchNumber());
      if (row.isEmpty() || row.get().status().isTerminal()) {
        return;
      }
      int nextAttempt = row.get().attempts() + 1;
      boolean retryable = TransientBatchException.isTransient(failure);
      if (retryable && nextAttempt < maxAttempts) {
        long delayMs = retryPolicy.computeDelayMs(nextAttempt);
        Instant availableAt = clock.instant().plusMillis(delayMs);
        if (batchStore.retry(conn, queued.executionId(), queued.batchNumber(), availableAt, error)) {
          metrics.incrementBatchRetried();
          logger.log(Level.WARNING, "Batch " + queued.key() + " failed (attempt " + nextAttempt
              + "), retrying in " + delayMs + " ms", failure);
          scheduleRetry(queued, delayMs);
        }
        return;
      }
      int failed = worker.finalizer().failRemaining(conn, queued.executionId(),
          queued.batchNumber(), error);
      metrics.incrementBatchFailed();
      logger.log(Level.SEVERE, "Batch " + queued.key() + " FAILED after " + nextAttempt
          + " attempt(s); " + failed + " record(s) counted as failed", failure);
      worker.finalizer().finishIfDone(conn, queued.executionId());
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record failure of batch " + queued.key(), e);
    }
  }

  private void scheduleRetry(QueuedBatch queued, long delayMs) {
    try {
      retryTimer.schedule(() -> {
        if (!enqueueHot(new QueuedBatch(queued.executionId(), queued.batchNumber(),
            QueuedBatch.Source.HOT))) {
          logger.log(Level.FINE, "Retry of batch " + queued.key() + " left for the poller");
        }
      }, delayMs, TimeUnit.MILLISECONDS);
    } catch (java.util.concurrent.RejectedExecutionException e) {
      logger.log(Level.FINE, "Dispatcher closing; retry of batch " + queued.key()
          + " left for the poller");
    }
  }

  /**
   * Stops accepting batches, lets workers drain the queues for up to the drain timeout, then
   * stops them. Batches still queued remain in the database for the next start.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    retryTimer.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Hot remaining: "
            + hotQueue.size() + ", cold remaining: " + coldQueue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionStore executionStore;
    private BatchStore batchStore;
    private TargetResolver targetResolver;
    private EntityRegistry entities;
    private BatchWorker worker;
    private ProgressTracker tracker;
    private EventPublisher events;
    private InFlightTracker inFlightTracker;
    private RetryPolicy retryPolicy;
    private BatchSizer batchSizer;
    private MetricsExporter metrics;
    private Clock clock;
    private int maxAttempts = 3;
    private int workerCount = 4;
    private int hotQueueCapacity = 1000;
    private int coldQueueCapacity = 1000;
    private long drainTimeoutMs = 5000;

    private Builder() {
    }

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

    /** <b>Required.</b> Streams the ids to split into batches. */
    public Builder targetResolver(TargetResolver targetResolver) {
      this.targetResolver = targetResolver;
      return this;
    }

    /** <b>Required.</b> */
    public Builder entities(EntityRegistry entities) {
      this.entities = entities;
      return this;
    }

    /** <b>Required.</b> */
    public Builder worker(BatchWorker worker) {
      this.worker = worker;
      return this;
    }

    /** <b>Required.</b> */
    public Builder tracker(ProgressTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    /** <b>Required.</b> */
    public Builder events(EventPublisher events) {
      this.events = events;
      return this;
    }

    /** <b>Required.</b> */
    public Builder batchSizer(BatchSizer batchSizer) {
      this.batchSizer = batchSizer;
      return this;
    }

    /** Optional. Defaults to {@link DefaultInFlightTracker}. */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 s base and
     * a 60 s cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Attempts per batch before its records are counted as failed. Defaults to {@code 3}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Optional. Defaults to {@code 4}. {@code 0} starts no workers. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. */
    public Builder hotQueueCapacity(int hotQueueCapacity) {
      this.hotQueueCapacity = hotQueueCapacity;
      return this;
    }

    /** Optional. Defaults to {@code 1000}. */
    public Builder coldQueueCapacity(int coldQueueCapacity) {
      this.coldQueueCapacity = coldQueueCapacity;
      return this;
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public BatchDispatcher build() {
      return new BatchDispatcher(this);
    }
  }
}
