package io.bulkaction.poller;

import io.bulkaction.dispatch.QueuedBatch;
import io.bulkaction.model.Batch;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically looks for batches that are waiting in the database and offers them to workers.
 *
 * <p>This covers batches that did not fit the hot queue, retries whose delay has passed, and
 * batches whose claim lock expired because their node died. Workers claim batches atomically,
 * so several nodes may poll the same table.
 */
public final class BatchPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchPoller.class.getName());

  private final ConnectionProvider connectionProvider;
  private final BatchStore batchStore;
  private final BatchPollerHandler handler;
  private final Clock clock;
  private final int batchSize;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private BatchPoller(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.batchStore = Objects.requireNonNull(builder.batchStore, "batchStore");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("BatchPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("bulkaction-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one poll cycle.
   *
   * @return number of batches handed over
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    try {
      int capacity = Math.min(batchSize, handler.availableCapacity());
      if (capacity <= 0) {
        return 0;
      }
      List<Batch> rows;
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        rows = batchStore.findAvailable(conn, clock.instant(), capacity);
      }
      int handed = 0;
      for (Batch row : rows) {
        if (!handler.handle(new QueuedBatch(row.executionId(), row.batchNumber(),
            QueuedBatch.Source.COLD))) {
          break;
        }
        handed++;
      }
      if (handed > 0) {
        logger.log(Level.FINE, "Poller handed over " + handed + " batch(es)");
      }
      return handed;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to fetch available batches", e);
      return 0;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Poll cycle failed", t);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private BatchStore batchStore;
    private BatchPollerHandler handler;
    private Clock clock;
    private int batchSize = 50;
    private long intervalMs = 5000L;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder batchStore(BatchStore batchStore) {
      this.batchStore = batchStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder handler(BatchPollerHandler handler) {
      this.handler = handler;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Most batches fetched per cycle. Defaults to {@code 50}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Optional. Delay between cycles. Defaults to {@code 5000} ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public BatchPoller build() {
      return new BatchPoller(this);
    }
  }
}
