package io.bulkaction.purge;

import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.SnapshotStore;
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
 * Periodic housekeeping for execution state.
 *
 * <p>Each cycle has two phases. Executions whose undo window has passed lose their pending
 * snapshots and have undo disabled. Terminal executions older than the retention period are
 * then removed together with their batches and snapshots. Every chunk uses its own
 * auto-committed connection to keep lock time short.
 */
public final class RetentionPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetentionPurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ExecutionStore executionStore;
  private final BatchStore batchStore;
  private final SnapshotStore snapshotStore;
  private final Clock clock;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private RetentionPurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.batchStore = Objects.requireNonNull(builder.batchStore, "batchStore");
    this.snapshotStore = Objects.requireNonNull(builder.snapshotStore, "snapshotStore");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.retention != null && builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.retention = builder.retention != null ? builder.retention : Duration.ofDays(30);
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetentionPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("bulkaction-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  private void runSafely() {
    try {
      runOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Purge cycle failed", t);
    }
  }

  /**
   * Executes a single cycle. May be invoked directly for one-off purges.
   */
  public PurgeSummary runOnce() {
    if (closed) {
      return new PurgeSummary(0, 0, 0);
    }
    Instant now = clock.instant();
    int windowsClosed = 0;
    long snapshotsDiscarded = 0;
    List<String> expired;
    do {
      expired = query(conn -> executionStore.findExpiredUndo(conn, now, batchSize));
      int round = 0;
      for (String executionId : expired) {
        snapshotsDiscarded += discardSnapshots(executionId);
        Boolean disabled = query(conn -> executionStore.disableUndo(conn, executionId, now));
        if (Boolean.TRUE.equals(disabled)) {
          round++;
        }
      }
      windowsClosed += round;
      if (round == 0) {
        break;
      }
    } while (expired.size() >= batchSize);

    Instant cutoff = now.minus(retention);
    int purged = 0;
    List<String> purgeable;
    do {
      purgeable = query(conn -> executionStore.findPurgeable(conn, cutoff, batchSize));
      int round = 0;
      for (String executionId : purgeable) {
        if (purgeExecution(executionId)) {
          round++;
        }
      }
      purged += round;
      if (round == 0) {
        break;
      }
    } while (purgeable.size() >= batchSize);

    PurgeSummary summary = new PurgeSummary(windowsClosed, snapshotsDiscarded, purged);
    if (!summary.isEmpty()) {
      logger.log(Level.INFO,
          "Closed {0} expired undo windows ({1} snapshots), purged {2} executions older than {3}",
          new Object[]{windowsClosed, snapshotsDiscarded, purged, cutoff});
    }
    return summary;
  }

  private long discardSnapshots(String executionId) {
    long total = 0;
    Integer deleted;
    do {
      deleted = query(conn -> snapshotStore.deletePending(conn, executionId, batchSize));
      total += deleted;
    } while (deleted >= batchSize);
    return total;
  }

  private boolean purgeExecution(String executionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        snapshotStore.deleteByExecution(conn, executionId);
        batchStore.deleteByExecution(conn, executionId);
        int deleted = executionStore.delete(conn, executionId);
        conn.commit();
        return deleted > 0;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        logger.log(Level.WARNING, "Failed to purge execution " + executionId, e);
        return false;
      }
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return false;
    }
  }

  private <T> T query(ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Purge query failed", e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
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

  /** Builder for {@link RetentionPurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ExecutionStore executionStore;
    private BatchStore batchStore;
    private SnapshotStore snapshotStore;
    private Clock clock;
    private Duration retention;
    private int batchSize = 500;
    private long intervalSeconds = 3600;

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

    /** Optional. Defaults to the system UTC clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long terminal executions are kept after they finish.
     *
     * <p>Optional. Defaults to {@code 30 days}. Must be &ge; 0.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the number of rows handled per chunk.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the interval in seconds between purge cycles.
     *
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public RetentionPurgeScheduler build() {
      return new RetentionPurgeScheduler(this);
    }
  }
}
