package io.bulkaction.progress;

import io.bulkaction.event.EventPublisher;
import io.bulkaction.event.LifecycleEvent;
import io.bulkaction.model.Execution;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.TtlCache;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies counter increments to the ledger and derives progress and ETA.
 *
 * <p>The ledger counters are authoritative. Checkpoints live in the {@link TtlCache} and
 * only feed the ETA; when they are evicted the ETA is reported as unavailable.
 *
 * <p>{@code PROGRESS} notifications are throttled per execution to one per
 * {@code notifyInterval}, except the update that accounts for the last record, which is
 * always published.
 */
public final class ProgressTracker {
  private static final Logger logger = Logger.getLogger(ProgressTracker.class.getName());

  static final String KEY_PREFIX = "bulkaction:checkpoints:";

  private final ExecutionStore executionStore;
  private final TtlCache cache;
  private final EventPublisher events;
  private final Clock clock;
  private final int checkpointCapacity;
  private final Duration checkpointTtl;
  private final long notifyIntervalMs;
  private final Map<String, Long> lastNotifiedAt = new ConcurrentHashMap<>();

  private ProgressTracker(Builder builder) {
    this.executionStore = Objects.requireNonNull(builder.executionStore, "executionStore");
    this.cache = Objects.requireNonNull(builder.cache, "cache");
    this.events = Objects.requireNonNull(builder.events, "events");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.checkpointCapacity < 2) {
      throw new IllegalArgumentException("checkpointCapacity must be >= 2");
    }
    if (builder.notifyInterval.isNegative()) {
      throw new IllegalArgumentException("notifyInterval must be >= 0");
    }
    this.checkpointCapacity = builder.checkpointCapacity;
    this.checkpointTtl = builder.checkpointTtl;
    this.notifyIntervalMs = builder.notifyInterval.toMillis();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Seeds the checkpoint history of an execution that is about to start processing.
   */
  public void initialize(Execution execution, int totalBatches) {
    Checkpoint baseline = new Checkpoint(
        execution.processedRecords() + execution.failedRecords(), clock.instant());
    cache.put(key(execution.id()), CheckpointBuffer.empty(checkpointCapacity).append(baseline),
        checkpointTtl);
    lastNotifiedAt.remove(execution.id());
    logger.log(Level.FINE, "Tracking executionId=" + execution.id() + " total="
        + execution.totalRecords() + " batches=" + totalBatches);
  }

  /**
   * Atomically adds to the execution's counters inside the caller's transaction and appends
   * a checkpoint.
   *
   * @param affectedIds ids of the records the deltas account for
   * @return the execution as it stands after the increment, or empty if the increment was
   *     refused because the execution is no longer processing
   */
  public Optional<Execution> update(Connection conn, String executionId, long processedDelta,
      long failedDelta, Collection<String> affectedIds) {
    Instant now = clock.instant();
    if (!executionStore.incrementCounters(conn, executionId, processedDelta, failedDelta, now)) {
      logger.log(Level.WARNING, "Counter increment refused for executionId=" + executionId
          + " records=" + affectedIds);
      return Optional.empty();
    }
    Optional<Execution> current = executionStore.find(conn, executionId);
    current.ifPresent(execution -> {
      long handled = execution.processedRecords() + execution.failedRecords();
      cache.compute(key(executionId), CheckpointBuffer.class, checkpointTtl, buffer -> {
        CheckpointBuffer base = buffer != null ? buffer : CheckpointBuffer.empty(checkpointCapacity);
        return base.append(new Checkpoint(handled, now));
      });
    });
    return current;
  }

  /**
   * Publishes a {@code PROGRESS} event for {@code execution} unless one was published within
   * the notify interval. The update that handles the last record always goes out.
   */
  public void notifyProgress(Execution execution) {
    boolean last = execution.processedRecords() + execution.failedRecords()
        >= execution.totalRecords();
    long nowMs = clock.millis();
    AtomicBoolean publish = new AtomicBoolean();
    lastNotifiedAt.compute(execution.id(), (id, previous) -> {
      if (last || previous == null || nowMs - previous >= notifyIntervalMs) {
        publish.set(true);
        return nowMs;
      }
      return previous;
    });
    if (publish.get()) {
      events.publish(LifecycleEvent.of(LifecycleEvent.Type.PROGRESS, execution,
          getProgress(execution), null, clock.instant()));
    }
  }

  /**
   * Drops tracking state for an execution that reached a terminal status.
   */
  public void finish(String executionId) {
    lastNotifiedAt.remove(executionId);
    cache.remove(key(executionId));
  }

  /**
   * Processed share of the total in percent, rounded to two decimals and clamped to
   * {@code [0, 100]}. Zero when the total is zero.
   */
  public static double getProgress(Execution execution) {
    if (execution.totalRecords() <= 0) {
      return 0.0;
    }
    double pct = (double) execution.processedRecords() / execution.totalRecords() * 100.0;
    double clamped = Math.max(0.0, Math.min(100.0, pct));
    return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  /**
   * Time left at the rate observed between the oldest and newest buffered checkpoint.
   * Empty when the execution is terminal, fewer than two checkpoints are buffered, or no
   * progress was made between them.
   */
  public Optional<Duration> getEstimatedTimeRemaining(Execution execution) {
    if (execution.isTerminal()) {
      return Optional.empty();
    }
    Optional<CheckpointBuffer> buffer = cache.get(key(execution.id()), CheckpointBuffer.class);
    if (buffer.isEmpty()) {
      return Optional.empty();
    }
    Optional<Double> rate = buffer.get().ratePerMilli();
    if (rate.isEmpty() || rate.get() <= 0.0) {
      return Optional.empty();
    }
    long remaining = execution.remainingRecords();
    return Optional.of(Duration.ofMillis((long) Math.ceil(remaining / rate.get())));
  }

  Optional<CheckpointBuffer> checkpoints(String executionId) {
    return cache.get(key(executionId), CheckpointBuffer.class);
  }

  private static String key(String executionId) {
    return KEY_PREFIX + executionId;
  }

  public static final class Builder {
    private ExecutionStore executionStore;
    private TtlCache cache;
    private EventPublisher events;
    private Clock clock;
    private int checkpointCapacity = 10;
    private Duration checkpointTtl = Duration.ofHours(1);
    private Duration notifyInterval = Duration.ofMillis(500);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder executionStore(ExecutionStore executionStore) {
      this.executionStore = executionStore;
      return this;
    }

    /** <b>Required.</b> Holds checkpoint buffers. */
    public Builder cache(TtlCache cache) {
      this.cache = cache;
      return this;
    }

    /** <b>Required.</b> */
    public Builder events(EventPublisher events) {
      this.events = events;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Optional. Defaults to {@code 10}. Must be &ge; 2. */
    public Builder checkpointCapacity(int checkpointCapacity) {
      this.checkpointCapacity = checkpointCapacity;
      return this;
    }

    /** Optional. Defaults to one hour. */
    public Builder checkpointTtl(Duration checkpointTtl) {
      this.checkpointTtl = Objects.requireNonNull(checkpointTtl, "checkpointTtl");
      return this;
    }

    /** Optional. Defaults to 500 ms. */
    public Builder notifyInterval(Duration notifyInterval) {
      this.notifyInterval = Objects.requireNonNull(notifyInterval, "notifyInterval");
      return this;
    }

    public ProgressTracker build() {
      return new ProgressTracker(this);
    }
  }
}
