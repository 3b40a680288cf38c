package io.bulkaction.micrometer;

import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code bulkaction.submissions}: executions accepted</li>
 *   <li>{@code bulkaction.rejections}: submissions refused, tagged {@code reason}</li>
 *   <li>{@code bulkaction.records.processed} / {@code bulkaction.records.failed}</li>
 *   <li>{@code bulkaction.batches.retried} / {@code bulkaction.batches.failed}</li>
 *   <li>{@code bulkaction.executions.finished}: tagged {@code status}</li>
 *   <li>{@code bulkaction.undo.restored} / {@code bulkaction.undo.failed}: snapshot outcomes</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code bulkaction.queue.hot.depth} / {@code bulkaction.queue.cold.depth}</li>
 *   <li>{@code bulkaction.batch.duration}: wall time of completed batches</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter submissions;
  private final Counter recordsProcessed;
  private final Counter recordsFailed;
  private final Counter batchesRetried;
  private final Counter batchesFailed;
  private final Counter undoRestored;
  private final Counter undoFailed;
  private final Timer batchDuration;
  private final Gauge hotDepthGauge;
  private final Gauge coldDepthGauge;
  private final Map<String, Counter> tagged = new ConcurrentHashMap<>();

  private final AtomicInteger hotDepth = new AtomicInteger();
  private final AtomicInteger coldDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "bulkaction"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "bulkaction");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.bulkaction"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.submissions = Counter.builder(namePrefix + ".submissions")
        .description("Bulk action executions accepted")
        .register(registry);
    this.recordsProcessed = Counter.builder(namePrefix + ".records.processed")
        .description("Records the action was applied to")
        .register(registry);
    this.recordsFailed = Counter.builder(namePrefix + ".records.failed")
        .description("Records the action failed on")
        .register(registry);
    this.batchesRetried = Counter.builder(namePrefix + ".batches.retried")
        .description("Batches put back for retry after a transient failure")
        .register(registry);
    this.batchesFailed = Counter.builder(namePrefix + ".batches.failed")
        .description("Batches failed permanently")
        .register(registry);
    this.undoRestored = Counter.builder(namePrefix + ".undo.restored")
        .description("Records restored by undo")
        .register(registry);
    this.undoFailed = Counter.builder(namePrefix + ".undo.failed")
        .description("Records undo could not restore")
        .register(registry);
    this.batchDuration = Timer.builder(namePrefix + ".batch.duration")
        .description("Wall time of completed batches")
        .register(registry);

    this.hotDepthGauge = Gauge.builder(namePrefix + ".queue.hot.depth", hotDepth, AtomicInteger::get)
        .register(registry);
    this.coldDepthGauge = Gauge.builder(namePrefix + ".queue.cold.depth", coldDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementSubmitted() {
    if (closed) return;
    submissions.increment();
  }

  @Override
  public void incrementRejected(String reason) {
    if (closed) return;
    taggedCounter(".rejections", "reason", reason, "Submissions refused").increment();
  }

  @Override
  public void incrementRecordsProcessed(long count) {
    if (closed) return;
    recordsProcessed.increment(count);
  }

  @Override
  public void incrementRecordsFailed(long count) {
    if (closed) return;
    recordsFailed.increment(count);
  }

  @Override
  public void incrementBatchRetried() {
    if (closed) return;
    batchesRetried.increment();
  }

  @Override
  public void incrementBatchFailed() {
    if (closed) return;
    batchesFailed.increment();
  }

  @Override
  public void incrementExecutionFinished(ExecutionStatus status) {
    if (closed) return;
    taggedCounter(".executions.finished", "status", status.name().toLowerCase(Locale.ROOT),
        "Executions reaching a terminal status").increment();
  }

  @Override
  public void incrementUndone(long restored, long failed) {
    if (closed) return;
    undoRestored.increment(restored);
    undoFailed.increment(failed);
  }

  @Override
  public void recordQueueDepths(int hotDepth, int coldDepth) {
    if (closed) return;
    this.hotDepth.set(hotDepth);
    this.coldDepth.set(coldDepth);
  }

  @Override
  public void recordBatchDurationMs(long durationMs) {
    if (closed) return;
    batchDuration.record(Duration.ofMillis(durationMs));
  }

  private Counter taggedCounter(String suffix, String tag, String value, String description) {
    String tagValue = value == null ? "unknown" : value;
    return tagged.computeIfAbsent(suffix + "|" + tagValue,
        k -> Counter.builder(namePrefix + suffix)
            .description(description)
            .tag(tag, tagValue)
            .register(registry));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(submissions, recordsProcessed, recordsFailed,
        batchesRetried, batchesFailed, undoRestored, undoFailed, batchDuration,
        hotDepthGauge, coldDepthGauge));
    meters.addAll(tagged.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
