package io.bulkaction.spi;

import io.bulkaction.model.ExecutionStatus;

/**
 * Observability hook for engine counters and gauges.
 *
 * <p>{@link #NOOP} discards everything.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  void incrementSubmitted();

  /**
   * Counts a submission refused by validation, authorization or admission control.
   *
   * @param reason short machine-readable reason, e.g. {@code "rate_limited"}
   */
  void incrementRejected(String reason);

  void incrementRecordsProcessed(long count);

  void incrementRecordsFailed(long count);

  void incrementBatchRetried();

  void incrementBatchFailed();

  void incrementExecutionFinished(ExecutionStatus status);

  void incrementUndone(long restored, long failed);

  void recordQueueDepths(int hotDepth, int coldDepth);

  default void recordBatchDurationMs(long durationMs) {
  }

  final class Noop implements MetricsExporter {
    @Override
    public void incrementSubmitted() {
    }

    @Override
    public void incrementRejected(String reason) {
    }

    @Override
    public void incrementRecordsProcessed(long count) {
    }

    @Override
    public void incrementRecordsFailed(long count) {
    }

    @Override
    public void incrementBatchRetried() {
    }

    @Override
    public void incrementBatchFailed() {
    }

    @Override
    public void incrementExecutionFinished(ExecutionStatus status) {
    }

    @Override
    public void incrementUndone(long restored, long failed) {
    }

    @Override
    public void recordQueueDepths(int hotDepth, int coldDepth) {
    }
  }
}
