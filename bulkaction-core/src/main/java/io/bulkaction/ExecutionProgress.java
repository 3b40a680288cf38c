package io.bulkaction;

import io.bulkaction.model.BatchStatus;
import io.bulkaction.model.Execution;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time status of one execution.
 *
 * @param percentage processed share in {@code [0, 100]}, two decimals
 * @param estimatedRemaining {@code null} when no estimate is available
 * @param batchCounts number of batches per status
 */
public record ExecutionProgress(
    Execution execution,
    double percentage,
    Duration estimatedRemaining,
    Map<BatchStatus, Integer> batchCounts
) {

  public ExecutionProgress {
    batchCounts = Map.copyOf(batchCounts);
  }

  public Optional<Duration> eta() {
    return Optional.ofNullable(estimatedRemaining);
  }

  public int batchCount(BatchStatus status) {
    return batchCounts.getOrDefault(status, 0);
  }

  public int totalBatches() {
    return batchCounts.values().stream().mapToInt(Integer::intValue).sum();
  }
}
