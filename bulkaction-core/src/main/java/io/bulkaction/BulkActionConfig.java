package io.bulkaction;

import io.bulkaction.dispatch.FailurePolicy;

import java.time.Duration;

/**
 * Tunables for {@link BulkActionEngine}. Every setting has a working default.
 */
public final class BulkActionConfig {
  private int defaultBatchSize = 500;
  private int minBatchSize = 10;
  private int maxBatchSize = 10_000;
  private double memoryPressureThreshold = 0.8;
  private int dispatcherWorkers = 4;
  private int hotQueueCapacity = 1000;
  private int coldQueueCapacity = 1000;
  private int retryMaxAttempts = 3;
  private long retryBaseDelayMs = 1000L;
  private long retryMaxDelayMs = 60_000L;
  private Duration batchTimeout = Duration.ofHours(1);
  private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;
  private double failureThreshold = 0.5;
  private Duration defaultUndoWindow = Duration.ofDays(7);
  private Duration maxUndoWindow = Duration.ofDays(90);
  private int undoPageSize = 200;
  private int maxConcurrentPerActor = 5;
  private long maxRecordsPerAction = 100_000L;
  private Duration cooldown = Duration.ofSeconds(60);
  private long cooldownThreshold = 10_000L;
  private Duration progressNotifyInterval = Duration.ofMillis(500);
  private int checkpointCapacity = 10;
  private Duration checkpointTtl = Duration.ofHours(1);
  private int previewLimitCap = 100;
  private Duration maxScheduleHorizon = Duration.ofDays(365);
  private boolean pollerEnabled = true;
  private long pollerIntervalMs = 5000L;
  private int pollerBatchSize = 50;
  private long schedulerIntervalSeconds = 60L;
  private boolean purgeEnabled = true;
  private Duration retention = Duration.ofDays(30);
  private int purgeBatchSize = 500;
  private long purgeIntervalSeconds = 3600L;

  public int getDefaultBatchSize() {
    return defaultBatchSize;
  }

  public BulkActionConfig setDefaultBatchSize(int defaultBatchSize) {
    this.defaultBatchSize = defaultBatchSize;
    return this;
  }

  public int getMinBatchSize() {
    return minBatchSize;
  }

  public BulkActionConfig setMinBatchSize(int minBatchSize) {
    this.minBatchSize = minBatchSize;
    return this;
  }

  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  public BulkActionConfig setMaxBatchSize(int maxBatchSize) {
    this.maxBatchSize = maxBatchSize;
    return this;
  }

  public double getMemoryPressureThreshold() {
    return memoryPressureThreshold;
  }

  public BulkActionConfig setMemoryPressureThreshold(double memoryPressureThreshold) {
    this.memoryPressureThreshold = memoryPressureThreshold;
    return this;
  }

  public int getDispatcherWorkers() {
    return dispatcherWorkers;
  }

  public BulkActionConfig setDispatcherWorkers(int dispatcherWorkers) {
    this.dispatcherWorkers = dispatcherWorkers;
    return this;
  }

  public int getHotQueueCapacity() {
    return hotQueueCapacity;
  }

  public BulkActionConfig setHotQueueCapacity(int hotQueueCapacity) {
    this.hotQueueCapacity = hotQueueCapacity;
    return this;
  }

  public int getColdQueueCapacity() {
    return coldQueueCapacity;
  }

  public BulkActionConfig setColdQueueCapacity(int coldQueueCapacity) {
    this.coldQueueCapacity = coldQueueCapacity;
    return this;
  }

  public int getRetryMaxAttempts() {
    return retryMaxAttempts;
  }

  public BulkActionConfig setRetryMaxAttempts(int retryMaxAttempts) {
    this.retryMaxAttempts = retryMaxAttempts;
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public BulkActionConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public long getRetryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public BulkActionConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
    this.retryMaxDelayMs = retryMaxDelayMs;
    return this;
  }

  public Duration getBatchTimeout() {
    return batchTimeout;
  }

  public BulkActionConfig setBatchTimeout(Duration batchTimeout) {
    this.batchTimeout = batchTimeout;
    return this;
  }

  public FailurePolicy getFailurePolicy() {
    return failurePolicy;
  }

  public BulkActionConfig setFailurePolicy(FailurePolicy failurePolicy) {
    this.failurePolicy = failurePolicy;
    return this;
  }

  public double getFailureThreshold() {
    return failureThreshold;
  }

  public BulkActionConfig setFailureThreshold(double failureThreshold) {
    this.failureThreshold = failureThreshold;
    return this;
  }

  public Duration getDefaultUndoWindow() {
    return defaultUndoWindow;
  }

  public BulkActionConfig setDefaultUndoWindow(Duration defaultUndoWindow) {
    this.defaultUndoWindow = defaultUndoWindow;
    return this;
  }

  public Duration getMaxUndoWindow() {
    return maxUndoWindow;
  }

  public BulkActionConfig setMaxUndoWindow(Duration maxUndoWindow) {
    this.maxUndoWindow = maxUndoWindow;
    return this;
  }

  public int getUndoPageSize() {
    return undoPageSize;
  }

  public BulkActionConfig setUndoPageSize(int undoPageSize) {
    this.undoPageSize = undoPageSize;
    return this;
  }

  public int getMaxConcurrentPerActor() {
    return maxConcurrentPerActor;
  }

  public BulkActionConfig setMaxConcurrentPerActor(int maxConcurrentPerActor) {
    this.maxConcurrentPerActor = maxConcurrentPerActor;
    return this;
  }

  public long getMaxRecordsPerAction() {
    return maxRecordsPerAction;
  }

  public BulkActionConfig setMaxRecordsPerAction(long maxRecordsPerAction) {
    this.maxRecordsPerAction = maxRecordsPerAction;
    return this;
  }

  public Duration getCooldown() {
    return cooldown;
  }

  public BulkActionConfig setCooldown(Duration cooldown) {
    this.cooldown = cooldown;
    return this;
  }

  public long getCooldownThreshold() {
    return cooldownThreshold;
  }

  public BulkActionConfig setCooldownThreshold(long cooldownThreshold) {
    this.cooldownThreshold = cooldownThreshold;
    return this;
  }

  public Duration getProgressNotifyInterval() {
    return progressNotifyInterval;
  }

  public BulkActionConfig setProgressNotifyInterval(Duration progressNotifyInterval) {
    this.progressNotifyInterval = progressNotifyInterval;
    return this;
  }

  public int getCheckpointCapacity() {
    return checkpointCapacity;
  }

  public BulkActionConfig setCheckpointCapacity(int checkpointCapacity) {
    this.checkpointCapacity = checkpointCapacity;
    return this;
  }

  public Duration getCheckpointTtl() {
    return checkpointTtl;
  }

  public BulkActionConfig setCheckpointTtl(Duration checkpointTtl) {
    this.checkpointTtl = checkpointTtl;
    return this;
  }

  public int getPreviewLimitCap() {
    return previewLimitCap;
  }

  public BulkActionConfig setPreviewLimitCap(int previewLimitCap) {
    this.previewLimitCap = previewLimitCap;
    return this;
  }

  public Duration getMaxScheduleHorizon() {
    return maxScheduleHorizon;
  }

  public BulkActionConfig setMaxScheduleHorizon(Duration maxScheduleHorizon) {
    this.maxScheduleHorizon = maxScheduleHorizon;
    return this;
  }

  public boolean isPollerEnabled() {
    return pollerEnabled;
  }

  public BulkActionConfig setPollerEnabled(boolean pollerEnabled) {
    this.pollerEnabled = pollerEnabled;
    return this;
  }

  public long getPollerIntervalMs() {
    return pollerIntervalMs;
  }

  public BulkActionConfig setPollerIntervalMs(long pollerIntervalMs) {
    this.pollerIntervalMs = pollerIntervalMs;
    return this;
  }

  public int getPollerBatchSize() {
    return pollerBatchSize;
  }

  public BulkActionConfig setPollerBatchSize(int pollerBatchSize) {
    this.pollerBatchSize = pollerBatchSize;
    return this;
  }

  public long getSchedulerIntervalSeconds() {
    return schedulerIntervalSeconds;
  }

  public BulkActionConfig setSchedulerIntervalSeconds(long schedulerIntervalSeconds) {
    this.schedulerIntervalSeconds = schedulerIntervalSeconds;
    return this;
  }

  public boolean isPurgeEnabled() {
    return purgeEnabled;
  }

  public BulkActionConfig setPurgeEnabled(boolean purgeEnabled) {
    this.purgeEnabled = purgeEnabled;
    return this;
  }

  public Duration getRetention() {
    return retention;
  }

  public BulkActionConfig setRetention(Duration retention) {
    this.retention = retention;
    return this;
  }

  public int getPurgeBatchSize() {
    return purgeBatchSize;
  }

  public BulkActionConfig setPurgeBatchSize(int purgeBatchSize) {
    this.purgeBatchSize = purgeBatchSize;
    return this;
  }

  public long getPurgeIntervalSeconds() {
    return purgeIntervalSeconds;
  }

  public BulkActionConfig setPurgeIntervalSeconds(long purgeIntervalSeconds) {
    this.purgeIntervalSeconds = purgeIntervalSeconds;
    return this;
  }
}
