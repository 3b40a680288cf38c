package io.bulkaction.spring.boot;

import io.bulkaction.dispatch.FailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the bulk action engine.
 *
 * @see BulkActionAutoConfiguration
 */
@ConfigurationProperties(prefix = "bulkaction")
public class BulkActionProperties {

    /**
     * Entity types that may be targeted, keyed by logical name.
     */
    private final Map<String, Entity> entities = new LinkedHashMap<>();

    private final Tables tables = new Tables();
    private final Batch batch = new Batch();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Undo undo = new Undo();
    private final Gate gate = new Gate();
    private final Progress progress = new Progress();
    private final Scheduler scheduler = new Scheduler();
    private final Poller poller = new Poller();
    private final Purge purge = new Purge();
    private final Metrics metrics = new Metrics();

    public Map<String, Entity> getEntities() {
        return entities;
    }

    public Tables getTables() {
        return tables;
    }

    public Batch getBatch() {
        return batch;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Undo getUndo() {
        return undo;
    }

    public Gate getGate() {
        return gate;
    }

    public Progress getProgress() {
        return progress;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Poller getPoller() {
        return poller;
    }

    public Purge getPurge() {
        return purge;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Entity {
        /**
         * Backing table.
         */
        private String table;

        /**
         * Primary key column.
         */
        private String idColumn = "id";

        /**
         * Nullable timestamp column used by soft delete and restore.
         */
        private String softDeleteColumn;

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getIdColumn() {
            return idColumn;
        }

        public void setIdColumn(String idColumn) {
            this.idColumn = idColumn;
        }

        public String getSoftDeleteColumn() {
            return softDeleteColumn;
        }

        public void setSoftDeleteColumn(String softDeleteColumn) {
            this.softDeleteColumn = softDeleteColumn;
        }
    }

    public static class Tables {
        private String executions = "bulk_execution";
        private String batches = "bulk_batch";
        private String snapshots = "bulk_snapshot";

        public String getExecutions() {
            return executions;
        }

        public void setExecutions(String executions) {
            this.executions = executions;
        }

        public String getBatches() {
            return batches;
        }

        public void setBatches(String batches) {
            this.batches = batches;
        }

        public String getSnapshots() {
            return snapshots;
        }

        public void setSnapshots(String snapshots) {
            this.snapshots = snapshots;
        }
    }

    public static class Batch {
        private int defaultSize = 500;
        private int minSize = 10;
        private int maxSize = 10_000;

        /**
         * Heap usage fraction above which batches are shrunk to the minimum size.
         */
        private double memoryPressureThreshold = 0.8;

        private Duration timeout = Duration.ofHours(1);

        public int getDefaultSize() {
            return defaultSize;
        }

        public void setDefaultSize(int defaultSize) {
            this.defaultSize = defaultSize;
        }

        public int getMinSize() {
            return minSize;
        }

        public void setMinSize(int minSize) {
            this.minSize = minSize;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public double getMemoryPressureThreshold() {
            return memoryPressureThreshold;
        }

        public void setMemoryPressureThreshold(double memoryPressureThreshold) {
            this.memoryPressureThreshold = memoryPressureThreshold;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Dispatcher {
        private int workerCount = 4;
        private int hotQueueCapacity = 1000;
        private int coldQueueCapacity = 1000;
        private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;

        /**
         * Share of failed records above which a finished execution is marked FAILED.
         */
        private double failureThreshold = 0.5;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getHotQueueCapacity() {
            return hotQueueCapacity;
        }

        public void setHotQueueCapacity(int hotQueueCapacity) {
            this.hotQueueCapacity = hotQueueCapacity;
        }

        public int getColdQueueCapacity() {
            return coldQueueCapacity;
        }

        public void setColdQueueCapacity(int coldQueueCapacity) {
            this.coldQueueCapacity = coldQueueCapacity;
        }

        public FailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }

        public double getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(double failureThreshold) {
            this.failureThreshold = failureThreshold;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 60_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Undo {
        private Duration defaultWindow = Duration.ofDays(7);
        private Duration maxWindow = Duration.ofDays(90);
        private int pageSize = 200;

        public Duration getDefaultWindow() {
            return defaultWindow;
        }

        public void setDefaultWindow(Duration defaultWindow) {
            this.defaultWindow = defaultWindow;
        }

        public Duration getMaxWindow() {
            return maxWindow;
        }

        public void setMaxWindow(Duration maxWindow) {
            this.maxWindow = maxWindow;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class Gate {
        private int maxConcurrentPerActor = 5;
        private long maxRecordsPerAction = 100_000;
        private Duration cooldown = Duration.ofSeconds(60);

        /**
         * Record count at or above which an execution puts its actor into cooldown.
         */
        private long cooldownThreshold = 10_000;

        public int getMaxConcurrentPerActor() {
            return maxConcurrentPerActor;
        }

        public void setMaxConcurrentPerActor(int maxConcurrentPerActor) {
            this.maxConcurrentPerActor = maxConcurrentPerActor;
        }

        public long getMaxRecordsPerAction() {
            return maxRecordsPerAction;
        }

        public void setMaxRecordsPerAction(long maxRecordsPerAction) {
            this.maxRecordsPerAction = maxRecordsPerAction;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }

        public long getCooldownThreshold() {
            return cooldownThreshold;
        }

        public void setCooldownThreshold(long cooldownThreshold) {
            this.cooldownThreshold = cooldownThreshold;
        }
    }

    public static class Progress {
        private Duration notifyInterval = Duration.ofMillis(500);
        private int checkpointCapacity = 10;
        private Duration checkpointTtl = Duration.ofHours(1);
        private int previewLimitCap = 100;

        public Duration getNotifyInterval() {
            return notifyInterval;
        }

        public void setNotifyInterval(Duration notifyInterval) {
            this.notifyInterval = notifyInterval;
        }

        public int getCheckpointCapacity() {
            return checkpointCapacity;
        }

        public void setCheckpointCapacity(int checkpointCapacity) {
            this.checkpointCapacity = checkpointCapacity;
        }

        public Duration getCheckpointTtl() {
            return checkpointTtl;
        }

        public void setCheckpointTtl(Duration checkpointTtl) {
            this.checkpointTtl = checkpointTtl;
        }

        public int getPreviewLimitCap() {
            return previewLimitCap;
        }

        public void setPreviewLimitCap(int previewLimitCap) {
            this.previewLimitCap = previewLimitCap;
        }
    }

    public static class Scheduler {
        private long intervalSeconds = 60;
        private Duration maxHorizon = Duration.ofDays(365);

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public Duration getMaxHorizon() {
            return maxHorizon;
        }

        public void setMaxHorizon(Duration maxHorizon) {
            this.maxHorizon = maxHorizon;
        }
    }

    public static class Poller {
        private boolean enabled = true;
        private long intervalMs = 5000;
        private int batchSize = 50;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Purge {
        private boolean enabled = true;

        /**
         * How long finished executions are kept after their undo window closes.
         */
        private Duration retention = Duration.ofDays(30);

        private int batchSize = 500;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "bulkaction";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
