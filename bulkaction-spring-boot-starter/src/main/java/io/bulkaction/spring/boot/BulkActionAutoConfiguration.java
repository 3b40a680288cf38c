package io.bulkaction.spring.boot;

import io.bulkaction.BulkActionConfig;
import io.bulkaction.BulkActionEngine;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionRegistry;
import io.bulkaction.action.DefaultActionRegistry;
import io.bulkaction.jdbc.DataSourceConnectionProvider;
import io.bulkaction.jdbc.TableNames;
import io.bulkaction.jdbc.record.JdbcRecordStore;
import io.bulkaction.jdbc.record.JdbcTargetResolver;
import io.bulkaction.jdbc.store.JdbcBatchStore;
import io.bulkaction.jdbc.store.JdbcExecutionStore;
import io.bulkaction.jdbc.store.JdbcSnapshotStore;
import io.bulkaction.model.EntityRegistry;
import io.bulkaction.model.EntityType;
import io.bulkaction.spi.AuthorizationPolicy;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.EventSink;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.MetricsExporter;
import io.bulkaction.spi.RecordStore;
import io.bulkaction.spi.SnapshotStore;
import io.bulkaction.spi.TargetResolver;
import io.bulkaction.undo.SnapshotCodec;
import io.bulkaction.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.Map;

/**
 * Auto-configuration for the bulk action engine.
 *
 * <p>Wires a {@link BulkActionEngine} from a {@link DataSource} and
 * {@link BulkActionProperties}. Entity types come from {@code bulkaction.entities.*} and from
 * {@link EntityType} beans; {@link ActionHandler} beans are registered next to the built-in
 * actions.
 *
 * @see BulkActionProperties
 * @see BulkActionMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(BulkActionEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(BulkActionProperties.class)
public class BulkActionAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ExecutionStore.class)
  public JdbcExecutionStore executionStore(BulkActionProperties props) {
    return new JdbcExecutionStore(tableNames(props).executions(), JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean(BatchStore.class)
  public JdbcBatchStore batchStore(BulkActionProperties props) {
    return new JdbcBatchStore(tableNames(props).batches(), JsonCodec.getDefault());
  }

  @Bean
  @ConditionalOnMissingBean(SnapshotStore.class)
  public JdbcSnapshotStore snapshotStore(BulkActionProperties props) {
    return new JdbcSnapshotStore(tableNames(props).snapshots(), SnapshotCodec.defaults());
  }

  @Bean
  @ConditionalOnMissingBean(JdbcRecordStore.class)
  public JdbcRecordStore recordStore() {
    return new JdbcRecordStore();
  }

  @Bean
  @ConditionalOnMissingBean(TargetResolver.class)
  public JdbcTargetResolver targetResolver(JdbcRecordStore recordStore) {
    return new JdbcTargetResolver(recordStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public EntityRegistry entityRegistry(BulkActionProperties props,
      ObjectProvider<EntityType> entityTypes) {
    EntityRegistry registry = new EntityRegistry();
    for (Map.Entry<String, BulkActionProperties.Entity> entry : props.getEntities().entrySet()) {
      BulkActionProperties.Entity entity = entry.getValue();
      if (entity.getTable() == null || entity.getTable().isEmpty()) {
        throw new IllegalStateException(
            "bulkaction.entities." + entry.getKey() + ".table must be set");
      }
      registry.register(new EntityType(entry.getKey(), entity.getTable(),
          entity.getIdColumn(), entity.getSoftDeleteColumn()));
    }
    entityTypes.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean(ActionRegistry.class)
  public DefaultActionRegistry actionRegistry(ObjectProvider<ActionHandler> handlers) {
    DefaultActionRegistry registry = DefaultActionRegistry.withBuiltIns();
    handlers.orderedStream().forEach(registry::register);
    return registry;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public BulkActionEngine bulkActionEngine(BulkActionProperties props,
      ConnectionProvider connectionProvider,
      ExecutionStore executionStore,
      BatchStore batchStore,
      SnapshotStore snapshotStore,
      RecordStore recordStore,
      TargetResolver targetResolver,
      EntityRegistry entityRegistry,
      ActionRegistry actionRegistry,
      ObjectProvider<AuthorizationPolicy> authorizationProvider,
      ObjectProvider<EventSink> eventSinkProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = BulkActionEngine.builder()
        .connectionProvider(connectionProvider)
        .executionStore(executionStore)
        .batchStore(batchStore)
        .snapshotStore(snapshotStore)
        .recordStore(recordStore)
        .targetResolver(targetResolver)
        .entities(entityRegistry)
        .actions(actionRegistry)
        .config(toConfig(props));
    AuthorizationPolicy authorization = authorizationProvider.getIfAvailable();
    if (authorization != null) {
      builder.authorization(authorization);
    }
    EventSink eventSink = eventSinkProvider.getIfAvailable();
    if (eventSink != null) {
      builder.eventSink(eventSink);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  static BulkActionConfig toConfig(BulkActionProperties props) {
    var batch = props.getBatch();
    var dispatcher = props.getDispatcher();
    var retry = props.getRetry();
    var undo = props.getUndo();
    var gate = props.getGate();
    var progress = props.getProgress();
    var poller = props.getPoller();
    var purge = props.getPurge();
    return new BulkActionConfig()
        .setDefaultBatchSize(batch.getDefaultSize())
        .setMinBatchSize(batch.getMinSize())
        .setMaxBatchSize(batch.getMaxSize())
        .setMemoryPressureThreshold(batch.getMemoryPressureThreshold())
        .setBatchTimeout(batch.getTimeout())
        .setDispatcherWorkers(dispatcher.getWorkerCount())
        .setHotQueueCapacity(dispatcher.getHotQueueCapacity())
        .setColdQueueCapacity(dispatcher.getColdQueueCapacity())
        .setFailurePolicy(dispatcher.getFailurePolicy())
        .setFailureThreshold(dispatcher.getFailureThreshold())
        .setRetryMaxAttempts(retry.getMaxAttempts())
        .setRetryBaseDelayMs(retry.getBaseDelayMs())
        .setRetryMaxDelayMs(retry.getMaxDelayMs())
        .setDefaultUndoWindow(undo.getDefaultWindow())
        .setMaxUndoWindow(undo.getMaxWindow())
        .setUndoPageSize(undo.getPageSize())
        .setMaxConcurrentPerActor(gate.getMaxConcurrentPerActor())
        .setMaxRecordsPerAction(gate.getMaxRecordsPerAction())
        .setCooldown(gate.getCooldown())
        .setCooldownThreshold(gate.getCooldownThreshold())
        .setProgressNotifyInterval(progress.getNotifyInterval())
        .setCheckpointCapacity(progress.getCheckpointCapacity())
        .setCheckpointTtl(progress.getCheckpointTtl())
        .setPreviewLimitCap(progress.getPreviewLimitCap())
        .setMaxScheduleHorizon(props.getScheduler().getMaxHorizon())
        .setSchedulerIntervalSeconds(props.getScheduler().getIntervalSeconds())
        .setPollerEnabled(poller.isEnabled())
        .setPollerIntervalMs(poller.getIntervalMs())
        .setPollerBatchSize(poller.getBatchSize())
        .setPurgeEnabled(purge.isEnabled())
        .setRetention(purge.getRetention())
        .setPurgeBatchSize(purge.getBatchSize())
        .setPurgeIntervalSeconds(purge.getIntervalSeconds());
  }

  private static TableNames tableNames(BulkActionProperties props) {
    var tables = props.getTables();
    return new TableNames(tables.getExecutions(), tables.getBatches(), tables.getSnapshots());
  }
}
