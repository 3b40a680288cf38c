package io.bulkaction.spring.boot;

import io.bulkaction.BulkActionEngine;
import io.bulkaction.BulkActionRequest;
import io.bulkaction.ExecutionProgress;
import io.bulkaction.Preview;
import io.bulkaction.UnauthorizedException;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionRegistry;
import io.bulkaction.action.ActionResult;
import io.bulkaction.jdbc.DataSourceConnectionProvider;
import io.bulkaction.jdbc.record.JdbcTargetResolver;
import io.bulkaction.jdbc.store.JdbcBatchStore;
import io.bulkaction.jdbc.store.JdbcExecutionStore;
import io.bulkaction.jdbc.store.JdbcSnapshotStore;
import io.bulkaction.model.EntityRegistry;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.model.FilterSpec;
import io.bulkaction.model.MutationType;
import io.bulkaction.spi.AuthorizationPolicy;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.spi.ConnectionProvider;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.spi.SnapshotStore;
import io.bulkaction.spi.TargetResolver;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BulkActionAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          BulkActionAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:bulk_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:bulkaction/schema-h2.sql,classpath:schema.sql",
          "bulkaction.entities.widget.table=widget",
          "bulkaction.entities.widget.soft-delete-column=deleted_at",
          "bulkaction.poller.interval-ms=100");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("executionStore"));
      assertTrue(ctx.containsBean("batchStore"));
      assertTrue(ctx.containsBean("snapshotStore"));
      assertTrue(ctx.containsBean("recordStore"));
      assertTrue(ctx.containsBean("targetResolver"));
      assertTrue(ctx.containsBean("entityRegistry"));
      assertTrue(ctx.containsBean("actionRegistry"));
      assertTrue(ctx.containsBean("bulkActionEngine"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcExecutionStore.class, ctx.getBean(ExecutionStore.class));
      assertInstanceOf(JdbcBatchStore.class, ctx.getBean(BatchStore.class));
      assertInstanceOf(JdbcSnapshotStore.class, ctx.getBean(SnapshotStore.class));
      assertInstanceOf(JdbcTargetResolver.class, ctx.getBean(TargetResolver.class));
    });
  }

  @Test
  void registersEntitiesFromProperties() {
    runner.run(ctx -> {
      EntityType widget = ctx.getBean(EntityRegistry.class).require("widget");
      assertEquals("widget", widget.table());
      assertEquals("id", widget.idColumn());
      assertEquals("deleted_at", widget.softDeleteColumn());
    });
  }

  @Test
  void registersEntityTypeBeans() {
    runner.withUserConfiguration(GadgetConfig.class).run(ctx -> {
      var registry = ctx.getBean(EntityRegistry.class);
      assertTrue(registry.find("gadget").isPresent());
      assertTrue(registry.find("widget").isPresent());
    });
  }

  @Test
  void entityWithoutTableFailsStartup() {
    runner.withPropertyValues("bulkaction.entities.broken.id-column=id").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void registersActionHandlerBeansNextToBuiltIns() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      Set<String> names = ctx.getBean(ActionRegistry.class).names();
      assertTrue(names.contains("noop"));
      assertTrue(names.contains("delete"));
      assertTrue(names.contains("update"));
    });
  }

  @Test
  void previewCountsMatchingRecords() {
    runner.run(ctx -> {
      Preview preview = ctx.getBean(BulkActionEngine.class)
          .preview("widget", FilterSpec.all(), 2);
      assertEquals(3, preview.totalCount());
      assertEquals(2, preview.sample().size());
    });
  }

  @Test
  void submittedExecutionRunsToCompletion() {
    runner.run(ctx -> {
      BulkActionEngine engine = ctx.getBean(BulkActionEngine.class);
      Execution submitted = engine.submit(BulkActionRequest.builder("widget", "delete")
          .filter(FilterSpec.ids(List.of("1", "2")))
          .actor("alice")
          .build());

      ExecutionProgress progress = awaitTerminal(engine, submitted.id());
      assertEquals(ExecutionStatus.COMPLETED, progress.execution().status());
      assertEquals(2, progress.execution().processedRecords());
      assertEquals(100.0, progress.percentage(), 0.001);
    });
  }

  @Test
  void usesCustomAuthorizationPolicy() {
    runner.withUserConfiguration(DenyAllConfig.class).run(ctx -> {
      BulkActionEngine engine = ctx.getBean(BulkActionEngine.class);
      assertThrows(UnauthorizedException.class, () -> engine.submit(
          BulkActionRequest.builder("widget", "delete").actor("mallory").build()));
    });
  }

  @Test
  void backsOffWhenUserDefinesEngineInputs() {
    runner.withUserConfiguration(CustomExecutionStoreConfig.class).run(ctx -> {
      assertSame(CustomExecutionStoreConfig.STORE, ctx.getBean(ExecutionStore.class));
      assertFalse(ctx.containsBean("executionStore"));
    });
  }

  @Test
  void invalidTableNameFailsStartup() {
    runner.withPropertyValues("bulkaction.tables.executions=bad-name").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  private static ExecutionProgress awaitTerminal(BulkActionEngine engine, String id)
      throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    ExecutionProgress progress = engine.getStatus(id);
    while (!progress.execution().isTerminal() && System.currentTimeMillis() < deadline) {
      Thread.sleep(50);
      progress = engine.getStatus(id);
    }
    return progress;
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }

  @Configuration
  static class GadgetConfig {
    @Bean
    EntityType gadgetEntity() {
      return EntityType.of("gadget", "widget", "id");
    }
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    ActionHandler noopAction() {
      return ActionHandler.of("noop", MutationType.UPDATE_FIELDS, Set.of(),
          context -> ActionResult.ok());
    }
  }

  @Configuration
  static class DenyAllConfig {
    @Bean
    AuthorizationPolicy denyAll() {
      return (actor, action, entityType) -> false;
    }
  }

  @Configuration
  static class CustomExecutionStoreConfig {
    static final JdbcExecutionStore STORE = new JdbcExecutionStore();

    @Bean
    ExecutionStore customExecutionStore() {
      return STORE;
    }
  }
}
