package io.bulkaction.jdbc;

import io.bulkaction.BulkActionConfig;
import io.bulkaction.BulkActionEngine;
import io.bulkaction.BulkActionRequest;
import io.bulkaction.ExecutionNotFoundException;
import io.bulkaction.ExecutionProgress;
import io.bulkaction.Preview;
import io.bulkaction.RateLimitedException;
import io.bulkaction.SchedulingConflictException;
import io.bulkaction.SpecInvalidException;
import io.bulkaction.action.ActionHandler;
import io.bulkaction.action.ActionResult;
import io.bulkaction.dispatch.FailurePolicy;
import io.bulkaction.dispatch.TransientBatchException;
import io.bulkaction.jdbc.store.JdbcBatchStore;
import io.bulkaction.model.Batch;
import io.bulkaction.model.BatchStatus;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.model.FilterSpec;
import io.bulkaction.model.MutationType;
import io.bulkaction.model.Predicate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static io.bulkaction.jdbc.EngineFixture.awaitTerminal;
import static io.bulkaction.jdbc.EngineFixture.engine;
import static io.bulkaction.jdbc.EngineFixture.smallBatches;
import static org.junit.jupiter.api.Assertions.*;

class BulkActionEngineTest {
  private final TestClock clock = new TestClock();
  private TestDatabase db;
  private BulkActionEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    db = TestDatabase.create("engine");
  }

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.close();
    }
  }

  @Test
  void softDeletesEveryMatchingRecordInBatches() throws Exception {
    db.insertWidgets(1000);
    engine = engine(db, clock, smallBatches());

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "delete")
        .actor("alice")
        .build());
    assertEquals(1000, submitted.totalRecords());

    ExecutionProgress done = awaitTerminal(engine, submitted.id());
    assertEquals(ExecutionStatus.COMPLETED, done.execution().status());
    assertEquals(1000, done.execution().processedRecords());
    assertEquals(0, done.execution().failedRecords());
    assertEquals(100.0, done.percentage());
    assertEquals(10, done.totalBatches());
    assertEquals(10, done.batchCount(BatchStatus.COMPLETED));
    assertNull(done.execution().errorDetail());
    assertEquals(1000, db.deletedWidgets());
    assertEquals(1000, db.count("SELECT COUNT(*) FROM bulk_snapshot WHERE execution_id = ?",
        submitted.id()));
  }

  @Test
  void batchesAreNumberedContiguouslyAsIdsStreamIn() throws Exception {
    db.insertWidgets(95);
    engine = engine(db, clock, smallBatches().setDispatcherWorkers(0));

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "delete")
        .batchSize(10)
        .build());

    assertEquals(ExecutionStatus.PROCESSING, submitted.status());
    assertEquals(95, submitted.totalRecords());
    assertEquals(10, engine.getStatus(submitted.id()).totalBatches());
    assertEquals(1, db.count("SELECT MIN(batch_number) FROM bulk_batch WHERE execution_id = ?",
        submitted.id()));
    assertEquals(10, db.count("SELECT MAX(batch_number) FROM bulk_batch WHERE execution_id = ?",
        submitted.id()));
    assertEquals(95, db.count("SELECT SUM(record_count) FROM bulk_batch WHERE execution_id = ?",
        submitted.id()));
    assertEquals(5, db.count("SELECT record_count FROM bulk_batch"
        + " WHERE execution_id = ? AND batch_number = 10", submitted.id()));
  }

  @Test
  void filterLimitsTheTargets() throws Exception {
    db.insertWidgets(100);
    engine = engine(db, clock, smallBatches());

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "update")
        .filter(FilterSpec.where(Predicate.eq("status", "idle"), Predicate.lt("score", 21)))
        .parameter("data", Map.of("status", "retired"))
        .batchSize(10)
        .build());

    ExecutionProgress done = awaitTerminal(engine, submitted.id());
    assertEquals(ExecutionStatus.COMPLETED, done.execution().status());
    assertEquals(10, done.execution().processedRecords());
    assertEquals(10, db.count("SELECT COUNT(*) FROM widget WHERE status = 'retired'"));
    assertEquals(0, db.count("SELECT COUNT(*) FROM widget WHERE status = 'retired' AND score > 20"));
  }

  @Test
  void emptyMatchCompletesRightAway() throws Exception {
    db.insertWidgets(10);
    engine = engine(db, clock, smallBatches());

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "delete")
        .filter(FilterSpec.where(Predicate.eq("status", "retired")))
        .build());

    assertEquals(ExecutionStatus.COMPLETED, submitted.status());
    assertEquals(0, submitted.totalRecords());
    ExecutionProgress progress = engine.getStatus(submitted.id());
    assertEquals(0, progress.totalBatches());
    assertEquals(0.0, progress.percentage());
  }

  @Test
  void failedRecordsDoNotStopTheExecution() throws Exception {
    db.insertWidgets(50);
    engine = engine(db, clock, smallBatches(), failingOn("37"));

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "flaky")
        .batchSize(50)
        .build());

    ExecutionProgress done = awaitTerminal(engine, submitted.id());
    assertEquals(ExecutionStatus.COMPLETED, done.execution().status());
    assertEquals(1, done.totalBatches());
    assertEquals(49, done.execution().processedRecords());
    assertEquals(1, done.execution().failedRecords());
    assertEquals(98.0, done.percentage());
    assertTrue(done.execution().errorDetail().startsWith("1 of 50 records failed"));

    Batch batch = batchRow(submitted.id(), 1);
    assertEquals(BatchStatus.COMPLETED, batch.status());
    assertEquals(49, batch.processedCount());
    assertEquals(1, batch.failedCount());
    assertEquals("record 37 is locked", batch.errorDetail());
    assertEquals(49, db.count("SELECT COUNT(*) FROM widget WHERE name = 'touched'"));
  }

  @Test
  void mostlyFailingExecutionEndsFailed() throws Exception {
    db.insertWidgets(20);
    ActionHandler broken = ActionHandler.of("broken", MutationType.UPDATE_FIELDS, Set.of("name"),
        ctx -> Integer.parseInt(ctx.record().id()) <= 15
            ? ActionResult.failure("nope") : ActionResult.ok());
    engine = engine(db, clock, smallBatches(), broken);

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "broken")
        .batchSize(10)
        .build());

    ExecutionProgress done = awaitTerminal(engine, submitted.id());
    assertEquals(ExecutionStatus.FAILED, done.execution().status());
    assertEquals(5, done.execution().processedRecords());
    assertEquals(15, done.execution().failedRecords());
    assertTrue(done.execution().errorDetail().contains("above the 50.0% threshold"));
  }

  @Test
  void abortPolicyStopsAtTheFirstFailure() throws Exception {
    db.insertWidgets(20);
    BulkActionConfig config = smallBatches()
        .setDispatcherWorkers(1)
        .setFailurePolicy(FailurePolicy.ABORT);
    engine = engine(db, clock, config, failingOn("5"));

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "flaky")
        .batchSize(10)
        .build());

    ExecutionProgress done = awaitTerminal(engine, submitted.id());
    assertEquals(ExecutionStatus.FAILED, done.execution().status());
    assertEquals(4, done.execution().processedRecords());
    assertEquals(6, done.execution().failedRecords());
    assertEquals(1, done.batchCount(BatchStatus.FAILED));
    assertEquals(1, done.batchCount(BatchStatus.CANCELLED));
    assertEquals(4, db.count("SELECT COUNT(*) FROM widget WHERE name = 'touched'"));
  }

  @Test
  void transientFailureRetriesTheBatch() throws Exception {
    db.insertWidgets(10);
    AtomicBoolean thrown = new AtomicBoolean();
    ActionHandler hiccup = ActionHandler.of("hiccup", MutationType.UPDATE_FIELDS, Set.of("name"),
        ctx -> {
          if (ctx.record().id().equals("3") && thrown.compareAndSet(false, true)) {
            throw new TransientBatchException("lock timeout");
          }
          ctx.records().update(ctx.connection(), ctx.entity(), ctx.record().id(),
              Map.of("name", "touched"));
          return ActionResult.ok();
        });
    // retries become claimable only once wall time passes their backoff
    engine = engine(db, Clock.systemUTC(), smallBatches(), hiccup);

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "hiccup")
        .batchSize(10)
        .build());

    ExecutionProgress done = awaitTerminal(engine, submitted.id(), true);
    assertTrue(thrown.get());
    assertEquals(ExecutionStatus.COMPLETED, done.execution().status());
    assertEquals(10, done.execution().processedRecords());
    assertEquals(0, done.execution().failedRecords());
    assertEquals(10, db.count("SELECT COUNT(*) FROM widget WHERE name = 'touched'"));
    assertEquals(1, db.count("SELECT attempts FROM bulk_batch WHERE execution_id = ?",
        submitted.id()));
  }

  @Test
  void batchesLeftOutOfTheHotQueueArePolled() throws Exception {
    db.insertWidgets(50);
    BulkActionConfig config = smallBatches().setHotQueueCapacity(1);
    engine = engine(db, clock, config);

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "delete")
        .batchSize(10)
        .build());

    ExecutionProgress done = awaitTerminal(engine, submitted.id(), true);
    assertEquals(ExecutionStatus.COMPLETED, done.execution().status());
    assertEquals(5, done.batchCount(BatchStatus.COMPLETED));
    assertEquals(50, db.deletedWidgets());
  }

  @Test
  void dryRunRecordsTheCountWithoutTouchingRecords() throws Exception {
    db.insertWidgets(30);
    engine = engine(db, clock, smallBatches().setMaxConcurrentPerActor(2));

    Execution dryRun = engine.submit(BulkActionRequest.builder("widget", "delete")
        .filter(FilterSpec.where(Predicate.eq("status", "active")))
        .actor("alice")
        .scheduledFor(clock.instant().plus(Duration.ofHours(1)))
        .dryRun()
        .build());

    assertTrue(dryRun.dryRun());
    assertEquals(ExecutionStatus.COMPLETED, dryRun.status());
    assertEquals(15, dryRun.totalRecords());
    assertEquals(0, dryRun.processedRecords());
    assertNull(dryRun.scheduledFor());
    assertFalse(dryRun.undoEnabled());
    assertEquals(0, db.deletedWidgets());
    assertEquals(0, db.count("SELECT COUNT(*) FROM bulk_batch"));

    ExecutionProgress status = engine.getStatus(dryRun.id());
    assertTrue(status.execution().dryRun());
    assertEquals(0, status.totalBatches());
    assertEquals(2, engine.remainingSlots("alice"));
    assertFalse(engine.canUndo(dryRun.id()));
  }

  @Test
  void dryRunIsValidatedLikeARealSubmission() throws Exception {
    db.insertWidgets(5);
    engine = engine(db, clock, smallBatches());

    assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "update")
            .parameter("data", Map.of("colour", "red"))
            .dryRun()
            .build()));
    assertEquals(0, db.count("SELECT COUNT(*) FROM bulk_execution"));
  }

  @Test
  void previewIsCappedAndWritesNothing() throws Exception {
    db.insertWidgets(300);
    engine = engine(db, clock, smallBatches());

    Preview preview = engine.preview("widget",
        FilterSpec.where(Predicate.eq("status", "active")), 500);

    assertEquals(150, preview.totalCount());
    assertEquals(100, preview.sample().size());
    assertEquals("2", preview.sample().get(0).id());
    assertEquals(0, db.count("SELECT COUNT(*) FROM bulk_execution"));
    assertThrows(SpecInvalidException.class,
        () -> engine.preview("widget", FilterSpec.all(), -1));
  }

  @Test
  void invalidRequestsAreRejectedBeforeAnythingIsWritten() throws Exception {
    db.insertWidgets(5);
    engine = engine(db, clock, smallBatches());

    assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("gadget", "delete").build()));
    assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "shred").build()));
    assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "update").build()));
    assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "delete").batchSize(5).build()));
    assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "delete")
            .filter(FilterSpec.where(Predicate.eq("colour", "red")))
            .build()));
    assertEquals(0, db.count("SELECT COUNT(*) FROM bulk_execution"));
  }

  @Test
  void updateOfAnUnknownColumnIsRejectedAtSubmit() throws Exception {
    db.insertWidgets(3);
    engine = engine(db, clock, smallBatches());

    SpecInvalidException e = assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "update")
            .parameter("data", Map.of("colour", "red"))
            .build()));
    assertTrue(e.getMessage().contains("colour"));
    assertEquals(0, db.count("SELECT COUNT(*) FROM bulk_execution"));
  }

  @Test
  void updateValueThatDoesNotFitItsColumnIsRejectedAtSubmit() throws Exception {
    db.insertWidgets(3);
    engine = engine(db, clock, smallBatches());

    assertThrows(SpecInvalidException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "update")
            .parameter("data", Map.of("status", "retired", "score", "high"))
            .build()));
    assertEquals(0, db.count("SELECT COUNT(*) FROM bulk_execution"));
    assertEquals(0, db.count("SELECT COUNT(*) FROM widget WHERE status = 'retired'"));
  }

  @Test
  void tooManyMatchingRecordsIsRateLimited() throws Exception {
    db.insertWidgets(30);
    engine = engine(db, clock, smallBatches().setMaxRecordsPerAction(25));

    RateLimitedException e = assertThrows(RateLimitedException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "delete").build()));
    assertEquals(RateLimitedException.Reason.TOO_MANY_RECORDS, e.reason());
    assertEquals(0, db.count("SELECT COUNT(*) FROM bulk_execution"));
  }

  @Test
  void actorsAreLimitedToTheirActiveExecutions() throws Exception {
    db.insertWidgets(5);
    engine = engine(db, clock, smallBatches().setMaxConcurrentPerActor(2));

    for (int i = 0; i < 2; i++) {
      engine.submit(BulkActionRequest.builder("widget", "delete")
          .actor("alice")
          .scheduledFor(clock.instant().plus(Duration.ofHours(1)))
          .build());
    }
    assertEquals(0, engine.remainingSlots("alice"));
    RateLimitedException e = assertThrows(RateLimitedException.class,
        () -> engine.submit(BulkActionRequest.builder("widget", "delete").actor("alice").build()));
    assertEquals(RateLimitedException.Reason.TOO_MANY_ACTIVE, e.reason());

    assertEquals(2, engine.remainingSlots("bob"));
    assertNotNull(engine.submit(BulkActionRequest.builder("widget", "delete")
        .actor("bob")
        .scheduledFor(clock.instant().plus(Duration.ofHours(1)))
        .build()));
    assertNotNull(engine.submit(BulkActionRequest.builder("widget", "delete")
        .scheduledFor(clock.instant().plus(Duration.ofHours(1)))
        .build()));
  }

  @Test
  void cancellingARunningExecutionDropsItsQueuedBatches() throws Exception {
    db.insertWidgets(30);
    engine = engine(db, clock, smallBatches().setDispatcherWorkers(0));

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "delete")
        .batchSize(10)
        .build());
    assertEquals(ExecutionStatus.PROCESSING, submitted.status());

    Execution cancelled = engine.cancel(submitted.id());
    assertEquals(ExecutionStatus.CANCELLED, cancelled.status());
    assertEquals(0, cancelled.processedRecords());
    assertNotNull(cancelled.completedAt());
    assertEquals(3, engine.getStatus(submitted.id()).batchCount(BatchStatus.CANCELLED));
    assertEquals(0, db.deletedWidgets());

    assertThrows(SchedulingConflictException.class, () -> engine.cancel(submitted.id()));
  }

  @Test
  void cancellingInsideABatchLeavesLaterRecordsUntouched() throws Exception {
    db.insertWidgets(10);
    AtomicReference<BulkActionEngine> self = new AtomicReference<>();
    ActionHandler cancelling = ActionHandler.of("cancelling", MutationType.UPDATE_FIELDS,
        Set.of("name"), ctx -> {
          ctx.records().update(ctx.connection(), ctx.entity(), ctx.record().id(),
              Map.of("name", "touched"));
          if (ctx.record().id().equals("5")) {
            self.get().cancel(ctx.executionId());
          }
          return ActionResult.ok();
        });
    engine = engine(db, clock, smallBatches().setDispatcherWorkers(1), cancelling);
    self.set(engine);

    Execution submitted = engine.submit(BulkActionRequest.builder("widget", "cancelling")
        .batchSize(10)
        .build());

    awaitTerminal(engine, submitted.id());
    Batch batch = awaitBatchTerminal(submitted.id(), 1);
    Execution execution = engine.getStatus(submitted.id()).execution();
    assertEquals(ExecutionStatus.CANCELLED, execution.status());
    assertEquals(4, execution.processedRecords());
    assertEquals(0, execution.failedRecords());
    assertTrue(execution.processedRecords() + execution.failedRecords()
        <= execution.totalRecords());
    // record 5 was mid-flight when the cancel landed; its write rolls back with it
    assertEquals(4, db.count("SELECT COUNT(*) FROM widget WHERE name = 'touched'"));
    assertEquals(0, db.count("SELECT COUNT(*) FROM widget WHERE name = 'touched' AND id >= 5"));
    assertEquals(BatchStatus.CANCELLED, batch.status());
    assertEquals(4, batch.processedCount());
    assertEquals(0, batch.failedCount());
  }

  @Test
  void unknownExecutionIsNotFound() throws Exception {
    engine = engine(db, clock, smallBatches());

    assertThrows(ExecutionNotFoundException.class, () -> engine.getStatus("missing"));
    assertThrows(ExecutionNotFoundException.class, () -> engine.cancel("missing"));
  }

  private Batch batchRow(String executionId, int batchNumber) throws Exception {
    try (Connection conn = db.connection()) {
      return new JdbcBatchStore().find(conn, executionId, batchNumber).orElseThrow();
    }
  }

  /** The execution turns CANCELLED before the worker notices, so wait for the batch row too. */
  private Batch awaitBatchTerminal(String executionId, int batchNumber) throws Exception {
    long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
    Batch batch = batchRow(executionId, batchNumber);
    while (!batch.status().isTerminal() && System.nanoTime() < deadline) {
      Thread.sleep(20);
      batch = batchRow(executionId, batchNumber);
    }
    return batch;
  }

  private static ActionHandler failingOn(String failingId) {
    return ActionHandler.of("flaky", MutationType.UPDATE_FIELDS, Set.of("name"), ctx -> {
      if (ctx.record().id().equals(failingId)) {
        return ActionResult.failure("record " + failingId + " is locked");
      }
      ctx.records().update(ctx.connection(), ctx.entity(), ctx.record().id(),
          Map.of("name", "touched"));
      return ActionResult.ok();
    });
  }
}
