package io.bulkaction.jdbc;

import io.bulkaction.BulkActionEngine;
import io.bulkaction.BulkActionRequest;
import io.bulkaction.SchedulingConflictException;
import io.bulkaction.SpecInvalidException;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.bulkaction.jdbc.EngineFixture.awaitTerminal;
import static io.bulkaction.jdbc.EngineFixture.engine;
import static io.bulkaction.jdbc.EngineFixture.smallBatches;
import static org.junit.jupiter.api.Assertions.*;

class SchedulingIntegrationTest {
  private static final Instant IN_ONE_HOUR = TestClock.START.plus(Duration.ofHours(1));

  private final TestClock clock = new TestClock();
  private TestDatabase db;
  private BulkActionEngine engine;

  @BeforeEach
  void setUp() throws Exception {
    db = TestDatabase.create("scheduling");
    db.insertWidgets(30);
    engine = engine(db, clock, smallBatches().setDefaultBatchSize(10).setMaxRecordsPerAction(40));
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  void scheduledExecutionWaitsUntilDue() throws Exception {
    Execution scheduled = schedule("alice", IN_ONE_HOUR);
    assertEquals(ExecutionStatus.SCHEDULED, scheduled.status());
    assertEquals(IN_ONE_HOUR.plus(Duration.ofDays(7)), scheduled.undoExpiresAt());

    assertEquals(0, engine.processDueSchedules());
    assertEquals(0, db.deletedWidgets());

    clock.advance(Duration.ofHours(1));
    assertEquals(1, engine.processDueSchedules());
    assertEquals(0, engine.processDueSchedules());

    Execution done = awaitTerminal(engine, scheduled.id()).execution();
    assertEquals(ExecutionStatus.COMPLETED, done.status());
    assertEquals(30, done.processedRecords());
    assertEquals(30, db.deletedWidgets());
    assertTrue(engine.listScheduled(null).isEmpty());
  }

  @Test
  void targetsAreCountedAgainAtActivation() throws Exception {
    Execution scheduled = schedule("alice", IN_ONE_HOUR);
    assertEquals(30, scheduled.totalRecords());
    db.insertWidgetsFrom(31, 35);

    clock.advance(Duration.ofHours(1));
    engine.processDueSchedules();

    Execution done = awaitTerminal(engine, scheduled.id()).execution();
    assertEquals(35, done.totalRecords());
    assertEquals(35, done.processedRecords());
  }

  @Test
  void activationFailsWhenTheTargetSetOutgrewTheLimit() throws Exception {
    Execution scheduled = schedule("alice", IN_ONE_HOUR);
    db.insertWidgetsFrom(31, 45);

    clock.advance(Duration.ofHours(1));
    engine.processDueSchedules();

    Execution failed = engine.getStatus(scheduled.id()).execution();
    assertEquals(ExecutionStatus.FAILED, failed.status());
    assertTrue(failed.errorDetail().contains("above the limit of 40"));
    assertEquals(0, db.deletedWidgets());
  }

  @Test
  void rescheduleMovesActivationAndUndoWindow() {
    Execution scheduled = schedule("alice", IN_ONE_HOUR);
    Instant later = TestClock.START.plus(Duration.ofHours(3));

    Execution moved = engine.reschedule(scheduled.id(), later);

    assertEquals(later, moved.scheduledFor());
    assertEquals(later.plus(Duration.ofDays(7)), moved.undoExpiresAt());
    assertTrue(engine.listUpcoming(Duration.ofHours(2), null).isEmpty());
    assertEquals(List.of(scheduled.id()), ids(engine.listUpcoming(Duration.ofHours(4), "alice")));

    clock.advance(Duration.ofHours(1));
    assertEquals(0, engine.processDueSchedules());
  }

  @Test
  void listsScheduledExecutionsSoonestFirst() {
    Execution late = schedule("alice", IN_ONE_HOUR.plus(Duration.ofHours(5)));
    Execution early = schedule("alice", IN_ONE_HOUR);
    Execution other = schedule("bob", IN_ONE_HOUR.plus(Duration.ofHours(2)));

    assertEquals(List.of(early.id(), late.id()), ids(engine.listScheduled("alice")));
    assertEquals(List.of(early.id(), other.id(), late.id()), ids(engine.listScheduled(null)));
  }

  @Test
  void cancelledScheduleCannotBeRescheduled() throws Exception {
    Execution scheduled = schedule("alice", IN_ONE_HOUR);

    Execution cancelled = engine.cancel(scheduled.id());
    assertEquals(ExecutionStatus.CANCELLED, cancelled.status());
    assertThrows(SchedulingConflictException.class,
        () -> engine.reschedule(scheduled.id(), IN_ONE_HOUR.plus(Duration.ofHours(1))));

    clock.advance(Duration.ofHours(2));
    assertEquals(0, engine.processDueSchedules());
    assertEquals(0, db.deletedWidgets());
  }

  @Test
  void activationMustLieInTheFutureWithinTheHorizon() throws Exception {
    assertThrows(SpecInvalidException.class, () -> schedule("alice", TestClock.START));
    assertThrows(SpecInvalidException.class,
        () -> schedule("alice", TestClock.START.minus(Duration.ofMinutes(1))));
    assertThrows(SpecInvalidException.class,
        () -> schedule("alice", TestClock.START.plus(Duration.ofDays(366))));

    Execution scheduled = schedule("alice", IN_ONE_HOUR);
    assertThrows(SpecInvalidException.class,
        () -> engine.reschedule(scheduled.id(), TestClock.START.minus(Duration.ofHours(1))));
    assertEquals(1, db.count("SELECT COUNT(*) FROM bulk_execution"));
  }

  private Execution schedule(String actor, Instant at) {
    return engine.submit(BulkActionRequest.builder("widget", "delete")
        .actor(actor)
        .scheduledFor(at)
        .build());
  }

  private static List<String> ids(List<Execution> executions) {
    return executions.stream().map(Execution::id).toList();
  }
}
