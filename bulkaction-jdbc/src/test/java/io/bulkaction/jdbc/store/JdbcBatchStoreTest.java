package io.bulkaction.jdbc.store;

import io.bulkaction.jdbc.TestDatabase;
import io.bulkaction.model.Batch;
import io.bulkaction.model.BatchStatus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcBatchStoreTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final Duration LOCK = Duration.ofMinutes(10);

  private final JdbcBatchStore store = new JdbcBatchStore();
  private Connection conn;

  @BeforeEach
  void setUp() throws Exception {
    conn = TestDatabase.create("batch_store").connection();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  @Test
  void insertAndFindKeepRecordIdsInOrder() {
    store.insert(conn, batch("e1", 1, List.of("10", "2", "33")));

    Batch found = store.find(conn, "e1", 1).orElseThrow();
    assertEquals(List.of("10", "2", "33"), found.recordIds());
    assertEquals(BatchStatus.PENDING, found.status());
    assertEquals(0, found.cursor());
    assertEquals(0, found.attempts());
    assertTrue(store.find(conn, "e1", 2).isEmpty());
  }

  @Test
  void findByExecutionOrdersByNumber() {
    store.insert(conn, batch("e1", 2, List.of("3")));
    store.insert(conn, batch("e1", 1, List.of("1", "2")));
    store.insert(conn, batch("e2", 1, List.of("9")));

    assertEquals(List.of(1, 2),
        store.findByExecution(conn, "e1").stream().map(Batch::batchNumber).toList());
  }

  @Test
  void claimIsExclusiveUntilTheLockExpires() {
    store.insert(conn, batch("e1", 1, List.of("1")));

    assertTrue(store.claim(conn, "e1", 1, "node-a", NOW, NOW.plus(LOCK)));
    assertFalse(store.claim(conn, "e1", 1, "node-b", NOW.plusSeconds(1), NOW.plus(LOCK)));
    assertEquals(BatchStatus.PROCESSING, store.find(conn, "e1", 1).orElseThrow().status());

    Instant afterLock = NOW.plus(LOCK).plusSeconds(1);
    assertTrue(store.claim(conn, "e1", 1, "node-b", afterLock, afterLock.plus(LOCK)));
  }

  @Test
  void recordOutcomeAdvancesCursorAndCounts() {
    store.insert(conn, batch("e1", 1, List.of("1", "2", "3")));
    store.claim(conn, "e1", 1, "node", NOW, NOW.plus(LOCK));

    store.recordOutcome(conn, "e1", 1, 1, 0, null);
    store.recordOutcome(conn, "e1", 1, 0, 1, "record 2 failed");

    Batch b = store.find(conn, "e1", 1).orElseThrow();
    assertEquals(2, b.cursor());
    assertEquals(1, b.processedCount());
    assertEquals(1, b.failedCount());
    assertEquals("record 2 failed", b.errorDetail());

    assertTrue(store.complete(conn, "e1", 1, NOW));
    assertFalse(store.complete(conn, "e1", 1, NOW));
    assertEquals(BatchStatus.COMPLETED, store.find(conn, "e1", 1).orElseThrow().status());
  }

  @Test
  void retryDefersAvailability() {
    store.insert(conn, batch("e1", 1, List.of("1")));
    store.claim(conn, "e1", 1, "node", NOW, NOW.plus(LOCK));

    Instant availableAt = NOW.plusSeconds(30);
    assertTrue(store.retry(conn, "e1", 1, availableAt, "timeout"));

    Batch b = store.find(conn, "e1", 1).orElseThrow();
    assertEquals(BatchStatus.RETRY, b.status());
    assertEquals(1, b.attempts());
    assertEquals(availableAt, b.availableAt());

    assertTrue(store.findAvailable(conn, NOW, 10).isEmpty());
    assertFalse(store.claim(conn, "e1", 1, "node", NOW, NOW.plus(LOCK)));
    assertEquals(1, store.findAvailable(conn, availableAt, 10).size());
    assertTrue(store.claim(conn, "e1", 1, "node", availableAt, availableAt.plus(LOCK)));
  }

  @Test
  void failRemainingCountsRecordsPastTheCursorOnce() {
    store.insert(conn, batch("e1", 1, List.of("1", "2", "3", "4", "5")));
    store.claim(conn, "e1", 1, "node", NOW, NOW.plus(LOCK));
    store.recordOutcome(conn, "e1", 1, 1, 0, null);
    store.recordOutcome(conn, "e1", 1, 1, 0, null);

    assertEquals(3, store.failRemaining(conn, "e1", 1, "gave up", NOW));
    assertEquals(-1, store.failRemaining(conn, "e1", 1, "gave up", NOW));

    Batch b = store.find(conn, "e1", 1).orElseThrow();
    assertEquals(BatchStatus.FAILED, b.status());
    assertEquals(2, b.processedCount());
    assertEquals(3, b.failedCount());
    assertEquals(5, b.cursor());
    assertEquals("gave up", b.errorDetail());
  }

  @Test
  void cancelUnclaimedLeavesRunningBatchesAlone() {
    store.insert(conn, batch("e1", 1, List.of("1")));
    store.insert(conn, batch("e1", 2, List.of("2")));
    store.insert(conn, batch("e1", 3, List.of("3")));
    store.claim(conn, "e1", 1, "node", NOW, NOW.plus(LOCK));
    store.claim(conn, "e1", 3, "node", NOW, NOW.plus(LOCK));
    store.retry(conn, "e1", 3, NOW.plusSeconds(5), "flaky");

    assertEquals(2, store.cancelUnclaimed(conn, "e1", NOW));

    Map<BatchStatus, Integer> counts = store.countByStatus(conn, "e1");
    assertEquals(1, counts.get(BatchStatus.PROCESSING));
    assertEquals(2, counts.get(BatchStatus.CANCELLED));
    assertNull(counts.get(BatchStatus.PENDING));
    assertEquals(1, store.countOutstanding(conn, "e1"));

    assertTrue(store.cancel(conn, "e1", 1, NOW));
    assertEquals(0, store.countOutstanding(conn, "e1"));
    assertFalse(store.cancel(conn, "e1", 1, NOW));
  }

  @Test
  void findAvailableHonoursLimitAndAge() {
    for (int i = 1; i <= 5; i++) {
      store.insert(conn, batch("e1", i, List.of(String.valueOf(i))));
    }
    List<Batch> available = store.findAvailable(conn, NOW, 3);
    assertEquals(List.of(1, 2, 3), available.stream().map(Batch::batchNumber).toList());
  }

  @Test
  void deleteByExecutionRemovesAllRows() {
    store.insert(conn, batch("e1", 1, List.of("1")));
    store.insert(conn, batch("e1", 2, List.of("2")));
    store.insert(conn, batch("e2", 1, List.of("3")));

    assertEquals(2, store.deleteByExecution(conn, "e1"));
    assertTrue(store.findByExecution(conn, "e1").isEmpty());
    assertEquals(1, store.findByExecution(conn, "e2").size());
  }

  private static Batch batch(String executionId, int number, List<String> ids) {
    return new Batch(executionId, number, ids, BatchStatus.PENDING, 0, 0, 0, 0, null, NOW, NOW,
        null);
  }
}
