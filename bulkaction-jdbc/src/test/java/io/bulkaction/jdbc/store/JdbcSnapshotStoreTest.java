package io.bulkaction.jdbc.store;

import io.bulkaction.jdbc.TestDatabase;
import io.bulkaction.model.SnapshotRecord;
import io.bulkaction.model.UndoOperation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSnapshotStoreTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private final JdbcSnapshotStore store = new JdbcSnapshotStore();
  private TestDatabase db;
  private Connection conn;

  @BeforeEach
  void setUp() throws Exception {
    db = TestDatabase.create("snapshot_store");
    conn = db.connection();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  @Test
  void insertsOnePendingSnapshotPerRecord() {
    assertTrue(store.insert(conn, snapshot("e1", "1", Map.of("name", "alpha"))));
    assertFalse(store.insert(conn, snapshot("e1", "1", Map.of("name", "changed"))));
    assertTrue(store.insert(conn, snapshot("e2", "1", Map.of("name", "alpha"))));

    List<SnapshotRecord> pending = store.findPending(conn, "e1", 0, 10);
    assertEquals(1, pending.size());
    SnapshotRecord s = pending.get(0);
    assertEquals("1", s.recordId());
    assertEquals("widget", s.entityType());
    assertEquals("alpha", s.fields().get("name"));
    assertEquals(UndoOperation.REVERT_FIELDS, s.undoOperation());
    assertFalse(s.undone());
    assertEquals(NOW, s.createdAt());
  }

  @Test
  void nullFieldValuesSurvive() {
    Map<String, Object> fields = new HashMap<>();
    fields.put("deleted_at", null);
    store.insert(conn, snapshot("e1", "7", fields));

    SnapshotRecord s = store.findPending(conn, "e1", 0, 10).get(0);
    assertTrue(s.fields().containsKey("deleted_at"));
    assertNull(s.fields().get("deleted_at"));
  }

  @Test
  void largePayloadsAreStoredCompressed() throws Exception {
    String big = "lorem ipsum ".repeat(500);
    store.insert(conn, snapshot("e1", "1", Map.of("notes", big)));
    store.insert(conn, snapshot("e1", "2", Map.of("notes", "short")));

    assertEquals(1, db.count("SELECT COUNT(*) FROM bulk_snapshot WHERE compressed = TRUE"));
    List<SnapshotRecord> pending = store.findPending(conn, "e1", 0, 10);
    assertEquals(big, pending.get(0).fields().get("notes"));
    assertEquals("short", pending.get(1).fields().get("notes"));
  }

  @Test
  void pagesWithKeysetOnId() {
    for (int i = 1; i <= 5; i++) {
      store.insert(conn, snapshot("e1", String.valueOf(i), Map.of("n", i)));
    }
    List<SnapshotRecord> first = store.findPending(conn, "e1", 0, 2);
    List<SnapshotRecord> second = store.findPending(conn, "e1", first.get(1).id(), 2);
    List<SnapshotRecord> third = store.findPending(conn, "e1", second.get(1).id(), 2);

    assertEquals(List.of("1", "2"), first.stream().map(SnapshotRecord::recordId).toList());
    assertEquals(List.of("3", "4"), second.stream().map(SnapshotRecord::recordId).toList());
    assertEquals(List.of("5"), third.stream().map(SnapshotRecord::recordId).toList());
  }

  @Test
  void markUndoneIsOneShot() {
    store.insert(conn, snapshot("e1", "1", Map.of("name", "alpha")));
    store.insert(conn, snapshot("e1", "2", Map.of("name", "beta")));
    long id = store.findPending(conn, "e1", 0, 10).get(0).id();

    assertTrue(store.markUndone(conn, id, NOW, "alice"));
    assertFalse(store.markUndone(conn, id, NOW, "bob"));

    assertEquals(1, store.countPending(conn, "e1"));
    assertEquals("2", store.findPending(conn, "e1", 0, 10).get(0).recordId());
    assertTrue(store.insert(conn, snapshot("e1", "1", Map.of("name", "again"))));
  }

  @Test
  void deletePendingRespectsLimit() {
    for (int i = 1; i <= 5; i++) {
      store.insert(conn, snapshot("e1", String.valueOf(i), Map.of("n", i)));
    }
    assertEquals(3, store.deletePending(conn, "e1", 3));
    assertEquals(2, store.countPending(conn, "e1"));
    assertEquals(2, store.deletePending(conn, "e1", 3));
    assertEquals(0, store.countPending(conn, "e1"));
  }

  @Test
  void deleteByExecutionRemovesUndoneRowsToo() {
    store.insert(conn, snapshot("e1", "1", Map.of("n", 1)));
    store.insert(conn, snapshot("e1", "2", Map.of("n", 2)));
    long id = store.findPending(conn, "e1", 0, 10).get(0).id();
    store.markUndone(conn, id, NOW, "alice");

    assertEquals(2, store.deleteByExecution(conn, "e1"));
  }

  private static SnapshotRecord snapshot(String executionId, String recordId,
      Map<String, Object> fields) {
    return new SnapshotRecord(0L, executionId, recordId, "widget", fields,
        UndoOperation.REVERT_FIELDS, false, null, null, NOW);
  }
}
