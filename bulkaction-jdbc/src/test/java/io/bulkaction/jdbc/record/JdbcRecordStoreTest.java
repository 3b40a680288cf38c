package io.bulkaction.jdbc.record;

import io.bulkaction.jdbc.TestDatabase;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.TargetRecord;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRecordStoreTest {
  private static final EntityType WIDGET = new EntityType("widget", "widget", "id", "deleted_at");

  private final JdbcRecordStore store = new JdbcRecordStore();
  private TestDatabase db;
  private Connection conn;

  @BeforeEach
  void setUp() throws Exception {
    db = TestDatabase.create("record_store");
    db.insertWidgets(3);
    conn = db.connection();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  @Test
  void findReturnsLowerCasedColumns() {
    TargetRecord record = store.find(conn, WIDGET, "2").orElseThrow();
    assertEquals("2", record.id());
    assertEquals("widget-2", record.get("name"));
    assertEquals("active", record.get("STATUS"));
    assertTrue(record.has("deleted_at"));
    assertNull(record.get("deleted_at"));
    assertTrue(record.fields().keySet().stream().allMatch(k -> k.equals(k.toLowerCase())));
  }

  @Test
  void findMissingIsEmpty() {
    assertTrue(store.find(conn, WIDGET, "99").isEmpty());
  }

  @Test
  void updateCoercesTextToColumnTypes() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("score", "41");
    values.put("deleted_at", "2024-03-01T10:15:30");
    assertTrue(store.update(conn, WIDGET, "1", values));

    TargetRecord record = store.find(conn, WIDGET, "1").orElseThrow();
    assertEquals(41, ((Number) record.get("score")).intValue());
    assertEquals(LocalDateTime.of(2024, 3, 1, 10, 15, 30), record.get("deleted_at"));
  }

  @Test
  void updateCanClearColumns() {
    store.update(conn, WIDGET, "1", Map.of("deleted_at", LocalDateTime.of(2024, 1, 1, 0, 0)));
    Map<String, Object> values = new HashMap<>();
    values.put("deleted_at", null);
    assertTrue(store.update(conn, WIDGET, "1", values));
    assertNull(store.find(conn, WIDGET, "1").orElseThrow().get("deleted_at"));
  }

  @Test
  void updateOfMissingRowReportsFalse() {
    assertFalse(store.update(conn, WIDGET, "99", Map.of("name", "ghost")));
  }

  @Test
  void unknownColumnIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> store.update(conn, WIDGET, "1", Map.of("colour", "red")));
  }

  @Test
  void deleteThenInsertRestoresTheRow() {
    TargetRecord before = store.find(conn, WIDGET, "3").orElseThrow();
    assertTrue(store.delete(conn, WIDGET, "3"));
    assertFalse(store.delete(conn, WIDGET, "3"));
    assertTrue(store.find(conn, WIDGET, "3").isEmpty());

    store.insert(conn, WIDGET, before.fields());
    assertEquals(before.fields(), store.find(conn, WIDGET, "3").orElseThrow().fields());
  }

  @Test
  void binaryColumnsAcceptTaggedBase64() throws Exception {
    db.execute("CREATE TABLE blob_holder (id BIGINT PRIMARY KEY, payload VARBINARY(16))");
    EntityType holder = EntityType.of("blob_holder", "blob_holder", "id");

    store.insert(conn, holder, Map.of("id", "1", "payload", "base64:AQKg/w=="));

    byte[] payload = (byte[]) store.find(conn, holder, "1").orElseThrow().get("payload");
    assertArrayEquals(new byte[]{0x01, 0x02, (byte) 0xA0, (byte) 0xFF}, payload);
    assertThrows(IllegalArgumentException.class,
        () -> store.update(conn, holder, "1", Map.of("payload", "AQKg/w==")));
  }

  @Test
  void insertWithoutIdIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> store.insert(conn, WIDGET, Map.of("name", "no id")));
  }
}
