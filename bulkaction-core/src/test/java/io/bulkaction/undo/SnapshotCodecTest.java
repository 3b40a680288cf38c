package io.bulkaction.undo;

import io.bulkaction.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCodecTest {

  @Test
  void smallSnapshotsStayPlainJson() {
    SnapshotCodec codec = SnapshotCodec.defaults();

    SnapshotCodec.Encoded encoded = codec.encode(Map.of("deleted_at", "2024-03-01T10:00:00"));

    assertFalse(encoded.compressed());
    assertEquals("{\"deleted_at\":\"2024-03-01T10:00:00\"}", encoded.payload());
  }

  @Test
  void largeSnapshotsAreCompressed() {
    SnapshotCodec codec = new SnapshotCodec(JsonCodec.getDefault(), true, 64);
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("bio", "x".repeat(2000));
    fields.put("age", 42L);

    SnapshotCodec.Encoded encoded = codec.encode(fields);

    assertTrue(encoded.compressed());
    assertTrue(encoded.payload().length() < 2000);
    assertEquals(fields, codec.decode(encoded.payload(), true));
  }

  @Test
  void compressionCanBeDisabled() {
    SnapshotCodec codec = new SnapshotCodec(JsonCodec.getDefault(), false, 0);

    assertFalse(codec.encode(Map.of("bio", "x".repeat(5000))).compressed());
  }

  @Test
  void nullValuesSurvive() {
    SnapshotCodec codec = SnapshotCodec.defaults();
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("deleted_at", null);

    Map<String, Object> decoded = codec.decode(codec.encode(fields).payload(), false);

    assertTrue(decoded.containsKey("deleted_at"));
    assertNull(decoded.get("deleted_at"));
  }

  @Test
  void rejectsNegativeThreshold() {
    assertThrows(IllegalArgumentException.class,
        () -> new SnapshotCodec(JsonCodec.getDefault(), true, -1));
  }
}
