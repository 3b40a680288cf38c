package io.bulkaction.undo;

import io.bulkaction.util.JsonCodec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Serializes snapshot field maps. Payloads whose JSON exceeds the threshold are stored
 * GZIP-compressed and Base64-encoded.
 */
public final class SnapshotCodec {

  /** A serialized field map and whether it is compressed. */
  public record Encoded(String payload, boolean compressed) {}

  private final JsonCodec json;
  private final boolean compressionEnabled;
  private final int compressionThreshold;

  public SnapshotCodec(JsonCodec json, boolean compressionEnabled, int compressionThreshold) {
    this.json = Objects.requireNonNull(json, "json");
    if (compressionThreshold < 0) {
      throw new IllegalArgumentException("compressionThreshold must be >= 0");
    }
    this.compressionEnabled = compressionEnabled;
    this.compressionThreshold = compressionThreshold;
  }

  public static SnapshotCodec defaults() {
    return new SnapshotCodec(JsonCodec.getDefault(), true, 1024);
  }

  public Encoded encode(Map<String, Object> fields) {
    String text = json.toJson(fields);
    if (!compressionEnabled || text.length() <= compressionThreshold) {
      return new Encoded(text, false);
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
      gzip.write(text.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to compress snapshot", e);
    }
    return new Encoded(Base64.getEncoder().encodeToString(bytes.toByteArray()), true);
  }

  public Map<String, Object> decode(String payload, boolean compressed) {
    if (!compressed) {
      return json.parseObject(payload);
    }
    byte[] raw = Base64.getDecoder().decode(payload);
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(raw))) {
      return json.parseObject(new String(gzip.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decompress snapshot", e);
    }
  }
}
