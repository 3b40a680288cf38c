package io.bulkaction.util;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Codec for the JSON columns of the execution ledger: filter specs, action parameters,
 * batch id lists and snapshot field maps.
 *
 * <p>Supported value types are {@code String}, {@code Number}, {@code Boolean}, {@code null},
 * {@code byte[]}, {@code Map<String, ?>} and {@code Collection<?>}. Any other value is written as
 * its {@code toString()} form. Integral numbers parse back as {@code Long} (or
 * {@code BigDecimal} past 64 bits), others as {@code BigDecimal} so no digit is lost. Byte
 * arrays are written as strings tagged with {@link #BINARY_PREFIX}; they parse back as those
 * strings and are decoded by whoever knows the target is binary.
 *
 * <p>Applications that already ship Jackson or Gson can implement this interface
 * on top of their library.
 *
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

  /** Marks a string value holding Base64-encoded binary data. */
  String BINARY_PREFIX = "base64:";

  static String encodeBinary(byte[] bytes) {
    return BINARY_PREFIX + Base64.getEncoder().encodeToString(bytes);
  }

  /**
   * Returns the bytes of a string written by {@link #encodeBinary}, or {@code null} if the
   * string carries no binary tag.
   *
   * @throws IllegalArgumentException if the tagged payload is not valid Base64
   */
  static byte[] decodeBinary(String text) {
    if (text == null || !text.startsWith(BINARY_PREFIX)) {
      return null;
    }
    return Base64.getDecoder().decode(text.substring(BINARY_PREFIX.length()));
  }

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a value tree as JSON.
   *
   * @param value map, collection or scalar
   * @return JSON text, never {@code null}
   */
  String toJson(Object value);

  /**
   * Parses a JSON document into maps, lists and scalars.
   *
   * @param json JSON text
   * @return parsed value; {@code null} for a {@code null} or blank input
   * @throws IllegalArgumentException if the input is not valid JSON
   */
  Object parse(String json);

  /**
   * Parses a JSON object. Returns an empty map for {@code null} or blank input.
   *
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  @SuppressWarnings("unchecked")
  default Map<String, Object> parseObject(String json) {
    Object value = parse(json);
    if (value == null) {
      return new java.util.LinkedHashMap<>();
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    return (Map<String, Object>) value;
  }

  /**
   * Parses a JSON array. Returns an empty list for {@code null} or blank input.
   *
   * @throws IllegalArgumentException if the input is not a JSON array
   */
  @SuppressWarnings("unchecked")
  default List<Object> parseArray(String json) {
    Object value = parse(json);
    if (value == null) {
      return new java.util.ArrayList<>();
    }
    if (!(value instanceof List)) {
      throw new IllegalArgumentException("Expected JSON array");
    }
    return (List<Object>) value;
  }
}
