package io.bulkaction.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a target entity as seen by action handlers: its id plus its current column values.
 * Column names are lower-cased.
 */
public record TargetRecord(String id, Map<String, Object> fields) {
  public TargetRecord {
    Objects.requireNonNull(id, "id");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Object get(String column) {
    return fields.get(column.toLowerCase(java.util.Locale.ROOT));
  }

  public boolean has(String column) {
    return fields.containsKey(column.toLowerCase(java.util.Locale.ROOT));
  }
}
