package io.bulkaction.support;

import io.bulkaction.model.EntityType;
import io.bulkaction.model.TargetRecord;
import io.bulkaction.spi.RecordStore;

import java.sql.Connection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rows of every entity type kept in maps, keyed by table then id. Column names are
 * lower-cased like the JDBC record store does.
 */
public class InMemoryRecordStore implements RecordStore {
  private final Map<String, Map<String, Map<String, Object>>> tables = new ConcurrentHashMap<>();

  public InMemoryRecordStore put(EntityType entity, String id, Map<String, Object> columns) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(entity.idColumn().toLowerCase(Locale.ROOT), id);
    columns.forEach((k, v) -> row.put(k.toLowerCase(Locale.ROOT), v));
    table(entity).put(id, row);
    return this;
  }

  public Map<String, Object> row(EntityType entity, String id) {
    return table(entity).get(id);
  }

  @Override
  public Optional<TargetRecord> find(Connection conn, EntityType entity, String id) {
    Map<String, Object> row = table(entity).get(id);
    return row == null ? Optional.empty() : Optional.of(new TargetRecord(id, row));
  }

  @Override
  public boolean update(Connection conn, EntityType entity, String id,
      Map<String, Object> values) {
    Map<String, Object> row = table(entity).get(id);
    if (row == null) {
      return false;
    }
    values.forEach((k, v) -> row.put(k.toLowerCase(Locale.ROOT), v));
    return true;
  }

  @Override
  public boolean delete(Connection conn, EntityType entity, String id) {
    return table(entity).remove(id) != null;
  }

  @Override
  public void insert(Connection conn, EntityType entity, Map<String, Object> values) {
    Map<String, Object> row = new HashMap<>();
    values.forEach((k, v) -> row.put(k.toLowerCase(Locale.ROOT), v));
    String id = String.valueOf(row.get(entity.idColumn().toLowerCase(Locale.ROOT)));
    if (table(entity).putIfAbsent(id, row) != null) {
      throw new IllegalStateException("Duplicate id " + id);
    }
  }

  private Map<String, Map<String, Object>> table(EntityType entity) {
    return tables.computeIfAbsent(entity.table(), t -> new ConcurrentHashMap<>());
  }
}
