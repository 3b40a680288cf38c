package io.bulkaction.jdbc.record;

import io.bulkaction.jdbc.JdbcTemplate;
import io.bulkaction.jdbc.StoreException;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.TargetRecord;
import io.bulkaction.spi.RecordStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes target rows with plain SQL. Values are coerced to each column's SQL type
 * before binding.
 */
public class JdbcRecordStore implements RecordStore {
  private final ColumnCatalog catalog;

  public JdbcRecordStore() {
    this(new ColumnCatalog());
  }

  public JdbcRecordStore(ColumnCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  @Override
  public Optional<TargetRecord> find(Connection conn, EntityType entity, String id) {
    String sql = "SELECT * FROM " + entity.table() + " WHERE " + entity.idColumn() + "=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> toRecord(rs, entity), idValue(conn, entity, id));
  }

  @Override
  public boolean update(Connection conn, EntityType entity, String id, Map<String, Object> values) {
    if (values.isEmpty()) {
      return find(conn, entity, id).isPresent();
    }
    Map<String, Integer> columns = catalog.columns(conn, entity.table());
    StringBuilder sql = new StringBuilder("UPDATE ").append(entity.table()).append(" SET ");
    List<Object> params = new ArrayList<>();
    String separator = "";
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      String column = requireColumn(columns, entity, entry.getKey());
      sql.append(separator).append(column).append("=?");
      params.add(ColumnValues.coerce(entry.getValue(), columns.get(column)));
      separator = ", ";
    }
    sql.append(" WHERE ").append(entity.idColumn()).append("=?");
    params.add(idValue(conn, entity, id));
    return JdbcTemplate.update(conn, sql.toString(), params.toArray()) > 0;
  }

  @Override
  public boolean delete(Connection conn, EntityType entity, String id) {
    String sql = "DELETE FROM " + entity.table() + " WHERE " + entity.idColumn() + "=?";
    return JdbcTemplate.update(conn, sql, idValue(conn, entity, id)) > 0;
  }

  @Override
  public void insert(Connection conn, EntityType entity, Map<String, Object> values) {
    Map<String, Integer> columns = catalog.columns(conn, entity.table());
    String idColumn = entity.idColumn().toLowerCase(Locale.ROOT);
    boolean hasId = values.keySet().stream()
        .anyMatch(k -> k.toLowerCase(Locale.ROOT).equals(idColumn));
    if (!hasId) {
      throw new IllegalArgumentException("Insert into " + entity.table() + " needs column "
          + entity.idColumn());
    }
    StringBuilder names = new StringBuilder();
    StringBuilder marks = new StringBuilder();
    List<Object> params = new ArrayList<>();
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      String column = requireColumn(columns, entity, entry.getKey());
      if (!params.isEmpty()) {
        names.append(", ");
        marks.append(", ");
      }
      names.append(column);
      marks.append('?');
      params.add(ColumnValues.coerce(entry.getValue(), columns.get(column)));
    }
    JdbcTemplate.update(conn, "INSERT INTO " + entity.table() + " (" + names + ") VALUES ("
        + marks + ")", params.toArray());
  }

  /** Binds an id string with the id column's SQL type. */
  Object idValue(Connection conn, EntityType entity, String id) {
    Integer type = catalog.columns(conn, entity.table())
        .get(entity.idColumn().toLowerCase(Locale.ROOT));
    return type == null ? id : ColumnValues.coerce(id, type);
  }

  ColumnCatalog catalog() {
    return catalog;
  }

  static TargetRecord toRecord(ResultSet rs, EntityType entity) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 1; i <= meta.getColumnCount(); i++) {
      fields.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT),
          ColumnValues.normalize(rs.getObject(i)));
    }
    Object id = fields.get(entity.idColumn().toLowerCase(Locale.ROOT));
    if (id == null) {
      throw new StoreException("Row of " + entity.table() + " has no " + entity.idColumn(),
          null);
    }
    return new TargetRecord(String.valueOf(id), fields);
  }

  private static String requireColumn(Map<String, Integer> columns, EntityType entity,
      String name) {
    String column = name.toLowerCase(Locale.ROOT);
    if (!EntityType.isIdentifier(column) || !columns.containsKey(column)) {
      throw new IllegalArgumentException("Unknown column " + name + " on " + entity.table());
    }
    return column;
  }
}
