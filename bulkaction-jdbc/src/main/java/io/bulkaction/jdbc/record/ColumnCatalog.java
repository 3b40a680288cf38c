package io.bulkaction.jdbc.record;

import io.bulkaction.jdbc.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Column names and SQL types of target tables, read once from result set metadata and cached.
 * Names are lower-cased.
 */
public final class ColumnCatalog {
  private final Map<String, Map<String, Integer>> tables = new ConcurrentHashMap<>();

  public Map<String, Integer> columns(Connection conn, String table) {
    String key = table.toLowerCase(Locale.ROOT);
    Map<String, Integer> cached = tables.get(key);
    if (cached != null) {
      return cached;
    }
    Map<String, Integer> loaded = load(conn, table);
    tables.putIfAbsent(key, loaded);
    return loaded;
  }

  /** Forgets cached metadata, e.g. after a schema migration. */
  public void invalidate() {
    tables.clear();
  }

  private static Map<String, Integer> load(Connection conn, String table) {
    try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM " + table + " WHERE 1=0");
        ResultSet rs = ps.executeQuery()) {
      ResultSetMetaData meta = rs.getMetaData();
      Map<String, Integer> columns = new LinkedHashMap<>();
      for (int i = 1; i <= meta.getColumnCount(); i++) {
        columns.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), meta.getColumnType(i));
      }
      return Collections.unmodifiableMap(columns);
    } catch (SQLException e) {
      throw new StoreException("Failed to read columns of table " + table, e);
    }
  }
}
