package io.bulkaction.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in store implementations.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new StoreException("Failed to execute update: " + firstLine(sql), e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to execute query: " + firstLine(sql), e);
    }
  }

  /** Execute SELECT expected to return at most one row. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper,
      Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Execute a single-column numeric SELECT such as {@code COUNT(*)}. */
  public static long queryLong(Connection conn, String sql, Object... params) {
    return queryOne(conn, sql, rs -> rs.getLong(1), params).orElse(0L);
  }

  /** Binds one value, converting {@link Instant} to {@link Timestamp}. */
  public static void bind(PreparedStatement ps, int index, Object param) throws SQLException {
    if (param == null) {
      ps.setObject(index, null);
    } else if (param instanceof String s) {
      ps.setString(index, s);
    } else if (param instanceof Integer n) {
      ps.setInt(index, n);
    } else if (param instanceof Long n) {
      ps.setLong(index, n);
    } else if (param instanceof Boolean b) {
      ps.setBoolean(index, b);
    } else if (param instanceof Instant instant) {
      ps.setTimestamp(index, Timestamp.from(instant));
    } else if (param instanceof Timestamp ts) {
      ps.setTimestamp(index, ts);
    } else {
      ps.setObject(index, param);
    }
  }

  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      bind(ps, i + 1, params[i]);
    }
  }

  private static String firstLine(String sql) {
    return sql.length() <= 80 ? sql : sql.substring(0, 77) + "...";
  }

  private JdbcTemplate() {}
}
