package io.bulkaction.jdbc.record;

import io.bulkaction.SpecInvalidException;
import io.bulkaction.jdbc.JdbcTemplate;
import io.bulkaction.model.EntityType;
import io.bulkaction.model.FilterSpec;
import io.bulkaction.model.Predicate;
import io.bulkaction.model.TargetRecord;
import io.bulkaction.spi.TargetResolver;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Translates filters into SQL {@code WHERE} clauses over the entity's table.
 *
 * <p>Ids are streamed with keyset pagination on the id column, so memory stays bounded by the
 * page size however many rows match. Explicit id lists are split into {@code IN} groups of at
 * most {@value #MAX_IN_LIST} values.
 */
public class JdbcTargetResolver implements TargetResolver {
  static final int MAX_IN_LIST = 1000;

  private final JdbcRecordStore records;

  public JdbcTargetResolver() {
    this(new JdbcRecordStore());
  }

  /**
   * Shares the record store's column metadata cache.
   */
  public JdbcTargetResolver(JdbcRecordStore records) {
    this.records = Objects.requireNonNull(records, "records");
  }

  @Override
  public void validate(Connection conn, EntityType entity, FilterSpec filter) {
    filter.validate();
    Map<String, Integer> columns = records.catalog().columns(conn, entity.table());
    if (!columns.containsKey(entity.idColumn().toLowerCase(Locale.ROOT))) {
      throw new SpecInvalidException("Entity " + entity.name() + " has no id column "
          + entity.idColumn());
    }
    for (Predicate predicate : filter.predicates()) {
      if (!columns.containsKey(predicate.column().toLowerCase(Locale.ROOT))) {
        throw new SpecInvalidException("Unknown column " + predicate.column() + " on entity "
            + entity.name());
      }
    }
  }

  @Override
  public void validateValues(Connection conn, EntityType entity, Map<String, Object> values) {
    if (values.isEmpty()) {
      return;
    }
    Map<String, Integer> columns = records.catalog().columns(conn, entity.table());
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      Integer type = columns.get(entry.getKey().toLowerCase(Locale.ROOT));
      if (type == null) {
        throw new SpecInvalidException("Unknown column " + entry.getKey() + " on entity "
            + entity.name());
      }
      try {
        ColumnValues.coerce(entry.getValue(), type);
      } catch (IllegalArgumentException e) {
        throw new SpecInvalidException("Invalid value for column " + entry.getKey() + ": "
            + e.getMessage());
      }
    }
  }

  @Override
  public long count(Connection conn, EntityType entity, FilterSpec filter) {
    Where where = where(conn, entity, filter);
    return JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + entity.table() + where.sql(),
        where.params().toArray());
  }

  @Override
  public Iterator<String> streamIds(Connection conn, EntityType entity, FilterSpec filter,
      int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0");
    }
    return new KeysetIterator(conn, entity, where(conn, entity, filter), pageSize);
  }

  @Override
  public List<TargetRecord> sample(Connection conn, EntityType entity, FilterSpec filter,
      int limit) {
    Where where = where(conn, entity, filter);
    List<Object> params = new ArrayList<>(where.params());
    params.add(limit);
    return JdbcTemplate.query(conn, "SELECT * FROM " + entity.table() + where.sql()
            + " ORDER BY " + entity.idColumn() + " LIMIT ?",
        rs -> JdbcRecordStore.toRecord(rs, entity), params.toArray());
  }

  Where where(Connection conn, EntityType entity, FilterSpec filter) {
    Map<String, Integer> columns = records.catalog().columns(conn, entity.table());
    List<String> clauses = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    switch (filter.kind()) {
      case IDS: {
        Integer idType = columns.get(entity.idColumn().toLowerCase(Locale.ROOT));
        List<String> groups = new ArrayList<>();
        List<String> ids = filter.ids();
        for (int from = 0; from < ids.size(); from += MAX_IN_LIST) {
          List<String> group = ids.subList(from, Math.min(ids.size(), from + MAX_IN_LIST));
          groups.add(entity.idColumn() + " IN (" + marks(group.size()) + ")");
          for (String id : group) {
            try {
              params.add(idType == null ? id : ColumnValues.coerce(id, idType));
            } catch (IllegalArgumentException e) {
              throw new SpecInvalidException("Invalid id for entity " + entity.name() + ": "
                  + e.getMessage());
            }
          }
        }
        clauses.add(groups.size() == 1 ? groups.get(0) : "(" + String.join(" OR ", groups) + ")");
        break;
      }
      case PREDICATES:
        for (Predicate predicate : filter.predicates()) {
          String column = predicate.column().toLowerCase(Locale.ROOT);
          Integer type = columns.get(column);
          if (type == null) {
            throw new SpecInvalidException("Unknown column " + predicate.column() + " on entity "
                + entity.name());
          }
          clauses.add(clause(column, predicate));
          for (Object value : predicate.values()) {
            try {
              params.add(ColumnValues.coerce(value, type));
            } catch (IllegalArgumentException e) {
              throw new SpecInvalidException("Invalid value for column " + predicate.column()
                  + ": " + e.getMessage());
            }
          }
        }
        break;
      default:
        break;
    }
    String sql = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    return new Where(sql, params);
  }

  private static String clause(String column, Predicate predicate) {
    switch (predicate.operator()) {
      case EQ:
        return column + "=?";
      case LT:
        return column + "<?";
      case GT:
        return column + ">?";
      case IN:
        return column + " IN (" + marks(predicate.values().size()) + ")";
      case NOT_IN:
        return column + " NOT IN (" + marks(predicate.values().size()) + ")";
      case BETWEEN:
        return column + " BETWEEN ? AND ?";
      case IS_NULL:
        return column + " IS NULL";
      case IS_NOT_NULL:
        return column + " IS NOT NULL";
      default:
        throw new IllegalStateException("Unhandled operator " + predicate.operator());
    }
  }

  private static String marks(int count) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < count; i++) {
      sb.append(i == 0 ? "?" : ",?");
    }
    return sb.toString();
  }

  record Where(String sql, List<Object> params) {}

  private final class KeysetIterator implements Iterator<String> {
    private final Connection conn;
    private final EntityType entity;
    private final Where where;
    private final int pageSize;
    private Iterator<Object[]> page = List.<Object[]>of().iterator();
    private Object lastKey;
    private boolean exhausted;

    KeysetIterator(Connection conn, EntityType entity, Where where, int pageSize) {
      this.conn = conn;
      this.entity = entity;
      this.where = where;
      this.pageSize = pageSize;
    }

    @Override
    public boolean hasNext() {
      if (page.hasNext()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      List<Object[]> rows = fetch();
      if (rows.size() < pageSize) {
        exhausted = true;
      }
      page = rows.iterator();
      return page.hasNext();
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Object[] row = page.next();
      lastKey = row[0];
      return (String) row[1];
    }

    private List<Object[]> fetch() {
      String id = entity.idColumn();
      List<Object> params = new ArrayList<>(where.params());
      StringBuilder sql = new StringBuilder("SELECT ").append(id).append(" FROM ")
          .append(entity.table()).append(where.sql());
      if (lastKey != null) {
        sql.append(where.sql().isEmpty() ? " WHERE " : " AND ").append(id).append(">?");
        params.add(lastKey);
      }
      sql.append(" ORDER BY ").append(id).append(" LIMIT ?");
      params.add(pageSize);
      return JdbcTemplate.query(conn, sql.toString(),
          rs -> new Object[]{rs.getObject(1), rs.getString(1)}, params.toArray());
    }
  }
}
