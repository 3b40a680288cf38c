package io.bulkaction.jdbc.store;

import io.bulkaction.jdbc.JdbcTemplate;
import io.bulkaction.jdbc.TableNames;
import io.bulkaction.model.Execution;
import io.bulkaction.model.ExecutionStatus;
import io.bulkaction.model.FilterSpec;
import io.bulkaction.spi.ExecutionStore;
import io.bulkaction.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Execution ledger on a plain SQL table.
 *
 * <p>Every state change is a single conditional {@code UPDATE}: the row changes only when its
 * current status matches the expected one, and counters are incremented in SQL so concurrent
 * batches never lose an update.
 */
public class JdbcExecutionStore implements ExecutionStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS = "id, entity_type, filter_json, action_name, "
      + "parameters_json, batch_size, total_records, processed_records, failed_records, status, "
      + "undo_enabled, undo_expires_at, undone_at, scheduled_for, actor, error_detail, "
      + "created_at, started_at, completed_at, updated_at, dry_run";

  private static final String ACTIVE_STATUS_IN = "(" + ExecutionStatus.SCHEDULED.code() + ","
      + ExecutionStatus.PENDING.code() + "," + ExecutionStatus.PROCESSING.code() + ")";
  private static final String TERMINAL_STATUS_IN = "(" + ExecutionStatus.COMPLETED.code() + ","
      + ExecutionStatus.FAILED.code() + "," + ExecutionStatus.CANCELLED.code() + ")";

  private final String table;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Execution> rowMapper;

  public JdbcExecutionStore() {
    this(TableNames.DEFAULT_EXECUTIONS, JsonCodec.getDefault());
  }

  public JdbcExecutionStore(String table, JsonCodec jsonCodec) {
    this.table = TableNames.validate(table);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = this::mapRow;
  }

  protected String table() {
    return table;
  }

  @Override
  public void insert(Connection conn, Execution e) {
    String sql = "INSERT INTO " + table + " (" + COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        e.id(), e.entityType(), jsonCodec.toJson(e.filter().toMap()), e.actionName(),
        jsonCodec.toJson(e.parameters()), e.batchSize(), e.totalRecords(),
        e.processedRecords(), e.failedRecords(), e.status().code(), e.undoEnabled(),
        e.undoExpiresAt(), e.undoneAt(), e.scheduledFor(), e.actor(),
        truncateError(e.errorDetail()), e.createdAt(), e.startedAt(), e.completedAt(),
        e.updatedAt(), e.dryRun());
  }

  @Override
  public Optional<Execution> find(Connection conn, String executionId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + table + " WHERE id=?", rowMapper, executionId);
  }

  @Override
  public boolean transition(Connection conn, String executionId, ExecutionStatus expected,
      ExecutionStatus target, String errorDetail, Instant now) {
    if (!expected.canTransitionTo(target)) {
      throw new IllegalArgumentException("Illegal transition " + expected + " -> " + target);
    }
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("UPDATE ").append(table)
        .append(" SET status=?, updated_at=?");
    params.add(target.code());
    params.add(now);
    if (errorDetail != null) {
      sql.append(", error_detail=?");
      params.add(truncateError(errorDetail));
    }
    if (target == ExecutionStatus.PROCESSING) {
      sql.append(", started_at=COALESCE(started_at, ?)");
      params.add(now);
    }
    if (target.isTerminal()) {
      sql.append(", completed_at=?");
      params.add(now);
    }
    sql.append(" WHERE id=? AND status=?");
    params.add(executionId);
    params.add(expected.code());
    return JdbcTemplate.update(conn, sql.toString(), params.toArray()) == 1;
  }

  @Override
  public boolean incrementCounters(Connection conn, String executionId, long processedDelta,
      long failedDelta, Instant now) {
    if (processedDelta < 0 || failedDelta < 0) {
      throw new IllegalArgumentException("Counter deltas must be >= 0");
    }
    String sql = "UPDATE " + table
        + " SET processed_records=processed_records+?, failed_records=failed_records+?,"
        + " updated_at=?"
        + " WHERE id=? AND status=" + ExecutionStatus.PROCESSING.code()
        + " AND processed_records+failed_records+?<=total_records";
    return JdbcTemplate.update(conn, sql, processedDelta, failedDelta, now, executionId,
        processedDelta + failedDelta) == 1;
  }

  @Override
  public boolean updateTotal(Connection conn, String executionId, long totalRecords,
      ExecutionStatus expected, Instant now) {
    String sql = "UPDATE " + table + " SET total_records=?, updated_at=?"
        + " WHERE id=? AND status=? AND processed_records+failed_records<=?";
    return JdbcTemplate.update(conn, sql, totalRecords, now, executionId, expected.code(),
        totalRecords) == 1;
  }

  @Override
  public int countActiveByActor(Connection conn, String actor) {
    String sql = "SELECT COUNT(*) FROM " + table + " WHERE actor=? AND status IN "
        + ACTIVE_STATUS_IN;
    return (int) JdbcTemplate.queryLong(conn, sql, actor);
  }

  @Override
  public List<Execution> findDueScheduled(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + table
        + " WHERE status=" + ExecutionStatus.SCHEDULED.code() + " AND scheduled_for<=?"
        + " ORDER BY scheduled_for, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, now, limit);
  }

  @Override
  public List<Execution> findScheduled(Connection conn, String actor, Instant before) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ")
        .append(table).append(" WHERE status=").append(ExecutionStatus.SCHEDULED.code());
    if (actor != null) {
      sql.append(" AND actor=?");
      params.add(actor);
    }
    if (before != null) {
      sql.append(" AND scheduled_for<=?");
      params.add(before);
    }
    sql.append(" ORDER BY scheduled_for, id");
    return JdbcTemplate.query(conn, sql.toString(), rowMapper, params.toArray());
  }

  @Override
  public boolean reschedule(Connection conn, String executionId, Instant scheduledFor,
      Instant undoExpiresAt, Instant now) {
    String sql = "UPDATE " + table + " SET scheduled_for=?, undo_expires_at=?, updated_at=?"
        + " WHERE id=? AND status=" + ExecutionStatus.SCHEDULED.code();
    return JdbcTemplate.update(conn, sql, scheduledFor, undoExpiresAt, now, executionId) == 1;
  }

  @Override
  public boolean claimUndo(Connection conn, String executionId, Instant now) {
    String sql = "UPDATE " + table + " SET undo_enabled=FALSE, undone_at=?, updated_at=?"
        + " WHERE id=? AND undo_enabled=TRUE AND undone_at IS NULL"
        + " AND status=" + ExecutionStatus.COMPLETED.code() + " AND undo_expires_at>?";
    return JdbcTemplate.update(conn, sql, now, now, executionId, now) == 1;
  }

  @Override
  public boolean disableUndo(Connection conn, String executionId, Instant now) {
    String sql = "UPDATE " + table + " SET undo_enabled=FALSE, updated_at=?"
        + " WHERE id=? AND undo_enabled=TRUE";
    return JdbcTemplate.update(conn, sql, now, executionId) == 1;
  }

  @Override
  public List<String> findExpiredUndo(Connection conn, Instant now, int limit) {
    String sql = "SELECT id FROM " + table
        + " WHERE undo_enabled=TRUE AND undo_expires_at<=? AND status IN " + TERMINAL_STATUS_IN
        + " ORDER BY undo_expires_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString(1), now, limit);
  }

  @Override
  public List<String> findPurgeable(Connection conn, Instant cutoff, int limit) {
    String sql = "SELECT id FROM " + table
        + " WHERE status IN " + TERMINAL_STATUS_IN + " AND completed_at<?"
        + " AND undo_enabled=FALSE ORDER BY completed_at, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString(1), cutoff, limit);
  }

  @Override
  public int delete(Connection conn, String executionId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE id=?", executionId);
  }

  private Execution mapRow(ResultSet rs) throws SQLException {
    return new Execution(
        rs.getString("id"),
        rs.getString("entity_type"),
        FilterSpec.fromMap(jsonCodec.parseObject(rs.getString("filter_json"))),
        rs.getString("action_name"),
        jsonCodec.parseObject(rs.getString("parameters_json")),
        rs.getInt("batch_size"),
        rs.getLong("total_records"),
        rs.getLong("processed_records"),
        rs.getLong("failed_records"),
        ExecutionStatus.fromCode(rs.getInt("status")),
        rs.getBoolean("undo_enabled"),
        JdbcTemplate.instant(rs, "undo_expires_at"),
        JdbcTemplate.instant(rs, "undone_at"),
        JdbcTemplate.instant(rs, "scheduled_for"),
        rs.getString("actor"),
        rs.getString("error_detail"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "started_at"),
        JdbcTemplate.instant(rs, "completed_at"),
        JdbcTemplate.instant(rs, "updated_at"),
        rs.getBoolean("dry_run"));
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
