package io.bulkaction.jdbc.store;

import io.bulkaction.jdbc.JdbcTemplate;
import io.bulkaction.jdbc.TableNames;
import io.bulkaction.model.Batch;
import io.bulkaction.model.BatchStatus;
import io.bulkaction.spi.BatchStore;
import io.bulkaction.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Batch rows keyed by {@code (execution_id, batch_number)}. The id list of a batch is stored
 * as a JSON array.
 *
 * <p>A batch is claimable when it is {@code PENDING} or {@code RETRY} and its
 * {@code available_at} has passed, or when it is {@code PROCESSING} under an expired lock.
 */
public class JdbcBatchStore implements BatchStore {

  protected static final String CLAIMABLE_STATUS_IN =
      "(" + BatchStatus.PENDING.code() + "," + BatchStatus.RETRY.code() + ")";
  protected static final String OPEN_STATUS_IN = "(" + BatchStatus.PENDING.code() + ","
      + BatchStatus.PROCESSING.code() + "," + BatchStatus.RETRY.code() + ")";

  private static final String COLUMNS = "execution_id, batch_number, record_ids, record_count, "
      + "status, processed_count, failed_count, cursor_pos, attempts, last_error, available_at, "
      + "created_at, completed_at";

  private static final String AVAILABLE = "((status IN " + CLAIMABLE_STATUS_IN
      + " AND available_at<=?) OR (status=" + BatchStatus.PROCESSING.code()
      + " AND locked_until<?))";

  private final String table;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Batch> rowMapper;

  public JdbcBatchStore() {
    this(TableNames.DEFAULT_BATCHES, JsonCodec.getDefault());
  }

  public JdbcBatchStore(String table, JsonCodec jsonCodec) {
    this.table = TableNames.validate(table);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = this::mapRow;
  }

  protected String table() {
    return table;
  }

  @Override
  public void insert(Connection conn, Batch b) {
    String sql = "INSERT INTO " + table + " (" + COLUMNS + ", locked_by, locked_until) "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        b.executionId(), b.batchNumber(), jsonCodec.toJson(b.recordIds()), b.size(),
        b.status().code(), b.processedCount(), b.failedCount(), b.cursor(), b.attempts(),
        JdbcExecutionStore.truncateError(b.errorDetail()), b.availableAt(), b.createdAt(),
        b.completedAt());
  }

  @Override
  public Optional<Batch> find(Connection conn, String executionId, int batchNumber) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM " + table
        + " WHERE execution_id=? AND batch_number=?", rowMapper, executionId, batchNumber);
  }

  @Override
  public List<Batch> findByExecution(Connection conn, String executionId) {
    return JdbcTemplate.query(conn, "SELECT " + COLUMNS + " FROM " + table
        + " WHERE execution_id=? ORDER BY batch_number", rowMapper, executionId);
  }

  @Override
  public boolean claim(Connection conn, String executionId, int batchNumber, String owner,
      Instant now, Instant lockedUntil) {
    String sql = "UPDATE " + table + " SET status=" + BatchStatus.PROCESSING.code()
        + ", locked_by=?, locked_until=?"
        + " WHERE execution_id=? AND batch_number=? AND " + AVAILABLE;
    return JdbcTemplate.update(conn, sql, owner, lockedUntil, executionId, batchNumber,
        now, now) == 1;
  }

  @Override
  public void recordOutcome(Connection conn, String executionId, int batchNumber,
      int processedDelta, int failedDelta, String error) {
    String sql = "UPDATE " + table
        + " SET processed_count=processed_count+?, failed_count=failed_count+?,"
        + " cursor_pos=cursor_pos+1, last_error=COALESCE(?, last_error)"
        + " WHERE execution_id=? AND batch_number=?";
    JdbcTemplate.update(conn, sql, processedDelta, failedDelta,
        JdbcExecutionStore.truncateError(error), executionId, batchNumber);
  }

  @Override
  public boolean complete(Connection conn, String executionId, int batchNumber, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + BatchStatus.COMPLETED.code()
        + ", completed_at=?, locked_by=NULL, locked_until=NULL"
        + " WHERE execution_id=? AND batch_number=? AND status=" + BatchStatus.PROCESSING.code();
    return JdbcTemplate.update(conn, sql, now, executionId, batchNumber) == 1;
  }

  @Override
  public boolean retry(Connection conn, String executionId, int batchNumber, Instant availableAt,
      String error) {
    String sql = "UPDATE " + table + " SET status=" + BatchStatus.RETRY.code()
        + ", attempts=attempts+1, available_at=?, last_error=?, locked_by=NULL, locked_until=NULL"
        + " WHERE execution_id=? AND batch_number=? AND status IN " + OPEN_STATUS_IN;
    return JdbcTemplate.update(conn, sql, availableAt, JdbcExecutionStore.truncateError(error),
        executionId, batchNumber) == 1;
  }

  @Override
  public int failRemaining(Connection conn, String executionId, int batchNumber, String error,
      Instant now) {
    Optional<Batch> row = find(conn, executionId, batchNumber);
    if (row.isEmpty() || row.get().status().isTerminal()) {
      return -1;
    }
    Batch batch = row.get();
    int remaining = batch.size() - batch.cursor();
    String sql = "UPDATE " + table + " SET status=" + BatchStatus.FAILED.code()
        + ", failed_count=failed_count+?, cursor_pos=record_count, last_error=?, completed_at=?,"
        + " attempts=attempts+1, locked_by=NULL, locked_until=NULL"
        + " WHERE execution_id=? AND batch_number=? AND cursor_pos=? AND status IN "
        + OPEN_STATUS_IN;
    int updated = JdbcTemplate.update(conn, sql, remaining,
        JdbcExecutionStore.truncateError(error), now, executionId, batchNumber, batch.cursor());
    return updated == 1 ? remaining : -1;
  }

  @Override
  public boolean cancel(Connection conn, String executionId, int batchNumber, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + BatchStatus.CANCELLED.code()
        + ", completed_at=?, locked_by=NULL, locked_until=NULL"
        + " WHERE execution_id=? AND batch_number=? AND status IN " + OPEN_STATUS_IN;
    return JdbcTemplate.update(conn, sql, now, executionId, batchNumber) == 1;
  }

  @Override
  public int cancelUnclaimed(Connection conn, String executionId, Instant now) {
    String sql = "UPDATE " + table + " SET status=" + BatchStatus.CANCELLED.code()
        + ", completed_at=?, locked_by=NULL, locked_until=NULL"
        + " WHERE execution_id=? AND status IN " + CLAIMABLE_STATUS_IN;
    return JdbcTemplate.update(conn, sql, now, executionId);
  }

  @Override
  public long countOutstanding(Connection conn, String executionId) {
    return JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + table
        + " WHERE execution_id=? AND status IN " + OPEN_STATUS_IN, executionId);
  }

  @Override
  public Map<BatchStatus, Integer> countByStatus(Connection conn, String executionId) {
    Map<BatchStatus, Integer> counts = new EnumMap<>(BatchStatus.class);
    String sql = "SELECT status, COUNT(*) FROM " + table
        + " WHERE execution_id=? GROUP BY status";
    for (Object[] row : JdbcTemplate.query(conn, sql,
        rs -> new Object[]{rs.getInt(1), rs.getInt(2)}, executionId)) {
      counts.put(BatchStatus.fromCode((Integer) row[0]), (Integer) row[1]);
    }
    return counts;
  }

  @Override
  public List<Batch> findAvailable(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE " + AVAILABLE
        + " ORDER BY available_at, execution_id, batch_number LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, now, now, limit);
  }

  @Override
  public int deleteByExecution(Connection conn, String executionId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE execution_id=?",
        executionId);
  }

  private Batch mapRow(ResultSet rs) throws SQLException {
    List<String> ids = new ArrayList<>();
    for (Object id : jsonCodec.parseArray(rs.getString("record_ids"))) {
      ids.add(String.valueOf(id));
    }
    return new Batch(
        rs.getString("execution_id"),
        rs.getInt("batch_number"),
        ids,
        BatchStatus.fromCode(rs.getInt("status")),
        rs.getInt("processed_count"),
        rs.getInt("failed_count"),
        rs.getInt("cursor_pos"),
        rs.getInt("attempts"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "available_at"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "completed_at"));
  }
}
