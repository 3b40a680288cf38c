package io.bulkaction.jdbc.store;

import io.bulkaction.jdbc.JdbcTemplate;
import io.bulkaction.jdbc.TableNames;
import io.bulkaction.model.SnapshotRecord;
import io.bulkaction.model.UndoOperation;
import io.bulkaction.spi.SnapshotStore;
import io.bulkaction.undo.SnapshotCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot rows with an identity key. Field maps go through a {@link SnapshotCodec}, so large
 * ones are stored compressed.
 */
public class JdbcSnapshotStore implements SnapshotStore {

  private static final String COLUMNS = "id, execution_id, record_id, entity_type, payload, "
      + "compressed, undo_operation, undone, undone_at, undone_by, created_at";

  private final String table;
  private final SnapshotCodec codec;
  private final JdbcTemplate.RowMapper<SnapshotRecord> rowMapper;

  public JdbcSnapshotStore() {
    this(TableNames.DEFAULT_SNAPSHOTS, SnapshotCodec.defaults());
  }

  public JdbcSnapshotStore(String table, SnapshotCodec codec) {
    this.table = TableNames.validate(table);
    this.codec = Objects.requireNonNull(codec, "codec");
    this.rowMapper = this::mapRow;
  }

  protected String table() {
    return table;
  }

  /**
   * Expected to run inside the worker's record transaction. Batches never share a record, so
   * the existence check and the insert cannot interleave with another writer for the same pair.
   */
  @Override
  public boolean insert(Connection conn, SnapshotRecord snapshot) {
    long existing = JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + table
            + " WHERE execution_id=? AND record_id=? AND undone=FALSE",
        snapshot.executionId(), snapshot.recordId());
    if (existing > 0) {
      return false;
    }
    SnapshotCodec.Encoded encoded = codec.encode(snapshot.fields());
    String sql = "INSERT INTO " + table + " (execution_id, record_id, entity_type, payload, "
        + "compressed, undo_operation, undone, undone_at, undone_by, created_at) "
        + "VALUES (?,?,?,?,?,?,FALSE,NULL,NULL,?)";
    JdbcTemplate.update(conn, sql, snapshot.executionId(), snapshot.recordId(),
        snapshot.entityType(), encoded.payload(), encoded.compressed(),
        snapshot.undoOperation().code(), snapshot.createdAt());
    return true;
  }

  @Override
  public List<SnapshotRecord> findPending(Connection conn, String executionId, long afterId,
      int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + table
        + " WHERE execution_id=? AND undone=FALSE AND id>? ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, executionId, afterId, limit);
  }

  @Override
  public boolean markUndone(Connection conn, long snapshotId, Instant undoneAt, String undoneBy) {
    String sql = "UPDATE " + table + " SET undone=TRUE, undone_at=?, undone_by=?"
        + " WHERE id=? AND undone=FALSE";
    return JdbcTemplate.update(conn, sql, undoneAt, undoneBy, snapshotId) == 1;
  }

  @Override
  public long countPending(Connection conn, String executionId) {
    return JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + table
        + " WHERE execution_id=? AND undone=FALSE", executionId);
  }

  @Override
  public int deletePending(Connection conn, String executionId, int limit) {
    String sql = "DELETE FROM " + table + " WHERE id IN (SELECT id FROM " + table
        + " WHERE execution_id=? AND undone=FALSE ORDER BY id LIMIT ?)";
    return JdbcTemplate.update(conn, sql, executionId, limit);
  }

  @Override
  public int deleteByExecution(Connection conn, String executionId) {
    return JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE execution_id=?",
        executionId);
  }

  private SnapshotRecord mapRow(ResultSet rs) throws SQLException {
    return new SnapshotRecord(
        rs.getLong("id"),
        rs.getString("execution_id"),
        rs.getString("record_id"),
        rs.getString("entity_type"),
        codec.decode(rs.getString("payload"), rs.getBoolean("compressed")),
        UndoOperation.fromCode(rs.getInt("undo_operation")),
        rs.getBoolean("undone"),
        JdbcTemplate.instant(rs, "undone_at"),
        rs.getString("undone_by"),
        JdbcTemplate.instant(rs, "created_at"));
  }
}
