package io.bulkaction.spi;

import io.bulkaction.model.EntityType;
import io.bulkaction.model.TargetRecord;

import java.sql.Connection;
import java.util.Map;
import java.util.Optional;

/**
 * Access to the target entities that actions mutate. Values are converted to and from the
 * column types of the backing table.
 */
public interface RecordStore {

  Optional<TargetRecord> find(Connection conn, EntityType entity, String id);

  /**
   * @return {@code true} if a row was updated
   */
  boolean update(Connection conn, EntityType entity, String id, Map<String, Object> values);

  /**
   * @return {@code true} if a row was deleted
   */
  boolean delete(Connection conn, EntityType entity, String id);

  /**
   * Inserts a row; {@code values} must contain the id column.
   */
  void insert(Connection conn, EntityType entity, Map<String, Object> values);
}
