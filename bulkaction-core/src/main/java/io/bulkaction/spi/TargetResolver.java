package io.bulkaction.spi;

import io.bulkaction.model.EntityType;
import io.bulkaction.model.FilterSpec;
import io.bulkaction.model.TargetRecord;

import java.sql.Connection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link FilterSpec} into the set of records it selects.
 */
public interface TargetResolver {

  /**
   * Checks that every column the filter mentions exists on the entity.
   *
   * @throws io.bulkaction.SpecInvalidException if it does not
   */
  void validate(Connection conn, EntityType entity, FilterSpec filter);

  /**
   * Checks that each value can be written to the named column of the entity.
   *
   * @throws io.bulkaction.SpecInvalidException if a column is unknown or a value does not fit it
   */
  default void validateValues(Connection conn, EntityType entity, Map<String, Object> values) {
  }

  long count(Connection conn, EntityType entity, FilterSpec filter);

  /**
   * Streams matching ids in ascending id order, fetching {@code pageSize} at a time.
   * The iterator reads lazily through {@code conn}, which must stay open while iterating.
   */
  Iterator<String> streamIds(Connection conn, EntityType entity, FilterSpec filter, int pageSize);

  /**
   * Returns the first {@code limit} matching records in id order.
   */
  List<TargetRecord> sample(Connection conn, EntityType entity, FilterSpec filter, int limit);
}
