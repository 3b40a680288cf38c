package io.bulkaction.jdbc;

import java.util.Objects;

/**
 * Names of the three ledger tables. Validated as plain identifiers because they are spliced
 * into SQL.
 */
public record TableNames(String executions, String batches, String snapshots) {
  public static final String DEFAULT_EXECUTIONS = "bulk_execution";
  public static final String DEFAULT_BATCHES = "bulk_batch";
  public static final String DEFAULT_SNAPSHOTS = "bulk_snapshot";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public TableNames {
    validate(executions);
    validate(batches);
    validate(snapshots);
  }

  public static TableNames defaults() {
    return new TableNames(DEFAULT_EXECUTIONS, DEFAULT_BATCHES, DEFAULT_SNAPSHOTS);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
