package io.bulkaction.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A persisted record type that bulk actions can target.
 *
 * @param name              logical name used in requests (e.g. {@code "user"})
 * @param table             backing table
 * @param idColumn          primary key column; ids are ordered by this column when streamed
 * @param softDeleteColumn  nullable timestamp column marking soft deletion, or {@code null}
 *                          if the type only supports hard deletes
 */
public record EntityType(String name, String table, String idColumn, String softDeleteColumn) {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public EntityType {
    Objects.requireNonNull(name, "name");
    requireIdentifier(table, "table");
    requireIdentifier(idColumn, "idColumn");
    if (softDeleteColumn != null) {
      requireIdentifier(softDeleteColumn, "softDeleteColumn");
    }
  }

  public static EntityType of(String name, String table, String idColumn) {
    return new EntityType(name, table, idColumn, null);
  }

  public boolean supportsSoftDelete() {
    return softDeleteColumn != null;
  }

  /**
   * Returns whether {@code value} is a plain SQL identifier. Column and table names coming
   * from requests are checked with this before they are spliced into SQL.
   */
  public static boolean isIdentifier(String value) {
    return value != null && IDENTIFIER.matcher(value).matches();
  }

  private static void requireIdentifier(String value, String label) {
    if (!isIdentifier(value)) {
      throw new IllegalArgumentException(label + " must match [A-Za-z_][A-Za-z0-9_]*: " + value);
    }
  }
}
