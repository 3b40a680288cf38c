package io.bulkaction.jdbc;

import io.bulkaction.BulkActionException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the ledger stores and the record store.
 */
public final class StoreException extends BulkActionException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
