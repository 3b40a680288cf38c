package io.bulkaction.dispatch;

import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * A batch-level failure worth retrying, such as lock contention or a timeout. The batch is
 * retried with backoff until its attempts run out.
 */
public class TransientBatchException extends RuntimeException {

  public TransientBatchException(String message) {
    super(message);
  }

  public TransientBatchException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns whether {@code error} or any of its causes is a transient failure.
   */
  public static boolean isTransient(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof TransientBatchException
          || current instanceof SQLTransientException
          || current instanceof SQLRecoverableException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
