package io.bulkaction;

/**
 * Base type of every exception the engine raises to a synchronous caller.
 */
public class BulkActionException extends RuntimeException {

  public BulkActionException(String message) {
    super(message);
  }

  public BulkActionException(String message, Throwable cause) {
    super(message, cause);
  }
}
