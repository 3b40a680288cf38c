package io.bulkaction;

/**
 * Thrown when a submitted request cannot be executed as written: unknown entity type or
 * action, malformed filter, bad parameters, out-of-range batch size or schedule. Raised
 * before any ledger row is written.
 */
public class SpecInvalidException extends BulkActionException {

  public SpecInvalidException(String message) {
    super(message);
  }
}
