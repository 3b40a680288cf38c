package io.bulkaction;

public class ExecutionNotFoundException extends BulkActionException {

  public ExecutionNotFoundException(String executionId) {
    super("Execution not found: " + executionId);
  }
}
