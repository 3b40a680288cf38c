package io.bulkaction;

import io.bulkaction.model.ExecutionStatus;

/**
 * Thrown when cancel or reschedule targets an execution that is no longer scheduled.
 */
public class SchedulingConflictException extends BulkActionException {
  private final ExecutionStatus actualStatus;

  public SchedulingConflictException(String executionId, String operation,
      ExecutionStatus actualStatus) {
    super("Cannot " + operation + " execution " + executionId + " in status " + actualStatus);
    this.actualStatus = actualStatus;
  }

  public ExecutionStatus actualStatus() {
    return actualStatus;
  }
}
