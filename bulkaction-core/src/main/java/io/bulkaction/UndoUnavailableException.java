package io.bulkaction;

import java.util.Objects;

/**
 * Thrown when an execution cannot be undone. {@link #reason()} tells the cases apart.
 */
public class UndoUnavailableException extends BulkActionException {

  public enum Reason {
    /** The undo window has passed. */
    EXPIRED,
    /** The execution was already undone once. */
    ALREADY_UNDONE,
    /** The execution was submitted without undo. */
    NEVER_ENABLED,
    /** The execution did not complete successfully. */
    NOT_COMPLETED,
    /** No snapshot is left to restore. */
    NOTHING_TO_UNDO
  }

  private final String executionId;
  private final Reason reason;

  public UndoUnavailableException(String executionId, Reason reason) {
    super("Execution " + executionId + " cannot be undone: "
        + Objects.requireNonNull(reason, "reason").name().toLowerCase(java.util.Locale.ROOT));
    this.executionId = executionId;
    this.reason = reason;
  }

  public String executionId() {
    return executionId;
  }

  public Reason reason() {
    return reason;
  }
}
