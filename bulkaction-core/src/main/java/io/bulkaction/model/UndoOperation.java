package io.bulkaction.model;

/**
 * How a {@link SnapshotRecord} is replayed to reverse the mutation it was captured for.
 */
public enum UndoOperation {
  /** The record was soft-deleted; clear the deletion marker. */
  REINSTATE_DELETED(0),
  /** The record was reinstated; set the deletion marker back. */
  DELETE_AGAIN(1),
  /** Fields were overwritten; write the captured values back. */
  REVERT_FIELDS(2),
  /** The row was destroyed; insert it again from the captured columns. */
  RECREATE_FROM_SCRATCH(3);

  private final int code;

  UndoOperation(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static UndoOperation fromCode(int code) {
    for (UndoOperation op : values()) {
      if (op.code == code) {
        return op;
      }
    }
    throw new IllegalArgumentException("Unknown undo operation code: " + code);
  }
}
