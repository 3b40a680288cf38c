package io.bulkaction.model;

/**
 * The kind of change an action applies to a record. Each kind maps to exactly one
 * {@link UndoOperation}.
 */
public enum MutationType {
  SOFT_DELETE(UndoOperation.REINSTATE_DELETED),
  REINSTATE(UndoOperation.DELETE_AGAIN),
  UPDATE_FIELDS(UndoOperation.REVERT_FIELDS),
  DESTROY(UndoOperation.RECREATE_FROM_SCRATCH);

  private final UndoOperation undoOperation;

  MutationType(UndoOperation undoOperation) {
    this.undoOperation = undoOperation;
  }

  public UndoOperation undoOperation() {
    return undoOperation;
  }
}
