package io.bulkaction.undo;

/**
 * Summary of one undo run. Records counted in {@code failed} keep their snapshots, which stay
 * non-undone.
 */
public record UndoResult(String executionId, long restored, long failed) {

  public boolean isComplete() {
    return failed == 0;
  }
}
