package io.bulkaction.purge;

/**
 * Counts from one purge cycle.
 *
 * @param undoWindowsClosed executions whose expired undo window was closed
 * @param snapshotsDiscarded snapshots deleted because their window expired
 * @param executionsPurged terminal executions deleted past the retention period
 */
public record PurgeSummary(int undoWindowsClosed, long snapshotsDiscarded, int executionsPurged) {

  public boolean isEmpty() {
    return undoWindowsClosed == 0 && snapshotsDiscarded == 0 && executionsPurged == 0;
  }
}
