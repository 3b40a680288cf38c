package io.bulkaction.dispatch;

/**
 * What a worker does after one record fails.
 */
public enum FailurePolicy {
  /** Count the failure and go on with the next record. */
  CONTINUE,
  /** Fail the rest of the batch and the whole execution. */
  ABORT
}
