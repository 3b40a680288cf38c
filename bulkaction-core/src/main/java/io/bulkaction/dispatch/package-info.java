/**
 * Batch creation, the worker pool and per-record processing.
 *
 * <p>{@link io.bulkaction.dispatch.BatchDispatcher} owns the queues and threads,
 * {@link io.bulkaction.dispatch.BatchWorker} processes one batch, and
 * {@link io.bulkaction.dispatch.ExecutionFinalizer} decides terminal status.
 */
package io.bulkaction.dispatch;
