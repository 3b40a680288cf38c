/**
 * Snapshot capture and one-shot, best-effort undo.
 */
package io.bulkaction.undo;
