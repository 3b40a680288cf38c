package io.bulkaction.model;

import java.time.Instant;
import java.util.Map;

/**
 * Pre-mutation state of one record, captured so an execution can be reversed.
 *
 * <p>At most one non-undone snapshot exists per {@code (executionId, recordId)}.
 */
public record SnapshotRecord(
    long id,
    String executionId,
    String recordId,
    String entityType,
    Map<String, Object> fields,
    UndoOperation undoOperation,
    boolean undone,
    Instant undoneAt,
    String undoneBy,
    Instant createdAt
) {}
