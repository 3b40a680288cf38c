package io.bulkaction.action;

import io.bulkaction.model.EntityType;
import io.bulkaction.model.TargetRecord;
import io.bulkaction.spi.RecordStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Map;

/**
 * Everything a handler sees when applied to one record. {@code connection} is inside the
 * record's transaction; handlers must not commit, roll back or close it.
 */
public record ActionContext(
    String executionId,
    String actor,
    EntityType entity,
    TargetRecord record,
    Map<String, Object> parameters,
    Connection connection,
    RecordStore records,
    Instant now
) {}
