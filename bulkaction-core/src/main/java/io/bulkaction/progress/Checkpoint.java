package io.bulkaction.progress;

import java.time.Instant;

/**
 * Number of records handled (processed plus failed) observed at one instant.
 */
public record Checkpoint(long count, Instant at) {}
