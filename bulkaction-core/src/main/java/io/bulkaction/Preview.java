package io.bulkaction;

import io.bulkaction.model.TargetRecord;

import java.util.List;

/**
 * Result of {@link BulkActionEngine#preview}: how many records a filter matches and the first
 * few of them.
 */
public record Preview(long totalCount, List<TargetRecord> sample) {

  public Preview {
    sample = List.copyOf(sample);
  }
}
