package io.bulkaction.progress;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable bounded history of checkpoints for one execution. Appending to a full buffer
 * drops the oldest sample.
 */
public final class CheckpointBuffer {
  private final int capacity;
  private final List<Checkpoint> checkpoints;

  private CheckpointBuffer(int capacity, List<Checkpoint> checkpoints) {
    this.capacity = capacity;
    this.checkpoints = checkpoints;
  }

  public static CheckpointBuffer empty(int capacity) {
    if (capacity < 2) {
      throw new IllegalArgumentException("capacity must be >= 2, got: " + capacity);
    }
    return new CheckpointBuffer(capacity, List.of());
  }

  /**
   * Returns a buffer with {@code checkpoint} appended. Counts never go backwards: a sample
   * lower than the newest one, which concurrent writers can produce, is raised to it.
   */
  public CheckpointBuffer append(Checkpoint checkpoint) {
    Checkpoint next = checkpoint;
    if (!checkpoints.isEmpty()) {
      Checkpoint newest = checkpoints.get(checkpoints.size() - 1);
      if (checkpoint.count() < newest.count()) {
        next = new Checkpoint(newest.count(), checkpoint.at());
      }
    }
    List<Checkpoint> list = new ArrayList<>(checkpoints.size() + 1);
    int skip = checkpoints.size() >= capacity ? checkpoints.size() - capacity + 1 : 0;
    list.addAll(checkpoints.subList(skip, checkpoints.size()));
    list.add(next);
    return new CheckpointBuffer(capacity, Collections.unmodifiableList(list));
  }

  public List<Checkpoint> checkpoints() {
    return checkpoints;
  }

  public int size() {
    return checkpoints.size();
  }

  /**
   * Records per millisecond between the oldest and newest sample. Empty with fewer than two
   * samples or when no time has elapsed between them.
   */
  public Optional<Double> ratePerMilli() {
    if (checkpoints.size() < 2) {
      return Optional.empty();
    }
    Checkpoint oldest = checkpoints.get(0);
    Checkpoint newest = checkpoints.get(checkpoints.size() - 1);
    long elapsedMs = Duration.between(oldest.at(), newest.at()).toMillis();
    if (elapsedMs <= 0) {
      return Optional.empty();
    }
    return Optional.of((double) (newest.count() - oldest.count()) / elapsedMs);
  }
}
