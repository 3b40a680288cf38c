package io.bulkaction.dispatch;

import java.util.Objects;

/**
 * Chooses the size of the next batch. Under memory pressure the size halves, down to the
 * minimum; once usage drops below half it grows back by half again, up to the requested size.
 */
public final class BatchSizer {

  /** Fraction of the maximum heap currently in use, in {@code [0, 1]}. */
  @FunctionalInterface
  public interface MemoryProbe {
    double usageRatio();

    static MemoryProbe runtime() {
      return () -> {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return (double) used / runtime.maxMemory();
      };
    }
  }

  private final int minSize;
  private final int maxSize;
  private final double pressureThreshold;
  private final MemoryProbe probe;

  public BatchSizer(int minSize, int maxSize, double pressureThreshold, MemoryProbe probe) {
    if (minSize < 1) {
      throw new IllegalArgumentException("minSize must be >= 1");
    }
    if (maxSize < minSize) {
      throw new IllegalArgumentException("maxSize must be >= minSize");
    }
    if (pressureThreshold <= 0.0 || pressureThreshold > 1.0) {
      throw new IllegalArgumentException("pressureThreshold must be in (0, 1]");
    }
    this.minSize = minSize;
    this.maxSize = maxSize;
    this.pressureThreshold = pressureThreshold;
    this.probe = Objects.requireNonNull(probe, "probe");
  }

  public int minSize() {
    return minSize;
  }

  public int maxSize() {
    return maxSize;
  }

  public boolean accepts(int requested) {
    return requested >= minSize && requested <= maxSize;
  }

  /**
   * @param current   size of the previous batch, or the requested size for the first one
   * @param requested size asked for at submission
   */
  public int nextSize(int current, int requested) {
    int ceiling = clamp(requested);
    int size = clamp(current);
    double usage = probe.usageRatio();
    if (usage >= pressureThreshold) {
      return Math.max(minSize, size / 2);
    }
    if (usage < 0.5 && size < ceiling) {
      return Math.min(ceiling, (int) Math.ceil(size * 1.5));
    }
    return Math.min(size, ceiling);
  }

  private int clamp(int size) {
    return Math.max(minSize, Math.min(maxSize, size));
  }
}
