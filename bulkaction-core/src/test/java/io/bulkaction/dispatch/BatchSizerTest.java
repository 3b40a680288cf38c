package io.bulkaction.dispatch;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class BatchSizerTest {

  private final AtomicReference<Double> usage = new AtomicReference<>(0.6);
  private final BatchSizer sizer = new BatchSizer(10, 10_000, 0.8, usage::get);

  @Test
  void acceptsSizesWithinBounds() {
    assertTrue(sizer.accepts(10));
    assertTrue(sizer.accepts(10_000));
    assertFalse(sizer.accepts(9));
    assertFalse(sizer.accepts(10_001));
  }

  @Test
  void keepsRequestedSizeUnderNormalLoad() {
    assertEquals(500, sizer.nextSize(500, 500));
  }

  @Test
  void halvesUnderMemoryPressure() {
    usage.set(0.85);

    assertEquals(250, sizer.nextSize(500, 500));
    assertEquals(125, sizer.nextSize(250, 500));
  }

  @Test
  void neverShrinksBelowMinimum() {
    usage.set(0.95);

    assertEquals(10, sizer.nextSize(15, 500));
    assertEquals(10, sizer.nextSize(10, 500));
  }

  @Test
  void growsBackWhenPressureEases() {
    usage.set(0.3);

    assertEquals(375, sizer.nextSize(250, 500));
    assertEquals(500, sizer.nextSize(375, 500));
    assertEquals(500, sizer.nextSize(500, 500));
  }

  @Test
  void holdsReducedSizeBetweenHalfAndThreshold() {
    usage.set(0.6);

    assertEquals(250, sizer.nextSize(250, 500));
  }

  @Test
  void clampsOutOfRangeSizes() {
    assertEquals(10_000, sizer.nextSize(50_000, 50_000));
    assertEquals(10, sizer.nextSize(1, 1));
  }

  @Test
  void runtimeProbeReportsFraction() {
    double ratio = BatchSizer.MemoryProbe.runtime().usageRatio();

    assertTrue(ratio > 0.0 && ratio <= 1.0, "got " + ratio);
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> new BatchSizer(0, 10, 0.8, usage::get));
    assertThrows(IllegalArgumentException.class, () -> new BatchSizer(10, 5, 0.8, usage::get));
    assertThrows(IllegalArgumentException.class, () -> new BatchSizer(1, 5, 0.0, usage::get));
    assertThrows(IllegalArgumentException.class, () -> new BatchSizer(1, 5, 1.5, usage::get));
    assertThrows(NullPointerException.class, () -> new BatchSizer(1, 5, 0.8, null));
  }
}
