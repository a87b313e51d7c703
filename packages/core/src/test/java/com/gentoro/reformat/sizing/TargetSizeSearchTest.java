package com.gentoro.reformat.sizing;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.reformat.exception.ConfigurationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TargetSizeSearchTest {

  /** One byte per pixel: size grows monotonically with the area. */
  private static final EncodeSizeOracle AREA = (w, h, q) -> (long) w * h;

  @Test
  @DisplayName("Converges into the tolerance band for a monotonic encoder")
  void convergesWithinTolerance() {
    TargetSizeSearch search = new TargetSizeSearch();
    long target = ByteUnits.fromMiB(2);

    TargetSizeResult result = search.findTargetSize(4000, 3000, 2, 85, AREA);

    assertTrue(result.success());
    assertFalse(result.hasWarning());
    assertTrue(result.bytes() >= target * 0.9 && result.bytes() <= target * 1.1, "" + result);
    assertTrue(result.width() < 4000);
    assertEquals(4.0 / 3, (double) result.width() / result.height(), 0.01);
    assertTrue(result.iterations() <= SizingSettings.DEFAULTS.maxIterations());
  }

  @Test
  @DisplayName("Sources already below the target are kept as they are")
  void sourceBelowTarget() {
    TargetSizeResult result = new TargetSizeSearch().findTargetSize(100, 100, 1, 85, AREA);

    assertTrue(result.success());
    assertEquals(100, result.width());
    assertEquals(100, result.height());
    assertEquals(1, result.iterations());
    assertTrue(result.warning().startsWith("Original file (0.01 MiB) is smaller than target"));
  }

  @Test
  @DisplayName("Sources already within tolerance need a single encode")
  void sourceWithinTolerance() {
    long target = ByteUnits.fromMiB(1);
    EncodeSizeOracle oracle = (w, h, q) -> target + 10;

    TargetSizeResult result = new TargetSizeSearch().findTargetSize(800, 600, 1, 85, oracle);

    assertTrue(result.success());
    assertNull(result.warning());
    assertEquals(1, result.iterations());
    assertEquals(800, result.width());
  }

  @Test
  @DisplayName("Reports failure when even the minimum size is too large")
  void unreachableAtMinimumDimension() {
    EncodeSizeOracle huge = (w, h, q) -> ByteUnits.fromMiB(10);

    TargetSizeResult result = new TargetSizeSearch().findTargetSize(1000, 1000, 1, 85, huge);

    assertFalse(result.success());
    assertEquals(48, result.width());
    assertEquals(48, result.height());
    assertEquals("Cannot reach target: minimum size (48×48) still produces 10.00 MiB",
        result.warning());
  }

  @Test
  @DisplayName("Returns the closest candidate under the band when the encoder jumps over it")
  void closestAchievable() {
    // Nothing between 100 bytes and 10 MiB, so the band around 2 MiB is never hit.
    EncodeSizeOracle stepped = (w, h, q) -> w >= 500 ? ByteUnits.fromMiB(10) : 100;

    TargetSizeResult result = new TargetSizeSearch().findTargetSize(1000, 1000, 2, 85, stepped);

    assertFalse(result.success());
    assertEquals(100, result.bytes());
    assertTrue(result.width() < 500);
    assertEquals("Closest achievable: 0.00 MiB", result.warning());
  }

  @Test
  @DisplayName("A non-positive target fails without encoding")
  void nonPositiveTarget() {
    AtomicInteger calls = new AtomicInteger();
    EncodeSizeOracle counting =
        (w, h, q) -> {
          calls.incrementAndGet();
          return 1;
        };

    TargetSizeResult result = new TargetSizeSearch().findTargetSize(100, 100, 0, 85, counting);

    assertFalse(result.success());
    assertEquals("Target size must be greater than 0", result.warning());
    assertEquals(0, calls.get());
  }

  @Test
  @DisplayName("Iteration cap bounds the number of encodes")
  void iterationCap() {
    AtomicInteger calls = new AtomicInteger();
    EncodeSizeOracle counting =
        (w, h, q) -> {
          calls.incrementAndGet();
          return (long) w * h;
        };
    TargetSizeSearch search = new TargetSizeSearch(new SizingSettings(0.01, 16, 3));

    TargetSizeResult result = search.findTargetSize(4000, 3000, 2, 85, counting);

    assertEquals(3, calls.get());
    assertEquals(3, result.iterations());
  }

  @Test
  @DisplayName("Invalid tunables are rejected")
  void validatesSettings() {
    assertThrows(ConfigurationException.class, () -> new SizingSettings(0, 48, 20));
    assertThrows(ConfigurationException.class, () -> new SizingSettings(0.1, 0, 20));
    assertThrows(ConfigurationException.class, () -> new SizingSettings(0.1, 48, 1));
  }
}
