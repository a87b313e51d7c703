package com.gentoro.reformat.sizing;

import com.gentoro.reformat.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Binary search over a uniform scale factor for the dimensions whose encoding is closest to a
 * target byte size.
 *
 * <p>The oracle is assumed to be monotonic: smaller dimensions never produce a larger encoding.
 * The best candidate kept is the largest one that does not exceed the upper tolerance bound.
 */
public class TargetSizeSearch {
  private static final Logger log = LoggingService.getLogger(TargetSizeSearch.class);

  static final double MIN_SCALE = 0.01;
  static final double CONVERGENCE = 0.001;

  private final SizingSettings settings;

  public TargetSizeSearch() {
    this(SizingSettings.DEFAULTS);
  }

  public TargetSizeSearch(SizingSettings settings) {
    this.settings = settings;
  }

  public SizingSettings settings() {
    return settings;
  }

  public TargetSizeResult findTargetSize(
      int sourceWidth, int sourceHeight, double targetMiB, int quality, EncodeSizeOracle oracle) {
    if (!(targetMiB > 0)) {
      return new TargetSizeResult(
          false, sourceWidth, sourceHeight, 0, 1, "Target size must be greater than 0", 0);
    }

    long targetBytes = ByteUnits.fromMiB(targetMiB);
    double lowerBound = targetBytes * (1 - settings.tolerance());
    double upperBound = targetBytes * (1 + settings.tolerance());

    long originalBytes = oracle.encodedSize(sourceWidth, sourceHeight, quality);
    if (originalBytes >= lowerBound && originalBytes <= upperBound) {
      return new TargetSizeResult(true, sourceWidth, sourceHeight, originalBytes, 1, null, 1);
    }
    if (originalBytes < lowerBound) {
      return new TargetSizeResult(
          true,
          sourceWidth,
          sourceHeight,
          originalBytes,
          1,
          "Original file (" + ByteUnits.formatMiB(originalBytes) + " MiB) is smaller than target",
          1);
    }

    double low = MIN_SCALE;
    double high = 1.0;
    Candidate best = null;
    int iterations = 1;

    while (iterations < settings.maxIterations()) {
      double mid = (low + high) / 2;
      int width = scaled(sourceWidth, mid);
      int height = scaled(sourceHeight, mid);
      boolean atMinimum = width <= settings.minDimension() || height <= settings.minDimension();

      long bytes = oracle.encodedSize(width, height, quality);
      iterations++;
      log.trace("Target size probe {}x{} (scale {}) -> {} bytes", width, height, mid, bytes);

      if (bytes <= upperBound && (best == null || bytes > best.bytes)) {
        best = new Candidate(width, height, bytes, mid);
      }
      if (bytes >= lowerBound && bytes <= upperBound) {
        return new TargetSizeResult(true, width, height, bytes, mid, null, iterations);
      }
      if (atMinimum && bytes > upperBound) {
        return new TargetSizeResult(
            false,
            width,
            height,
            bytes,
            mid,
            "Cannot reach target: minimum size ("
                + width
                + "×"
                + height
                + ") still produces "
                + ByteUnits.formatMiB(bytes)
                + " MiB",
            iterations);
      }

      if (bytes > targetBytes) {
        high = mid;
      } else {
        low = mid;
      }
      if (high - low < CONVERGENCE) {
        break;
      }
    }

    if (best != null) {
      boolean within = best.bytes >= lowerBound && best.bytes <= upperBound;
      return new TargetSizeResult(
          within,
          best.width,
          best.height,
          best.bytes,
          best.scale,
          within ? null : "Closest achievable: " + ByteUnits.formatMiB(best.bytes) + " MiB",
          iterations);
    }
    return new TargetSizeResult(
        false,
        sourceWidth,
        sourceHeight,
        originalBytes,
        1,
        "Could not find suitable dimensions for target size",
        iterations);
  }

  /** Scaled side, never below the configured minimum dimension. */
  public int scaled(int side, double scale) {
    return Math.max(settings.minDimension(), (int) Math.round(side * scale));
  }

  private record Candidate(int width, int height, long bytes, double scale) {}
}
