package com.gentoro.reformat.model;

/**
 * How output dimensions are derived for a run.
 *
 * <p>Consumers dispatch with {@code instanceof} over the three permitted variants.
 */
public sealed interface ResizeSpec
    permits ResizeSpec.Percent, ResizeSpec.Pixels, ResizeSpec.TargetSize {

  /** Which side a keep-ratio pixel resize is computed from. */
  enum DrivingDimension {
    WIDTH,
    HEIGHT,
    /** The longer of the two sides. */
    MAX_SIDE
  }

  /** No resize at all: pixel mode driven by max side, without a value. */
  static ResizeSpec none() {
    return new Pixels(true, DrivingDimension.MAX_SIDE, null, null, null);
  }

  static ResizeSpec percent(double percent) {
    return new Percent(percent);
  }

  static ResizeSpec width(int width) {
    return new Pixels(true, DrivingDimension.WIDTH, width, null, null);
  }

  static ResizeSpec height(int height) {
    return new Pixels(true, DrivingDimension.HEIGHT, null, height, null);
  }

  static ResizeSpec maxSide(int maxSide) {
    return new Pixels(true, DrivingDimension.MAX_SIDE, null, null, maxSide);
  }

  static ResizeSpec exact(Integer width, Integer height) {
    return new Pixels(false, DrivingDimension.WIDTH, width, height, null);
  }

  static ResizeSpec targetSize(double megabytes) {
    return new TargetSize(megabytes);
  }

  /** Uniform scale in percent of the current size, {@code 1..1000}. */
  record Percent(double percent) implements ResizeSpec {
    public Percent {
      if (!(percent >= 1 && percent <= 1000)) {
        throw new IllegalArgumentException("Percent must be within 1..1000, got " + percent);
      }
    }
  }

  /**
   * Pixel dimensions.
   *
   * @param keepRatio when false both {@code width} and {@code height} are applied as given
   * @param driving side used when {@code keepRatio} is set
   */
  record Pixels(
      boolean keepRatio, DrivingDimension driving, Integer width, Integer height, Integer maxSide)
      implements ResizeSpec {
    public Pixels {
      driving = driving == null ? DrivingDimension.MAX_SIDE : driving;
      requirePositive("width", width);
      requirePositive("height", height);
      requirePositive("maxSide", maxSide);
    }

    private static void requirePositive(String name, Integer value) {
      if (value != null && value < 1) {
        throw new IllegalArgumentException(name + " must be positive, got " + value);
      }
    }
  }

  /**
   * Search for the dimensions whose encoding is closest to {@code megabytes} MiB, {@code 0 <
   * megabytes <= 100}.
   */
  record TargetSize(double megabytes) implements ResizeSpec {
    public static final double MAX_MEGABYTES = 100;

    public TargetSize {
      if (!(megabytes > 0)) {
        throw new IllegalArgumentException("Target size must be greater than 0, got " + megabytes);
      }
      if (megabytes > MAX_MEGABYTES) {
        throw new IllegalArgumentException(
            "Target size must be at most " + MAX_MEGABYTES + " MiB, got " + megabytes);
      }
    }
  }
}
