package com.gentoro.reformat.model;

/**
 * Crop rectangle normalized to {@code [0,1]} on both axes, relative to the transformed (viewer)
 * image.
 */
public record CropRect(double x, double y, double width, double height) {
  public static final CropRect FULL = new CropRect(0, 0, 1, 1);

  static final double FULL_EPSILON = 0.001;
  static final double MIN_SIZE = 0.01;

  /** True when the rectangle covers the whole unit square. */
  public boolean isFull() {
    return Math.abs(x) < FULL_EPSILON
        && Math.abs(y) < FULL_EPSILON
        && Math.abs(width - 1) < FULL_EPSILON
        && Math.abs(height - 1) < FULL_EPSILON;
  }

  /** Origin kept inside the unit square, sizes between {@code 0.01} and the remaining room. */
  public CropRect clamp() {
    double cx = Math.max(0, Math.min(1, x));
    double cy = Math.max(0, Math.min(1, y));
    double cw = Math.max(MIN_SIZE, Math.min(1 - cx, width));
    double ch = Math.max(MIN_SIZE, Math.min(1 - cy, height));
    return new CropRect(cx, cy, cw, ch);
  }

  /** Parse {@code "x,y,width,height"}. */
  public static CropRect parse(String value) {
    String[] parts = value.split(",");
    if (parts.length != 4) {
      throw new IllegalArgumentException("Crop must be x,y,width,height: " + value);
    }
    double[] v = new double[4];
    for (int i = 0; i < 4; i++) {
      v[i] = Double.parseDouble(parts[i].trim());
    }
    return new CropRect(v[0], v[1], v[2], v[3]);
  }
}
