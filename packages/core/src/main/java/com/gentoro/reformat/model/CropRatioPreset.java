package com.gentoro.reformat.model;

/** Aspect ratios offered when drawing a crop. */
public enum CropRatioPreset {
  ORIGINAL("original", 0),
  FREE("free", 0),
  SQUARE("1:1", 1.0),
  PORTRAIT_4_5("4:5", 4.0 / 5),
  PORTRAIT_3_4("3:4", 3.0 / 4),
  PORTRAIT_9_16("9:16", 9.0 / 16),
  LANDSCAPE_16_9("16:9", 16.0 / 9),
  PORTRAIT_2_3("2:3", 2.0 / 3),
  LANDSCAPE_3_2("3:2", 3.0 / 2);

  private final String label;
  private final double ratio;

  CropRatioPreset(String label, double ratio) {
    this.label = label;
    this.ratio = ratio;
  }

  public String label() {
    return label;
  }

  /**
   * Width divided by height for this preset.
   *
   * @return the ratio, or {@code 0} when unconstrained ({@link #FREE}, or {@link #ORIGINAL}
   *     without valid dimensions)
   */
  public double ratio(int imageWidth, int imageHeight) {
    if (this == ORIGINAL) {
      return imageWidth > 0 && imageHeight > 0 ? (double) imageWidth / imageHeight : 0;
    }
    return ratio;
  }

  /** Largest rectangle of this ratio centered in an image of the given size. */
  public CropRect centeredRect(int imageWidth, int imageHeight) {
    double target = ratio(imageWidth, imageHeight);
    if (target <= 0 || imageWidth <= 0 || imageHeight <= 0) {
      return CropRect.FULL;
    }
    double imageRatio = (double) imageWidth / imageHeight;
    double w = 1;
    double h = 1;
    if (target > imageRatio) {
      h = imageRatio / target;
    } else {
      w = target / imageRatio;
    }
    return new CropRect((1 - w) / 2, (1 - h) / 2, w, h);
  }

  public static CropRatioPreset fromLabel(String label) {
    if (label == null || label.isBlank()) return ORIGINAL;
    for (CropRatioPreset preset : values()) {
      if (preset.label.equalsIgnoreCase(label.trim()) || preset.name().equalsIgnoreCase(label)) {
        return preset;
      }
    }
    throw new IllegalArgumentException("Unknown crop ratio: " + label);
  }
}
