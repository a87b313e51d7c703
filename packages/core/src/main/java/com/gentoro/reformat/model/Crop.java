package com.gentoro.reformat.model;

import java.util.Objects;

/** Per-item crop as drawn by the user. */
public record Crop(boolean active, CropRatioPreset ratioPreset, CropRect rect) {
  public static final Crop NONE = new Crop(false, CropRatioPreset.ORIGINAL, CropRect.FULL);

  public Crop {
    ratioPreset = ratioPreset == null ? CropRatioPreset.ORIGINAL : ratioPreset;
    rect = Objects.requireNonNullElse(rect, CropRect.FULL);
  }

  public static Crop none() {
    return NONE;
  }

  public static Crop of(CropRect rect) {
    return new Crop(true, CropRatioPreset.FREE, rect);
  }

  /** Whether the crop actually removes pixels. */
  public boolean isEffective() {
    return active && !rect.isFull();
  }
}
