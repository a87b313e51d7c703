package com.gentoro.reformat.model;

import java.util.Locale;

/** Output format chosen by the user for a whole run. */
public enum OutputFormat {
  /** Keep each item's source encoding. */
  SAME(null),
  JPG(ImageFormat.JPEG),
  PNG(ImageFormat.PNG),
  WEBP(ImageFormat.WEBP),
  TIFF(ImageFormat.TIFF),
  HEIC(ImageFormat.HEIC),
  BMP(ImageFormat.BMP);

  private final ImageFormat format;

  OutputFormat(ImageFormat format) {
    this.format = format;
  }

  /** The concrete encoding, or {@code null} for {@link #SAME}. */
  public ImageFormat format() {
    return format;
  }

  public static OutputFormat parse(String value) {
    if (value == null || value.isBlank()) return SAME;
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("JPEG")) return JPG;
    if (normalized.equals("TIF")) return TIFF;
    if (normalized.equals("HEIF")) return HEIC;
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown output format: " + value, e);
    }
  }
}
