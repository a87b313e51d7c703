package com.gentoro.reformat.model;

import java.util.Locale;

/** Concrete encodings an item can be read from or written to. */
public enum ImageFormat {
  JPEG(".jpg", false, true),
  PNG(".png", true, false),
  WEBP(".webp", true, true),
  TIFF(".tiff", true, false),
  HEIC(".heic", true, true),
  BMP(".bmp", false, false),
  GIF(".gif", true, false);

  private final String extension;
  private final boolean supportsAlpha;
  private final boolean supportsQuality;

  ImageFormat(String extension, boolean supportsAlpha, boolean supportsQuality) {
    this.extension = extension;
    this.supportsAlpha = supportsAlpha;
    this.supportsQuality = supportsQuality;
  }

  /** File extension including the leading dot. */
  public String extension() {
    return extension;
  }

  public boolean supportsAlpha() {
    return supportsAlpha;
  }

  public boolean supportsQuality() {
    return supportsQuality;
  }

  /**
   * Map a format or reader name ({@code "jpg"}, {@code "JPEG"}, {@code "heif"}, {@code "tif"}) to
   * a format.
   *
   * @return the format, or {@code null} when the name is unknown
   */
  public static ImageFormat fromName(String name) {
    if (name == null) return null;
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "jpg":
      case "jpeg":
        return JPEG;
      case "png":
        return PNG;
      case "webp":
        return WEBP;
      case "tif":
      case "tiff":
        return TIFF;
      case "heic":
      case "heif":
        return HEIC;
      case "bmp":
      case "wbmp":
        return BMP;
      case "gif":
        return GIF;
      default:
        return null;
    }
  }
}
