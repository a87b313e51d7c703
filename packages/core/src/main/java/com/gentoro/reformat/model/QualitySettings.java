package com.gentoro.reformat.model;

import com.gentoro.reformat.exception.ConfigurationException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/** Encoder quality for each lossy format, bounded to {@code 40..100}. */
public record QualitySettings(int jpg, int webp, int heic) {
  public static final int MIN = 40;
  public static final int MAX = 100;
  public static final int DEFAULT = 85;

  public static final QualitySettings DEFAULTS = new QualitySettings(DEFAULT, DEFAULT, DEFAULT);

  public QualitySettings {
    check("jpg", jpg);
    check("webp", webp);
    check("heic", heic);
  }

  public static QualitySettings fromConfiguration(Configuration config) {
    try {
      return new QualitySettings(
          config.getInt("quality.jpg", DEFAULT),
          config.getInt("quality.webp", DEFAULT),
          config.getInt("quality.heic", DEFAULT));
    } catch (ConversionException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid quality configuration: " + e.getMessage(), e);
    }
  }

  /** Quality to hand to the encoder; formats without a quality knob get the default. */
  public int forFormat(ImageFormat format) {
    if (format == null) return DEFAULT;
    switch (format) {
      case JPEG:
        return jpg;
      case WEBP:
        return webp;
      case HEIC:
        return heic;
      default:
        return DEFAULT;
    }
  }

  public QualitySettings withJpg(int value) {
    return new QualitySettings(value, webp, heic);
  }

  public QualitySettings withWebp(int value) {
    return new QualitySettings(jpg, value, heic);
  }

  public QualitySettings withHeic(int value) {
    return new QualitySettings(jpg, webp, value);
  }

  private static void check(String name, int value) {
    if (value < MIN || value > MAX) {
      throw new IllegalArgumentException(
          "Quality " + name + " must be within " + MIN + ".." + MAX + ", got " + value);
    }
  }
}
