package com.gentoro.reformat.sizing;

import com.gentoro.reformat.exception.ConfigurationException;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables of the target size search.
 *
 * @param tolerance accepted relative deviation from the target, e.g. {@code 0.10}
 * @param minDimension smallest width or height a candidate may have
 * @param maxIterations upper bound on encodes, the initial full-size encode included
 */
public record SizingSettings(double tolerance, int minDimension, int maxIterations) {
  public static final SizingSettings DEFAULTS = new SizingSettings(0.10, 48, 20);

  public SizingSettings {
    if (!(tolerance > 0 && tolerance < 1)) {
      throw new ConfigurationException("target-size.tolerance must be within (0, 1): " + tolerance);
    }
    if (minDimension < 1) {
      throw new ConfigurationException(
          "target-size.min-dimension must be positive: " + minDimension);
    }
    if (maxIterations < 2) {
      throw new ConfigurationException(
          "target-size.max-iterations must be at least 2: " + maxIterations);
    }
  }

  public static SizingSettings fromConfiguration(Configuration config) {
    try {
      return new SizingSettings(
          config.getDouble("target-size.tolerance", DEFAULTS.tolerance()),
          config.getInt("target-size.min-dimension", DEFAULTS.minDimension()),
          config.getInt("target-size.max-iterations", DEFAULTS.maxIterations()));
    } catch (ConfigurationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigurationException("Invalid target-size configuration", e);
    }
  }
}
