package com.gentoro.reformat.pipeline;

import com.gentoro.reformat.geometry.Dimensions;
import com.gentoro.reformat.model.ResizeSpec;
import java.util.Optional;

/**
 * Target dimensions for percent and pixel resizes.
 *
 * <p>An empty result means "leave the image as it is": either nothing was requested or the request
 * would not make the image smaller along the driving dimension. Target size resizes are resolved
 * by {@link com.gentoro.reformat.sizing.TargetSizeSearch} and always yield empty here.
 */
public final class ResizeCalculator {
  private ResizeCalculator() {}

  public static Optional<Dimensions> targetFor(int width, int height, ResizeSpec spec) {
    if (spec instanceof ResizeSpec.Percent percent) {
      return percent(width, height, percent.percent());
    }
    if (spec instanceof ResizeSpec.Pixels pixels) {
      return pixels.keepRatio() ? keepRatio(width, height, pixels) : exact(width, height, pixels);
    }
    return Optional.empty();
  }

  private static Optional<Dimensions> percent(int width, int height, double percent) {
    int tw = Math.max(1, (int) Math.round(width * percent / 100.0));
    int th = Math.max(1, (int) Math.round(height * percent / 100.0));
    if (tw < width || th < height) {
      return Optional.of(new Dimensions(Math.min(tw, width), Math.min(th, height)));
    }
    return Optional.empty();
  }

  private static Optional<Dimensions> keepRatio(int width, int height, ResizeSpec.Pixels pixels) {
    boolean byWidth;
    Integer side;
    switch (pixels.driving()) {
      case WIDTH -> {
        byWidth = true;
        side = pixels.width();
      }
      case HEIGHT -> {
        byWidth = false;
        side = pixels.height();
      }
      default -> {
        byWidth = width >= height;
        side = pixels.maxSide();
      }
    }
    if (side == null) {
      return Optional.empty();
    }
    if (byWidth) {
      if (side >= width) return Optional.empty();
      return Optional.of(new Dimensions(side, scaleOther(height, side, width)));
    }
    if (side >= height) return Optional.empty();
    return Optional.of(new Dimensions(scaleOther(width, side, height), side));
  }

  private static Optional<Dimensions> exact(int width, int height, ResizeSpec.Pixels pixels) {
    Integer tw = pixels.width();
    Integer th = pixels.height();
    boolean shrink = (tw != null && tw < width) || (th != null && th < height);
    if (!shrink) {
      return Optional.empty();
    }
    return Optional.of(
        new Dimensions(
            tw == null ? width : Math.min(tw, width), th == null ? height : Math.min(th, height)));
  }

  private static int scaleOther(int other, int side, int driving) {
    return Math.max(1, (int) Math.round(other * (double) side / driving));
  }
}
