package com.gentoro.reformat.geometry;

import com.gentoro.reformat.model.CropRect;
import com.gentoro.reformat.model.Transform;

/**
 * Maps crop rectangles between the viewer space (the image after its {@link Transform}) and the
 * untransformed source.
 *
 * <p>A transform rotates first and flips second, so inversion undoes the flips and then the
 * rotation.
 */
public final class CropGeometry {
  private CropGeometry() {}

  /** Size of the image as seen after {@code transform}. */
  public static Dimensions effectiveDimensions(int width, int height, Transform transform) {
    Dimensions d = new Dimensions(width, height);
    return transform != null && transform.swapsAxes() ? d.swapped() : d;
  }

  /**
   * Convert a normalized viewer-space rectangle into a source pixel rectangle.
   *
   * @param rect crop relative to the transformed image, clamped into the unit square first
   * @param transform transform the user saw when drawing the crop
   * @param sourceWidth width of the untransformed (orientation-corrected) source
   * @param sourceHeight height of the untransformed source
   */
  public static PixelRect invert(
      CropRect rect, Transform transform, int sourceWidth, int sourceHeight) {
    rect = rect.clamp();
    if (transform == null || transform.isIdentity()) {
      return toPixels(rect, sourceWidth, sourceHeight);
    }
    Dimensions eff = effectiveDimensions(sourceWidth, sourceHeight, transform);

    double left = rect.x() * eff.width();
    double top = rect.y() * eff.height();
    double width = rect.width() * eff.width();
    double height = rect.height() * eff.height();

    if (transform.flipH()) {
      left = eff.width() - left - width;
    }
    if (transform.flipV()) {
      top = eff.height() - top - height;
    }

    // One counter-clockwise quarter turn per clockwise step. The space alternates between (W,H)
    // and (H,W).
    double spaceW = eff.width();
    double spaceH = eff.height();
    for (int i = 0; i < transform.rotateSteps(); i++) {
      double newLeft = top;
      double newTop = spaceW - left - width;
      double newWidth = height;
      double newHeight = width;
      left = newLeft;
      top = newTop;
      width = newWidth;
      height = newHeight;
      double tmp = spaceW;
      spaceW = spaceH;
      spaceH = tmp;
    }

    return clampToSource(
        (int) Math.round(left),
        (int) Math.round(top),
        (int) Math.round(width),
        (int) Math.round(height),
        sourceWidth,
        sourceHeight);
  }

  /** Normalized rectangle to pixels without any transform; the rectangle is clamped first. */
  public static PixelRect toPixels(CropRect rect, int width, int height) {
    CropRect r = rect.clamp();
    return clampToSource(
        (int) Math.round(r.x() * width),
        (int) Math.round(r.y() * height),
        (int) Math.round(r.width() * width),
        (int) Math.round(r.height() * height),
        width,
        height);
  }

  /** True when {@code rect} selects every pixel of a {@code width x height} image. */
  public static boolean isFullImage(PixelRect rect, int width, int height) {
    return rect.covers(width, height);
  }

  private static PixelRect clampToSource(
      int left, int top, int width, int height, int sourceWidth, int sourceHeight) {
    int l = Math.max(0, Math.min(left, sourceWidth - 1));
    int t = Math.max(0, Math.min(top, sourceHeight - 1));
    int w = Math.max(1, Math.min(width, sourceWidth - l));
    int h = Math.max(1, Math.min(height, sourceHeight - t));
    return new PixelRect(l, t, w, h);
  }
}
