package com.gentoro.reformat.codec;

import com.gentoro.reformat.model.ImageFormat;

/**
 * Header information read without decoding pixels.
 *
 * @param width stored width, before orientation correction
 * @param height stored height, before orientation correction
 * @param format detected encoding, {@code null} if unknown
 * @param orientation EXIF orientation {@code 1..8}, {@code 1} when absent
 */
public record ImageInfo(
    int width, int height, ImageFormat format, boolean hasAlpha, int orientation) {

  /** Dimensions as displayed, i.e. after orientation correction. */
  public int displayWidth() {
    return Orientation.swapsAxes(orientation) ? height : width;
  }

  public int displayHeight() {
    return Orientation.swapsAxes(orientation) ? width : height;
  }
}
