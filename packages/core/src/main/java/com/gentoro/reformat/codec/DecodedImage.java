package com.gentoro.reformat.codec;

import com.gentoro.reformat.model.ImageFormat;
import java.awt.image.BufferedImage;

/** Pixels as stored in the file plus what is needed to interpret them. */
public record DecodedImage(BufferedImage image, ImageFormat format, int orientation) {

  public boolean hasAlpha() {
    return image.getColorModel().hasAlpha();
  }
}
