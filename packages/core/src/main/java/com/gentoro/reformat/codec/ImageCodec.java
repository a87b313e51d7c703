package com.gentoro.reformat.codec;

import com.gentoro.reformat.geometry.PixelRect;
import com.gentoro.reformat.model.ImageFormat;
import com.gentoro.reformat.model.Transform;
import java.awt.image.BufferedImage;

/**
 * Decode, encode and pixel-geometry primitives used by the image pipeline.
 *
 * <p>All operations return new images and leave their input untouched. Failures surface as
 * {@link com.gentoro.reformat.exception.CodecException}.
 */
public interface ImageCodec {

  /** Read dimensions, format, alpha and orientation without decoding pixels. */
  ImageInfo probe(ImageSource source);

  /** Decode pixels as stored; orientation is reported, not applied. */
  DecodedImage decode(ImageSource source);

  /** Rotate clockwise by {@code steps} quarter turns. */
  BufferedImage rotateQuarterTurns(BufferedImage image, int steps);

  BufferedImage flipHorizontal(BufferedImage image);

  BufferedImage flipVertical(BufferedImage image);

  BufferedImage extract(BufferedImage image, PixelRect region);

  /** Scale to exactly {@code width x height}. */
  BufferedImage resize(BufferedImage image, int width, int height);

  /** Convert pixels into the sRGB color space. */
  BufferedImage toSrgb(BufferedImage image);

  /**
   * Encode to {@code format}.
   *
   * @param quality {@code 40..100}; ignored by formats without a quality setting
   */
  byte[] encode(BufferedImage image, ImageFormat format, int quality);

  boolean canEncode(ImageFormat format);

  /** Apply a transform: rotation first, then flips. */
  default BufferedImage apply(BufferedImage image, Transform transform) {
    if (transform == null || transform.isIdentity()) {
      return image;
    }
    BufferedImage result = image;
    if (transform.rotateSteps() != 0) {
      result = rotateQuarterTurns(result, transform.rotateSteps());
    }
    if (transform.flipH()) {
      result = flipHorizontal(result);
    }
    if (transform.flipV()) {
      result = flipVertical(result);
    }
    return result;
  }
}
