package com.gentoro.reformat.sizing;

/** Encodes an image at the given dimensions and reports the resulting size. */
@FunctionalInterface
public interface EncodeSizeOracle {
  long encodedSize(int width, int height, int quality);
}
