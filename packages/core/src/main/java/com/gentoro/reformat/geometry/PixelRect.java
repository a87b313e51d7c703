package com.gentoro.reformat.geometry;

/** Integer pixel rectangle, top-left origin. */
public record PixelRect(int left, int top, int width, int height) {

  public static PixelRect full(int width, int height) {
    return new PixelRect(0, 0, width, height);
  }

  public int right() {
    return left + width;
  }

  public int bottom() {
    return top + height;
  }

  public boolean covers(int imageWidth, int imageHeight) {
    return left == 0 && top == 0 && width == imageWidth && height == imageHeight;
  }
}
