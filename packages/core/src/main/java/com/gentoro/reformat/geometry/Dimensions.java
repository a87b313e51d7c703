package com.gentoro.reformat.geometry;

/** Width and height in pixels. */
public record Dimensions(int width, int height) {

  public Dimensions swapped() {
    return new Dimensions(height, width);
  }

  public int maxSide() {
    return Math.max(width, height);
  }
}
