package com.gentoro.reformat.codec;

import com.gentoro.reformat.model.Transform;

/** EXIF orientation tag values and the transform that makes the image upright. */
public final class Orientation {
  public static final int NORMAL = 1;

  private Orientation() {}

  public static boolean isValid(int orientation) {
    return orientation >= 1 && orientation <= 8;
  }

  /** Correction for an orientation value; unknown values are treated as upright. */
  public static Transform correction(int orientation) {
    switch (orientation) {
      case 2:
        return new Transform(0, true, false);
      case 3:
        return new Transform(2, false, false);
      case 4:
        return new Transform(0, false, true);
      case 5:
        // transpose
        return new Transform(1, true, false);
      case 6:
        return new Transform(1, false, false);
      case 7:
        // transverse
        return new Transform(3, true, false);
      case 8:
        return new Transform(3, false, false);
      default:
        return Transform.IDENTITY;
    }
  }

  public static boolean swapsAxes(int orientation) {
    return correction(orientation).swapsAxes();
  }
}
