package com.gentoro.reformat.model;

/**
 * Rotation in clockwise quarter turns followed by optional flips.
 *
 * <p>{@code rotateSteps} is normalized into {@code 0..3}. Two values can describe the same pixel
 * mapping: both flips equal a half turn.
 */
public record Transform(int rotateSteps, boolean flipH, boolean flipV) {
  public static final Transform IDENTITY = new Transform(0, false, false);

  public Transform {
    rotateSteps = Math.floorMod(rotateSteps, 4);
  }

  public static Transform identity() {
    return IDENTITY;
  }

  public static Transform rotation(int steps) {
    return new Transform(steps, false, false);
  }

  public Transform rotateCw() {
    return new Transform(rotateSteps + 1, flipH, flipV);
  }

  public Transform rotateCcw() {
    return new Transform(rotateSteps + 3, flipH, flipV);
  }

  public Transform toggleFlipH() {
    return new Transform(rotateSteps, !flipH, flipV);
  }

  public Transform toggleFlipV() {
    return new Transform(rotateSteps, flipH, !flipV);
  }

  public boolean isIdentity() {
    return rotateSteps == 0 && !flipH && !flipV;
  }

  /** True when the transform exchanges width and height. */
  public boolean swapsAxes() {
    return rotateSteps % 2 == 1;
  }

  public int degrees() {
    return rotateSteps * 90;
  }

  /**
   * Compose: the returned transform equals applying {@code this} and then {@code next}.
   *
   * <p>An odd rotation in {@code next} exchanges the axes our flips were applied to.
   */
  public Transform then(Transform next) {
    boolean h = flipH;
    boolean v = flipV;
    if (next.swapsAxes()) {
      boolean tmp = h;
      h = v;
      v = tmp;
    }
    return new Transform(rotateSteps + next.rotateSteps, h != next.flipH, v != next.flipV);
  }
}
