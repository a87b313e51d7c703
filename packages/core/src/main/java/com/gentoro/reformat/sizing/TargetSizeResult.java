package com.gentoro.reformat.sizing;

/**
 * Outcome of a target size search.
 *
 * @param success whether the encoded size landed within tolerance (or the source was already
 *     smaller than the target)
 * @param scale factor relative to the source dimensions
 * @param warning explanation when the target could not be met exactly, otherwise {@code null}
 * @param iterations number of encodes performed
 */
public record TargetSizeResult(
    boolean success,
    int width,
    int height,
    long bytes,
    double scale,
    String warning,
    int iterations) {

  public boolean hasWarning() {
    return warning != null;
  }
}
