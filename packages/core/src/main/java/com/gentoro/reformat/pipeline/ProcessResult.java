package com.gentoro.reformat.pipeline;

import com.gentoro.reformat.model.ImageFormat;
import java.nio.file.Path;
import java.util.List;

/** Outcome of {@link ImagePipeline#process}; failures are values, never exceptions. */
public record ProcessResult(
    boolean success,
    Path outputPath,
    long outputBytes,
    int width,
    int height,
    ImageFormat format,
    List<String> warnings,
    String error) {

  public ProcessResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static ProcessResult success(
      Path outputPath,
      long bytes,
      int width,
      int height,
      ImageFormat format,
      List<String> warnings) {
    return new ProcessResult(true, outputPath, bytes, width, height, format, warnings, null);
  }

  public static ProcessResult failure(String error, List<String> warnings) {
    return new ProcessResult(false, null, 0, 0, 0, null, warnings, error);
  }
}
