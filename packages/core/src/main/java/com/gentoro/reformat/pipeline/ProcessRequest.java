package com.gentoro.reformat.pipeline;

import com.gentoro.reformat.codec.ImageSource;
import com.gentoro.reformat.model.Crop;
import com.gentoro.reformat.model.OutputFormat;
import com.gentoro.reformat.model.QualitySettings;
import com.gentoro.reformat.model.ResizeSpec;
import com.gentoro.reformat.model.Transform;
import com.gentoro.reformat.scheduler.TaskContext;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything needed to turn one source image into one output file.
 *
 * @param outputFormat run-level format; only consulted when {@code effectiveFormat} is absent
 * @param effectiveFormat format already resolved by the caller, or {@code null} to resolve it from
 *     the decoded image
 */
public record ProcessRequest(
    ImageSource source,
    Path destination,
    Transform transform,
    Crop crop,
    ResizeSpec resize,
    OutputFormat outputFormat,
    EffectiveFormat effectiveFormat,
    QualitySettings quality,
    TaskContext.CancelChecker cancelChecker) {

  public ProcessRequest {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
    transform = transform == null ? Transform.IDENTITY : transform;
    crop = crop == null ? Crop.NONE : crop;
    resize = resize == null ? ResizeSpec.none() : resize;
    outputFormat = outputFormat == null ? OutputFormat.SAME : outputFormat;
    quality = quality == null ? QualitySettings.DEFAULTS : quality;
    cancelChecker = cancelChecker == null ? TaskContext.CancelChecker.never() : cancelChecker;
  }

  public static Builder builder(ImageSource source, Path destination) {
    return new Builder(source, destination);
  }

  public static final class Builder {
    private final ImageSource source;
    private final Path destination;
    private Transform transform;
    private Crop crop;
    private ResizeSpec resize;
    private OutputFormat outputFormat;
    private EffectiveFormat effectiveFormat;
    private QualitySettings quality;
    private TaskContext.CancelChecker cancelChecker;

    private Builder(ImageSource source, Path destination) {
      this.source = source;
      this.destination = destination;
    }

    public Builder transform(Transform transform) {
      this.transform = transform;
      return this;
    }

    public Builder crop(Crop crop) {
      this.crop = crop;
      return this;
    }

    public Builder resize(ResizeSpec resize) {
      this.resize = resize;
      return this;
    }

    public Builder outputFormat(OutputFormat outputFormat) {
      this.outputFormat = outputFormat;
      return this;
    }

    public Builder effectiveFormat(EffectiveFormat effectiveFormat) {
      this.effectiveFormat = effectiveFormat;
      return this;
    }

    public Builder quality(QualitySettings quality) {
      this.quality = quality;
      return this;
    }

    public Builder cancelChecker(TaskContext.CancelChecker cancelChecker) {
      this.cancelChecker = cancelChecker;
      return this;
    }

    public ProcessRequest build() {
      return new ProcessRequest(
          source,
          destination,
          transform,
          crop,
          resize,
          outputFormat,
          effectiveFormat,
          quality,
          cancelChecker);
    }
  }
}
