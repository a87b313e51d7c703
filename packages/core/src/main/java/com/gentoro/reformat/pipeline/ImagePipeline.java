package com.gentoro.reformat.pipeline;

import com.gentoro.reformat.codec.DecodedImage;
import com.gentoro.reformat.codec.ImageCodec;
import com.gentoro.reformat.codec.Orientation;
import com.gentoro.reformat.exception.ExceptionUtil;
import com.gentoro.reformat.geometry.CropGeometry;
import com.gentoro.reformat.geometry.Dimensions;
import com.gentoro.reformat.geometry.PixelRect;
import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.model.ResizeSpec;
import com.gentoro.reformat.scheduler.TaskCanceledException;
import com.gentoro.reformat.sizing.TargetSizeResult;
import com.gentoro.reformat.sizing.TargetSizeSearch;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Turns one source image into one output file.
 *
 * <p>Steps always run in this order: decode and orientation correction, crop (extracted in source
 * space from the inverted viewer rectangle), transform, resize, sRGB conversion, encode, cancel
 * check, write. Extracting before transforming selects exactly the pixels the user framed in the
 * transformed view.
 *
 * <p>Any failure becomes a {@link ProcessResult#failure}; only {@link TaskCanceledException}
 * escapes.
 */
public class ImagePipeline {
  private static final Logger log = LoggingService.getLogger(ImagePipeline.class);

  private final ImageCodec codec;
  private final FormatResolver formatResolver;
  private final TargetSizeSearch targetSizeSearch;

  public ImagePipeline(ImageCodec codec, TargetSizeSearch targetSizeSearch) {
    this(codec, new FormatResolver(codec), targetSizeSearch);
  }

  public ImagePipeline(
      ImageCodec codec, FormatResolver formatResolver, TargetSizeSearch targetSizeSearch) {
    this.codec = codec;
    this.formatResolver = formatResolver;
    this.targetSizeSearch = targetSizeSearch;
  }

  public FormatResolver formatResolver() {
    return formatResolver;
  }

  public ProcessResult process(ProcessRequest request) {
    List<String> warnings = new ArrayList<>();
    try {
      DecodedImage decoded = codec.decode(request.source());
      BufferedImage image =
          codec.apply(decoded.image(), Orientation.correction(decoded.orientation()));

      if (request.crop().isEffective()) {
        PixelRect region =
            CropGeometry.invert(
                request.crop().rect(), request.transform(), image.getWidth(), image.getHeight());
        log.debug("Crop {} of {} maps to source region {}", request.crop().rect(),
            request.source(), region);
        image = codec.extract(image, region);
      }
      image = codec.apply(image, request.transform());

      EffectiveFormat format = request.effectiveFormat();
      if (format == null) {
        format =
            formatResolver.resolve(request.outputFormat(), decoded.format(), decoded.hasAlpha());
      }
      warnings.addAll(format.warnings());
      int quality = request.quality().forFormat(format.format());

      image = resize(image, request.resize(), format, quality, warnings);
      image = codec.toSrgb(image);
      byte[] bytes = codec.encode(image, format.format(), quality);

      if (request.cancelChecker().isCancelled()) {
        throw new TaskCanceledException();
      }
      Path destination = request.destination();
      Path parent = destination.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.write(destination, bytes);

      return ProcessResult.success(
          destination, bytes.length, image.getWidth(), image.getHeight(), format.format(),
          warnings);
    } catch (TaskCanceledException e) {
      throw e;
    } catch (Exception e) {
      String message = ExceptionUtil.extractErrorMessage(e);
      log.warn("Processing {} failed: {}", request.source(), message);
      log.debug("Processing failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      return ProcessResult.failure(message, warnings);
    }
  }

  private BufferedImage resize(
      BufferedImage image,
      ResizeSpec spec,
      EffectiveFormat format,
      int quality,
      List<String> warnings) {
    int width = image.getWidth();
    int height = image.getHeight();

    if (spec instanceof ResizeSpec.TargetSize target) {
      BufferedImage base = image;
      TargetSizeResult result =
          targetSizeSearch.findTargetSize(
              width,
              height,
              target.megabytes(),
              quality,
              (w, h, q) -> encodedSize(base, w, h, format, q));
      log.debug("Target size search for {} MiB: {}", target.megabytes(), result);
      if (!result.success() && result.iterations() == 0) {
        // Rejected before any candidate was encoded; there is nothing to fall back on.
        throw new IllegalArgumentException(result.warning());
      }
      if (result.warning() != null) {
        warnings.add(result.warning());
      }
      return scaled(image, result.width(), result.height());
    }

    Optional<Dimensions> dims = ResizeCalculator.targetFor(width, height, spec);
    if (dims.isPresent()) {
      return codec.resize(image, dims.get().width(), dims.get().height());
    }
    return image;
  }

  private long encodedSize(BufferedImage base, int w, int h, EffectiveFormat format, int quality) {
    return codec.encode(codec.toSrgb(scaled(base, w, h)), format.format(), quality).length;
  }

  /** Resize when the candidate is smaller on either axis, never enlarging. */
  private BufferedImage scaled(BufferedImage image, int width, int height) {
    int w = Math.min(width, image.getWidth());
    int h = Math.min(height, image.getHeight());
    if (w == image.getWidth() && h == image.getHeight()) {
      return image;
    }
    return codec.resize(image, w, h);
  }
}
