package com.gentoro.reformat;

import com.gentoro.reformat.exception.ConfigurationException;
import com.gentoro.reformat.geometry.CropGeometry;
import com.gentoro.reformat.geometry.Dimensions;
import com.gentoro.reformat.model.Crop;
import com.gentoro.reformat.model.CropRatioPreset;
import com.gentoro.reformat.model.CropRect;
import com.gentoro.reformat.model.Item;
import com.gentoro.reformat.model.ItemSettings;
import com.gentoro.reformat.model.OutputFormat;
import com.gentoro.reformat.model.QualitySettings;
import com.gentoro.reformat.model.ResizeSpec;
import com.gentoro.reformat.model.RunConfig;
import com.gentoro.reformat.model.Transform;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/** Translates command-line options into a {@link RunConfig}. */
public final class RunConfigFactory {
  private RunConfigFactory() {}

  public static RunConfig fromParameters(
      StartupParameters params, QualitySettings defaults, List<Item> items) {
    try {
      RunConfig.Builder builder =
          RunConfig.builder()
              .outputFormat(OutputFormat.parse(params.getParameter("format", String.class)))
              .resize(resize(params))
              .quality(quality(params, defaults));

      String destination =
          StringUtils.trimToNull(params.getParameter("destination", String.class));
      if (destination != null) {
        builder.destinationOverride(Path.of(destination));
      }

      Transform transform = transform(params);
      for (Item item : items) {
        builder.itemSettings(item.id(), new ItemSettings(transform, crop(params, item, transform)));
      }
      return builder.build();
    } catch (ConfigurationException e) {
      throw e;
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  static ResizeSpec resize(StartupParameters params) {
    Double targetMiB = params.getParameter("target-mib", Double.class);
    if (targetMiB != null) {
      return ResizeSpec.targetSize(targetMiB);
    }
    Double percent = params.getParameter("percent", Double.class);
    if (percent != null) {
      return ResizeSpec.percent(percent);
    }
    Integer width = params.getParameter("width", Integer.class);
    Integer height = params.getParameter("height", Integer.class);
    Integer maxSide = params.getParameter("max-side", Integer.class);
    if (params.has("exact")) {
      if (width == null && height == null) {
        throw new ConfigurationException("--exact needs --width and/or --height");
      }
      return ResizeSpec.exact(width, height);
    }
    if (maxSide != null) return ResizeSpec.maxSide(maxSide);
    if (width != null) return ResizeSpec.width(width);
    if (height != null) return ResizeSpec.height(height);
    return ResizeSpec.none();
  }

  static QualitySettings quality(StartupParameters params, QualitySettings defaults) {
    return new QualitySettings(
        params.getParameter("quality-jpg", Integer.class, defaults.jpg()),
        params.getParameter("quality-webp", Integer.class, defaults.webp()),
        params.getParameter("quality-heic", Integer.class, defaults.heic()));
  }

  static Transform transform(StartupParameters params) {
    int degrees = params.getParameter("rotate", Integer.class, 0);
    if (degrees % 90 != 0) {
      throw new ConfigurationException("--rotate must be a multiple of 90, got " + degrees);
    }
    return new Transform(
        degrees / 90,
        Boolean.TRUE.equals(params.getParameter("flip-h", Boolean.class)),
        Boolean.TRUE.equals(params.getParameter("flip-v", Boolean.class)));
  }

  static Crop crop(StartupParameters params, Item item, Transform transform) {
    String rect = params.getParameter("crop", String.class);
    if (rect != null) {
      return new Crop(true, CropRatioPreset.FREE, CropRect.parse(rect).clamp());
    }
    String ratio = params.getParameter("crop-ratio", String.class);
    if (ratio != null) {
      CropRatioPreset preset = CropRatioPreset.fromLabel(ratio);
      // The crop lives in the transformed view.
      Dimensions view = CropGeometry.effectiveDimensions(item.width(), item.height(), transform);
      return new Crop(true, preset, preset.centeredRect(view.width(), view.height()));
    }
    return Crop.NONE;
  }
}
