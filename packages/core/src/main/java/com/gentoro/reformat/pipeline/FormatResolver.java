package com.gentoro.reformat.pipeline;

import com.gentoro.reformat.codec.ImageCodec;
import com.gentoro.reformat.model.ImageFormat;
import com.gentoro.reformat.model.OutputFormat;
import java.util.ArrayList;
import java.util.List;

/** Decides the encoding written for an item from the run's output format and the source. */
public class FormatResolver {
  static final String TRANSPARENCY_WARNING =
      "Auto-switched from %s to PNG to preserve transparency";

  private final ImageCodec codec;

  public FormatResolver(ImageCodec codec) {
    this.codec = codec;
  }

  /**
   * Resolve in order: {@code SAME} to the source format (GIF and BMP become PNG), transparency
   * switch to PNG, then PNG again when the codec has no encoder for the result.
   *
   * @param source detected source encoding, {@code null} if unknown
   */
  public EffectiveFormat resolve(OutputFormat requested, ImageFormat source, boolean hasAlpha) {
    List<String> warnings = new ArrayList<>();
    ImageFormat format;
    if (requested == null || requested == OutputFormat.SAME) {
      if (source == null) {
        format = ImageFormat.PNG;
      } else if (source == ImageFormat.GIF || source == ImageFormat.BMP) {
        format = ImageFormat.PNG;
        warnings.add("Converted " + source.name() + " source to PNG");
      } else {
        format = source;
      }
    } else {
      format = requested.format();
    }

    boolean autoSwitched = false;
    if (hasAlpha && !format.supportsAlpha()) {
      warnings.add(String.format(TRANSPARENCY_WARNING, label(format)));
      format = ImageFormat.PNG;
      autoSwitched = true;
    }

    if (!codec.canEncode(format)) {
      warnings.add(format.name() + " output not supported; saved as PNG");
      format = ImageFormat.PNG;
    }
    return new EffectiveFormat(format, warnings, autoSwitched);
  }

  private static String label(ImageFormat format) {
    return format == ImageFormat.JPEG ? "JPG" : format.name();
  }
}
