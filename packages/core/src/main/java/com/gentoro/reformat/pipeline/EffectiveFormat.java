package com.gentoro.reformat.pipeline;

import com.gentoro.reformat.model.ImageFormat;
import java.util.List;

/**
 * Encoding that will actually be written for an item.
 *
 * @param warnings why the format differs from what was asked for, if it does
 * @param autoSwitched whether the format was changed to keep transparency
 */
public record EffectiveFormat(ImageFormat format, List<String> warnings, boolean autoSwitched) {

  public EffectiveFormat {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static EffectiveFormat of(ImageFormat format) {
    return new EffectiveFormat(format, List.of(), false);
  }

  public String extension() {
    return format.extension();
  }
}
