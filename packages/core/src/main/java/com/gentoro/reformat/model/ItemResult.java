package com.gentoro.reformat.model;

import java.nio.file.Path;
import java.util.List;

/** Outcome of one item, as reported to the caller of an export run. */
public record ItemResult(
    String itemId,
    ItemStatus status,
    Path outputPath,
    long outputBytes,
    int width,
    int height,
    List<String> warnings,
    String error,
    boolean autoSwitched) {

  public ItemResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static ItemResult failed(String itemId, String error, List<String> warnings) {
    return new ItemResult(itemId, ItemStatus.FAILED, null, 0, 0, 0, warnings, error, false);
  }

  public static ItemResult canceled(String itemId) {
    return new ItemResult(itemId, ItemStatus.CANCELED, null, 0, 0, 0, List.of(), null, false);
  }
}
