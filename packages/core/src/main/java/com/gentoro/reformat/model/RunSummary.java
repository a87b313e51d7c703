package com.gentoro.reformat.model;

import java.nio.file.Path;
import java.util.List;

/** Totals of an export run. */
public record RunSummary(
    int total, int succeeded, int failed, int canceled, int autoSwitched, Path outputFolder) {

  /** Count the results in a single pass. */
  public static RunSummary of(List<ItemResult> results, Path outputFolder) {
    int succeeded = 0;
    int failed = 0;
    int canceled = 0;
    int autoSwitched = 0;
    for (ItemResult r : results) {
      switch (r.status()) {
        case COMPLETED -> succeeded++;
        case FAILED -> failed++;
        case CANCELED -> canceled++;
      }
      if (r.autoSwitched()) autoSwitched++;
    }
    return new RunSummary(results.size(), succeeded, failed, canceled, autoSwitched, outputFolder);
  }
}
