package com.gentoro.reformat.export;

import com.gentoro.reformat.model.ItemResult;
import com.gentoro.reformat.model.RunSummary;
import java.nio.file.Path;
import java.util.List;

/** Everything an export run produced, with results in item order. */
public record ExportResult(
    String runId, Path outputFolder, List<ItemResult> results, RunSummary summary) {

  public ExportResult {
    results = List.copyOf(results);
  }
}
