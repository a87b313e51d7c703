package com.gentoro.reformat.report;

import com.gentoro.reformat.export.ExportResult;
import com.gentoro.reformat.model.ItemResult;
import com.gentoro.reformat.model.RunSummary;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** JSON shape of a finished export run; {@code finishedAt} is ISO-8601. */
public record RunReport(
    String runId,
    String finishedAt,
    String outputFolder,
    Summary summary,
    List<Entry> items) {

  public record Summary(int total, int succeeded, int failed, int canceled, int autoSwitched) {}

  public record Entry(
      String itemId,
      String status,
      String outputPath,
      long outputBytes,
      int width,
      int height,
      List<String> warnings,
      String error) {}

  public static RunReport of(ExportResult result, Instant finishedAt) {
    RunSummary s = result.summary();
    List<Entry> entries = new ArrayList<>(result.results().size());
    for (ItemResult r : result.results()) {
      entries.add(
          new Entry(
              r.itemId(),
              r.status().name().toLowerCase(Locale.ROOT),
              r.outputPath() == null ? null : r.outputPath().toString(),
              r.outputBytes(),
              r.width(),
              r.height(),
              r.warnings(),
              r.error()));
    }
    return new RunReport(
        result.runId(),
        finishedAt.toString(),
        result.outputFolder().toString(),
        new Summary(s.total(), s.succeeded(), s.failed(), s.canceled(), s.autoSwitched()),
        entries);
  }
}
