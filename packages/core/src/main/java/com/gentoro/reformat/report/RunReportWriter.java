package com.gentoro.reformat.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.reformat.exception.IoException;
import com.gentoro.reformat.export.ExportResult;
import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;

/** Serializes export results as JSON run reports. */
public class RunReportWriter {
  private static final Logger log = LoggingService.getLogger(RunReportWriter.class);

  private final Clock clock;

  public RunReportWriter(Clock clock) {
    this.clock = clock;
  }

  public String toJson(ExportResult result) {
    try {
      return JacksonUtility.getJsonMapper()
          .writeValueAsString(RunReport.of(result, clock.instant()));
    } catch (JsonProcessingException e) {
      throw new IoException("Failed to serialize run report for " + result.runId(), e);
    }
  }

  public void write(ExportResult result, Path target) {
    String json = toJson(result);
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(target, json, StandardCharsets.UTF_8);
      log.info("Run report written to {}", target);
    } catch (IOException e) {
      throw new IoException("Failed to write run report " + target, e);
    }
  }
}
