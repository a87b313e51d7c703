package com.gentoro.reformat;

import com.gentoro.reformat.exception.ErrorDetails;
import com.gentoro.reformat.exception.ExceptionUtil;
import com.gentoro.reformat.exception.ReformatErrorCode;
import com.gentoro.reformat.export.ExportResult;
import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.model.Item;
import com.gentoro.reformat.model.ItemResult;
import com.gentoro.reformat.model.ItemStatus;
import com.gentoro.reformat.model.RunConfig;
import com.gentoro.reformat.model.RunSummary;
import com.gentoro.reformat.sizing.ByteUnits;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;

/** Command-line entry point. */
public class ReformatApp {
  private static final Logger log = LoggingService.getLogger(ReformatApp.class);

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_ITEMS_FAILED = 2;

  static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage: reformat [options] <image> [<image> ...]",
          "  --config-file <path>     YAML configuration (default: classpath application.yaml)",
          "  --format <fmt>           same|jpg|png|webp|tiff|heic|bmp",
          "  --percent <p>            scale to p percent (1..1000)",
          "  --width <px>             resize to width, keeping the ratio",
          "  --height <px>            resize to height, keeping the ratio",
          "  --max-side <px>          resize the longer side",
          "  --exact                  use --width/--height as given",
          "  --target-mib <mib>       search for an output size in MiB",
          "  --quality-jpg|--quality-webp|--quality-heic <40..100>",
          "  --rotate <deg>           clockwise rotation, multiple of 90",
          "  --flip-h, --flip-v       mirror after rotating",
          "  --crop x,y,w,h           normalized crop in the rotated view",
          "  --crop-ratio <ratio>     centered crop: original|1:1|4:5|3:4|9:16|16:9|2:3|3:2",
          "  --destination <folder>   output folder, relative to the output root",
          "  --concurrency <n>        parallel workers",
          "  --report <file.json>     write a JSON run report");

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  static int run(String[] args, PrintStream out) {
    Reformat app = null;
    try {
      StartupParameters params = new StartupParameters(args);
      if (params.has("help") || params.positional().isEmpty()) {
        out.println(USAGE);
        return params.has("help") ? EXIT_OK : EXIT_ERROR;
      }

      app = new Reformat(args);
      app.initialize();

      List<Item> items = new ItemImporter(app.codec()).importFiles(params.positional());
      RunConfig config = RunConfigFactory.fromParameters(params, app.qualityDefaults(), items);
      ExportResult result =
          app.export(
              items,
              config,
              progress ->
                  out.printf(
                      "[%d/%d] %s %s%n",
                      progress.completed(),
                      progress.total(),
                      progress.latest().itemId(),
                      progress.latest().status().name().toLowerCase(Locale.ROOT)));

      printSummary(result, out);
      String report = params.getParameter("report", String.class);
      if (report != null) {
        app.reportWriter().write(result, Path.of(report));
      }
      return result.summary().failed() > 0 ? EXIT_ITEMS_FAILED : EXIT_OK;
    } catch (Exception e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      String message = ExceptionUtil.extractErrorMessage(e);
      log.error("Reformat failed [{}]: {} {}", details.code(), message, details.context());
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      out.println("Error: " + message);
      if (details.code() == ReformatErrorCode.CONFIGURATION_ERROR) {
        out.println("Run with --help for usage.");
      }
      return EXIT_ERROR;
    } finally {
      if (app != null) {
        app.shutdown();
      }
    }
  }

  static void printSummary(ExportResult result, PrintStream out) {
    for (ItemResult r : result.results()) {
      if (r.status() == ItemStatus.COMPLETED) {
        out.printf(
            "  %s -> %s (%dx%d, %s MiB)%n",
            r.itemId(),
            r.outputPath(),
            r.width(),
            r.height(),
            ByteUnits.formatMiB(r.outputBytes()));
      } else if (r.status() == ItemStatus.FAILED) {
        out.printf("  %s failed: %s%n", r.itemId(), r.error());
      }
      for (String warning : r.warnings()) {
        out.printf("    warning: %s%n", warning);
      }
    }
    RunSummary s = result.summary();
    out.printf(
        "%d succeeded, %d failed, %d canceled, %d auto-switched. Output: %s%n",
        s.succeeded(), s.failed(), s.canceled(), s.autoSwitched(), s.outputFolder());
  }
}
