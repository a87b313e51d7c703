package com.gentoro.reformat.export;

import com.gentoro.reformat.codec.ImageSource;
import com.gentoro.reformat.exception.ExceptionUtil;
import com.gentoro.reformat.exception.ExportException;
import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.model.Item;
import com.gentoro.reformat.model.ItemResult;
import com.gentoro.reformat.model.ItemSettings;
import com.gentoro.reformat.model.ItemStatus;
import com.gentoro.reformat.model.RunConfig;
import com.gentoro.reformat.model.RunSummary;
import com.gentoro.reformat.pipeline.EffectiveFormat;
import com.gentoro.reformat.pipeline.ImagePipeline;
import com.gentoro.reformat.pipeline.ProcessRequest;
import com.gentoro.reformat.pipeline.ProcessResult;
import com.gentoro.reformat.scheduler.CancellationToken;
import com.gentoro.reformat.scheduler.PoolProgress;
import com.gentoro.reformat.scheduler.ProgressListener;
import com.gentoro.reformat.scheduler.Task;
import com.gentoro.reformat.scheduler.TaskContext;
import com.gentoro.reformat.scheduler.TaskResult;
import com.gentoro.reformat.scheduler.WorkerPool;
import com.gentoro.reformat.utility.BestEffort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Runs a batch export: output folder, collision-free paths, one pipeline task per item, results.
 *
 * <p>Everything up to task submission happens sequentially on the calling thread. Failing to
 * prepare the output folder aborts the run with {@link ExportException}; problems with single items
 * only fail those items.
 */
public class ExportOrchestrator {
  private static final Logger log = LoggingService.getLogger(ExportOrchestrator.class);

  static final String MISSING_BUFFER = "Clipboard buffer not found";
  static final String MISSING_PATH = "Source path not found";

  private final ImagePipeline pipeline;
  private final ExportSettings settings;
  private final BufferSource buffers;
  private final RunIdGenerator runIds;
  private final OutputFolderResolver folderResolver;

  public ExportOrchestrator(
      ImagePipeline pipeline,
      ExportSettings settings,
      BufferSource buffers,
      RunIdGenerator runIds,
      Clock clock) {
    this.pipeline = pipeline;
    this.settings = settings;
    this.buffers = buffers == null ? BufferSource.empty() : buffers;
    this.runIds = runIds;
    this.folderResolver = new OutputFolderResolver(settings, clock);
  }

  public ExportResult exportBatch(List<Item> items, RunConfig config) {
    return exportBatch(items, config, null, null);
  }

  /**
   * Export all items and block until every item has resolved.
   *
   * @param token optional; cancelling stops items that have not started yet
   * @param listener optional; receives an update after every item
   * @throws ExportException if the output folder cannot be prepared or no free name exists
   */
  public ExportResult exportBatch(
      List<Item> items,
      RunConfig config,
      CancellationToken token,
      ExportProgressListener listener) {
    String runId = runIds.nextRunId();
    List<Item> batch = List.copyOf(items);
    Path folder = folderResolver.resolve(batch, config.destinationOverride());
    log.info("Export {} started: {} item(s) into {}", runId, batch.size(), folder);

    try {
      Files.createDirectories(folder);
    } catch (IOException | RuntimeException e) {
      log.error("Cannot create output folder {}: {}", folder, e.toString());
      throw new ExportException("Cannot create output folder " + folder, e)
          .withContext("runId", runId);
    }

    // Sequential barrier: formats and names are fixed before anything runs concurrently.
    OutputPathResolver paths = new OutputPathResolver(folder, settings);
    List<Task<ItemResult>> tasks = new ArrayList<>(batch.size());
    for (Item item : batch) {
      EffectiveFormat format =
          pipeline.formatResolver().resolve(config.outputFormat(), item.format(), item.hasAlpha());
      Path output = paths.reserve(displayName(item), format.extension());
      tasks.add(ctx -> processItem(item, config, format, output, ctx.cancelChecker()));
    }

    WorkerPool pool = new WorkerPool(settings.concurrency());
    List<TaskResult<ItemResult>> taskResults =
        pool.run(
            tasks, token, listener == null ? null : new ProgressRelay(runId, batch, listener));

    List<ItemResult> results = new ArrayList<>(taskResults.size());
    for (TaskResult<ItemResult> tr : taskResults) {
      results.add(toItemResult(batch.get(tr.index()), tr));
    }
    RunSummary summary = RunSummary.of(results, folder);
    log.info(
        "Export {} finished: {} succeeded, {} failed, {} canceled",
        runId,
        summary.succeeded(),
        summary.failed(),
        summary.canceled());
    return new ExportResult(runId, folder, results, summary);
  }

  private ItemResult processItem(
      Item item,
      RunConfig config,
      EffectiveFormat format,
      Path output,
      TaskContext.CancelChecker cancel) {
    Optional<ImageSource> source = sourceOf(item);
    if (source.isEmpty()) {
      String error = item.isFile() ? MISSING_PATH : MISSING_BUFFER;
      log.warn("Item {} skipped: {}", item.id(), error);
      return ItemResult.failed(item.id(), error, format.warnings());
    }

    ItemSettings itemSettings = config.settingsFor(item.id());
    ProcessRequest request =
        ProcessRequest.builder(source.get(), output)
            .transform(itemSettings.transform())
            .crop(itemSettings.crop())
            .resize(config.resize())
            .outputFormat(config.outputFormat())
            .effectiveFormat(format)
            .quality(config.quality())
            .cancelChecker(cancel)
            .build();
    ProcessResult result = pipeline.process(request);

    if (!result.success()) {
      return new ItemResult(
          item.id(), ItemStatus.FAILED, null, 0, 0, 0, result.warnings(), result.error(),
          format.autoSwitched());
    }
    if (item.isFile()) {
      BestEffort.attempt(
          "preserve modification time of " + output,
          () -> Files.setLastModifiedTime(output, Files.getLastModifiedTime(item.sourcePath())));
    }
    return new ItemResult(
        item.id(),
        ItemStatus.COMPLETED,
        result.outputPath(),
        result.outputBytes(),
        result.width(),
        result.height(),
        result.warnings(),
        null,
        format.autoSwitched());
  }

  private Optional<ImageSource> sourceOf(Item item) {
    if (item.isFile()) {
      return Optional.ofNullable(item.sourcePath())
          .filter(path -> Files.isRegularFile(path))
          .map(ImageSource::of);
    }
    return buffers.buffer(item.id()).map(bytes -> ImageSource.of(bytes, displayName(item)));
  }

  private static String displayName(Item item) {
    if (!item.isFile()) {
      return "clipboard";
    }
    if (item.originalName() != null && !item.originalName().isBlank()) {
      return item.originalName();
    }
    Path name = item.sourcePath() == null ? null : item.sourcePath().getFileName();
    return name == null ? item.id() : name.toString();
  }

  private static ItemResult toItemResult(Item item, TaskResult<ItemResult> tr) {
    switch (tr.status()) {
      case SUCCEEDED:
        return tr.value();
      case CANCELED:
        return ItemResult.canceled(item.id());
      default:
        return ItemResult.failed(item.id(), ExceptionUtil.extractErrorMessage(tr.error()), null);
    }
  }

  /**
   * Re-publishes pool progress per item status: an item whose task returned a failed result still
   * counts as failed here although the pool saw the task succeed.
   */
  private static final class ProgressRelay implements ProgressListener<ItemResult> {
    private final String runId;
    private final List<Item> batch;
    private final ExportProgressListener listener;
    private int succeeded;
    private int failed;
    private int canceled;

    ProgressRelay(String runId, List<Item> batch, ExportProgressListener listener) {
      this.runId = runId;
      this.batch = batch;
      this.listener = listener;
    }

    @Override
    public void onProgress(PoolProgress<ItemResult> progress) {
      TaskResult<ItemResult> latest = progress.latest();
      ItemResult item = toItemResult(batch.get(latest.index()), latest);
      switch (item.status()) {
        case COMPLETED -> succeeded++;
        case FAILED -> failed++;
        case CANCELED -> canceled++;
      }
      listener.onProgress(
          new ExportProgress(
              runId, progress.total(), progress.completed(), succeeded, failed, canceled, item));
    }
  }
}
