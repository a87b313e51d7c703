package com.gentoro.reformat;

import com.gentoro.reformat.codec.ImageCodec;
import com.gentoro.reformat.codec.Java2dImageCodec;
import com.gentoro.reformat.exception.StateException;
import com.gentoro.reformat.export.ExportOrchestrator;
import com.gentoro.reformat.export.ExportProgressListener;
import com.gentoro.reformat.export.ExportResult;
import com.gentoro.reformat.export.ExportSettings;
import com.gentoro.reformat.export.InMemoryBufferSource;
import com.gentoro.reformat.export.RunIdGenerator;
import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.model.Item;
import com.gentoro.reformat.model.QualitySettings;
import com.gentoro.reformat.model.RunConfig;
import com.gentoro.reformat.pipeline.ImagePipeline;
import com.gentoro.reformat.report.RunReportWriter;
import com.gentoro.reformat.scheduler.CancellationToken;
import com.gentoro.reformat.sizing.SizingSettings;
import com.gentoro.reformat.sizing.TargetSizeSearch;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Application context: loads configuration once and wires codec, pipeline and orchestrator.
 *
 * <p>Only one export runs at a time through {@link #export}; {@link #cancel()} and the JVM
 * shutdown hook cancel it cooperatively. {@link #shutdown()} releases the hook.
 */
public class Reformat {
  private static final Logger log = LoggingService.getLogger(Reformat.class);

  private final StartupParameters startupParameters;
  private final Clock clock;
  private ConfigurationProvider configurationProvider;
  private ImageCodec codec;
  private InMemoryBufferSource buffers;
  private ImagePipeline pipeline;
  private ExportOrchestrator orchestrator;
  private ExportSettings exportSettings;
  private QualitySettings qualityDefaults;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicReference<CancellationToken> activeRun = new AtomicReference<>();
  private volatile Thread shutdownHook;

  public Reformat(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), Clock.systemDefaultZone());
  }

  public Reformat(StartupParameters startupParameters, Clock clock) {
    this.startupParameters = startupParameters;
    this.clock = clock;
  }

  public void initialize() {
    if (!initialized.compareAndSet(false, true)) {
      throw new StateException("Reformat is already initialized");
    }
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Logging levels first, so everything below logs at the configured level.
    LoggingService.applyConfiguration(configuration());

    this.exportSettings = ExportSettings.fromConfiguration(configuration());
    Integer concurrency = startupParameters.getParameter("concurrency", Integer.class);
    if (concurrency != null) {
      exportSettings =
          new ExportSettings(
              concurrency,
              exportSettings.outputRoot(),
              exportSettings.folderSuffix(),
              exportSettings.fileSuffix(),
              exportSettings.dateFolderPrefix(),
              exportSettings.maxCollisionAttempts());
    }
    this.qualityDefaults = QualitySettings.fromConfiguration(configuration());

    this.codec = new Java2dImageCodec();
    this.buffers = new InMemoryBufferSource();
    this.pipeline =
        new ImagePipeline(
            codec, new TargetSizeSearch(SizingSettings.fromConfiguration(configuration())));
    this.orchestrator =
        new ExportOrchestrator(
            pipeline, exportSettings, buffers, RunIdGenerator.sequential(clock), clock);
    log.debug(
        "Initialized: output root {}, concurrency {}",
        exportSettings.outputRoot(),
        exportSettings.concurrency());
  }

  /** Run one export, cancellable through {@link #cancel()} while it is in progress. */
  public ExportResult export(List<Item> items, RunConfig config, ExportProgressListener listener) {
    requireInitialized();
    CancellationToken token = new CancellationToken();
    if (!activeRun.compareAndSet(null, token)) {
      throw new StateException("An export is already running");
    }
    registerShutdownHook();
    try {
      return orchestrator.exportBatch(items, config, token, listener);
    } finally {
      activeRun.set(null);
    }
  }

  /** Cancel the running export, if any. */
  public boolean cancel() {
    CancellationToken token = activeRun.get();
    if (token == null) return false;
    log.info("Cancelling running export");
    return token.cancel();
  }

  /** Cancel any running export and unregister the shutdown hook. Safe to call repeatedly. */
  public void shutdown() {
    cancel();
    Thread hook;
    synchronized (this) {
      hook = shutdownHook;
      shutdownHook = null;
    }
    if (hook != null) {
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException e) {
        // The JVM is already shutting down and the hook is running.
        log.debug("Shutdown hook not removed: {}", e.getMessage());
      }
    }
  }

  boolean hasShutdownHook() {
    return shutdownHook != null;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public ImageCodec codec() {
    requireInitialized();
    return codec;
  }

  /** Store for in-memory captures exported as {@code MEMORY} items. */
  public InMemoryBufferSource buffers() {
    requireInitialized();
    return buffers;
  }

  public ExportSettings exportSettings() {
    requireInitialized();
    return exportSettings;
  }

  public QualitySettings qualityDefaults() {
    requireInitialized();
    return qualityDefaults;
  }

  public RunReportWriter reportWriter() {
    return new RunReportWriter(clock);
  }

  private void registerShutdownHook() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::cancel, "reformat-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
  }

  private void requireInitialized() {
    if (!initialized.get()) {
      throw new StateException("Reformat has not been initialized");
    }
  }
}
