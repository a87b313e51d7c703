package com.gentoro.reformat.export;

import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.model.Item;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Chooses the folder a run writes into.
 *
 * <ol>
 *   <li>An explicit destination wins; relative destinations live under the output root.
 *   <li>Without any file item the folder is date stamped, {@code Reformat_2024-05-01}.
 *   <li>When all file items share one parent directory the folder is named after it, {@code
 *       holiday_reformat}.
 *   <li>Otherwise the folder is date stamped.
 * </ol>
 */
public class OutputFolderResolver {
  private static final Logger log = LoggingService.getLogger(OutputFolderResolver.class);
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

  private final ExportSettings settings;
  private final Clock clock;

  public OutputFolderResolver(ExportSettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
  }

  public Path resolve(List<Item> items, Path destinationOverride) {
    Path root = settings.outputRoot();
    if (destinationOverride != null) {
      Path folder =
          destinationOverride.isAbsolute()
              ? destinationOverride
              : root.resolve(destinationOverride);
      log.debug("Using destination override {}", folder);
      return folder;
    }
    Path folder = root.resolve(subfolderFor(items));
    log.debug("Resolved output folder {} for {} item(s)", folder, items.size());
    return folder;
  }

  /** Folder name below the output root. */
  public String subfolderFor(List<Item> items) {
    Set<String> parents = new LinkedHashSet<>();
    String firstPath = null;
    for (Item item : items) {
      if (!item.isFile() || item.sourcePath() == null) continue;
      String path = item.sourcePath().toString();
      if (firstPath == null) firstPath = path;
      String parent = PathCanonicalizer.parent(path);
      if (parent != null) {
        parents.add(PathCanonicalizer.key(parent));
      }
    }
    if (firstPath == null) {
      return dateFolder();
    }
    if (parents.size() == 1) {
      String name = PathCanonicalizer.parentName(firstPath);
      if (name != null) {
        return name + settings.folderSuffix();
      }
    }
    return dateFolder();
  }

  String dateFolder() {
    return settings.dateFolderPrefix() + LocalDate.now(clock).format(DATE);
  }
}
