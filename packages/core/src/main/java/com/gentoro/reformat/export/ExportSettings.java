package com.gentoro.reformat.export;

import com.gentoro.reformat.exception.ConfigurationException;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Export tunables read from the {@code export.*} configuration keys.
 *
 * @param outputRoot folder under which run folders are created
 * @param folderSuffix appended to the shared source folder name, {@code _reformat}
 * @param fileSuffix appended to every output base name, {@code _reformat}
 * @param dateFolderPrefix prefix of date-stamped folders, {@code Reformat_}
 */
public record ExportSettings(
    int concurrency,
    Path outputRoot,
    String folderSuffix,
    String fileSuffix,
    String dateFolderPrefix,
    int maxCollisionAttempts) {

  public static final int DEFAULT_CONCURRENCY = 4;
  public static final int DEFAULT_MAX_COLLISION_ATTEMPTS = 10_000;

  public ExportSettings {
    if (concurrency < 1) {
      throw new ConfigurationException("export.concurrency must be at least 1: " + concurrency);
    }
    if (maxCollisionAttempts < 1) {
      throw new ConfigurationException(
          "export.max-collision-attempts must be at least 1: " + maxCollisionAttempts);
    }
    if (outputRoot == null) {
      throw new ConfigurationException("export.output-root is required");
    }
    folderSuffix = folderSuffix == null ? "" : folderSuffix;
    fileSuffix = fileSuffix == null ? "" : fileSuffix;
    dateFolderPrefix = dateFolderPrefix == null ? "" : dateFolderPrefix;
  }

  public static Path defaultOutputRoot() {
    return Path.of(System.getProperty("user.home"), "Downloads");
  }

  /** Defaults with a custom output root. */
  public static ExportSettings defaults(Path outputRoot) {
    return new ExportSettings(
        DEFAULT_CONCURRENCY,
        outputRoot,
        "_reformat",
        "_reformat",
        "Reformat_",
        DEFAULT_MAX_COLLISION_ATTEMPTS);
  }

  public static ExportSettings fromConfiguration(Configuration config) {
    String root = StringUtils.trimToNull(config.getString("export.output-root", null));
    Path outputRoot;
    try {
      outputRoot = root == null ? defaultOutputRoot() : Path.of(expandHome(root));
    } catch (RuntimeException e) {
      throw new ConfigurationException("Invalid export.output-root: " + root, e);
    }
    try {
      return new ExportSettings(
          config.getInt("export.concurrency", DEFAULT_CONCURRENCY),
          outputRoot,
          config.getString("export.folder-suffix", "_reformat"),
          config.getString("export.file-suffix", "_reformat"),
          config.getString("export.date-folder-prefix", "Reformat_"),
          config.getInt("export.max-collision-attempts", DEFAULT_MAX_COLLISION_ATTEMPTS));
    } catch (ConfigurationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigurationException("Invalid export configuration: " + e.getMessage(), e);
    }
  }

  private static String expandHome(String value) {
    if (value.equals("~")) return System.getProperty("user.home");
    if (value.startsWith("~/")) return System.getProperty("user.home") + value.substring(1);
    return value;
  }
}
