package com.gentoro.reformat.export;

import com.gentoro.reformat.exception.ExportException;
import com.gentoro.reformat.logging.LoggingService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;

/**
 * Hands out collision-free output paths for one run.
 *
 * <p>Names are reserved one at a time before any work starts, so two items of the same batch can
 * never be given the same path even though they are written concurrently. A candidate is taken when
 * neither the reserved set (compared case-insensitively) nor the filesystem knows it; otherwise
 * {@code -1}, {@code -2}, ... is appended to the base name.
 */
public class OutputPathResolver {
  private static final Logger log = LoggingService.getLogger(OutputPathResolver.class);

  private final Path folder;
  private final String fileSuffix;
  private final int maxAttempts;
  private final Predicate<Path> exists;
  private final Set<String> reserved = new HashSet<>();

  public OutputPathResolver(Path folder, ExportSettings settings) {
    this(folder, settings.fileSuffix(), settings.maxCollisionAttempts(), Files::exists);
  }

  public OutputPathResolver(
      Path folder, String fileSuffix, int maxAttempts, Predicate<Path> exists) {
    this.folder = folder;
    this.fileSuffix = fileSuffix;
    this.maxAttempts = maxAttempts;
    this.exists = exists;
  }

  /**
   * Reserve the output path for an item.
   *
   * @param originalName display name of the source, sanitized here
   * @param extension extension of the effective format, with its dot
   * @throws ExportException when no free name is found within the attempt limit
   */
  public Path reserve(String originalName, String extension) {
    String filename = FilenameSanitizer.outputFilename(originalName, fileSuffix, extension);
    Path candidate = folder.resolve(filename);
    if (isFree(candidate)) {
      return claim(candidate);
    }
    String[] parts = FilenameSanitizer.splitExtension(filename);
    for (int i = 1; i < maxAttempts; i++) {
      candidate = folder.resolve(parts[0] + "-" + i + parts[1]);
      if (isFree(candidate)) {
        return claim(candidate);
      }
    }
    throw new ExportException(
            "Could not find a free file name for " + filename + " after " + maxAttempts
                + " attempts")
        .withContext("folder", folder.toString());
  }

  public boolean isReserved(Path path) {
    return reserved.contains(PathCanonicalizer.key(path));
  }

  private boolean isFree(Path candidate) {
    return !isReserved(candidate) && !exists.test(candidate);
  }

  private Path claim(Path path) {
    reserved.add(PathCanonicalizer.key(path));
    log.debug("Reserved output path {}", path);
    return path;
  }
}
