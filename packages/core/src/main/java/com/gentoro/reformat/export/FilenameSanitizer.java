package com.gentoro.reformat.export;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/** Makes display names safe to use as file names on Windows, macOS and Linux. */
public final class FilenameSanitizer {
  static final String FALLBACK = "unnamed";

  private static final Pattern ILLEGAL = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f]");
  private static final Pattern TRAILING_DOTS_AND_SPACES = Pattern.compile("[\\s.]+$");
  private static final Set<String> RESERVED =
      Set.of(
          "CON", "PRN", "AUX", "NUL", "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7",
          "COM8", "COM9", "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");

  private FilenameSanitizer() {}

  public static String sanitize(String name) {
    if (StringUtils.isEmpty(name)) return FALLBACK;
    String sanitized = ILLEGAL.matcher(name).replaceAll("_");
    sanitized = TRAILING_DOTS_AND_SPACES.matcher(sanitized).replaceAll("");
    if (sanitized.isEmpty()) return FALLBACK;

    String[] parts = splitExtension(sanitized);
    if (RESERVED.contains(parts[0].toUpperCase(Locale.ROOT))) {
      sanitized = "_" + sanitized;
    }
    return sanitized;
  }

  /**
   * Split into base name and extension (with its dot). A leading dot is part of the base name.
   */
  public static String[] splitExtension(String filename) {
    int dot = filename.lastIndexOf('.');
    if (dot <= 0) {
      return new String[] {filename, ""};
    }
    return new String[] {filename.substring(0, dot), filename.substring(dot)};
  }

  /**
   * Sanitized base name plus suffix plus extension: {@code photo.jpeg} with {@code _reformat} and
   * {@code .png} gives {@code photo_reformat.png}.
   */
  public static String outputFilename(String originalName, String suffix, String extension) {
    String base = splitExtension(sanitize(originalName))[0];
    return base + (suffix == null ? "" : suffix) + extension;
  }
}
