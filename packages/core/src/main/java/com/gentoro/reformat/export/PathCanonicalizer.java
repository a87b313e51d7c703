package com.gentoro.reformat.export;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Comparison keys for paths: forward slashes, no duplicate or trailing separators, lower case.
 *
 * <p>Works on the textual form so Windows-style paths compare the same way on every platform.
 */
public final class PathCanonicalizer {
  private PathCanonicalizer() {}

  public static String key(Path path) {
    return path == null ? "" : key(path.toString());
  }

  public static String key(String path) {
    if (path == null) return "";
    String normalized = path.replace('\\', '/').replaceAll("/{2,}", "/");
    while (normalized.length() > 1 && normalized.endsWith("/")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized.toLowerCase(Locale.ROOT);
  }

  /** Parent directory part of the textual path, or {@code null} when there is none. */
  public static String parent(String path) {
    if (path == null) return null;
    String normalized = path.replace('\\', '/').replaceAll("/{2,}", "/");
    int slash = normalized.lastIndexOf('/');
    if (slash <= 0) return null;
    return normalized.substring(0, slash);
  }

  /** Name of the directory that contains {@code path}, or {@code null}. */
  public static String parentName(String path) {
    String parent = parent(path);
    if (parent == null) return null;
    int slash = parent.lastIndexOf('/');
    String name = parent.substring(slash + 1);
    return name.isEmpty() || name.endsWith(":") ? null : name;
  }
}
