package com.gentoro.reformat.codec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Encoded image bytes, either on disk or already in memory. */
public final class ImageSource {
  private final Path path;
  private final byte[] bytes;
  private final String name;

  private ImageSource(Path path, byte[] bytes, String name) {
    this.path = path;
    this.bytes = bytes;
    this.name = name;
  }

  public static ImageSource of(Path path) {
    Objects.requireNonNull(path, "path");
    Path fileName = path.getFileName();
    return new ImageSource(path, null, fileName == null ? path.toString() : fileName.toString());
  }

  public static ImageSource of(byte[] bytes, String name) {
    Objects.requireNonNull(bytes, "bytes");
    return new ImageSource(null, bytes, name == null ? "buffer" : name);
  }

  /** File location, or {@code null} for in-memory sources. */
  public Path path() {
    return path;
  }

  public String name() {
    return name;
  }

  public byte[] readAllBytes() throws IOException {
    return bytes != null ? bytes : Files.readAllBytes(path);
  }

  @Override
  public String toString() {
    return path != null ? path.toString() : name + " (" + bytes.length + " bytes in memory)";
  }
}
