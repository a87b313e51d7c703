package com.gentoro.reformat.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One image of a batch, as produced by the import stage.
 *
 * @param sourcePath file location; {@code null} for {@link ItemOrigin#MEMORY} items
 * @param originalName display name, used to derive the output file name
 * @param format detected encoding, {@code null} when it could not be determined
 */
public record Item(
    String id,
    ItemOrigin origin,
    Path sourcePath,
    String originalName,
    long byteSize,
    int width,
    int height,
    ImageFormat format,
    boolean hasAlpha) {

  public Item {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(origin, "origin");
  }

  public static Item file(
      String id,
      Path path,
      long byteSize,
      int width,
      int height,
      ImageFormat format,
      boolean hasAlpha) {
    Path name = path == null ? null : path.getFileName();
    return new Item(
        id,
        ItemOrigin.FILE,
        path,
        name == null ? null : name.toString(),
        byteSize,
        width,
        height,
        format,
        hasAlpha);
  }

  public static Item memory(String id, long byteSize, int width, int height, boolean hasAlpha) {
    return new Item(
        id,
        ItemOrigin.MEMORY,
        null,
        "clipboard",
        byteSize,
        width,
        height,
        ImageFormat.PNG,
        hasAlpha);
  }

  public boolean isFile() {
    return origin == ItemOrigin.FILE;
  }
}
