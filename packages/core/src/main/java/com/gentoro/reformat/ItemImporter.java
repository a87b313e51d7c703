package com.gentoro.reformat;

import com.gentoro.reformat.codec.ImageCodec;
import com.gentoro.reformat.codec.ImageInfo;
import com.gentoro.reformat.codec.ImageSource;
import com.gentoro.reformat.exception.CodecException;
import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.model.ImageFormat;
import com.gentoro.reformat.model.Item;
import com.gentoro.reformat.model.ItemOrigin;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/**
 * Builds {@link Item}s for files named on the command line by probing their headers.
 *
 * <p>Files that cannot be probed are still imported so the run reports them as failed.
 */
public class ItemImporter {
  private static final Logger log = LoggingService.getLogger(ItemImporter.class);

  private final ImageCodec codec;

  public ItemImporter(ImageCodec codec) {
    this.codec = codec;
  }

  public List<Item> importFiles(List<String> paths) {
    List<Item> items = new ArrayList<>(paths.size());
    for (int i = 0; i < paths.size(); i++) {
      items.add(importFile("item-" + (i + 1), Path.of(paths.get(i))));
    }
    return items;
  }

  public Item importFile(String id, Path path) {
    String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
    long size = 0;
    try {
      size = Files.size(path);
      ImageInfo info = codec.probe(ImageSource.of(path));
      return new Item(
          id,
          ItemOrigin.FILE,
          path,
          name,
          size,
          info.displayWidth(),
          info.displayHeight(),
          info.format(),
          info.hasAlpha());
    } catch (IOException | CodecException e) {
      log.warn("Could not inspect {}: {}", path, e.getMessage());
      ImageFormat guessed = ImageFormat.fromName(extensionOf(name));
      return new Item(id, ItemOrigin.FILE, path, name, size, 0, 0, guessed, false);
    }
  }

  private static String extensionOf(String name) {
    int dot = name.lastIndexOf('.');
    return dot < 0 ? null : name.substring(dot + 1);
  }
}
