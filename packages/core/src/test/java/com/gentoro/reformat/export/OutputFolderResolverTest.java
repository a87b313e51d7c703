package com.gentoro.reformat.export;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.reformat.model.ImageFormat;
import com.gentoro.reformat.model.Item;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OutputFolderResolverTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
  private static final Path ROOT = Path.of("/exports");

  private final OutputFolderResolver resolver =
      new OutputFolderResolver(ExportSettings.defaults(ROOT), CLOCK);

  private static Item file(String id, String path) {
    return Item.file(id, Path.of(path), 10, 10, 10, ImageFormat.JPEG, false);
  }

  @Test
  @DisplayName("Items sharing a parent folder are exported next to its name")
  void sharedParent() {
    List<Item> items =
        List.of(file("1", "/photos/holiday/a.jpg"), file("2", "/photos/holiday/b.jpg"));

    assertEquals(ROOT.resolve("holiday_reformat"), resolver.resolve(items, null));
  }

  @Test
  @DisplayName("Parents are compared case-insensitively and across separator styles")
  void windowsStylePaths() {
    List<Item> items =
        List.of(
            file("1", "C:\\Users\\Ana\\Pictures\\a.jpg"),
            file("2", "c:/users/ana//pictures/b.jpg"));

    assertEquals("Pictures_reformat", resolver.subfolderFor(items));
  }

  @Test
  @DisplayName("Mixed parents fall back to a dated folder")
  void mixedParents() {
    List<Item> items = List.of(file("1", "/a/x.jpg"), file("2", "/b/y.jpg"));

    assertEquals("Reformat_2024-05-01", resolver.subfolderFor(items));
  }

  @Test
  @DisplayName("Batches without files use a dated folder")
  void memoryOnly() {
    List<Item> items = List.of(Item.memory("m1", 100, 10, 10, false));

    assertEquals(ROOT.resolve("Reformat_2024-05-01"), resolver.resolve(items, null));
    assertEquals("Reformat_2024-05-01", resolver.subfolderFor(List.of()));
  }

  @Test
  @DisplayName("Files at a drive root have no usable folder name")
  void driveRoot() {
    assertEquals("Reformat_2024-05-01", resolver.subfolderFor(List.of(file("1", "C:\\a.jpg"))));
  }

  @Test
  @DisplayName("Explicit destinations win; relative ones live under the root")
  void destinationOverride() {
    List<Item> items = List.of(file("1", "/photos/holiday/a.jpg"));

    assertEquals(Path.of("/elsewhere"), resolver.resolve(items, Path.of("/elsewhere")));
    assertEquals(ROOT.resolve("mine"), resolver.resolve(items, Path.of("mine")));
  }

  @Test
  @DisplayName("Canonical keys ignore case and separator noise")
  void canonicalKeys() {
    assertEquals("c:/users/ana", PathCanonicalizer.key("C:\\Users\\\\Ana\\"));
    assertEquals("/", PathCanonicalizer.key("/"));
    assertNull(PathCanonicalizer.parent("file.jpg"));
    assertEquals("holiday", PathCanonicalizer.parentName("/photos/holiday/a.jpg"));
  }
}
