package com.gentoro.reformat.pipeline;

import static com.gentoro.reformat.testing.TestImages.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import com.gentoro.reformat.codec.DecodedImage;
import com.gentoro.reformat.codec.ImageCodec;
import com.gentoro.reformat.codec.ImageSource;
import com.gentoro.reformat.codec.Java2dImageCodec;
import com.gentoro.reformat.model.Crop;
import com.gentoro.reformat.model.CropRect;
import com.gentoro.reformat.model.ImageFormat;
import com.gentoro.reformat.model.OutputFormat;
import com.gentoro.reformat.model.ResizeSpec;
import com.gentoro.reformat.model.Transform;
import com.gentoro.reformat.scheduler.TaskCanceledException;
import com.gentoro.reformat.sizing.TargetSizeResult;
import com.gentoro.reformat.sizing.TargetSizeSearch;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImagePipelineTest {
  private final Java2dImageCodec codec = new Java2dImageCodec();
  private final ImagePipeline pipeline = new ImagePipeline(codec, new TargetSizeSearch());

  @TempDir Path temp;

  @Test
  @DisplayName("Crop drawn on a rotated view selects exactly the framed pixels")
  void rotateAndCrop() throws Exception {
    Path source = write(coordinates(100, 60), "png", temp.resolve("grid.png"));
    Path out = temp.resolve("out/grid.png");

    ProcessResult result =
        pipeline.process(
            ProcessRequest.builder(ImageSource.of(source), out)
                .transform(Transform.rotation(1))
                .crop(Crop.of(new CropRect(0.1, 0.2, 0.3, 0.5)))
                .build());

    assertTrue(result.success(), result.error());
    assertEquals(18, result.width());
    assertEquals(50, result.height());
    BufferedImage written = ImageIO.read(out.toFile());
    // Viewer pixel (vx, vy) shows source pixel (vy, 59 - vx); the crop starts at (6, 20).
    for (int[] p : new int[][] {{0, 0}, {17, 0}, {0, 49}, {17, 49}, {9, 25}}) {
      int rgb = written.getRGB(p[0], p[1]);
      assertEquals(20 + p[1], red(rgb), "x at " + p[0] + "," + p[1]);
      assertEquals(53 - p[0], green(rgb), "y at " + p[0] + "," + p[1]);
    }
  }

  @Test
  @DisplayName("Transparent sources requested as JPG are written as PNG with a warning")
  void transparencyAutoSwitch() throws Exception {
    Path source = write(halfTransparent(20, 20), "png", temp.resolve("logo.png"));
    Path out = temp.resolve("logo_out.png");

    ProcessResult result =
        pipeline.process(
            ProcessRequest.builder(ImageSource.of(source), out)
                .outputFormat(OutputFormat.JPG)
                .build());

    assertTrue(result.success());
    assertEquals(ImageFormat.PNG, result.format());
    assertTrue(
        result.warnings().contains("Auto-switched from JPG to PNG to preserve transparency"));
    assertEquals(0, alpha(ImageIO.read(out.toFile()).getRGB(0, 0)));
  }

  @Test
  @DisplayName("Percent resize halves both sides")
  void percentResize() throws Exception {
    Path source = write(coordinates(100, 60), "jpg", temp.resolve("p.jpg"));
    Path out = temp.resolve("p_out.jpg");

    ProcessResult result =
        pipeline.process(
            ProcessRequest.builder(ImageSource.of(source), out)
                .resize(ResizeSpec.percent(50))
                .build());

    assertTrue(result.success());
    assertEquals(ImageFormat.JPEG, result.format());
    assertEquals(50, result.width());
    assertEquals(30, result.height());
    assertEquals(Files.size(out), result.outputBytes());
  }

  @Test
  @DisplayName("Pixel resize never enlarges")
  void noUpscale() throws Exception {
    Path source = write(coordinates(100, 60), "png", temp.resolve("s.png"));

    ProcessResult result =
        pipeline.process(
            ProcessRequest.builder(ImageSource.of(source), temp.resolve("s_out.png"))
                .resize(ResizeSpec.maxSide(4000))
                .build());

    assertEquals(100, result.width());
    assertEquals(60, result.height());
  }

  @Test
  @DisplayName("Target size larger than the encoded source keeps the source size and warns")
  void targetSizeAboveSource() throws Exception {
    Path source = write(coordinates(64, 64), "png", temp.resolve("t.png"));

    ProcessResult result =
        pipeline.process(
            ProcessRequest.builder(ImageSource.of(source), temp.resolve("t_out.png"))
                .resize(ResizeSpec.targetSize(5))
                .build());

    assertTrue(result.success());
    assertEquals(64, result.width());
    assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("Original file (")));
  }

  @Test
  @DisplayName("Target size search shrinks a large image below the limit")
  void targetSizeShrinks() throws Exception {
    Path source = write(coordinates(240, 240), "png", temp.resolve("big.png"));
    long original = codec.encode(coordinates(240, 240), ImageFormat.PNG, 85).length;
    double targetMiB = original / 4.0 / 1_048_576;

    ProcessResult result =
        pipeline.process(
            ProcessRequest.builder(ImageSource.of(source), temp.resolve("big_out.png"))
                .resize(ResizeSpec.targetSize(targetMiB))
                .build());

    assertTrue(result.success(), result.error());
    assertTrue(result.width() < 240);
    assertEquals(result.width(), result.height());
  }

  @Test
  @DisplayName("A target size rejected before any encode fails the item and writes nothing")
  void targetSizeRejected() throws Exception {
    TargetSizeSearch search = mock(TargetSizeSearch.class);
    when(search.findTargetSize(anyInt(), anyInt(), anyDouble(), anyInt(), any()))
        .thenReturn(
            new TargetSizeResult(false, 64, 64, 0, 1, "Target size must be greater than 0", 0));
    ImagePipeline rejecting = new ImagePipeline(codec, search);
    Path source = write(coordinates(64, 64), "png", temp.resolve("z.png"));
    Path out = temp.resolve("z_out.png");

    ProcessResult result =
        rejecting.process(
            ProcessRequest.builder(ImageSource.of(source), out)
                .resize(ResizeSpec.targetSize(1))
                .build());

    assertFalse(result.success());
    assertEquals("Target size must be greater than 0", result.error());
    assertFalse(Files.exists(out));
  }

  @Test
  @DisplayName("EXIF orientation is applied before anything else")
  void appliesOrientation() {
    ImageCodec oriented = spy(new Java2dImageCodec());
    doReturn(new DecodedImage(coordinates(40, 10), ImageFormat.PNG, 6))
        .when(oriented)
        .decode(any());
    ImagePipeline withOrientation = new ImagePipeline(oriented, new TargetSizeSearch());

    ProcessResult result =
        withOrientation.process(
            ProcessRequest.builder(ImageSource.of(new byte[0], "x.png"), temp.resolve("o.png"))
                .build());

    assertTrue(result.success(), result.error());
    assertEquals(10, result.width());
    assertEquals(40, result.height());
  }

  @Test
  @DisplayName("Cancellation observed before writing leaves no file behind")
  void cancelBeforeWrite() throws Exception {
    Path source = write(coordinates(20, 20), "png", temp.resolve("c.png"));
    Path out = temp.resolve("c_out.png");

    assertThrows(
        TaskCanceledException.class,
        () ->
            pipeline.process(
                ProcessRequest.builder(ImageSource.of(source), out)
                    .cancelChecker(() -> true)
                    .build()));
    assertFalse(Files.exists(out));
  }

  @Test
  @DisplayName("Undecodable input becomes a failed result")
  void corruptInput() throws Exception {
    Path source = temp.resolve("broken.jpg");
    Files.write(source, new byte[] {(byte) 0xFF, (byte) 0xD8, 0, 1, 2});
    Path out = temp.resolve("broken_out.jpg");

    ProcessResult result =
        pipeline.process(ProcessRequest.builder(ImageSource.of(source), out).build());

    assertFalse(result.success());
    assertNotNull(result.error());
    assertFalse(Files.exists(out));
  }
}
