package com.gentoro.reformat;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.reformat.exception.ConfigurationException;
import com.gentoro.reformat.model.CropRatioPreset;
import com.gentoro.reformat.model.CropRect;
import com.gentoro.reformat.model.ImageFormat;
import com.gentoro.reformat.model.Item;
import com.gentoro.reformat.model.ItemSettings;
import com.gentoro.reformat.model.OutputFormat;
import com.gentoro.reformat.model.QualitySettings;
import com.gentoro.reformat.model.ResizeSpec;
import com.gentoro.reformat.model.RunConfig;
import com.gentoro.reformat.model.Transform;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RunConfigFactoryTest {
  private static final Item LANDSCAPE =
      Item.file("item-1", Path.of("/p/a.jpg"), 100, 1000, 800, ImageFormat.JPEG, false);

  private static RunConfig build(String... args) {
    return RunConfigFactory.fromParameters(
        new StartupParameters(args), QualitySettings.DEFAULTS, List.of(LANDSCAPE));
  }

  @Test
  @DisplayName("No options keep format and size")
  void defaults() {
    RunConfig config = build("a.jpg");

    assertEquals(OutputFormat.SAME, config.outputFormat());
    assertEquals(ResizeSpec.none(), config.resize());
    assertEquals(ItemSettings.DEFAULT, config.settingsFor("item-1"));
    assertNull(config.destinationOverride());
  }

  @Test
  @DisplayName("Resize options are picked by precedence")
  void resizePrecedence() {
    assertEquals(ResizeSpec.targetSize(2), build("--target-mib", "2", "--percent", "50").resize());
    assertEquals(ResizeSpec.percent(50), build("--percent", "50", "--width", "10").resize());
    assertEquals(
        ResizeSpec.exact(300, 200),
        build("--exact", "--width", "300", "--height", "200").resize());
    assertEquals(ResizeSpec.maxSide(640), build("--max-side", "640", "--width", "10").resize());
    assertEquals(ResizeSpec.width(10), build("--width", "10", "--height", "20").resize());
    assertEquals(ResizeSpec.height(20), build("--height", "20").resize());
  }

  @Test
  @DisplayName("Exact resize needs at least one side")
  void exactNeedsDimensions() {
    assertThrows(ConfigurationException.class, () -> build("--exact"));
  }

  @Test
  @DisplayName("Target sizes must be positive")
  void targetSizeMustBePositive() {
    ConfigurationException e =
        assertThrows(ConfigurationException.class, () -> build("--target-mib", "0"));
    assertTrue(e.getMessage().startsWith("Target size must be greater than 0"));
    assertThrows(ConfigurationException.class, () -> build("--target-mib", "-3"));
  }

  @Test
  @DisplayName("Quality options override the configured defaults")
  void quality() {
    RunConfig config = build("--quality-jpg", "60", "--format", "jpeg");

    assertEquals(OutputFormat.JPG, config.outputFormat());
    assertEquals(new QualitySettings(60, 85, 85), config.quality());
    assertThrows(ConfigurationException.class, () -> build("--quality-webp", "20"));
  }

  @Test
  @DisplayName("Rotation and flips become the item transform")
  void transform() {
    RunConfig config = build("--rotate", "-90", "--flip-v");

    assertEquals(new Transform(3, false, true), config.settingsFor("item-1").transform());
    assertThrows(ConfigurationException.class, () -> build("--rotate", "45"));
  }

  @Test
  @DisplayName("Explicit crops are clamped into the unit square")
  void explicitCrop() {
    RunConfig config = build("--crop", "0.5,0.5,0.8,0.2");

    CropRect rect = config.settingsFor("item-1").crop().rect();
    assertEquals(CropRatioPreset.FREE, config.settingsFor("item-1").crop().ratioPreset());
    assertEquals(0.5, rect.width(), 1e-9);
    assertEquals(0.2, rect.height(), 1e-9);
    assertTrue(config.settingsFor("item-1").crop().isEffective());
  }

  @Test
  @DisplayName("Ratio crops are centered in the rotated view")
  void ratioCropFollowsRotation() {
    // Rotated, the 1000x800 image is seen as 800x1000; a 4:5 frame then fills it exactly.
    RunConfig rotated = build("--rotate", "90", "--crop-ratio", "4:5");
    RunConfig upright = build("--crop-ratio", "4:5");

    assertTrue(rotated.settingsFor("item-1").crop().rect().isFull());
    CropRect rect = upright.settingsFor("item-1").crop().rect();
    assertEquals(0.8 / 1.25, rect.width(), 1e-9);
    assertEquals(1, rect.height(), 1e-9);
  }

  @Test
  @DisplayName("Unknown values surface as configuration errors")
  void invalidValues() {
    assertThrows(ConfigurationException.class, () -> build("--format", "avif"));
    assertThrows(ConfigurationException.class, () -> build("--crop", "1,2"));
    assertThrows(ConfigurationException.class, () -> build("--crop-ratio", "7:5"));
    assertThrows(ConfigurationException.class, () -> build("--percent", "0"));
  }

  @Test
  @DisplayName("Destination is taken as given")
  void destination() {
    assertEquals(
        Path.of("exports/today"), build("--destination", " exports/today ").destinationOverride());
  }
}
