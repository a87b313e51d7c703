package com.gentoro.reformat.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RunConfigTest {

  @Test
  @DisplayName("Defaults keep the source format at full size")
  void defaults() {
    RunConfig config = RunConfig.builder().build();
    assertEquals(OutputFormat.SAME, config.outputFormat());
    assertEquals(ResizeSpec.none(), config.resize());
    assertEquals(QualitySettings.DEFAULTS, config.quality());
    assertNull(config.destinationOverride());
    assertEquals(ItemSettings.DEFAULT, config.settingsFor("unknown"));
  }

  @Test
  @DisplayName("Per-item settings are snapshotted when the config is built")
  void snapshotsItemSettings() {
    Map<String, ItemSettings> live = new HashMap<>();
    ItemSettings rotated = new ItemSettings(Transform.rotation(1), Crop.NONE);
    live.put("a", rotated);
    live.put("b", null);

    RunConfig config = RunConfig.builder().itemSettings(live).build();
    live.put("a", ItemSettings.DEFAULT);
    live.put("c", rotated);

    assertEquals(rotated, config.settingsFor("a"));
    assertEquals(ItemSettings.DEFAULT, config.settingsFor("b"));
    assertEquals(ItemSettings.DEFAULT, config.settingsFor("c"));
    assertThrows(UnsupportedOperationException.class, () -> config.itemSettings().clear());
  }
}
