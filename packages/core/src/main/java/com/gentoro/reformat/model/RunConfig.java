package com.gentoro.reformat.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Settings locked for the duration of one export run.
 *
 * <p>Per-item settings are copied when the config is built, so later changes to the map handed to
 * the builder do not reach a running export.
 */
public final class RunConfig {
  private final OutputFormat outputFormat;
  private final ResizeSpec resize;
  private final QualitySettings quality;
  private final Map<String, ItemSettings> itemSettings;
  private final Path destinationOverride;

  private RunConfig(Builder b) {
    this.outputFormat = b.outputFormat;
    this.resize = b.resize;
    this.quality = b.quality;
    this.itemSettings = Map.copyOf(b.itemSettings);
    this.destinationOverride = b.destinationOverride;
  }

  public static Builder builder() {
    return new Builder();
  }

  public OutputFormat outputFormat() {
    return outputFormat;
  }

  public ResizeSpec resize() {
    return resize;
  }

  public QualitySettings quality() {
    return quality;
  }

  /** Immutable view of all per-item settings. */
  public Map<String, ItemSettings> itemSettings() {
    return itemSettings;
  }

  /** Settings for {@code itemId}, or identity/no-crop when none were given. */
  public ItemSettings settingsFor(String itemId) {
    return itemSettings.getOrDefault(itemId, ItemSettings.DEFAULT);
  }

  /** Explicit output folder, or {@code null} to let the folder policy decide. */
  public Path destinationOverride() {
    return destinationOverride;
  }

  public static final class Builder {
    private OutputFormat outputFormat = OutputFormat.SAME;
    private ResizeSpec resize = ResizeSpec.none();
    private QualitySettings quality = QualitySettings.DEFAULTS;
    private final Map<String, ItemSettings> itemSettings = new LinkedHashMap<>();
    private Path destinationOverride;

    private Builder() {}

    public Builder outputFormat(OutputFormat outputFormat) {
      this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
      return this;
    }

    public Builder resize(ResizeSpec resize) {
      this.resize = Objects.requireNonNull(resize, "resize");
      return this;
    }

    public Builder quality(QualitySettings quality) {
      this.quality = Objects.requireNonNull(quality, "quality");
      return this;
    }

    public Builder itemSettings(String itemId, ItemSettings settings) {
      itemSettings.put(
          Objects.requireNonNull(itemId, "itemId"),
          settings == null ? ItemSettings.DEFAULT : settings);
      return this;
    }

    public Builder itemSettings(Map<String, ItemSettings> settings) {
      if (settings != null) {
        settings.forEach(this::itemSettings);
      }
      return this;
    }

    public Builder destinationOverride(Path destinationOverride) {
      this.destinationOverride = destinationOverride;
      return this;
    }

    public RunConfig build() {
      return new RunConfig(this);
    }
  }
}
