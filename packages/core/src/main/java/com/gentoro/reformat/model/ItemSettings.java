package com.gentoro.reformat.model;

/** Geometry chosen for a single item. */
public record ItemSettings(Transform transform, Crop crop) {
  public static final ItemSettings DEFAULT = new ItemSettings(Transform.IDENTITY, Crop.NONE);

  public ItemSettings {
    transform = transform == null ? Transform.IDENTITY : transform;
    crop = crop == null ? Crop.NONE : crop;
  }
}
