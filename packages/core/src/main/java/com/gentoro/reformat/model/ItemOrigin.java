package com.gentoro.reformat.model;

/** Where an item's pixels come from. */
public enum ItemOrigin {
  /** A file on disk, addressed by {@link Item#sourcePath()}. */
  FILE,
  /** An in-memory capture (clipboard), fetched by item id when the run starts. */
  MEMORY
}
