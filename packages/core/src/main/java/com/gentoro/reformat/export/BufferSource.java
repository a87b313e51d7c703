package com.gentoro.reformat.export;

import java.util.Optional;

/** Supplies encoded bytes of in-memory (clipboard) items by item id. */
@FunctionalInterface
public interface BufferSource {
  Optional<byte[]> buffer(String itemId);

  static BufferSource empty() {
    return id -> Optional.empty();
  }
}
