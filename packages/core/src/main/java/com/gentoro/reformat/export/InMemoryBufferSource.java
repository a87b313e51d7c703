package com.gentoro.reformat.export;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Thread-safe map of captured buffers. */
public class InMemoryBufferSource implements BufferSource {
  private final Map<String, byte[]> buffers = new ConcurrentHashMap<>();

  public void put(String itemId, byte[] bytes) {
    buffers.put(itemId, bytes);
  }

  public void remove(String itemId) {
    buffers.remove(itemId);
  }

  @Override
  public Optional<byte[]> buffer(String itemId) {
    return Optional.ofNullable(buffers.get(itemId));
  }
}
