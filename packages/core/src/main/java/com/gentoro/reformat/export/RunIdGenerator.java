package com.gentoro.reformat.export;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/** Produces identifiers for export runs. */
@FunctionalInterface
public interface RunIdGenerator {
  String nextRunId();

  /** {@code run-<epochMillis>-<n>} with a counter private to the returned generator. */
  static RunIdGenerator sequential(Clock clock) {
    AtomicLong counter = new AtomicLong();
    return () -> "run-" + clock.millis() + "-" + counter.incrementAndGet();
  }

  static RunIdGenerator uuid() {
    return () -> "run-" + UUID.randomUUID();
  }
}
