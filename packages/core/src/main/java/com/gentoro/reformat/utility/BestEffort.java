package com.gentoro.reformat.utility;

import com.gentoro.reformat.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Runs operations whose failure must never affect the caller: attempt, log, continue.
 *
 * <p>Failures are logged at debug level together with a description of what was attempted, so
 * absorbed errors remain visible when diagnosing a run.
 */
public final class BestEffort {
  private static final Logger log = LoggingService.getLogger(BestEffort.class);

  /** An action that may throw any exception. */
  @FunctionalInterface
  public interface Action {
    void run() throws Exception;
  }

  private BestEffort() {}

  /**
   * Execute {@code action}; any exception is logged and absorbed.
   *
   * @return {@code true} when the action completed without throwing
   */
  public static boolean attempt(String description, Action action) {
    try {
      action.run();
      return true;
    } catch (Exception e) {
      log.debug("Best-effort operation '{}' failed: {}", description, e.toString());
      return false;
    }
  }
}
