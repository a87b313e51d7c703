package com.gentoro.reformat.scheduler;

import com.gentoro.reformat.logging.LoggingService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;

/**
 * One-shot cancellation latch shared between the caller of a run and its tasks.
 *
 * <p>{@link #cancel()} is idempotent: listeners run once, synchronously, on the thread that trips
 * the latch. A listener registered after cancellation runs immediately on the registering thread.
 * Listener failures are logged and never reach the caller.
 */
public final class CancellationToken implements TaskContext.CancelChecker {
  private static final Logger log = LoggingService.getLogger(CancellationToken.class);

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Request cancellation.
   *
   * @return {@code true} if this call tripped the latch, {@code false} if it was already tripped
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    for (Runnable listener : listeners) {
      notifyListener(listener);
    }
    listeners.clear();
    return true;
  }

  /** Register a callback for when cancellation is requested. */
  public void onCancel(Runnable listener) {
    if (listener == null) return;
    if (cancelled.get()) {
      notifyListener(listener);
      return;
    }
    listeners.add(listener);
    // cancel() may have drained the list between the check above and the add
    if (cancelled.get() && listeners.remove(listener)) {
      notifyListener(listener);
    }
  }

  private static void notifyListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException e) {
      log.warn("Cancellation listener failed: {}", e.toString());
    }
  }
}
