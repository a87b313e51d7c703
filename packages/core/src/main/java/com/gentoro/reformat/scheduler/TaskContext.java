package com.gentoro.reformat.scheduler;

/** Context passed to a {@link Task} with its position in the batch and cancellation flags. */
public final class TaskContext {
  private final int index;
  private final CancelChecker cancelChecker;

  /** Functional interface checked by tasks to cooperatively cancel execution. */
  @FunctionalInterface
  public interface CancelChecker {
    boolean isCancelled();

    /** A checker that never reports cancellation. */
    static CancelChecker never() {
      return () -> false;
    }
  }

  public TaskContext(int index, CancelChecker cancelChecker) {
    this.index = index;
    this.cancelChecker = cancelChecker;
  }

  public int index() {
    return index;
  }

  public CancelChecker cancelChecker() {
    return cancelChecker == null ? CancelChecker.never() : cancelChecker;
  }

  public boolean isCancelled() {
    return cancelChecker != null && cancelChecker.isCancelled();
  }

  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new TaskCanceledException();
    }
  }
}
