package com.gentoro.reformat.scheduler;

import java.util.concurrent.CancellationException;

/** Thrown by a task that observed cancellation before producing its visible side effect. */
public class TaskCanceledException extends CancellationException {
  public TaskCanceledException() {
    super("Operation cancelled");
  }

  public TaskCanceledException(String message) {
    super(message);
  }
}
