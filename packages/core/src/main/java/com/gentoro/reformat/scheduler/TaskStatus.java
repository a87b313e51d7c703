package com.gentoro.reformat.scheduler;

/** Terminal state of a scheduled task. */
public enum TaskStatus {
  /** Task ran to completion and produced a value. */
  SUCCEEDED,
  /** Task threw; the error is captured in the result. */
  FAILED,
  /** Task was never started, or exited early because cancellation was requested. */
  CANCELED
}
