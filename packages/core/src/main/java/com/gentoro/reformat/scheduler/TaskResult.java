package com.gentoro.reformat.scheduler;

/**
 * Outcome of one task, positioned by its submission index.
 *
 * @param index submission index of the task
 * @param status terminal state
 * @param value produced value, only for {@link TaskStatus#SUCCEEDED}
 * @param error captured error, only for {@link TaskStatus#FAILED}
 */
public record TaskResult<T>(int index, TaskStatus status, T value, Throwable error) {

  public static <T> TaskResult<T> succeeded(int index, T value) {
    return new TaskResult<>(index, TaskStatus.SUCCEEDED, value, null);
  }

  public static <T> TaskResult<T> failed(int index, Throwable error) {
    return new TaskResult<>(index, TaskStatus.FAILED, null, error);
  }

  public static <T> TaskResult<T> canceled(int index) {
    return new TaskResult<>(index, TaskStatus.CANCELED, null, null);
  }

  public boolean isSucceeded() {
    return status == TaskStatus.SUCCEEDED;
  }

  public boolean isFailed() {
    return status == TaskStatus.FAILED;
  }

  public boolean isCanceled() {
    return status == TaskStatus.CANCELED;
  }
}
