package com.gentoro.reformat.scheduler;

/** Unit of work executed by the {@link WorkerPool}. */
@FunctionalInterface
public interface Task<T> {
  /**
   * Executes the task. Throwing marks the task as failed; throwing {@link TaskCanceledException}
   * marks it as canceled.
   */
  T execute(TaskContext ctx) throws Exception;
}
