package com.gentoro.reformat.scheduler;

/** Observer notified once per task resolution. */
@FunctionalInterface
public interface ProgressListener<T> {
  void onProgress(PoolProgress<T> progress);
}
