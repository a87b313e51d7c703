package com.gentoro.reformat.scheduler;

import com.gentoro.reformat.logging.LoggingService;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Fixed-concurrency task runner with cooperative cancellation and ordered results.
 *
 * <p>{@link #run} blocks the calling thread, which acts as the dispatcher: it starts up to {@code
 * concurrency} tasks, waits for any of them to finish, records the result, reports progress and
 * starts the next pending task. Because only the dispatcher touches the counters and the result
 * list, no locking is needed around them.
 *
 * <p>Cancellation stops the dispatcher from starting further tasks; tasks already running are
 * never interrupted and their results are kept. Interrupting the dispatcher cancels the token,
 * then waits for the running tasks so their reported status matches what they actually did.
 */
public final class WorkerPool {
  private static final Logger log = LoggingService.getLogger(WorkerPool.class);

  public static final int DEFAULT_CONCURRENCY = 4;

  private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

  private final int concurrency;

  public WorkerPool() {
    this(DEFAULT_CONCURRENCY);
  }

  public WorkerPool(int concurrency) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
    }
    this.concurrency = concurrency;
  }

  public int concurrency() {
    return concurrency;
  }

  public <T> List<TaskResult<T>> run(List<? extends Task<T>> tasks) {
    return run(tasks, null, null);
  }

  /**
   * Run all tasks and return one result per task, in submission order.
   *
   * @param tasks tasks to execute
   * @param token optional cancellation token
   * @param listener optional progress observer, invoked on the calling thread
   */
  public <T> List<TaskResult<T>> run(
      List<? extends Task<T>> tasks, CancellationToken token, ProgressListener<T> listener) {
    Objects.requireNonNull(tasks, "tasks");
    int total = tasks.size();
    if (total == 0) {
      return new ArrayList<>();
    }

    CancellationToken cancel = token != null ? token : new CancellationToken();
    Dispatch<T> dispatch = new Dispatch<>(total, listener);
    Deque<Integer> pending = new ArrayDeque<>(total);
    for (int i = 0; i < total; i++) {
      pending.add(i);
    }

    int poolId = POOL_SEQUENCE.incrementAndGet();
    ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(concurrency, total), workerThreads(poolId));
    CompletionService<TaskResult<T>> completion = new ExecutorCompletionService<>(executor);
    Map<Future<TaskResult<T>>, Integer> inFlight = new HashMap<>();

    try {
      fill(tasks, pending, inFlight, completion, cancel, dispatch);

      while (!inFlight.isEmpty()) {
        Future<TaskResult<T>> done = completion.take();
        int index = inFlight.remove(done);
        dispatch.resolve(collect(done, index));
        fill(tasks, pending, inFlight, completion, cancel, dispatch);
      }
    } catch (InterruptedException ie) {
      log.warn(
          "Worker pool dispatcher interrupted; cancelling and awaiting {} running task(s)",
          inFlight.size());
      cancel.cancel();
      cancelPending(pending, dispatch);
      awaitInFlight(inFlight, completion, dispatch);
      Thread.currentThread().interrupt();
    } finally {
      executor.shutdown();
    }
    return dispatch.results();
  }

  /** Start tasks until the ceiling is reached, or resolve everything pending on cancellation. */
  private <T> void fill(
      List<? extends Task<T>> tasks,
      Deque<Integer> pending,
      Map<Future<TaskResult<T>>, Integer> inFlight,
      CompletionService<TaskResult<T>> completion,
      CancellationToken cancel,
      Dispatch<T> dispatch) {
    while (inFlight.size() < concurrency && !pending.isEmpty()) {
      if (cancel.isCancelled()) {
        cancelPending(pending, dispatch);
        return;
      }
      int index = pending.poll();
      Task<T> task = tasks.get(index);
      inFlight.put(completion.submit(() -> execute(task, index, cancel)), index);
    }
    if (cancel.isCancelled()) {
      cancelPending(pending, dispatch);
    }
  }

  private static <T> TaskResult<T> execute(Task<T> task, int index, CancellationToken cancel) {
    // Cancellation may have been requested between submission and a worker picking the task up.
    if (cancel.isCancelled()) {
      return TaskResult.canceled(index);
    }
    try {
      return TaskResult.succeeded(index, task.execute(new TaskContext(index, cancel)));
    } catch (TaskCanceledException ce) {
      return TaskResult.canceled(index);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      return TaskResult.canceled(index);
    } catch (Exception e) {
      log.debug("Task {} failed: {}", index, e.toString());
      return TaskResult.failed(index, e);
    }
  }

  /** Wait for every running task without giving up on interrupts, recording its real outcome. */
  private static <T> void awaitInFlight(
      Map<Future<TaskResult<T>>, Integer> inFlight,
      CompletionService<TaskResult<T>> completion,
      Dispatch<T> dispatch) {
    while (!inFlight.isEmpty()) {
      Future<TaskResult<T>> done;
      try {
        done = completion.take();
      } catch (InterruptedException again) {
        // The caller restores the interrupt flag once everything has resolved.
        continue;
      }
      int index = inFlight.remove(done);
      dispatch.resolve(collect(done, index));
    }
  }

  /** Outcome of a future taken from the completion service, so already done. */
  private static <T> TaskResult<T> collect(Future<TaskResult<T>> done, int index) {
    try {
      return done.get();
    } catch (ExecutionException ee) {
      // Only errors escape execute(); they still fail just this task.
      return TaskResult.failed(index, ee.getCause() != null ? ee.getCause() : ee);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      return TaskResult.failed(index, ie);
    }
  }

  private static <T> void cancelPending(Deque<Integer> pending, Dispatch<T> dispatch) {
    while (!pending.isEmpty()) {
      dispatch.resolve(TaskResult.canceled(pending.poll()));
    }
  }

  private static ThreadFactory workerThreads(int poolId) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "reformat-worker-" + poolId + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  /** Result slots and counters, mutated only by the dispatching thread. */
  private static final class Dispatch<T> {
    private final List<TaskResult<T>> results;
    private final ProgressListener<T> listener;
    private final int total;
    private int completed;
    private int succeeded;
    private int failed;
    private int canceled;

    Dispatch(int total, ProgressListener<T> listener) {
      this.total = total;
      this.listener = listener;
      this.results = new ArrayList<>(Collections.nCopies(total, null));
    }

    void resolve(TaskResult<T> result) {
      results.set(result.index(), result);
      completed++;
      switch (result.status()) {
        case SUCCEEDED -> succeeded++;
        case FAILED -> failed++;
        case CANCELED -> canceled++;
      }
      if (listener != null) {
        try {
          listener.onProgress(
              new PoolProgress<>(total, completed, succeeded, failed, canceled, result));
        } catch (RuntimeException e) {
          log.warn("Progress listener failed: {}", e.toString());
        }
      }
    }

    List<TaskResult<T>> results() {
      return results;
    }
  }
}
