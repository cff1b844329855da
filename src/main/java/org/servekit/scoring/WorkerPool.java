package org.servekit.scoring;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * A handle on the workers one inference call may use. A pool is opened for the duration of a call
 * and closed on every exit path; closing cancels any task of the call that is still pending.
 *
 * <p>A pool never owns its executor. The executor is owned by the runner replica and outlives the
 * individual calls made against it.
 */
public final class WorkerPool implements AutoCloseable {
  private final ExecutorService executor;
  private final int parallelism;
  private final List<Future<?>> pending = new ArrayList<>();
  private boolean closed = false;

  private WorkerPool(ExecutorService executor, int parallelism) {
    this.executor = executor;
    this.parallelism = parallelism;
  }

  /**
   * Opens a scope that runs tasks on {@code executor}
   *
   * @param parallelism The maximum number of workers tasks should be spread across
   */
  public static WorkerPool open(ExecutorService executor, int parallelism) {
    Preconditions.checkArgument(parallelism >= 1, "Parallelism must be at least 1");
    return new WorkerPool(Preconditions.checkNotNull(executor), parallelism);
  }

  /** Opens a scope that runs every task on the calling thread */
  public static WorkerPool callerThread() {
    return new WorkerPool(null, 1);
  }

  /** @return The number of workers tasks may be spread across */
  public int getParallelism() {
    return parallelism;
  }

  /**
   * Runs the tasks and returns their results in task order. Tasks run on the calling thread when
   * there is only one of them or when the pool has no executor.
   *
   * @throws PredictorEvaluationException If any task fails or the calling thread is interrupted
   * @throws IllegalStateException If the executor no longer accepts tasks
   */
  public synchronized <T> List<T> invokeAll(List<Callable<T>> tasks)
      throws PredictorEvaluationException {
    Preconditions.checkState(!closed, "Worker pool has already been closed");
    List<T> results = new ArrayList<>(tasks.size());
    if (executor == null || tasks.size() == 1) {
      for (Callable<T> task : tasks) {
        results.add(callInline(task));
      }
      return results;
    }

    List<Future<T>> futures = new ArrayList<>(tasks.size());
    try {
      for (Callable<T> task : tasks) {
        Future<T> future = executor.submit(task);
        futures.add(future);
        pending.add(future);
      }
    } catch (RejectedExecutionException e) {
      cancelPending();
      throw new IllegalStateException("The workers of this pool have been shut down", e);
    }
    try {
      for (Future<T> future : futures) {
        results.add(future.get());
      }
    } catch (ExecutionException e) {
      throw new PredictorEvaluationException(
          "A worker failed while evaluating the batch: " + e.getCause().getMessage(),
          e.getCause());
    } catch (CancellationException e) {
      throw new PredictorEvaluationException("A worker task was cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PredictorEvaluationException("Interrupted while waiting for workers", e);
    } finally {
      cancelPending();
    }
    return results;
  }

  @Override
  public synchronized void close() {
    closed = true;
    cancelPending();
  }

  private void cancelPending() {
    for (Future<?> future : pending) {
      future.cancel(true);
    }
    pending.clear();
  }

  private static <T> T callInline(Callable<T> task) throws PredictorEvaluationException {
    try {
      return task.call();
    } catch (PredictorEvaluationException e) {
      throw e;
    } catch (Exception e) {
      throw new PredictorEvaluationException(
          "Failed while evaluating the batch: " + e.getMessage(), e);
    }
  }
}
