package org.servekit.scoring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class WorkerPoolTest {
  private final ExecutorService executor = Executors.newFixedThreadPool(4);

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  @Test
  public void testResultsAreReturnedInTaskOrder() throws PredictorEvaluationException {
    List<Callable<Integer>> tasks = new ArrayList<>();
    for (int i = 0; i < 4; ++i) {
      final int value = i;
      // Later tasks finish first
      tasks.add(() -> {
        Thread.sleep(40 - value * 10);
        return value;
      });
    }
    try (WorkerPool workers = WorkerPool.open(executor, 4)) {
      Assert.assertEquals(Arrays.asList(0, 1, 2, 3), workers.invokeAll(tasks));
    }
  }

  @Test
  public void testTasksRunOnExecutorThreads() throws PredictorEvaluationException {
    Set<String> threadNames = ConcurrentHashMap.newKeySet();
    CountDownLatch bothRunning = new CountDownLatch(2);
    List<Callable<Boolean>> tasks = new ArrayList<>();
    for (int i = 0; i < 2; ++i) {
      tasks.add(() -> {
        threadNames.add(Thread.currentThread().getName());
        bothRunning.countDown();
        return bothRunning.await(5, TimeUnit.SECONDS);
      });
    }
    try (WorkerPool workers = WorkerPool.open(executor, 2)) {
      Assert.assertEquals(Arrays.asList(true, true), workers.invokeAll(tasks));
    }
    Assert.assertEquals(2, threadNames.size());
    Assert.assertFalse(threadNames.contains(Thread.currentThread().getName()));
  }

  @Test
  public void testCallerThreadPoolRunsTasksInline() throws PredictorEvaluationException {
    String caller = Thread.currentThread().getName();
    List<Callable<String>> tasks =
        Arrays.asList(() -> Thread.currentThread().getName(), () -> "second");
    try (WorkerPool workers = WorkerPool.callerThread()) {
      Assert.assertEquals(1, workers.getParallelism());
      Assert.assertEquals(Arrays.asList(caller, "second"), workers.invokeAll(tasks));
    }
  }

  @Test
  public void testFailingTaskIsReportedAsEvaluationError() {
    List<Callable<Integer>> tasks =
        Arrays.asList(() -> 1, () -> {
          throw new ArithmeticException("boom");
        });
    try (WorkerPool workers = WorkerPool.open(executor, 2)) {
      workers.invokeAll(tasks);
      Assert.fail("Expected a failing task to fail the whole call");
    } catch (PredictorEvaluationException e) {
      Assert.assertTrue(e.getCause() instanceof ArithmeticException);
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testClosedPoolRejectsTasks() throws PredictorEvaluationException {
    WorkerPool workers = WorkerPool.open(executor, 2);
    workers.close();
    List<Callable<Integer>> tasks = new ArrayList<>();
    tasks.add(() -> 1);
    tasks.add(() -> 2);
    workers.invokeAll(tasks);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testParallelismMustBePositive() {
    WorkerPool.open(executor, 0);
  }

  @Test(expected = IllegalStateException.class)
  public void testShutDownExecutorIsReportedAsIllegalState() throws PredictorEvaluationException {
    executor.shutdownNow();
    List<Callable<Integer>> tasks = new ArrayList<>();
    tasks.add(() -> 1);
    tasks.add(() -> 2);
    try (WorkerPool workers = WorkerPool.open(executor, 2)) {
      workers.invokeAll(tasks);
    }
  }
}
