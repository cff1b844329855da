package org.servekit.runner;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One entry of a runner's replica arena. The slot initializes its state at most once: concurrent
 * first callers wait on the slot's lock while one of them runs the setup, and a failed setup is
 * remembered and reported to every later caller instead of being retried.
 *
 * <p>A slot that reaches {@link ReplicaState#READY} also owns the executor its batch calls run
 * their workers on.
 */
final class ReplicaSlot<S> {
  private static final Logger logger = LoggerFactory.getLogger(ReplicaSlot.class);

  private final String runnerName;
  private final int replicaId;
  private final int numWorkers;
  private final Object lock = new Object();

  // Written under the lock; the volatile state publishes the other fields to lock-free readers
  private volatile ReplicaState state = ReplicaState.UNINITIALIZED;
  private S value;
  private ExecutorService workers;
  private Throwable failure;
  private volatile boolean shutDown = false;

  ReplicaSlot(String runnerName, int replicaId, int numWorkers) {
    this.runnerName = runnerName;
    this.replicaId = replicaId;
    this.numWorkers = numWorkers;
  }

  /**
   * Returns the replica's state, running {@code setup} first if the replica is uninitialized
   *
   * @throws ReplicaSetupException If an earlier setup of this replica failed
   * @throws IllegalStateException If the slot has been shut down
   */
  S get(IntFunction<S> setup) {
    if (state == ReplicaState.READY && !shutDown) {
      return value;
    }
    synchronized (lock) {
      if (shutDown) {
        throw new IllegalStateException(
            String.format("Replica %d of runner %s has been shut down", replicaId, runnerName));
      }
      switch (state) {
        case READY:
          return value;
        case FAILED:
          throw new ReplicaSetupException(
              String.format(
                  "Replica %d of runner %s failed to set up and cannot serve requests",
                  replicaId, runnerName),
              failure);
        default:
          break;
      }
      state = ReplicaState.LOADING;
      logger.info("Setting up replica {} of runner {}", replicaId, runnerName);
      try {
        S loaded = setup.apply(replicaId);
        if (loaded == null) {
          throw new IllegalStateException(
              String.format("Setup of replica %d of runner %s produced no state",
                  replicaId, runnerName));
        }
        value = loaded;
        workers = newWorkers();
        state = ReplicaState.READY;
        return loaded;
      } catch (RuntimeException | Error e) {
        logger.error("Setup of replica {} of runner {} failed", replicaId, runnerName, e);
        failure = e;
        state = ReplicaState.FAILED;
        throw e;
      }
    }
  }

  ReplicaState getState() {
    return state;
  }

  /** @return The executor of a ready replica */
  ExecutorService getWorkers() {
    return workers;
  }

  int getNumWorkers() {
    return numWorkers;
  }

  /** Stops the slot's workers. Later calls to {@link #get} fail instead of setting up again */
  void shutdown() {
    synchronized (lock) {
      shutDown = true;
      if (workers != null) {
        workers.shutdownNow();
      }
    }
  }

  private ExecutorService newWorkers() {
    return Executors.newFixedThreadPool(
        numWorkers,
        new ThreadFactoryBuilder()
            .setNameFormat(runnerName + "-replica-" + replicaId + "-worker-%d")
            .setDaemon(true)
            .build());
  }
}
