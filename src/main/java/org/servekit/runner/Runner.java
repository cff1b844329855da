package org.servekit.runner;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.servekit.scoring.PredictorEvaluationException;
import org.servekit.scoring.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A unit of serving logic wrapping one model, scaled to {@link #getNumReplica()} replicas that
 * each run batches with up to {@link #getNumConcurrencyPerReplica()} workers. Both numbers are
 * derived from the {@link ResourceQuota} once, when the runner is constructed.
 *
 * <p>Replica state of type {@code S} is created lazily by {@link #setup(int)} on the first batch a
 * replica serves, exactly once per replica. Runners are long-lived and shared between threads;
 * they do not limit how many batch calls are in flight at a time.
 *
 * @param <S> The per-replica state, usually the loaded model
 * @param <I> The batch input type
 * @param <O> The batch output type
 */
public abstract class Runner<S, I, O> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(Runner.class);

  private final String name;
  private final ResourceQuota resourceQuota;
  private final BatchOptions batchOptions;
  private final int numReplica;
  private final int numConcurrencyPerReplica;
  private final List<ReplicaSlot<S>> replicas;
  private final AtomicInteger nextReplica = new AtomicInteger();
  private volatile boolean closed = false;

  /**
   * @param name A name identifying the runner in logs and worker thread names
   * @param resourceQuota The resources available to the runner; required
   * @param batchOptions Batching options; defaults are used when null
   */
  protected Runner(String name, ResourceQuota resourceQuota, BatchOptions batchOptions) {
    this.name = Preconditions.checkNotNull(name, "Runner name must not be null");
    this.resourceQuota =
        Preconditions.checkNotNull(resourceQuota, "A runner requires a resource quota");
    this.batchOptions = batchOptions == null ? BatchOptions.defaults() : batchOptions;
    this.numReplica = computeNumReplica(resourceQuota);
    this.numConcurrencyPerReplica = computeConcurrencyPerReplica(resourceQuota);
    Preconditions.checkArgument(
        numReplica >= 1, "%s does not allow any replica for %s", name, resourceQuota);
    Preconditions.checkArgument(
        numConcurrencyPerReplica >= 1,
        "%s does not allow any worker per replica for %s",
        name,
        resourceQuota);

    ImmutableList.Builder<ReplicaSlot<S>> slots = ImmutableList.builder();
    for (int replicaId = 0; replicaId < numReplica; ++replicaId) {
      slots.add(new ReplicaSlot<>(name, replicaId, numConcurrencyPerReplica));
    }
    this.replicas = slots.build();
    logger.info(
        "Created runner {} with {} replica(s) of {} worker(s) each",
        name, numReplica, numConcurrencyPerReplica);
  }

  /**
   * Computes the number of replicas for a quota. Called once from the constructor, so
   * implementations must depend on the quota only and not on subclass fields.
   */
  protected abstract int computeNumReplica(ResourceQuota quota);

  /**
   * Computes the worker budget of each replica for a quota. Called once from the constructor, so
   * implementations must depend on the quota only and not on subclass fields.
   */
  protected abstract int computeConcurrencyPerReplica(ResourceQuota quota);

  /**
   * Creates the state of a replica, typically by loading the model artifact. Runs at most once
   * per replica; a thrown exception leaves the replica permanently failed.
   */
  protected abstract S setup(int replicaId);

  /** Runs one batch against a ready replica's state using the given workers */
  protected abstract O runBatch(S state, WorkerPool workers, I input)
      throws PredictorEvaluationException;

  /** @return Tags of the models this runner needs available before it can serve */
  public abstract List<String> getRequiredModels();

  /**
   * Runs a batch on the next replica in round-robin order
   *
   * @throws ReplicaSetupException If the chosen replica failed to set up earlier
   */
  public O runBatch(I input) throws PredictorEvaluationException {
    int replicaId = Math.floorMod(nextReplica.getAndIncrement(), numReplica);
    return runBatch(replicaId, input);
  }

  /**
   * Runs a batch on the specified replica, setting it up first if this is its first batch. The
   * call blocks until inference completes.
   *
   * @throws ReplicaSetupException If the replica failed to set up earlier
   */
  public O runBatch(int replicaId, I input) throws PredictorEvaluationException {
    Preconditions.checkState(!closed, "Runner %s has been closed", name);
    Preconditions.checkElementIndex(replicaId, numReplica, "replica id");
    ReplicaSlot<S> replica = replicas.get(replicaId);
    S state = replica.get(this::setup);
    try (WorkerPool workers = WorkerPool.open(replica.getWorkers(), replica.getNumWorkers())) {
      return runBatch(state, workers, input);
    }
  }

  public final int getNumReplica() {
    return numReplica;
  }

  public final int getNumConcurrencyPerReplica() {
    return numConcurrencyPerReplica;
  }

  public ReplicaState getReplicaState(int replicaId) {
    Preconditions.checkElementIndex(replicaId, numReplica, "replica id");
    return replicas.get(replicaId).getState();
  }

  public String getName() {
    return name;
  }

  public ResourceQuota getResourceQuota() {
    return resourceQuota;
  }

  public BatchOptions getBatchOptions() {
    return batchOptions;
  }

  /** Stops the worker threads of every replica. Batch calls fail after a runner is closed */
  @Override
  public void close() {
    closed = true;
    for (ReplicaSlot<S> replica : replicas) {
      replica.shutdown();
    }
    logger.info("Closed runner {}", name);
  }
}
