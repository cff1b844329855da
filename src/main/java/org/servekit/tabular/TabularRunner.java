package org.servekit.tabular;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.List;
import org.servekit.codec.ArtifactCodec;
import org.servekit.models.ModelInfo;
import org.servekit.runner.BatchOptions;
import org.servekit.runner.ResourceQuota;
import org.servekit.runner.Runner;
import org.servekit.scoring.Predictor;
import org.servekit.scoring.PredictorEvaluationException;
import org.servekit.scoring.SplitOrientedDataFrame;
import org.servekit.scoring.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Runner} for tabular predictors. These predictors run on CPUs only, so the runner uses
 * a single replica whose worker budget is the quota's CPU count rounded to the nearest integer
 * (halves round to even). GPU ids in the quota are ignored.
 */
public class TabularRunner extends Runner<Predictor, double[][], double[]> {
  private static final Logger logger = LoggerFactory.getLogger(TabularRunner.class);

  private final ModelInfo modelInfo;
  private final Path artifactPath;
  private final ArtifactCodec<Predictor> codec;

  TabularRunner(
      ModelInfo modelInfo,
      Path artifactPath,
      ArtifactCodec<Predictor> codec,
      ResourceQuota resourceQuota,
      BatchOptions batchOptions) {
    super(modelInfo.getTag().toString(), resourceQuota, batchOptions);
    this.modelInfo = modelInfo;
    this.artifactPath = artifactPath;
    this.codec = Preconditions.checkNotNull(codec);
  }

  @Override
  protected int computeNumReplica(ResourceQuota quota) {
    return 1;
  }

  @Override
  protected int computeConcurrencyPerReplica(ResourceQuota quota) {
    return (int) Math.rint(quota.getCpu());
  }

  @Override
  public List<String> getRequiredModels() {
    return ImmutableList.of(modelInfo.getTag().toString());
  }

  @Override
  protected Predictor setup(int replicaId) {
    logger.debug("Loading {} for replica {} from {}", modelInfo.getTag(), replicaId, artifactPath);
    return codec.load(artifactPath);
  }

  @Override
  protected double[] runBatch(Predictor predictor, WorkerPool workers, double[][] input)
      throws PredictorEvaluationException {
    return predictor.predict(input, workers);
  }

  /** Runs a batch given as a split-oriented data frame; columns are used in frame order */
  public double[] runBatch(SplitOrientedDataFrame frame) throws PredictorEvaluationException {
    Preconditions.checkNotNull(frame, "Input frame must not be null");
    return runBatch(frame.toMatrix());
  }

  public ModelInfo getModelInfo() {
    return modelInfo;
  }
}
