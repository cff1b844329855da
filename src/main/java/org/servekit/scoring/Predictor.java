package org.servekit.scoring;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A generic predictor object that provides a uniform interface for model inference. Concrete
 * model families implement this interface and are told apart by their type id when an artifact is
 * loaded.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = LinearRegressor.class, name = LinearRegressor.TYPE_NAME),
  @JsonSubTypes.Type(
      value = NearestCentroidClassifier.class,
      name = NearestCentroidClassifier.TYPE_NAME)
})
public interface Predictor {
  /**
   * Performs inference on a batch of samples
   *
   * @param input One row of feature values per sample
   * @param workers The worker budget inference may use
   * @return One prediction per input row, in input order
   */
  double[] predict(double[][] input, WorkerPool workers) throws PredictorEvaluationException;

  /** Performs inference on a batch of samples using the calling thread only */
  default double[] predict(double[][] input) throws PredictorEvaluationException {
    try (WorkerPool workers = WorkerPool.callerThread()) {
      return predict(input, workers);
    }
  }
}
