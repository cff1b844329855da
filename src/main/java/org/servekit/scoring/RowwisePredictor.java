package org.servekit.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Base class for predictors whose prediction for a sample depends only on that sample's features.
 * A batch is split into at most {@link WorkerPool#getParallelism()} contiguous chunks that are
 * evaluated on the pool and concatenated back in input order.
 */
public abstract class RowwisePredictor implements Predictor {

  @Override
  public double[] predict(double[][] input, WorkerPool workers)
      throws PredictorEvaluationException {
    validate(input);
    int numRows = input.length;
    int numChunks = Math.min(workers.getParallelism(), numRows);
    int chunkSize = (numRows + numChunks - 1) / numChunks;

    List<Callable<double[]>> tasks = new ArrayList<>(numChunks);
    for (int start = 0; start < numRows; start += chunkSize) {
      final int from = start;
      final int to = Math.min(start + chunkSize, numRows);
      tasks.add(() -> predictRange(input, from, to));
    }

    double[] predictions = new double[numRows];
    int offset = 0;
    for (double[] chunk : workers.invokeAll(tasks)) {
      System.arraycopy(chunk, 0, predictions, offset, chunk.length);
      offset += chunk.length;
    }
    return predictions;
  }

  /** @return The number of features every input row must have */
  public abstract int getNumFeatures();

  /** Computes the prediction for a single sample */
  protected abstract double predictRow(double[] row);

  private double[] predictRange(double[][] input, int from, int to) {
    double[] chunk = new double[to - from];
    for (int i = from; i < to; ++i) {
      chunk[i - from] = predictRow(input[i]);
    }
    return chunk;
  }

  private void validate(double[][] input) throws PredictorEvaluationException {
    if (input == null || input.length == 0) {
      throw new PredictorEvaluationException("The input batch must contain at least one row.");
    }
    for (int rowIndex = 0; rowIndex < input.length; ++rowIndex) {
      double[] row = input[rowIndex];
      if (row == null || row.length != getNumFeatures()) {
        throw new PredictorEvaluationException(
            String.format(
                "Row %d of the input does not contain the expected number of features! Found %d"
                    + " features, expected %d features",
                rowIndex, row == null ? 0 : row.length, getNumFeatures()));
      }
    }
  }
}
