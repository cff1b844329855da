package org.servekit.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.TreeMap;

/**
 * A classifier that assigns each sample the label of the class centroid closest to it in euclidean
 * distance. Ties go to the centroid listed first.
 */
public class NearestCentroidClassifier extends RowwisePredictor {
  public static final String TYPE_NAME = "nearest_centroid";

  @JsonProperty("centroids")
  private final double[][] centroids;

  @JsonProperty("labels")
  private final double[] labels;

  @JsonCreator
  public NearestCentroidClassifier(
      @JsonProperty("centroids") double[][] centroids,
      @JsonProperty("labels") double[] labels) {
    Preconditions.checkArgument(
        centroids != null && centroids.length > 0, "At least one centroid is required");
    Preconditions.checkArgument(
        labels != null && labels.length == centroids.length,
        "Exactly one label is required per centroid");
    int numFeatures = centroids[0].length;
    this.centroids = new double[centroids.length][];
    for (int i = 0; i < centroids.length; ++i) {
      Preconditions.checkArgument(
          centroids[i].length == numFeatures, "Centroid %s has a different dimension", i);
      this.centroids[i] = centroids[i].clone();
    }
    this.labels = labels.clone();
  }

  /**
   * Computes one centroid per distinct label as the mean of the samples carrying it. Centroids are
   * ordered by ascending label
   *
   * @param samples Training samples, one row per sample
   * @param targets The class label of each sample
   */
  public static NearestCentroidClassifier fit(double[][] samples, double[] targets) {
    Preconditions.checkArgument(
        samples.length > 0 && samples.length == targets.length,
        "Expected one target per sample and at least one sample");
    int numFeatures = samples[0].length;
    Map<Double, double[]> sums = new TreeMap<>();
    Map<Double, Integer> counts = new TreeMap<>();
    for (int i = 0; i < samples.length; ++i) {
      Preconditions.checkArgument(
          samples[i].length == numFeatures, "Sample %s has a different dimension", i);
      double[] sum = sums.computeIfAbsent(targets[i], label -> new double[numFeatures]);
      for (int j = 0; j < numFeatures; ++j) {
        sum[j] += samples[i][j];
      }
      counts.merge(targets[i], 1, Integer::sum);
    }

    double[][] centroids = new double[sums.size()][];
    double[] labels = new double[sums.size()];
    int index = 0;
    for (Map.Entry<Double, double[]> entry : sums.entrySet()) {
      int count = counts.get(entry.getKey());
      double[] centroid = entry.getValue();
      for (int j = 0; j < numFeatures; ++j) {
        centroid[j] /= count;
      }
      centroids[index] = centroid;
      labels[index] = entry.getKey();
      ++index;
    }
    return new NearestCentroidClassifier(centroids, labels);
  }

  @JsonIgnore
  @Override
  public int getNumFeatures() {
    return centroids[0].length;
  }

  @Override
  protected double predictRow(double[] row) {
    int best = 0;
    double bestDistance = Double.POSITIVE_INFINITY;
    for (int c = 0; c < centroids.length; ++c) {
      double distance = 0;
      for (int j = 0; j < row.length; ++j) {
        double delta = row[j] - centroids[c][j];
        distance += delta * delta;
      }
      if (distance < bestDistance) {
        bestDistance = distance;
        best = c;
      }
    }
    return labels[best];
  }
}
