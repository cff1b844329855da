package org.servekit.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.util.Arrays;

/** A linear model predicting {@code intercept + sum(coefficients[i] * x[i])} */
public class LinearRegressor extends RowwisePredictor {
  public static final String TYPE_NAME = "linear_regressor";

  @JsonProperty("coefficients")
  private final double[] coefficients;

  @JsonProperty("intercept")
  private final double intercept;

  @JsonCreator
  public LinearRegressor(
      @JsonProperty("coefficients") double[] coefficients,
      @JsonProperty("intercept") double intercept) {
    Preconditions.checkArgument(
        coefficients != null && coefficients.length > 0,
        "A linear model requires at least one coefficient");
    this.coefficients = coefficients.clone();
    this.intercept = intercept;
  }

  @JsonIgnore
  @Override
  public int getNumFeatures() {
    return coefficients.length;
  }

  @Override
  protected double predictRow(double[] row) {
    double prediction = intercept;
    for (int i = 0; i < coefficients.length; ++i) {
      prediction += coefficients[i] * row[i];
    }
    return prediction;
  }

  @Override
  public String toString() {
    return String.format(
        "LinearRegressor(coefficients=%s, intercept=%s)",
        Arrays.toString(coefficients), intercept);
  }
}
