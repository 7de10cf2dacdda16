/*
 * Copyright (c) 2026 QANWP Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.qanwp.stats.engine;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.qanwp.stats.exception.UnknownAlgorithmException;

/** The algorithms the dispatcher can run, keyed by their request id. */
public enum Algorithm {
  KALMAN("kalman", "Kalman Filter",
      "Optimal recursive state estimation for noisy weather observations",
      "Kalman, R. E. (1960). A new approach to linear filtering and prediction problems."),
  ARIMA("arima", "ARIMA Time Series Analysis",
      "AutoRegressive Integrated Moving Average for weather pattern prediction",
      "Box, G.E.P., Jenkins, G.M. (1970). Time Series Analysis: Forecasting and Control."),
  ENSEMBLE_BAYESIAN("ensemble_bayesian", "Bayesian Model Averaging (BMA)",
      "Probabilistic ensemble weighting using Bayesian inference",
      "Raftery et al. (2005). Using Bayesian Model Averaging to Calibrate Forecast Ensembles."),
  BIAS_CORRECTION("bias_correction", "Quantile Mapping Bias Correction",
      "Statistical post-processing using empirical cumulative distribution functions",
      "Maraun, D. (2016). Bias Correcting Climate Change Simulations - a Critical Review."),
  ANOMALY_DETECTION("anomaly_detection", "Statistical Anomaly Detection",
      "Combined Z-score and IQR methods for identifying unusual weather patterns",
      "Grubbs, F. E. (1969). Procedures for Detecting Outlying Observations."),
  TREND_ANALYSIS("trend_analysis", "Mann-Kendall Trend Test with Sen's Slope",
      "Non-parametric test for detecting monotonic trends in climate data",
      "Sen, P. K. (1968). Estimates of the Regression Coefficient Based on Kendall's Tau.");

  private final String id;
  private final String displayName;
  private final String description;
  private final String reference;

  Algorithm(String id, String displayName, String description, String reference) {
    this.id = id;
    this.displayName = displayName;
    this.description = description;
    this.reference = reference;
  }

  public String getId() {
    return id;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public static List<String> ids() {
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (Algorithm algorithm : values()) {
      ids.add(algorithm.id);
    }
    return ids.build();
  }

  /**
   * @throws UnknownAlgorithmException if no algorithm has this id
   */
  public static Algorithm fromId(String id) {
    for (Algorithm algorithm : values()) {
      if (algorithm.id.equals(id)) {
        return algorithm;
      }
    }
    throw new UnknownAlgorithmException(id, ids());
  }
}
