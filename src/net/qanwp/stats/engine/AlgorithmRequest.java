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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.qanwp.stats.timeseries.ModelPrediction;

/**
 * One invocation of the engine: the algorithm id, its inputs and parameter
 * overrides. Build with {@link #builder(String)}.
 */
public final class AlgorithmRequest {
  private final String algorithmId;
  private final double[] series;
  private final List<ModelPrediction> models;
  private final double[] trainForecasts;
  private final double[] trainObservations;
  private final double[] newForecasts;
  private final Map<String, Object> params;

  private AlgorithmRequest(Builder builder) {
    this.algorithmId = builder.algorithmId;
    this.series = builder.series;
    this.models = builder.models;
    this.trainForecasts = builder.trainForecasts;
    this.trainObservations = builder.trainObservations;
    this.newForecasts = builder.newForecasts;
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
  }

  public static Builder builder(String algorithmId) {
    return new Builder(algorithmId);
  }

  public String getAlgorithmId() {
    return algorithmId;
  }

  /** The primary series, or null when the request carries none. */
  public double[] getSeries() {
    return copy(series);
  }

  /** Ensemble members, or null to fall back to the synthetic ensemble. */
  public List<ModelPrediction> getModels() {
    return models;
  }

  /** True when all three bias-correction inputs were given. */
  public boolean hasTrainingPairs() {
    return trainForecasts != null && trainObservations != null && newForecasts != null;
  }

  public double[] getTrainForecasts() {
    return copy(trainForecasts);
  }

  public double[] getTrainObservations() {
    return copy(trainObservations);
  }

  public double[] getNewForecasts() {
    return copy(newForecasts);
  }

  public Map<String, Object> getParams() {
    return params;
  }

  private static double[] copy(double[] values) {
    return values == null ? null : values.clone();
  }

  public static final class Builder {
    private final String algorithmId;
    private double[] series;
    private List<ModelPrediction> models;
    private double[] trainForecasts;
    private double[] trainObservations;
    private double[] newForecasts;
    private final Map<String, Object> params = new LinkedHashMap<>();

    private Builder(String algorithmId) {
      this.algorithmId = Preconditions.checkNotNull(algorithmId, "algorithm id");
    }

    public Builder series(double... values) {
      this.series = copy(values);
      return this;
    }

    public Builder models(List<ModelPrediction> models) {
      this.models = models == null ? null : ImmutableList.copyOf(models);
      return this;
    }

    public Builder trainingPairs(double[] forecasts, double[] observations, double[] fresh) {
      this.trainForecasts = copy(forecasts);
      this.trainObservations = copy(observations);
      this.newForecasts = copy(fresh);
      return this;
    }

    public Builder param(String name, Object value) {
      params.put(name, value);
      return this;
    }

    public Builder params(Map<String, ?> values) {
      if (values != null) {
        params.putAll(values);
      }
      return this;
    }

    public AlgorithmRequest build() {
      return new AlgorithmRequest(this);
    }
  }
}
