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
package net.qanwp.stats.timeseries;

import com.google.common.base.Preconditions;

/**
 * The predicted series of one ensemble member together with its historical
 * mean absolute error.
 */
public final class ModelPrediction {
  private final String name;
  private final TimeSeries predictions;
  private final double historicalError;

  public ModelPrediction(String name, TimeSeries predictions, double historicalError) {
    Preconditions.checkArgument(name != null, "model name is required");
    Preconditions.checkArgument(predictions != null, "predictions are required for %s", name);
    Preconditions.checkArgument(Double.isFinite(historicalError) && historicalError > 0,
        "historical error of %s must be a positive number, got %s", name, historicalError);
    this.name = name;
    this.predictions = predictions;
    this.historicalError = historicalError;
  }

  public static ModelPrediction of(String name, double historicalError, double... predictions) {
    return new ModelPrediction(name, SeriesPreparer.prepare(predictions), historicalError);
  }

  public String getName() {
    return name;
  }

  public TimeSeries getPredictions() {
    return predictions;
  }

  public double getHistoricalError() {
    return historicalError;
  }

  @Override
  public String toString() {
    return String.format("%s(error=%s, %d predictions)", name, historicalError, predictions.size());
  }
}
