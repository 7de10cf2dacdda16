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
package net.qanwp.stats.algorithms;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import net.qanwp.stats.helper.ArgsBase;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import org.apache.commons.math.stat.descriptive.moment.Mean;

/**
 * Implements a scalar Kalman filter for noisy weather observations:
 * Kalman, R. E. (1960). A new approach to linear filtering and prediction
 * problems. Journal of Basic Engineering, 82(1), 35-45.
 *
 * The state is the level of the observed variable with an identity transition
 * and no control input. Each observation runs one predict and one update step;
 * the forecast then runs predict steps only, so it is a persistence forecast
 * whose uncertainty keeps growing.
 */
public final class KalmanEstimator {
  public static class Args extends ArgsBase {
    @Doc(help = "Process noise variance Q added to the covariance at every prediction step.")
    @Optional
    public double processNoise = 0.1;

    @Doc(help = "Measurement noise variance R of the observations.")
    @Optional
    public double measurementNoise = 1.0;

    @Doc(help = "Number of predict-only steps appended as forecast.")
    @Optional
    public int forecastHorizon = 7;

    @Override
    public void validate() {
      check(processNoise >= 0, "processNoise must not be negative, got %s", processNoise);
      check(measurementNoise > 0, "measurementNoise must be positive, got %s", measurementNoise);
      check(forecastHorizon >= 0, "forecastHorizon must not be negative, got %s", forecastHorizon);
    }
  }

  /** Output of one filtering pass. */
  public static final class Estimate {
    private final double[] filtered;
    private final double[] gains;
    private final double[] uncertainties;
    private final double[] forecast;
    private final KalmanState finalState;
    private final double avgGain;
    private final double avgUncertainty;
    private final int noiseReductionPct;
    private final int signalClarityPct;

    Estimate(double[] filtered, double[] gains, double[] uncertainties, double[] forecast,
        KalmanState finalState) {
      this.filtered = filtered;
      this.gains = gains;
      this.uncertainties = uncertainties;
      this.forecast = forecast;
      this.finalState = finalState;
      this.avgGain = new Mean().evaluate(gains);
      this.avgUncertainty = new Mean().evaluate(uncertainties);
      this.noiseReductionPct =
          (int) Math.round((1 - uncertainties[uncertainties.length - 1]) * 100);
      this.signalClarityPct = (int) Math.round(gains[gains.length - 1] * 100);
    }

    public double[] getFiltered() {
      return filtered.clone();
    }

    public double[] getGains() {
      return gains.clone();
    }

    public double[] getUncertainties() {
      return uncertainties.clone();
    }

    public double[] getForecast() {
      return forecast.clone();
    }

    /** State after the last forecast step. */
    public KalmanState getFinalState() {
      return finalState;
    }

    public double getAvgGain() {
      return avgGain;
    }

    public double getAvgUncertainty() {
      return avgUncertainty;
    }

    public int getNoiseReductionPct() {
      return noiseReductionPct;
    }

    public int getSignalClarityPct() {
      return signalClarityPct;
    }
  }

  private final Args args;

  public KalmanEstimator() {
    this(new Args());
  }

  public KalmanEstimator(Args args) {
    args.validate();
    this.args = args;
  }

  /**
   * Filters the series and forecasts {@code forecastHorizon} steps ahead.
   *
   * @param series observations, at least one
   */
  public Estimate filter(TimeSeries series) {
    SeriesPreparer.requireNonEmpty(series, "Kalman filter input");

    int n = series.size();
    double[] filtered = new double[n];
    double[] gains = new double[n];
    double[] uncertainties = new double[n];

    KalmanState state =
        KalmanState.initial(series.first(), args.processNoise, args.measurementNoise);
    for (int i = 0; i < n; i++) {
      state = state.predict().update(series.get(i));
      filtered[i] = state.getEstimate();
      gains[i] = state.getGain();
      uncertainties[i] = state.getCovariance();
    }

    DoubleArrayList forecast = new DoubleArrayList(args.forecastHorizon);
    for (int i = 0; i < args.forecastHorizon; i++) {
      state = state.predict();
      forecast.add(state.getEstimate());
    }

    return new Estimate(filtered, gains, uncertainties, forecast.toDoubleArray(), state);
  }
}
