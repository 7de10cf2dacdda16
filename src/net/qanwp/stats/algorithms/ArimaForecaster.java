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

import java.util.Arrays;
import net.qanwp.stats.helper.ArgsBase;
import net.qanwp.stats.helper.ArrayHelper;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import net.qanwp.stats.timeseries.TimeSeriesUtils;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simplified ARIMA(p, d, q) forecaster after
 * Box, G.E.P., Jenkins, G.M. (1970). Time Series Analysis: Forecasting and
 * Control.
 *
 * The series is differenced d times and an AR(p) model is fitted with the
 * sample autocorrelations as coefficients. The MA part is not estimated: its
 * coefficients follow the fixed ramp 0.1 * (1 - 0.1 i) and only enter the AIC
 * parameter count.
 */
public final class ArimaForecaster {
  private static final Logger log = LoggerFactory.getLogger(ArimaForecaster.class);

  /** Used when a lag has no usable autocorrelation. */
  private static final double FALLBACK_AR_COEFFICIENT = 0.1;
  /** Floor of the residual mean square inside the AIC log. */
  private static final double MIN_MSE = 1e-12;
  private static final int EXTRA_POINTS = 5;

  public static class Args extends ArgsBase {
    @Doc(help = "Autoregressive order p.")
    @Optional
    public int p = 2;

    @Doc(help = "Differencing order d.")
    @Optional
    public int d = 1;

    @Doc(help = "Moving-average order q.")
    @Optional
    public int q = 1;

    @Doc(help = "Number of steps to forecast.")
    @Optional
    public int forecastHorizon = 7;

    @Override
    public void validate() {
      check(p >= 0, "p must not be negative, got %s", p);
      check(d >= 0, "d must not be negative, got %s", d);
      check(q >= 0, "q must not be negative, got %s", q);
      check(forecastHorizon >= 0, "forecastHorizon must not be negative, got %s",
          forecastHorizon);
    }
  }

  /** Fitted coefficients, diagnostics and forecast. */
  public static final class Fit {
    private final int p;
    private final int d;
    private final int q;
    private final double[] arCoefficients;
    private final double[] maCoefficients;
    private final double[] autocorrelation;
    private final double mean;
    private final double rmse;
    private final double aic;
    private final double[] forecast;
    private final TrendDirection trendDirection;

    Fit(Args args, double[] arCoefficients, double[] maCoefficients, double[] autocorrelation,
        double mean, double rmse, double aic, double[] forecast) {
      this.p = args.p;
      this.d = args.d;
      this.q = args.q;
      this.arCoefficients = arCoefficients;
      this.maCoefficients = maCoefficients;
      this.autocorrelation = autocorrelation;
      this.mean = mean;
      this.rmse = rmse;
      this.aic = aic;
      this.forecast = forecast;
      this.trendDirection = TrendDirection.ofSign(mean);
    }

    public int getP() {
      return p;
    }

    public int getD() {
      return d;
    }

    public int getQ() {
      return q;
    }

    public double[] getArCoefficients() {
      return arCoefficients.clone();
    }

    public double[] getMaCoefficients() {
      return maCoefficients.clone();
    }

    /** Autocorrelation of the differenced series at lags 0..p. */
    public double[] getAutocorrelation() {
      return autocorrelation.clone();
    }

    /** Mean of the differenced series. */
    public double getMean() {
      return mean;
    }

    public double getRmse() {
      return rmse;
    }

    public double getAic() {
      return aic;
    }

    /** Forecast on the scale of the original series. */
    public double[] getForecast() {
      return forecast.clone();
    }

    public TrendDirection getTrendDirection() {
      return trendDirection;
    }
  }

  private final Args args;

  public ArimaForecaster() {
    this(new Args());
  }

  public ArimaForecaster(Args args) {
    args.validate();
    this.args = args;
  }

  /** Smallest series this forecaster accepts: p + d + 5. */
  public int minimumLength() {
    return args.p + args.d + EXTRA_POINTS;
  }

  public Fit analyze(TimeSeries series) {
    SeriesPreparer.requireLength(series, minimumLength(), "ARIMA");
    int p = args.p;

    double[] diff = TimeSeriesUtils.difference(series.toArray(), args.d);
    int n = diff.length;
    double mean = new Mean().evaluate(diff);
    double variance = new Variance(false).evaluate(diff, mean);

    double[] centered = new double[n];
    for (int i = 0; i < n; i++) {
      centered[i] = diff[i] - mean;
    }
    if (variance == 0) {
      log.debug("Differenced series is constant ({}); AR coefficients fall back to {}",
          mean, FALLBACK_AR_COEFFICIENT);
    }
    double[] acf = TimeSeriesUtils.autocorrelation(centered, variance, p);

    double[] ar = new double[p];
    for (int j = 0; j < p; j++) {
      double coefficient = acf[j + 1];
      ar[j] = Double.isFinite(coefficient) && coefficient != 0
          ? coefficient : FALLBACK_AR_COEFFICIENT;
    }

    double[] ma = new double[args.q];
    for (int i = 0; i < args.q; i++) {
      ma[i] = 0.1 * (1 - i * 0.1);
    }

    // Forecast the differenced series, sliding a window of the last p values.
    double[] window = Arrays.copyOfRange(diff, n - p, n);
    double[] diffForecast = new double[args.forecastHorizon];
    for (int step = 0; step < diffForecast.length; step++) {
      double next = predict(window, window.length, ar, mean);
      diffForecast[step] = next;
      if (p > 0) {
        System.arraycopy(window, 1, window, 0, p - 1);
        window[p - 1] = next;
      }
    }
    double[] forecast = TimeSeriesUtils.integrate(diffForecast, series.last(), args.d);

    // In-sample one-step fit for the diagnostics.
    double[] fitted = new double[n - p];
    for (int i = p; i < n; i++) {
      fitted[i - p] = predict(diff, i, ar, mean);
    }
    double[] residuals =
        ArrayHelper.subtract(Arrays.copyOfRange(diff, p, n), fitted);
    double mse = ArrayHelper.sumOfSquares(residuals) / residuals.length;
    double rmse = Math.sqrt(mse);
    double aic = n * Math.log(Math.max(mse, MIN_MSE)) + 2 * (p + args.q + 1);

    return new Fit(args, ar, ma, acf, mean, rmse, aic, forecast);
  }

  /**
   * AR recurrence: mean + sum_j ar[j] * (values[end - 1 - j] - mean).
   */
  private static double predict(double[] values, int end, double[] ar, double mean) {
    double next = mean;
    for (int j = 0; j < ar.length; j++) {
      next += ar[j] * (values[end - 1 - j] - mean);
    }
    return next;
  }
}
