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

/**
 * Differencing, integration and autocorrelation helpers shared by the
 * forecasting algorithms.
 *
 * Box, G.E.P., Jenkins, G.M. (1970). Time Series Analysis: Forecasting and
 * Control. Holden-Day, San Francisco.
 */
public class TimeSeriesUtils {

  /**
   * Replaces y with its first differences, {@code order} times. Each pass
   * shortens the series by one.
   *
   * @param y values to difference
   * @param order number of passes (d in ARIMA(p, d, q))
   */
  public static double[] difference(double[] y, int order) {
    double[] diff = y.clone();
    for (int pass = 0; pass < order; pass++) {
      double[] next = new double[Math.max(0, diff.length - 1)];
      for (int i = 1; i < diff.length; i++) {
        next[i - 1] = diff[i] - diff[i - 1];
      }
      diff = next;
    }
    return diff;
  }

  /**
   * Undoes {@link #difference} for forecast increments.
   *
   * <p>Every pass is a cumulative sum that starts from {@code start}, the last
   * undifferenced observation. For order > 1 this is an approximation: the
   * intermediate differenced levels are not recovered.
   *
   * @param increments forecast of the differenced series
   * @param start last value of the original series
   * @param order number of passes
   */
  public static double[] integrate(double[] increments, double start, int order) {
    double[] integrated = increments.clone();
    for (int pass = 0; pass < order; pass++) {
      double cumSum = start;
      for (int i = 0; i < integrated.length; i++) {
        cumSum += integrated[i];
        integrated[i] = cumSum;
      }
    }
    return integrated;
  }

  /**
   * Sample autocorrelation of a centered series at lags 0..maxLag.
   *
   * <p>acf[k] = sum_{i >= k} c[i] * c[i - k] / (n * variance). A series with no
   * variance has no defined autocorrelation; every lag is reported as 0.
   *
   * @param centered series with its mean removed
   * @param variance population variance of the series
   * @param maxLag highest lag to compute
   */
  public static double[] autocorrelation(double[] centered, double variance, int maxLag) {
    double[] acf = new double[maxLag + 1];
    if (variance <= 0 || centered.length == 0) {
      return acf;
    }

    int n = centered.length;
    for (int lag = 0; lag <= maxLag; lag++) {
      double sum = 0;
      for (int i = lag; i < n; i++) {
        sum += centered[i] * centered[i - lag];
      }
      acf[lag] = sum / (n * variance);
    }
    return acf;
  }
}
