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
import java.util.Arrays;
import net.qanwp.stats.exception.SeriesTooLongException;
import net.qanwp.stats.helper.ArgsBase;
import net.qanwp.stats.helper.FitGenerator;
import net.qanwp.stats.helper.NormalApproximation;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mann-Kendall trend test with Sen's slope and an OLS baseline, see
 * Sen, P. K. (1968). Estimates of the Regression Coefficient Based on Kendall's
 * Tau. Journal of the American Statistical Association, 63, 1379-1389.
 *
 * <p>Tie groups are always counted; Var(S) subtracts their contribution only
 * when {@link Args#tieCorrection} is set. The confidence bounds of Sen's slope
 * follow Gilbert, R. O. (1987). Statistical Methods for Environmental Pollution
 * Monitoring, 16.5.
 */
public final class TrendAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

  public static final int MIN_LENGTH = 10;
  /** Largest series whose pairwise slopes still fit in one array. */
  public static final int MAX_LENGTH = 65536;
  private static final double CRITICAL_Z = 1.96;
  /** Standard normal quantile at 0.975, for 95% bounds on Sen's slope. */
  private static final double CONFIDENCE_Z = 1.959963984540054;
  private static final double SIGNIFICANCE_LEVEL = 0.05;
  private static final int PROJECTION_STEPS = 10;

  public static class Args extends ArgsBase {
    @Doc(help = "Subtract the contribution of tied values from the Mann-Kendall variance.")
    @Optional
    public boolean tieCorrection = false;
  }

  public enum ClimateTrend {
    SIGNIFICANT_INCREASE, SIGNIFICANT_DECREASE, NO_SIGNIFICANT_TREND;

    static ClimateTrend of(double z) {
      if (z > CRITICAL_Z) {
        return SIGNIFICANT_INCREASE;
      }
      return z < -CRITICAL_Z ? SIGNIFICANT_DECREASE : NO_SIGNIFICANT_TREND;
    }
  }

  public enum Magnitude {
    NEGLIGIBLE, MODERATE, STRONG;

    static Magnitude of(double slope) {
      double abs = Math.abs(slope);
      if (abs < 0.01) {
        return NEGLIGIBLE;
      }
      return abs < 0.1 ? MODERATE : STRONG;
    }
  }

  public static final class MannKendall {
    private final double s;
    private final double variance;
    private final double z;
    private final double pValue;
    private final int tieGroups;

    MannKendall(double s, double variance, double z, double pValue, int tieGroups) {
      this.s = s;
      this.variance = variance;
      this.z = z;
      this.pValue = pValue;
      this.tieGroups = tieGroups;
    }

    public double getS() {
      return s;
    }

    public double getVariance() {
      return variance;
    }

    public double getZ() {
      return z;
    }

    public double getPValue() {
      return pValue;
    }

    public boolean isSignificant() {
      return pValue < SIGNIFICANCE_LEVEL;
    }

    /** Number of distinct values that occur more than once. */
    public int getTieGroups() {
      return tieGroups;
    }
  }

  public static final class LinearTrend {
    private final double slope;
    private final double intercept;
    private final double rSquared;

    LinearTrend(double slope, double intercept, double rSquared) {
      this.slope = slope;
      this.intercept = intercept;
      this.rSquared = rSquared;
    }

    public double getSlope() {
      return slope;
    }

    public double getIntercept() {
      return intercept;
    }

    public double getRSquared() {
      return rSquared;
    }
  }

  public static final class Trend {
    private final MannKendall mannKendall;
    private final double senSlope;
    private final double senLower;
    private final double senUpper;
    private final double senIntercept;
    private final LinearTrend linear;

    Trend(MannKendall mannKendall, double senSlope, double senLower, double senUpper,
        double senIntercept, LinearTrend linear) {
      this.mannKendall = mannKendall;
      this.senSlope = senSlope;
      this.senLower = senLower;
      this.senUpper = senUpper;
      this.senIntercept = senIntercept;
      this.linear = linear;
    }

    public MannKendall getMannKendall() {
      return mannKendall;
    }

    /** Median of the pairwise slopes (upper median for an even count). */
    public double getSenSlope() {
      return senSlope;
    }

    /** Lower 95% confidence bound of Sen's slope. */
    public double getSenLower() {
      return senLower;
    }

    /** Upper 95% confidence bound of Sen's slope. */
    public double getSenUpper() {
      return senUpper;
    }

    /** Median of {@code data[i] - senSlope * i}. */
    public double getSenIntercept() {
      return senIntercept;
    }

    public TrendDirection getSenInterpretation() {
      return TrendDirection.ofSign(senSlope);
    }

    public LinearTrend getLinear() {
      return linear;
    }

    public ClimateTrend getDirection() {
      return ClimateTrend.of(mannKendall.getZ());
    }

    public Magnitude getMagnitude() {
      return Magnitude.of(senSlope);
    }

    /** Sen's slope extrapolated over ten time steps. */
    public double getProjectedChange() {
      return senSlope * PROJECTION_STEPS;
    }
  }

  private final Args args;

  public TrendAnalyzer() {
    this(new Args());
  }

  public TrendAnalyzer(Args args) {
    args.validate();
    this.args = args;
  }

  /**
   * Runs the trend test on an evenly spaced series.
   *
   * @throws SeriesTooLongException if the series has more than {@link #MAX_LENGTH} points
   */
  public Trend analyze(TimeSeries series) {
    SeriesPreparer.requireLength(series, MIN_LENGTH, "Trend analysis");
    double[] data = series.toArray();
    int n = data.length;
    if (n > MAX_LENGTH) {
      throw new SeriesTooLongException("Trend analysis", MAX_LENGTH, n);
    }

    double s = 0;
    DoubleArrayList slopes = new DoubleArrayList((int) ((long) n * (n - 1) / 2));
    for (int i = 0; i < n - 1; i++) {
      for (int j = i + 1; j < n; j++) {
        s += Math.signum(data[j] - data[i]);
        slopes.add((data[j] - data[i]) / (j - i));
      }
    }

    int tieGroups = 0;
    double tieTerm = 0;
    double[] sorted = data.clone();
    Arrays.sort(sorted);
    for (int start = 0; start < n; ) {
      int end = start + 1;
      while (end < n && sorted[end] == sorted[start]) {
        end++;
      }
      double t = end - start;
      if (t > 1) {
        tieGroups++;
        tieTerm += t * (t - 1) * (2 * t + 5);
      }
      start = end;
    }

    double variance = n * (n - 1.0) * (2.0 * n + 5);
    if (args.tieCorrection) {
      variance -= tieTerm;
    }
    variance /= 18;
    double z;
    if (variance <= 0) {
      log.debug("Mann-Kendall variance is {}; z reported as 0", variance);
      z = 0;
    } else if (s > 0) {
      z = (s - 1) / Math.sqrt(variance);
    } else if (s < 0) {
      z = (s + 1) / Math.sqrt(variance);
    } else {
      z = 0;
    }
    MannKendall mannKendall = new MannKendall(
        s, variance, z, NormalApproximation.twoSidedPValue(z), tieGroups);

    double[] sortedSlopes = slopes.toDoubleArray();
    Arrays.sort(sortedSlopes);
    int pairs = sortedSlopes.length;
    double senSlope = sortedSlopes[pairs / 2];

    double halfWidth = CONFIDENCE_Z * Math.sqrt(Math.max(variance, 0));
    int lower = (int) Math.max(0, (pairs - halfWidth) / 2);
    int upper = (int) Math.min(pairs - 1, (pairs + halfWidth) / 2);

    double[] residuals = new double[n];
    for (int i = 0; i < n; i++) {
      residuals[i] = data[i] - senSlope * i;
    }
    double senIntercept = new Median().evaluate(residuals);

    return new Trend(mannKendall, senSlope, sortedSlopes[lower], sortedSlopes[upper],
        senIntercept, linearTrend(data));
  }

  private static LinearTrend linearTrend(double[] data) {
    double[] coefficients = FitGenerator.fitLine(data);
    double intercept = coefficients[0];
    double slope = coefficients[1];

    double mean = new Mean().evaluate(data);
    double ssTot = 0;
    double ssRes = 0;
    for (int i = 0; i < data.length; i++) {
      double fitted = intercept + slope * i;
      ssTot += (data[i] - mean) * (data[i] - mean);
      ssRes += (data[i] - fitted) * (data[i] - fitted);
    }
    double rSquared;
    if (ssTot == 0) {
      log.debug("Series is constant; R squared reported as 0");
      rSquared = 0;
    } else {
      rSquared = 1 - ssRes / ssTot;
    }
    return new LinearTrend(slope, intercept, rSquared);
  }
}
