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

import com.google.common.annotations.VisibleForTesting;
import java.util.Random;
import net.qanwp.stats.exception.InsufficientDataException;
import net.qanwp.stats.helper.ArgsBase;
import net.qanwp.stats.helper.ArrayHelper;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.rank.Max;
import org.apache.commons.math.stat.descriptive.rank.Min;

/**
 * Empirical quantile mapping bias correction, see
 * Maraun, D. (2016). Bias Correcting Climate Change Simulations - a Critical
 * Review. Current Climate Change Reports, 2, 211-220.
 *
 * <p>corrected = F_obs^-1(F_fcst(x)), where both distribution functions are
 * the empirical ones of the training forecasts and observations. A plain mean
 * bias removal is returned alongside as a baseline.
 */
public final class QuantileMappingCorrector {
  public static class Args extends ArgsBase {
    @Doc(help = "Minimum number of forecast/observation training pairs.")
    @Optional
    public int minimumPairs = 10;

    @Override
    public void validate() {
      check(minimumPairs >= 2, "minimumPairs must be at least 2, got %s", minimumPairs);
    }
  }

  /** Sign of the mean forecast error. */
  public enum BiasDirection {
    WARM_BIAS("warm bias"),
    COLD_BIAS("cold bias"),
    UNBIASED("unbiased");

    private final String label;

    BiasDirection(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }

    static BiasDirection of(double meanBias) {
      if (meanBias > 0) {
        return WARM_BIAS;
      }
      return meanBias < 0 ? COLD_BIAS : UNBIASED;
    }
  }

  /** Training pairs plus the forecasts to correct. */
  public static final class TrainingSet {
    private final TimeSeries forecasts;
    private final TimeSeries observations;
    private final TimeSeries newForecasts;

    public TrainingSet(TimeSeries forecasts, TimeSeries observations, TimeSeries newForecasts) {
      this.forecasts = forecasts;
      this.observations = observations;
      this.newForecasts = newForecasts;
    }

    public TimeSeries getForecasts() {
      return forecasts;
    }

    public TimeSeries getObservations() {
      return observations;
    }

    public TimeSeries getNewForecasts() {
      return newForecasts;
    }
  }

  public static final class Correction {
    private final int pairs;
    private final double meanBias;
    private final double maeBefore;
    private final BiasDirection biasDirection;
    private final double[] forecastRange;
    private final double[] observationRange;
    private final double[] original;
    private final double[] corrected;
    private final double[] linearCorrected;
    private final double avgAdjustment;

    Correction(int pairs, double meanBias, double maeBefore, double[] forecastRange,
        double[] observationRange, double[] original, double[] corrected,
        double[] linearCorrected, double avgAdjustment) {
      this.pairs = pairs;
      this.meanBias = meanBias;
      this.maeBefore = maeBefore;
      this.biasDirection = BiasDirection.of(meanBias);
      this.forecastRange = forecastRange;
      this.observationRange = observationRange;
      this.original = original;
      this.corrected = corrected;
      this.linearCorrected = linearCorrected;
      this.avgAdjustment = avgAdjustment;
    }

    public int getPairs() {
      return pairs;
    }

    /** Mean of forecast - observation over the training pairs. */
    public double getMeanBias() {
      return meanBias;
    }

    /** Mean absolute training error before any correction. */
    public double getMaeBefore() {
      return maeBefore;
    }

    public BiasDirection getBiasDirection() {
      return biasDirection;
    }

    /** {min, max} of the training forecasts. */
    public double[] getForecastRange() {
      return forecastRange.clone();
    }

    /** {min, max} of the training observations. */
    public double[] getObservationRange() {
      return observationRange.clone();
    }

    public double[] getOriginal() {
      return original.clone();
    }

    public double[] getCorrected() {
      return corrected.clone();
    }

    public double[] getLinearCorrected() {
      return linearCorrected.clone();
    }

    /** Mean absolute change applied by the quantile mapping. */
    public double getAvgAdjustment() {
      return avgAdjustment;
    }
  }

  private final Args args;

  public QuantileMappingCorrector() {
    this(new Args());
  }

  public QuantileMappingCorrector(Args args) {
    args.validate();
    this.args = args;
  }

  public Correction fitAndApply(TrainingSet training) {
    return fitAndApply(training.getForecasts(), training.getObservations(),
        training.getNewForecasts());
  }

  /**
   * Learns the transfer function from the training pairs and applies it.
   *
   * @param trainForecasts historical forecasts
   * @param trainObservations observations matching trainForecasts index by index
   * @param newForecasts forecasts to correct
   */
  public Correction fitAndApply(TimeSeries trainForecasts, TimeSeries trainObservations,
      TimeSeries newForecasts) {
    int numForecasts = trainForecasts.size();
    int numObservations = trainObservations.size();
    if (numForecasts != numObservations) {
      throw new InsufficientDataException(String.format(
          "Bias correction needs matching forecast-observation pairs, got %d forecasts and %d "
              + "observations", numForecasts, numObservations),
          args.minimumPairs, Math.min(numForecasts, numObservations));
    }
    SeriesPreparer.requireLength(trainForecasts, args.minimumPairs, "Bias correction");

    double[] forecasts = trainForecasts.toArray();
    double[] observations = trainObservations.toArray();
    double[] fresh = newForecasts.toArray();

    double[] biases = ArrayHelper.subtract(forecasts, observations);
    double meanBias = new Mean().evaluate(biases);
    double absSum = 0;
    for (double bias : biases) {
      absSum += Math.abs(bias);
    }
    double maeBefore = absSum / biases.length;

    double[] sortedForecasts = ArrayHelper.sortedCopy(forecasts);
    double[] sortedObservations = ArrayHelper.sortedCopy(observations);

    double[] corrected = new double[fresh.length];
    double[] linearCorrected = new double[fresh.length];
    double adjustment = 0;
    for (int i = 0; i < fresh.length; i++) {
      corrected[i] = interpolate(quantile(fresh[i], sortedForecasts), sortedObservations);
      linearCorrected[i] = fresh[i] - meanBias;
      adjustment += Math.abs(corrected[i] - fresh[i]);
    }
    double avgAdjustment = fresh.length == 0 ? 0 : adjustment / fresh.length;

    return new Correction(numForecasts, meanBias, maeBefore,
        new double[] {new Min().evaluate(forecasts), new Max().evaluate(forecasts)},
        new double[] {new Min().evaluate(observations), new Max().evaluate(observations)},
        fresh, corrected, linearCorrected, avgAdjustment);
  }

  /**
   * Empirical CDF lookup: rank of the largest entry at most value, over n - 1.
   */
  @VisibleForTesting
  static double quantile(double value, double[] sorted) {
    int rank = ArrayHelper.lastAtMost(value, sorted);
    double q = (double) rank / (sorted.length - 1);
    return Math.max(0, Math.min(1, q));
  }

  /**
   * Inverse empirical CDF: linear interpolation between the order statistics
   * around position q * (n - 1).
   */
  @VisibleForTesting
  static double interpolate(double quantile, double[] sorted) {
    int n = sorted.length;
    double position = quantile * (n - 1);
    int lower = (int) Math.floor(position);
    int upper = Math.min(lower + 1, n - 1);
    double fraction = position - lower;
    return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
  }

  /**
   * Demonstration training set cut from one series, used when a request
   * carries no explicit training pairs. The first half serves as forecasts,
   * the second half plus uniform noise in [-1, 1) as observations, and the
   * last {@code horizon} values as the forecasts to correct.
   */
  public static TrainingSet splitSeries(TimeSeries series, int horizon, Random random) {
    int half = series.size() / 2;
    double[] observations = series.slice(half, half * 2).toArray();
    for (int i = 0; i < observations.length; i++) {
      observations[i] += (random.nextDouble() - 0.5) * 2;
    }
    return new TrainingSet(series.slice(0, half), SeriesPreparer.prepare(observations),
        series.tail(horizon));
  }
}
