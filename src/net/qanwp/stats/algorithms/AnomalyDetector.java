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

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.List;
import net.qanwp.stats.helper.ArgsBase;
import net.qanwp.stats.helper.ArrayHelper;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags unusual observations with three independent criteria, see
 * Grubbs, F. E. (1969). Procedures for Detecting Outlying Observations in
 * Samples. Technometrics, 11(1), 1-21, and
 * Iglewicz, B., Hoaglin, D. C. (1993). How to Detect and Handle Outliers.
 *
 * <ul>
 *   <li>Z-score: |v - mean| / stdDev above a threshold, with a severity class.
 *   <li>IQR: outside [q1 - 1.5 iqr, q3 + 1.5 iqr] (Tukey fences).
 *   <li>Modified z-score: 0.6745 (v - median) / MAD above its own threshold.
 * </ul>
 */
public final class AnomalyDetector {
  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  public static final int MIN_LENGTH = 10;
  private static final double FENCE = 1.5;
  /** 0.75 quantile of the standard normal; scales the MAD to a stdDev. */
  private static final double MAD_SCALE = 0.6745;

  public static class Args extends ArgsBase {
    @Doc(help = "Absolute z-score above which a value is an anomaly.")
    @Optional
    public double threshold = 2.5;

    @Doc(help = "Absolute modified (MAD based) z-score above which a value is an anomaly.")
    @Optional
    public double modifiedThreshold = 3.5;

    @Doc(help = "Maximum number of anomalies reported per method.")
    @Optional
    public int maxReported = 10;

    @Override
    public void validate() {
      check(threshold > 0, "threshold must be positive, got %s", threshold);
      check(modifiedThreshold > 0, "modifiedThreshold must be positive, got %s",
          modifiedThreshold);
      check(maxReported >= 0, "maxReported must not be negative, got %s", maxReported);
    }
  }

  public enum Severity {
    EXTREME, SEVERE, MODERATE, MILD;

    static Severity of(double zScore) {
      double absZ = Math.abs(zScore);
      if (absZ > 3.5) {
        return EXTREME;
      }
      if (absZ > 3.0) {
        return SEVERE;
      }
      return absZ > 2.5 ? MODERATE : MILD;
    }
  }

  public enum Direction {
    ABOVE_NORMAL, BELOW_NORMAL
  }

  public enum OutlierType {
    LOW_OUTLIER, HIGH_OUTLIER
  }

  /** An observation flagged by the z-score criterion. */
  public static final class ZScoreAnomaly {
    private final int index;
    private final double value;
    private final double zScore;
    private final Severity severity;
    private final Direction direction;

    ZScoreAnomaly(int index, double value, double zScore) {
      this.index = index;
      this.value = value;
      this.zScore = zScore;
      this.severity = Severity.of(zScore);
      this.direction = zScore > 0 ? Direction.ABOVE_NORMAL : Direction.BELOW_NORMAL;
    }

    public int getIndex() {
      return index;
    }

    public double getValue() {
      return value;
    }

    public double getZScore() {
      return zScore;
    }

    public Severity getSeverity() {
      return severity;
    }

    public Direction getDirection() {
      return direction;
    }
  }

  /** An observation flagged by the modified z-score criterion. */
  public static final class RobustAnomaly {
    private final int index;
    private final double value;
    private final double modifiedZScore;

    RobustAnomaly(int index, double value, double modifiedZScore) {
      this.index = index;
      this.value = value;
      this.modifiedZScore = modifiedZScore;
    }

    public int getIndex() {
      return index;
    }

    public double getValue() {
      return value;
    }

    public double getModifiedZScore() {
      return modifiedZScore;
    }

    public Direction getDirection() {
      return modifiedZScore > 0 ? Direction.ABOVE_NORMAL : Direction.BELOW_NORMAL;
    }
  }

  /** An observation outside the IQR fences. */
  public static final class IqrAnomaly {
    private final int index;
    private final double value;
    private final OutlierType type;

    IqrAnomaly(int index, double value, OutlierType type) {
      this.index = index;
      this.value = value;
      this.type = type;
    }

    public int getIndex() {
      return index;
    }

    public double getValue() {
      return value;
    }

    public OutlierType getType() {
      return type;
    }
  }

  public static final class Detection {
    private final double mean;
    private final double stdDev;
    private final double q1;
    private final double median;
    private final double q3;
    private final double lowerBound;
    private final double upperBound;
    private final double threshold;
    private final double mad;
    private final List<ZScoreAnomaly> zScoreAnomalies;
    private final List<IqrAnomaly> iqrAnomalies;
    private final List<RobustAnomaly> robustAnomalies;
    private final int totalZScoreAnomalies;
    private final int totalIqrAnomalies;
    private final int totalRobustAnomalies;
    private final double anomalyRate;

    Detection(double mean, double stdDev, double q1, double median, double q3,
        double lowerBound, double upperBound, double threshold, double mad,
        List<ZScoreAnomaly> zScoreAnomalies, List<IqrAnomaly> iqrAnomalies,
        List<RobustAnomaly> robustAnomalies, int totalZScoreAnomalies,
        int totalIqrAnomalies, int totalRobustAnomalies, double anomalyRate) {
      this.mean = mean;
      this.stdDev = stdDev;
      this.q1 = q1;
      this.median = median;
      this.q3 = q3;
      this.lowerBound = lowerBound;
      this.upperBound = upperBound;
      this.threshold = threshold;
      this.mad = mad;
      this.zScoreAnomalies = zScoreAnomalies;
      this.iqrAnomalies = iqrAnomalies;
      this.robustAnomalies = robustAnomalies;
      this.totalZScoreAnomalies = totalZScoreAnomalies;
      this.totalIqrAnomalies = totalIqrAnomalies;
      this.totalRobustAnomalies = totalRobustAnomalies;
      this.anomalyRate = anomalyRate;
    }

    public double getMean() {
      return mean;
    }

    /** Population standard deviation. */
    public double getStdDev() {
      return stdDev;
    }

    public double getQ1() {
      return q1;
    }

    public double getMedian() {
      return median;
    }

    public double getQ3() {
      return q3;
    }

    public double getIqr() {
      return q3 - q1;
    }

    public double getLowerBound() {
      return lowerBound;
    }

    public double getUpperBound() {
      return upperBound;
    }

    /** Z-score threshold the detection ran with. */
    public double getThreshold() {
      return threshold;
    }

    /** Median absolute deviation from the true (averaging) median. */
    public double getMad() {
      return mad;
    }

    /** The first anomalies by index, at most {@code maxReported}. */
    public List<ZScoreAnomaly> getZScoreAnomalies() {
      return zScoreAnomalies;
    }

    /** The first anomalies by index, at most {@code maxReported}. */
    public List<IqrAnomaly> getIqrAnomalies() {
      return iqrAnomalies;
    }

    /** The first anomalies by index, at most {@code maxReported}. */
    public List<RobustAnomaly> getRobustAnomalies() {
      return robustAnomalies;
    }

    public int getTotalZScoreAnomalies() {
      return totalZScoreAnomalies;
    }

    public int getTotalIqrAnomalies() {
      return totalIqrAnomalies;
    }

    public int getTotalRobustAnomalies() {
      return totalRobustAnomalies;
    }

    /** Percentage of observations flagged by the z-score criterion. */
    public double getAnomalyRate() {
      return anomalyRate;
    }
  }

  private final Args args;

  public AnomalyDetector() {
    this(new Args());
  }

  public AnomalyDetector(Args args) {
    args.validate();
    this.args = args;
  }

  public Detection detect(TimeSeries series) {
    SeriesPreparer.requireLength(series, MIN_LENGTH, "Anomaly detection");
    double[] data = series.toArray();
    int n = data.length;

    double mean = new Mean().evaluate(data);
    double stdDev = new StandardDeviation(false).evaluate(data, mean);

    // Z-score path. A constant series has no outliers.
    IntArrayList zFlagged = new IntArrayList();
    double[] zScores = new double[n];
    if (stdDev > 0) {
      for (int i = 0; i < n; i++) {
        zScores[i] = (data[i] - mean) / stdDev;
        if (Math.abs(zScores[i]) > args.threshold) {
          zFlagged.add(i);
        }
      }
    } else {
      log.debug("Series of {} values has zero variance; no z-score anomalies", n);
    }

    ImmutableList.Builder<ZScoreAnomaly> zAnomalies = ImmutableList.builder();
    for (int k = 0; k < Math.min(args.maxReported, zFlagged.size()); k++) {
      int i = zFlagged.getInt(k);
      zAnomalies.add(new ZScoreAnomaly(i, data[i], zScores[i]));
    }

    // IQR path, on order statistics only.
    double[] sorted = ArrayHelper.sortedCopy(data);
    double q1 = sorted[(int) Math.floor(n * 0.25)];
    double median = sorted[n / 2];
    double q3 = sorted[(int) Math.floor(n * 0.75)];
    double iqr = q3 - q1;
    double lowerBound = q1 - FENCE * iqr;
    double upperBound = q3 + FENCE * iqr;

    ImmutableList.Builder<IqrAnomaly> iqrAnomalies = ImmutableList.builder();
    int totalIqr = 0;
    for (int i = 0; i < n; i++) {
      if (data[i] < lowerBound || data[i] > upperBound) {
        if (totalIqr < args.maxReported) {
          iqrAnomalies.add(new IqrAnomaly(i, data[i],
              data[i] < lowerBound ? OutlierType.LOW_OUTLIER : OutlierType.HIGH_OUTLIER));
        }
        totalIqr++;
      }
    }

    // Modified z-score path. The centre is the averaging median, not sorted[n / 2].
    Median medianOf = new Median();
    double center = medianOf.evaluate(data);
    double[] deviations = new double[n];
    for (int i = 0; i < n; i++) {
      deviations[i] = Math.abs(data[i] - center);
    }
    double mad = medianOf.evaluate(deviations);

    ImmutableList.Builder<RobustAnomaly> robustAnomalies = ImmutableList.builder();
    int totalRobust = 0;
    if (mad > 0) {
      for (int i = 0; i < n; i++) {
        double modifiedZ = MAD_SCALE * (data[i] - center) / mad;
        if (Math.abs(modifiedZ) > args.modifiedThreshold) {
          if (totalRobust < args.maxReported) {
            robustAnomalies.add(new RobustAnomaly(i, data[i], modifiedZ));
          }
          totalRobust++;
        }
      }
    } else {
      log.debug("Median absolute deviation is zero; no modified z-score anomalies");
    }

    return new Detection(mean, stdDev, q1, median, q3, lowerBound, upperBound, args.threshold,
        mad, zAnomalies.build(), iqrAnomalies.build(), robustAnomalies.build(), zFlagged.size(),
        totalIqr, totalRobust, 100.0 * zFlagged.size() / n);
  }
}
