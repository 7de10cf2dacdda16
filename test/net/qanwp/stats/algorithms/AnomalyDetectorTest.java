package net.qanwp.stats.algorithms;

import java.util.Arrays;
import net.qanwp.stats.exception.InsufficientDataException;
import net.qanwp.stats.exception.InvalidParameterException;
import net.qanwp.stats.timeseries.SeriesPreparer;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class AnomalyDetectorTest {
  double[] base;

  @Before
  public void setUp() {
    base = new double[50];
    for (int i = 0; i < base.length; i++) {
      base[i] = 10 + Math.sin(i * 0.5);
    }
  }

  @Test
  public void testCleanDataHasNoZScoreAnomalies() {
    AnomalyDetector.Detection detection =
        new AnomalyDetector().detect(SeriesPreparer.prepare(base));
    assertEquals(0, detection.getTotalZScoreAnomalies());
    assertTrue(detection.getZScoreAnomalies().isEmpty());
    assertEquals(0, detection.getAnomalyRate(), 0.0);
    assertEquals(0, detection.getTotalIqrAnomalies());
    assertEquals(0, detection.getTotalRobustAnomalies());
  }

  @Test
  public void testInjectedOutlierIsExtreme() {
    double mean = new Mean().evaluate(base);
    double std = new StandardDeviation(false).evaluate(base);
    double[] values = Arrays.copyOf(base, base.length + 1);
    values[base.length] = mean + 5 * std;

    AnomalyDetector.Detection detection =
        new AnomalyDetector().detect(SeriesPreparer.prepare(values));
    assertEquals(1, detection.getTotalZScoreAnomalies());
    AnomalyDetector.ZScoreAnomaly anomaly = detection.getZScoreAnomalies().get(0);
    assertEquals(50, anomaly.getIndex());
    assertEquals(AnomalyDetector.Severity.EXTREME, anomaly.getSeverity());
    assertEquals(AnomalyDetector.Direction.ABOVE_NORMAL, anomaly.getDirection());
    assertTrue(anomaly.getZScore() > 3.5);
    assertEquals(100.0 / 51, detection.getAnomalyRate(), 1e-12);

    boolean flagged = false;
    for (AnomalyDetector.IqrAnomaly outlier : detection.getIqrAnomalies()) {
      if (outlier.getIndex() == 50) {
        flagged = true;
        assertEquals(AnomalyDetector.OutlierType.HIGH_OUTLIER, outlier.getType());
      }
    }
    assertTrue(flagged);
  }

  @Test
  public void testReportedListsAreCapped() {
    double[] values = new double[30];
    values[5] = 100;
    values[20] = 100;
    AnomalyDetector.Args args = new AnomalyDetector.Args();
    args.maxReported = 1;

    AnomalyDetector.Detection detection =
        new AnomalyDetector(args).detect(SeriesPreparer.prepare(values));
    assertEquals(2, detection.getTotalZScoreAnomalies());
    assertEquals(1, detection.getZScoreAnomalies().size());
    assertEquals(5, detection.getZScoreAnomalies().get(0).getIndex());
    assertEquals(2, detection.getTotalIqrAnomalies());
    assertEquals(1, detection.getIqrAnomalies().size());
    assertEquals(0, detection.getIqr(), 0.0);
    // more than half the values are equal, so the MAD is zero
    assertEquals(0, detection.getMad(), 0.0);
    assertEquals(0, detection.getTotalRobustAnomalies());
  }

  @Test
  public void testModifiedZScoreUsesMedianAndMad() {
    double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 100};
    AnomalyDetector.Detection detection =
        new AnomalyDetector().detect(SeriesPreparer.prepare(values));
    // median 5.5, absolute deviations have median 2.5
    assertEquals(2.5, detection.getMad(), 1e-12);
    assertEquals(1, detection.getTotalRobustAnomalies());
    AnomalyDetector.RobustAnomaly anomaly = detection.getRobustAnomalies().get(0);
    assertEquals(9, anomaly.getIndex());
    assertEquals(100, anomaly.getValue(), 0.0);
    assertEquals(0.6745 * 94.5 / 2.5, anomaly.getModifiedZScore(), 1e-9);
    assertEquals(AnomalyDetector.Direction.ABOVE_NORMAL, anomaly.getDirection());
  }

  @Test
  public void testLowerThresholdFlagsMore() {
    AnomalyDetector.Args args = new AnomalyDetector.Args();
    args.threshold = 1.0;
    AnomalyDetector.Detection detection =
        new AnomalyDetector(args).detect(SeriesPreparer.prepare(base));
    assertEquals(1.0, detection.getThreshold(), 0.0);
    assertTrue(detection.getTotalZScoreAnomalies() > 0);
  }

  @Test(expected = InvalidParameterException.class)
  public void testNonPositiveModifiedThreshold() {
    AnomalyDetector.Args args = new AnomalyDetector.Args();
    args.modifiedThreshold = 0;
    new AnomalyDetector(args);
  }

  @Test
  public void testConstantSeries() {
    double[] values = new double[12];
    Arrays.fill(values, 7.0);
    AnomalyDetector.Detection detection =
        new AnomalyDetector().detect(SeriesPreparer.prepare(values));
    assertEquals(0, detection.getStdDev(), 0.0);
    assertEquals(0, detection.getTotalZScoreAnomalies());
    assertEquals(0, detection.getTotalIqrAnomalies());
    assertEquals(7.0, detection.getMedian(), 0.0);
    assertEquals(0, detection.getTotalRobustAnomalies());
    assertTrue(detection.getRobustAnomalies().isEmpty());
  }

  @Test
  public void testQuartilesAreOrderStatistics() {
    double[] values = {9, 1, 8, 2, 7, 3, 6, 4, 5, 0};
    AnomalyDetector.Detection detection =
        new AnomalyDetector().detect(SeriesPreparer.prepare(values));
    // sorted 0..9: q1 = sorted[2], median = sorted[5], q3 = sorted[7]
    assertEquals(2, detection.getQ1(), 0.0);
    assertEquals(5, detection.getMedian(), 0.0);
    assertEquals(7, detection.getQ3(), 0.0);
    assertEquals(-5.5, detection.getLowerBound(), 0.0);
    assertEquals(14.5, detection.getUpperBound(), 0.0);
  }

  @Test
  public void testSeverityClasses() {
    assertEquals(AnomalyDetector.Severity.EXTREME, AnomalyDetector.Severity.of(-3.6));
    assertEquals(AnomalyDetector.Severity.SEVERE, AnomalyDetector.Severity.of(3.2));
    assertEquals(AnomalyDetector.Severity.MODERATE, AnomalyDetector.Severity.of(2.7));
    assertEquals(AnomalyDetector.Severity.MILD, AnomalyDetector.Severity.of(2.5));
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooShort() {
    new AnomalyDetector().detect(SeriesPreparer.prepare(1, 2, 3));
  }
}
