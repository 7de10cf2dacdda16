package net.qanwp.stats.algorithms;

import java.util.Arrays;
import net.qanwp.stats.exception.InsufficientDataException;
import net.qanwp.stats.exception.SeriesTooLongException;
import net.qanwp.stats.timeseries.SeriesPreparer;
import org.junit.Test;

import static org.junit.Assert.*;

public class TrendAnalyzerTest {
  private final TrendAnalyzer analyzer = new TrendAnalyzer();

  private static double[] ramp(int n, double start, double step) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = start + i * step;
    }
    return values;
  }

  @Test
  public void testIncreasingRamp() {
    TrendAnalyzer.Trend trend = analyzer.analyze(SeriesPreparer.prepare(ramp(20, 1, 1)));
    TrendAnalyzer.MannKendall mk = trend.getMannKendall();
    assertEquals(190, mk.getS(), 0.0);
    assertEquals(950, mk.getVariance(), 1e-9);
    assertEquals(189 / Math.sqrt(950), mk.getZ(), 1e-12);
    assertTrue(mk.getZ() > 1.96);
    assertTrue(mk.isSignificant());
    assertEquals(TrendAnalyzer.ClimateTrend.SIGNIFICANT_INCREASE, trend.getDirection());

    assertEquals(1.0, trend.getSenSlope(), 0.0);
    assertEquals(TrendDirection.INCREASING, trend.getSenInterpretation());
    assertEquals(TrendAnalyzer.Magnitude.STRONG, trend.getMagnitude());
    assertEquals(10.0, trend.getProjectedChange(), 0.0);

    assertEquals(1.0, trend.getLinear().getSlope(), 1e-9);
    assertEquals(1.0, trend.getLinear().getIntercept(), 1e-9);
    assertEquals(1.0, trend.getLinear().getRSquared(), 1e-9);

    assertEquals(1.0, trend.getSenLower(), 0.0);
    assertEquals(1.0, trend.getSenUpper(), 0.0);
    assertEquals(1.0, trend.getSenIntercept(), 1e-12);
    assertEquals(0, mk.getTieGroups());
  }

  @Test
  public void testSenBoundsBracketTheSlope() {
    double[] values = new double[40];
    for (int i = 0; i < values.length; i++) {
      values[i] = 0.2 * i + 3 * Math.sin(i * 1.3);
    }
    TrendAnalyzer.Trend trend = analyzer.analyze(SeriesPreparer.prepare(values));
    assertTrue(trend.getSenLower() < trend.getSenSlope());
    assertTrue(trend.getSenUpper() > trend.getSenSlope());
    assertTrue(trend.getSenLower() > 0);
  }

  @Test
  public void testDecreasingRamp() {
    TrendAnalyzer.Trend trend = analyzer.analyze(SeriesPreparer.prepare(ramp(15, 30, -0.05)));
    assertEquals(-105, trend.getMannKendall().getS(), 0.0);
    assertEquals(TrendAnalyzer.ClimateTrend.SIGNIFICANT_DECREASE, trend.getDirection());
    assertEquals(TrendDirection.DECREASING, trend.getSenInterpretation());
    assertEquals(TrendAnalyzer.Magnitude.MODERATE, trend.getMagnitude());
    assertEquals(-0.05, trend.getSenSlope(), 1e-12);
  }

  @Test
  public void testConstantSeries() {
    double[] values = new double[12];
    Arrays.fill(values, 4.2);
    TrendAnalyzer.Trend trend = analyzer.analyze(SeriesPreparer.prepare(values));
    assertEquals(0, trend.getMannKendall().getS(), 0.0);
    assertEquals(0, trend.getMannKendall().getZ(), 0.0);
    assertFalse(trend.getMannKendall().isSignificant());
    assertEquals(TrendAnalyzer.ClimateTrend.NO_SIGNIFICANT_TREND, trend.getDirection());
    assertEquals(TrendDirection.STABLE, trend.getSenInterpretation());
    assertEquals(TrendAnalyzer.Magnitude.NEGLIGIBLE, trend.getMagnitude());
    assertEquals(0, trend.getLinear().getRSquared(), 0.0);
  }

  @Test
  public void testTiesDoNotCount() {
    // three tied pairs, the other 42 pairs increase
    double[] values = {0, 1, 1, 2, 3, 3, 4, 6, 6, 7};
    TrendAnalyzer.Trend trend = analyzer.analyze(SeriesPreparer.prepare(values));
    assertEquals(42, trend.getMannKendall().getS(), 0.0);
    assertTrue(trend.getSenSlope() > 0);
    assertEquals(TrendAnalyzer.ClimateTrend.SIGNIFICANT_INCREASE, trend.getDirection());
    assertEquals(3, trend.getMannKendall().getTieGroups());
    assertEquals(125, trend.getMannKendall().getVariance(), 1e-9);
  }

  @Test
  public void testTieCorrectedVariance() {
    TrendAnalyzer.Args args = new TrendAnalyzer.Args();
    args.tieCorrection = true;
    double[] values = {0, 1, 1, 2, 3, 3, 4, 6, 6, 7};
    TrendAnalyzer.MannKendall mk =
        new TrendAnalyzer(args).analyze(SeriesPreparer.prepare(values)).getMannKendall();
    // three groups of two: 3 * 2 * 1 * 9 = 54 removed from 2250
    assertEquals(122, mk.getVariance(), 1e-9);
    assertEquals(41 / Math.sqrt(122), mk.getZ(), 1e-12);
    assertEquals(3, mk.getTieGroups());
  }

  @Test
  public void testTieCorrectionOnConstantSeries() {
    TrendAnalyzer.Args args = new TrendAnalyzer.Args();
    args.tieCorrection = true;
    double[] values = new double[10];
    Arrays.fill(values, 1.5);
    TrendAnalyzer.Trend trend = new TrendAnalyzer(args).analyze(SeriesPreparer.prepare(values));
    assertEquals(0, trend.getMannKendall().getVariance(), 1e-9);
    assertEquals(0, trend.getMannKendall().getZ(), 0.0);
    assertEquals(1, trend.getMannKendall().getTieGroups());
    assertEquals(0, trend.getSenLower(), 0.0);
    assertEquals(0, trend.getSenUpper(), 0.0);
    assertEquals(1.5, trend.getSenIntercept(), 0.0);
  }

  @Test
  public void testTooLong() {
    try {
      analyzer.analyze(SeriesPreparer.prepare(ramp(TrendAnalyzer.MAX_LENGTH + 1, 0, 1)));
      fail("expected SeriesTooLongException");
    } catch (SeriesTooLongException e) {
      assertEquals(TrendAnalyzer.MAX_LENGTH, e.getMaximum());
      assertEquals(TrendAnalyzer.MAX_LENGTH + 1, e.getActual());
    }
  }

  @Test(expected = InsufficientDataException.class)
  public void testTooShort() {
    analyzer.analyze(SeriesPreparer.prepare(1, 2, 3));
  }
}
