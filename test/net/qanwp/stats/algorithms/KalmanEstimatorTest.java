package net.qanwp.stats.algorithms;

import java.util.Arrays;
import net.qanwp.stats.exception.EmptySeriesException;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import org.junit.Test;

import static org.junit.Assert.*;

public class KalmanEstimatorTest {

  private static TimeSeries constant(double value, int n) {
    double[] values = new double[n];
    Arrays.fill(values, value);
    return SeriesPreparer.prepare(values);
  }

  @Test
  public void testConstantSeriesConverges() {
    KalmanEstimator.Estimate estimate = new KalmanEstimator().filter(constant(12.5, 25));
    double[] filtered = estimate.getFiltered();
    assertEquals(25, filtered.length);
    assertEquals(12.5, filtered[filtered.length - 1], 1e-3);
  }

  @Test
  public void testUncertaintyNeverGrowsWhileFiltering() {
    double[] noisy = new double[40];
    for (int i = 0; i < noisy.length; i++) {
      noisy[i] = 20 + (i % 2 == 0 ? 0.8 : -0.8);
    }
    double[] uncertainties = new KalmanEstimator().filter(SeriesPreparer.prepare(noisy))
        .getUncertainties();
    for (int i = 1; i < uncertainties.length; i++) {
      assertTrue("uncertainty grew at " + i, uncertainties[i] <= uncertainties[i - 1] + 1e-12);
    }
  }

  @Test
  public void testForecastPersistsLastEstimate() {
    double[] values = {3, 4, 6, 5, 7, 8, 7, 9, 10, 9};
    KalmanEstimator.Estimate estimate =
        new KalmanEstimator().filter(SeriesPreparer.prepare(values));
    double[] filtered = estimate.getFiltered();
    double[] forecast = estimate.getForecast();
    assertEquals(7, forecast.length);
    for (double f : forecast) {
      assertEquals(filtered[filtered.length - 1], f, 0.0);
    }
    // predict-only steps keep adding Q to the covariance
    assertEquals(estimate.getUncertainties()[9] + 7 * 0.1,
        estimate.getFinalState().getCovariance(), 1e-9);
  }

  @Test
  public void testFirstGain() {
    // P = 1 + Q = 1.1, K = 1.1 / 2.1
    KalmanEstimator.Estimate estimate = new KalmanEstimator().filter(constant(1, 3));
    assertEquals(1.1 / 2.1, estimate.getGains()[0], 1e-12);
    assertEquals(1.1 / 2.1, 1 - estimate.getUncertainties()[0] / 1.1, 1e-12);
  }

  @Test
  public void testCustomHorizon() {
    KalmanEstimator.Args args = new KalmanEstimator.Args();
    args.forecastHorizon = 3;
    args.measurementNoise = 4.0;
    assertEquals(3, new KalmanEstimator(args).filter(constant(2, 10)).getForecast().length);
  }

  @Test(expected = EmptySeriesException.class)
  public void testEmptySeries() {
    new KalmanEstimator().filter(SeriesPreparer.prepare(new double[0]));
  }
}
