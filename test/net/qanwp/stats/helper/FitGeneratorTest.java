package net.qanwp.stats.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class FitGeneratorTest {

  @Test
  public void testFitLine() {
    double[] y = new double[12];
    for (int i = 0; i < y.length; i++) {
      y[i] = 3 + 2 * i;
    }
    assertArrayEquals(new double[] {3, 2}, FitGenerator.fitLine(y), 1e-9);
  }

  @Test
  public void testFitLineThroughNoise() {
    double[] y = {1, 3, 2, 4, 3, 5};
    double[] coefficients = FitGenerator.fitLine(y);
    // x mean 2.5, y mean 3, Sxy 11, Sxx 17.5
    assertEquals(11 / 17.5, coefficients[1], 1e-9);
    assertEquals(3 - 2.5 * 11 / 17.5, coefficients[0], 1e-9);
  }

  @Test
  public void testMultipleRegression() {
    FitGenerator fit = new FitGenerator();
    fit.init(4, 3);
    double[][] x = {{1, 0, 0}, {1, 1, 0}, {1, 0, 1}, {1, 1, 1}};
    for (int i = 0; i < x.length; i++) {
      for (int j = 0; j < 3; j++) {
        fit.setObservation(i, j, x[i][j]);
      }
      fit.setTarget(i, 1 + 2 * x[i][1] - x[i][2]);
    }
    assertArrayEquals(new double[] {1, 2, -1}, fit.linearFit(), 1e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnderdetermined() {
    new FitGenerator().init(1, 2);
  }
}
