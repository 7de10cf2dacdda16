package net.qanwp.stats.timeseries;

import java.util.Arrays;
import java.util.List;
import net.qanwp.stats.exception.EmptySeriesException;
import net.qanwp.stats.exception.InsufficientDataException;
import net.qanwp.stats.exception.NonFiniteValueException;
import org.junit.Test;

import static org.junit.Assert.*;

public class SeriesPreparerTest {

  @Test
  public void testPrepareCopiesInput() {
    double[] raw = {1, 2, 3};
    TimeSeries series = SeriesPreparer.prepare(raw);
    raw[0] = 99;
    assertEquals(1, series.first(), 0.0);
    assertEquals(3, series.last(), 0.0);
    assertEquals(3, series.size());
  }

  @Test
  public void testRejectsNaN() {
    try {
      SeriesPreparer.prepare(1, 2, Double.NaN, 4);
      fail("expected NonFiniteValueException");
    } catch (NonFiniteValueException e) {
      assertEquals(2, e.getIndex());
    }
  }

  @Test(expected = NonFiniteValueException.class)
  public void testRejectsInfinity() {
    SeriesPreparer.prepare(1, Double.POSITIVE_INFINITY);
  }

  @Test
  public void testRejectsMissingListValue() {
    List<Double> values = Arrays.asList(1.0, null, 3.0);
    try {
      SeriesPreparer.prepare(values);
      fail("expected NonFiniteValueException");
    } catch (NonFiniteValueException e) {
      assertEquals(1, e.getIndex());
    }
  }

  @Test
  public void testPrepareList() {
    TimeSeries series = SeriesPreparer.prepare(Arrays.asList(1, 2.5, 3L));
    assertArrayEquals(new double[] {1, 2.5, 3}, series.toArray(), 0.0);
  }

  @Test(expected = EmptySeriesException.class)
  public void testNullSeries() {
    SeriesPreparer.prepare((double[]) null);
  }

  @Test
  public void testRequireLength() {
    TimeSeries series = SeriesPreparer.prepare(1, 2, 3);
    SeriesPreparer.requireLength(series, 3, "Test");
    try {
      SeriesPreparer.requireLength(series, 10, "Trend analysis");
      fail("expected InsufficientDataException");
    } catch (InsufficientDataException e) {
      assertEquals(10, e.getMinimum());
      assertEquals(3, e.getActual());
      assertEquals("Trend analysis requires at least 10 data points, got 3", e.getMessage());
    }
  }

  @Test
  public void testEmptyIsInsufficient() {
    try {
      SeriesPreparer.requireNonEmpty(SeriesPreparer.prepare(), "Series");
      fail("expected EmptySeriesException");
    } catch (InsufficientDataException e) {
      assertTrue(e instanceof EmptySeriesException);
      assertEquals(0, e.getActual());
    }
  }

  @Test
  public void testTailSliceShift() {
    TimeSeries series = SeriesPreparer.prepare(1, 2, 3, 4, 5);
    assertArrayEquals(new double[] {4, 5}, series.tail(2).toArray(), 0.0);
    assertSame(series, series.tail(10));
    assertArrayEquals(new double[] {2, 3}, series.slice(1, 3).toArray(), 0.0);
    assertEquals(SeriesPreparer.prepare(2, 3, 4, 5, 6), series.shift(1));
  }
}
