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

import com.google.common.primitives.Doubles;
import java.util.List;
import net.qanwp.stats.exception.EmptySeriesException;
import net.qanwp.stats.exception.InsufficientDataException;
import net.qanwp.stats.exception.NonFiniteValueException;

/**
 * Validates raw input and turns it into a {@link TimeSeries}.
 *
 * <p>Missing values are expected to be removed upstream. Anything that is not
 * a finite number is rejected here, so no algorithm ever sees NaN.
 */
public final class SeriesPreparer {
  private SeriesPreparer() {}

  public static TimeSeries prepare(double... values) {
    if (values == null) {
      throw new EmptySeriesException("Series");
    }
    for (int i = 0; i < values.length; i++) {
      if (!Double.isFinite(values[i])) {
        throw new NonFiniteValueException(i, values[i]);
      }
    }
    return new TimeSeries(values.clone());
  }

  public static TimeSeries prepare(List<? extends Number> values) {
    if (values == null) {
      throw new EmptySeriesException("Series");
    }
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) == null) {
        throw new NonFiniteValueException(i, null);
      }
    }
    return prepare(Doubles.toArray(values));
  }

  public static void requireNonEmpty(TimeSeries series, String what) {
    if (series == null || series.isEmpty()) {
      throw new EmptySeriesException(what);
    }
  }

  /**
   * Fails with {@link InsufficientDataException} when the series holds fewer
   * than {@code minimum} values.
   */
  public static void requireLength(TimeSeries series, int minimum, String algorithm) {
    int actual = series == null ? 0 : series.size();
    if (actual < minimum) {
      throw InsufficientDataException.forAlgorithm(algorithm, minimum, actual);
    }
  }
}
