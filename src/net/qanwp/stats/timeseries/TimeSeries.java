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

import java.util.Arrays;
import org.apache.commons.lang3.ArrayUtils;

/**
 * An ordered, immutable sequence of finite observations of one variable.
 *
 * <p>Values are index aligned; the caller is responsible for ordering them in
 * time. Instances are only created by {@link SeriesPreparer}, which guarantees
 * that no value is NaN or infinite.
 */
public final class TimeSeries {
  private final double[] values;

  TimeSeries(double[] values) {
    this.values = values;
  }

  public int size() {
    return values.length;
  }

  public boolean isEmpty() {
    return values.length == 0;
  }

  public double get(int index) {
    return values[index];
  }

  public double first() {
    return values[0];
  }

  public double last() {
    return values[values.length - 1];
  }

  /** Returns a copy of the values. */
  public double[] toArray() {
    return values.clone();
  }

  /** The last {@code count} values, or the whole series when it is shorter. */
  public TimeSeries tail(int count) {
    if (count >= values.length) {
      return this;
    }
    return new TimeSeries(ArrayUtils.subarray(values, values.length - count, values.length));
  }

  /** Values between {@code from} (incl) and {@code to} (excl). */
  public TimeSeries slice(int from, int to) {
    return new TimeSeries(ArrayUtils.subarray(values, from, to));
  }

  /** A new series with {@code offset} added to every value. */
  public TimeSeries shift(double offset) {
    double[] shifted = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      shifted[i] = values[i] + offset;
    }
    return new TimeSeries(shifted);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TimeSeries && Arrays.equals(values, ((TimeSeries) o).values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "TimeSeries" + Arrays.toString(values);
  }
}
