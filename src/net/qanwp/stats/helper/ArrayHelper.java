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
package net.qanwp.stats.helper;

import java.util.Arrays;

/** Static array manipulation functions. */
public class ArrayHelper {
  /** A sorted copy of array; the input is left untouched. */
  public static double[] sortedCopy(double[] array) {
    double[] sorted = array.clone();
    Arrays.sort(sorted);
    return sorted;
  }

  /**
   * Find the last index of a sorted array whose entry is at most value. Returns 0 when every
   * entry is larger, so the lowest rank is reported rather than a miss.
   */
  public static int lastAtMost(double value, double[] sorted) {
    int rank = 0;
    for (int i = 0; i < sorted.length; i++) {
      if (sorted[i] <= value) {
        rank = i;
      }
    }
    return rank;
  }

  /** Sum of squared entries. */
  public static double sumOfSquares(double[] array) {
    double sum = 0;
    for (double v : array) {
      sum += v * v;
    }
    return sum;
  }

  /** Element-wise difference a - b. */
  public static double[] subtract(double[] a, double[] b) {
    double[] result = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      result[i] = a[i] - b[i];
    }
    return result;
  }
}
