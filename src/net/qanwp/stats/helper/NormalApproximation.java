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

/**
 * Standard normal distribution function via the rational approximation of
 * Abramowitz and Stegun (1964), Handbook of Mathematical Functions, 7.1.26.
 * Absolute error of the underlying erf approximation is below 1.5e-7.
 */
public final class NormalApproximation {
  private static final double A1 = 0.254829592;
  private static final double A2 = -0.284496736;
  private static final double A3 = 1.421413741;
  private static final double A4 = -1.453152027;
  private static final double A5 = 1.061405429;
  private static final double P = 0.3275911;

  private NormalApproximation() {}

  /** P(Z <= x) for a standard normal Z. */
  public static double cdf(double x) {
    double sign = x < 0 ? -1 : 1;
    double z = Math.abs(x) / Math.sqrt(2);

    double t = 1.0 / (1.0 + P * z);
    double erf = 1.0 - ((((A5 * t + A4) * t + A3) * t + A2) * t + A1) * t * Math.exp(-z * z);

    return 0.5 * (1.0 + sign * erf);
  }

  /** Two-sided p-value of a standard normal test statistic. */
  public static double twoSidedPValue(double z) {
    return 2 * (1 - cdf(Math.abs(z)));
  }
}
