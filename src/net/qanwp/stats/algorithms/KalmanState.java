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

/**
 * State of a scalar Kalman filter. Immutable: {@link #predict()} and
 * {@link #update(double)} return the next state.
 */
public final class KalmanState {
  private final double estimate;
  private final double covariance;
  private final double processNoise;
  private final double measurementNoise;
  private final double gain;

  public KalmanState(double estimate, double covariance, double processNoise,
      double measurementNoise, double gain) {
    this.estimate = estimate;
    this.covariance = covariance;
    this.processNoise = processNoise;
    this.measurementNoise = measurementNoise;
    this.gain = gain;
  }

  /** State at the start of a run: x = first observation, P = 1, K = 0. */
  public static KalmanState initial(double firstObservation, double processNoise,
      double measurementNoise) {
    return new KalmanState(firstObservation, 1.0, processNoise, measurementNoise, 0);
  }

  /**
   * Time update without control input: x stays, P grows by Q.
   */
  public KalmanState predict() {
    return new KalmanState(estimate, covariance + processNoise, processNoise, measurementNoise,
        gain);
  }

  /**
   * Measurement update: K = P / (P + R), x = x + K (z - x), P = (1 - K) P.
   */
  public KalmanState update(double measurement) {
    double k = covariance / (covariance + measurementNoise);
    return new KalmanState(estimate + k * (measurement - estimate), (1 - k) * covariance,
        processNoise, measurementNoise, k);
  }

  public double getEstimate() {
    return estimate;
  }

  public double getCovariance() {
    return covariance;
  }

  public double getProcessNoise() {
    return processNoise;
  }

  public double getMeasurementNoise() {
    return measurementNoise;
  }

  public double getGain() {
    return gain;
  }

  @Override
  public String toString() {
    return String.format("KalmanState{x=%s, P=%s, Q=%s, R=%s, K=%s}",
        estimate, covariance, processNoise, measurementNoise, gain);
  }
}
