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
package net.qanwp.stats.engine;

import com.google.common.base.Preconditions;
import java.time.Instant;

/**
 * Output of one algorithm run together with its identification. The payload
 * is the component's own result type, e.g. {@code KalmanEstimator.Estimate}.
 */
public final class AnalysisResult {
  private final Algorithm algorithm;
  private final int dataPoints;
  private final Instant executedAt;
  private final Object output;

  AnalysisResult(Algorithm algorithm, int dataPoints, Instant executedAt, Object output) {
    this.algorithm = algorithm;
    this.dataPoints = dataPoints;
    this.executedAt = executedAt;
    this.output = output;
  }

  public Algorithm getAlgorithm() {
    return algorithm;
  }

  public String getDisplayName() {
    return algorithm.getDisplayName();
  }

  public String getDescription() {
    return algorithm.getDescription();
  }

  public String getReference() {
    return algorithm.getReference();
  }

  /** Length of the primary input of the run. */
  public int getDataPoints() {
    return dataPoints;
  }

  public Instant getExecutedAt() {
    return executedAt;
  }

  public Object getOutput() {
    return output;
  }

  public <T> T outputAs(Class<T> type) {
    Preconditions.checkState(type.isInstance(output), "%s produced %s, not %s",
        algorithm.getId(), output.getClass().getSimpleName(), type.getSimpleName());
    return type.cast(output);
  }

  @Override
  public String toString() {
    return String.format("AnalysisResult{%s, %d points, %s}", algorithm.getId(), dataPoints,
        executedAt);
  }
}
