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
package net.qanwp.stats.exception;

/**
 * Raised when a series (or a set of training pairs) is shorter than the
 * minimum an algorithm needs.
 */
public class InsufficientDataException extends AnalysisException {
  private static final long serialVersionUID = 1L;

  private final int minimum;
  private final int actual;

  public InsufficientDataException(String message, int minimum, int actual) {
    super(message);
    this.minimum = minimum;
    this.actual = actual;
  }

  public static InsufficientDataException forAlgorithm(String algorithm, int minimum, int actual) {
    return new InsufficientDataException(
        String.format("%s requires at least %d data points, got %d", algorithm, minimum, actual),
        minimum, actual);
  }

  public int getMinimum() {
    return minimum;
  }

  public int getActual() {
    return actual;
  }
}
