package com.verlumen.tradeindicators.methods;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/** Fixed length ring buffer of the most recent values. */
public final class RollingWindow {
  private final double[] buffer;
  private int head;

  /** Creates a window of {@code length} slots, each holding {@code initialValue}. */
  public RollingWindow(int length, double initialValue) {
    checkArgument(length > 0, "Window length must be positive: %s", length);
    this.buffer = new double[length];
    Arrays.fill(buffer, initialValue);
  }

  public int length() {
    return buffer.length;
  }

  /** Stores {@code value} and returns the value that fell out of the window. */
  public double push(double value) {
    double evicted = buffer[head];
    buffer[head] = value;
    head = (head + 1) % buffer.length;
    return evicted;
  }

  /** Returns the oldest value, the one the next {@link #push(double)} will evict. */
  public double oldest() {
    return buffer[head];
  }

  public double sum() {
    double sum = 0.0;
    for (double value : buffer) {
      sum += value;
    }
    return sum;
  }

  public double max() {
    double max = Double.NEGATIVE_INFINITY;
    for (double value : buffer) {
      max = Math.max(max, value);
    }
    return max;
  }

  public double min() {
    double min = Double.POSITIVE_INFINITY;
    for (double value : buffer) {
      min = Math.min(min, value);
    }
    return min;
  }
}
