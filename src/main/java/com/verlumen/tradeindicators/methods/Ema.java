package com.verlumen.tradeindicators.methods;

import static com.google.common.base.Preconditions.checkArgument;

/** Exponential moving average. */
public final class Ema {
  private final double alpha;
  private double value;

  private Ema(double alpha, double seed) {
    checkArgument(alpha > 0 && alpha <= 1, "Smoothing factor must be within (0, 1]: %s", alpha);
    this.alpha = alpha;
    this.value = seed;
  }

  /** Standard EMA with smoothing factor {@code 2 / (period + 1)}. */
  public static Ema ofPeriod(int period, double seed) {
    checkArgument(period > 0, "Period must be positive: %s", period);
    return new Ema(2.0 / (period + 1.0), seed);
  }

  /** Wilder's smoothing, factor {@code 1 / period}. */
  public static Ema wilder(int period, double seed) {
    checkArgument(period > 0, "Period must be positive: %s", period);
    return new Ema(1.0 / period, seed);
  }

  public double next(double input) {
    value += alpha * (input - value);
    return value;
  }

  public double value() {
    return value;
  }
}
