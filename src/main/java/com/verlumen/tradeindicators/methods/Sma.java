package com.verlumen.tradeindicators.methods;

/** Simple moving average over a {@link RollingWindow}. */
public final class Sma {
  private final RollingWindow window;
  private double sum;

  /** Creates an average whose window is filled with {@code seed}. */
  public Sma(int period, double seed) {
    this.window = new RollingWindow(period, seed);
    this.sum = seed * period;
  }

  public double next(double value) {
    sum += value - window.push(value);
    if (!Double.isFinite(sum)) {
      // A non-finite input keeps the running sum non-finite after it leaves the window.
      sum = window.sum();
    }
    return sum / window.length();
  }
}
