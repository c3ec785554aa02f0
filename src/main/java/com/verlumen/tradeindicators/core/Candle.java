package com.verlumen.tradeindicators.core;

/**
 * Read-only view of one market observation (open, high, low, close and volume).
 *
 * <p>Candles are supplied by the host application. Implementations must be immutable and should
 * provide value equality and a readable {@code toString()} so that results can be diagnosed.
 */
public interface Candle {
  double open();

  double high();

  double low();

  double close();

  double volume();

  /** Returns {@code (high + low) / 2}. */
  default double hl2() {
    return (high() + low()) / 2.0;
  }

  /** Returns the typical price {@code (high + low + close) / 3}. */
  default double hlc3() {
    return (high() + low() + close()) / 3.0;
  }

  /** Returns {@code (open + high + low + close) / 4}. */
  default double ohlc4() {
    return (open() + high() + low() + close()) / 4.0;
  }

  /**
   * Returns the true range of this candle relative to the previous close.
   *
   * @param previousClose close of the preceding candle
   */
  default double tr(double previousClose) {
    return Math.max(high(), previousClose) - Math.min(low(), previousClose);
  }

  /**
   * Checks that every value is finite, the high and low bound the open and close, and volume is
   * not negative.
   */
  default boolean isValid() {
    return Double.isFinite(open())
        && Double.isFinite(high())
        && Double.isFinite(low())
        && Double.isFinite(close())
        && Double.isFinite(volume())
        && volume() >= 0
        && low() <= Math.min(open(), close())
        && high() >= Math.max(open(), close());
  }
}
