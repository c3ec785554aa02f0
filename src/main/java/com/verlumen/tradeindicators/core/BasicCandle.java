package com.verlumen.tradeindicators.core;

import com.google.auto.value.AutoValue;

/** Plain immutable {@link Candle}. */
@AutoValue
public abstract class BasicCandle implements Candle {
  public static BasicCandle create(
      double open, double high, double low, double close, double volume) {
    return new AutoValue_BasicCandle(open, high, low, close, volume);
  }

  /** Creates a flat candle where every price equals {@code price}. */
  public static BasicCandle ofPrice(double price) {
    return create(price, price, price, price, 0.0);
  }

  /** Creates a copy of any candle, dropping implementation specific state. */
  public static BasicCandle copyOf(Candle candle) {
    if (candle instanceof BasicCandle) {
      return (BasicCandle) candle;
    }
    return create(candle.open(), candle.high(), candle.low(), candle.close(), candle.volume());
  }
}
