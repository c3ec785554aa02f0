package com.verlumen.tradeindicators.ta4j;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.tradeindicators.core.Candle;
import org.ta4j.core.Bar;
import org.ta4j.core.BarSeries;
import org.ta4j.core.num.Num;

/** Presents a Ta4j {@link Bar} as a {@link Candle}. */
@AutoValue
public abstract class BarCandle implements Candle {
  public abstract Bar bar();

  public static BarCandle of(Bar bar) {
    return new AutoValue_BarCandle(bar);
  }

  /** Wraps every bar of {@code series}, oldest first. */
  public static ImmutableList<BarCandle> fromSeries(BarSeries series) {
    if (series.isEmpty()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<BarCandle> candles =
        ImmutableList.builderWithExpectedSize(series.getBarCount());
    for (int i = series.getBeginIndex(); i <= series.getEndIndex(); i++) {
      candles.add(of(series.getBar(i)));
    }
    return candles.build();
  }

  @Override
  public double open() {
    return toDouble(bar().getOpenPrice());
  }

  @Override
  public double high() {
    return toDouble(bar().getHighPrice());
  }

  @Override
  public double low() {
    return toDouble(bar().getLowPrice());
  }

  @Override
  public double close() {
    return toDouble(bar().getClosePrice());
  }

  @Override
  public double volume() {
    return toDouble(bar().getVolume());
  }

  // Bars built without a price report null.
  private static double toDouble(Num num) {
    return num == null ? Double.NaN : num.doubleValue();
  }
}
