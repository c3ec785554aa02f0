package com.verlumen.tradeindicators.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Declared arity of an indicator's output: count of raw values and count of signals. */
@AutoValue
public abstract class ResultSize {
  public abstract int rawCount();

  public abstract int signalCount();

  public static ResultSize of(int rawCount, int signalCount) {
    checkArgument(
        rawCount >= 0 && rawCount <= IndicatorResult.MAX_SIZE,
        "Raw value count must be within [0, %s]: %s",
        IndicatorResult.MAX_SIZE,
        rawCount);
    checkArgument(
        signalCount >= 0 && signalCount <= IndicatorResult.MAX_SIZE,
        "Signal count must be within [0, %s]: %s",
        IndicatorResult.MAX_SIZE,
        signalCount);
    return new AutoValue_ResultSize(rawCount, signalCount);
  }
}
