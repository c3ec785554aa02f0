package com.verlumen.tradeindicators.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/**
 * Output of an indicator for a single candle: a fixed number of raw values and a fixed number of
 * signals, as declared by the indicator's {@link ResultSize}.
 *
 * <p>Raw values may be {@code NaN} when the indicator has no meaningful value yet. Equality treats
 * two {@code NaN} values as equal.
 */
@AutoValue
public abstract class IndicatorResult {
  public static final int MAX_SIZE = 4;

  public abstract ImmutableList<Double> values();

  public abstract ImmutableList<Action> signals();

  public static IndicatorResult of(double[] values, Action... signals) {
    return create(ImmutableList.copyOf(Doubles.asList(values)), ImmutableList.copyOf(signals));
  }

  /** Creates a result with one raw value and one signal. */
  public static IndicatorResult of(double value, Action signal) {
    return create(ImmutableList.of(value), ImmutableList.of(signal));
  }

  public static IndicatorResult create(
      ImmutableList<Double> values, ImmutableList<Action> signals) {
    checkArgument(values.size() <= MAX_SIZE, "Too many values: %s", values.size());
    checkArgument(signals.size() <= MAX_SIZE, "Too many signals: %s", signals.size());
    return new AutoValue_IndicatorResult(values, signals);
  }

  public ResultSize size() {
    return ResultSize.of(values().size(), signals().size());
  }

  public double value(int index) {
    return values().get(index);
  }

  public Action signal(int index) {
    return signals().get(index);
  }
}
