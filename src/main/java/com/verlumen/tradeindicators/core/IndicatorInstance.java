package com.verlumen.tradeindicators.core;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Streaming state of an indicator, created by {@link IndicatorConfig#init(Candle)} and advanced
 * one candle at a time.
 *
 * <p>Instances never fail once built. Numeric edge cases are reported as {@code NaN} values and
 * {@link Action#NONE} signals.
 */
public interface IndicatorInstance {
  /** Returns the configuration this state was built from. */
  IndicatorConfig<?> config();

  /** Evaluates the next candle and returns its result. */
  IndicatorResult next(Candle candle);

  /** Evaluates every candle in order and returns one result per candle. */
  default ImmutableList<IndicatorResult> over(List<? extends Candle> inputs) {
    ImmutableList.Builder<IndicatorResult> results =
        ImmutableList.builderWithExpectedSize(inputs.size());
    for (Candle candle : inputs) {
      results.add(next(candle));
    }
    return results.build();
  }

  default ResultSize size() {
    return config().size();
  }

  default String name() {
    return config().name();
  }
}
