package com.verlumen.tradeindicators.core.dynamic;

import com.google.common.collect.ImmutableList;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import java.util.List;

/**
 * Type-erased {@link com.verlumen.tradeindicators.core.IndicatorInstance}. Safe to hand from one
 * thread to another.
 *
 * @param <T> the candle type
 */
public interface DynamicIndicatorInstance<T extends Candle> {
  IndicatorResult next(T candle);

  ImmutableList<IndicatorResult> over(List<? extends T> inputs);

  ResultSize size();

  String name();
}
