package com.verlumen.tradeindicators.core.dynamic;

import com.google.common.collect.ImmutableList;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorConfig;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import java.util.List;

/**
 * Type-erased {@link IndicatorConfig}, parameterized only by the candle type. Lets a host keep
 * configurations of different indicator kinds in one collection.
 *
 * <p>Unlike the static capability, {@link #init(Candle)} and {@link #over(List)} do not consume the
 * configuration: the same value can be initialized any number of times.
 *
 * <pre>{@code
 * DynamicIndicatorConfig<BasicCandle> config = DynamicIndicators.erase(new SimpleMovingAverage());
 * config.set("period", "3");
 * ImmutableList<IndicatorResult> results = config.over(candles);
 * }</pre>
 *
 * @param <T> the candle type
 */
public interface DynamicIndicatorConfig<T extends Candle> {
  /** Initializes a new state from the current parameters. See {@link IndicatorConfig#init}. */
  DynamicIndicatorInstance<T> init(T seed) throws IndicatorException;

  /** Evaluates the current parameters over {@code inputs}. See {@link IndicatorConfig#over}. */
  ImmutableList<IndicatorResult> over(List<? extends T> inputs) throws IndicatorException;

  String name();

  boolean validate();

  void set(String name, String value) throws IndicatorException;

  ResultSize size();
}
