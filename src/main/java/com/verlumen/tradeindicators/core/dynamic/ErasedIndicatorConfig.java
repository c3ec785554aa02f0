package com.verlumen.tradeindicators.core.dynamic;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorConfig;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.IndicatorInstance;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import java.util.List;

/**
 * The single adapter from any {@link IndicatorConfig} to {@link DynamicIndicatorConfig}.
 *
 * <p>{@code init} and {@code over} run on a {@link IndicatorConfig#copy()} of the wrapped
 * configuration, which therefore is never consumed. Every other call goes straight to it.
 */
final class ErasedIndicatorConfig<T extends Candle> implements DynamicIndicatorConfig<T> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final IndicatorConfig<?> config;

  ErasedIndicatorConfig(IndicatorConfig<?> config) {
    this.config = checkNotNull(config);
  }

  @Override
  public DynamicIndicatorInstance<T> init(T seed) throws IndicatorException {
    IndicatorInstance instance = config.copy().init(seed);
    logger.atFine().log("Erased instance of %s", config);
    return new ErasedIndicatorInstance<>(instance);
  }

  @Override
  public ImmutableList<IndicatorResult> over(List<? extends T> inputs) throws IndicatorException {
    return config.copy().over(inputs);
  }

  @Override
  public String name() {
    return config.name();
  }

  @Override
  public boolean validate() {
    return config.validate();
  }

  @Override
  public void set(String name, String value) throws IndicatorException {
    config.set(name, value);
  }

  @Override
  public ResultSize size() {
    return config.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ErasedIndicatorConfig)) return false;
    return config.equals(((ErasedIndicatorConfig<?>) o).config);
  }

  @Override
  public int hashCode() {
    return config.hashCode();
  }

  @Override
  public String toString() {
    return config.toString();
  }
}
