package com.verlumen.tradeindicators.core.dynamic;

import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorConfig;
import com.verlumen.tradeindicators.core.IndicatorInstance;

/**
 * Bridges the static indicator capabilities to their dynamic counterparts. Works for every {@link
 * IndicatorConfig} and {@link IndicatorInstance}; indicator kinds need no code of their own.
 */
public final class DynamicIndicators {
  /**
   * Wraps {@code config} so it can be stored and driven without knowing its concrete type.
   *
   * <p>The returned value shares {@code config}: parameters changed through {@link
   * DynamicIndicatorConfig#set(String, String)} are visible in both. Initialization works on a
   * copy, so {@code config} itself is never consumed.
   */
  public static <T extends Candle> DynamicIndicatorConfig<T> erase(IndicatorConfig<?> config) {
    return new ErasedIndicatorConfig<>(config);
  }

  /** Wraps an already initialized instance. */
  public static <T extends Candle> DynamicIndicatorInstance<T> erase(IndicatorInstance instance) {
    return new ErasedIndicatorInstance<>(instance);
  }

  // Prevent instantiation
  private DynamicIndicators() {}
}
