package com.verlumen.tradeindicators.configurable;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.mu.util.stream.BiStream;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import com.verlumen.tradeindicators.core.dynamic.DynamicIndicatorConfig;
import com.verlumen.tradeindicators.core.dynamic.DynamicIndicatorInstance;
import java.util.List;
import java.util.Map;

/**
 * A named collection of indicators of arbitrary kinds, keyed by id and evaluated over the same
 * candles. Iteration follows insertion order.
 *
 * @param <T> the candle type
 */
public final class IndicatorGroup<T extends Candle> {
  private final String name;
  private final ImmutableMap<String, DynamicIndicatorConfig<T>> configs;

  private IndicatorGroup(String name, ImmutableMap<String, DynamicIndicatorConfig<T>> configs) {
    this.name = name;
    this.configs = configs;
  }

  public static <T extends Candle> IndicatorGroup<T> of(
      String name, Map<String, DynamicIndicatorConfig<T>> configs) {
    return new IndicatorGroup<>(checkNotNull(name), ImmutableMap.copyOf(configs));
  }

  public String name() {
    return name;
  }

  public ImmutableMap<String, DynamicIndicatorConfig<T>> configs() {
    return configs;
  }

  public ImmutableMap<String, ResultSize> sizes() {
    return BiStream.from(configs)
        .mapValues(DynamicIndicatorConfig::size)
        .collect(ImmutableMap::toImmutableMap);
  }

  /**
   * Initializes every indicator of the group from the same seed.
   *
   * @throws IndicatorException from the first indicator that fails to initialize
   */
  public Instance<T> init(T seed) throws IndicatorException {
    ImmutableMap.Builder<String, DynamicIndicatorInstance<T>> instances = ImmutableMap.builder();
    for (Map.Entry<String, DynamicIndicatorConfig<T>> entry : configs.entrySet()) {
      instances.put(entry.getKey(), entry.getValue().init(seed));
    }
    return new Instance<>(instances.buildOrThrow());
  }

  /**
   * Evaluates every indicator of the group over {@code inputs}. Either all indicators produce
   * their results or the first failure is thrown.
   */
  public ImmutableMap<String, ImmutableList<IndicatorResult>> over(List<? extends T> inputs)
      throws IndicatorException {
    ImmutableMap.Builder<String, ImmutableList<IndicatorResult>> results = ImmutableMap.builder();
    for (Map.Entry<String, DynamicIndicatorConfig<T>> entry : configs.entrySet()) {
      results.put(entry.getKey(), entry.getValue().over(inputs));
    }
    return results.buildOrThrow();
  }

  /** Running state of every indicator of a group. */
  public static final class Instance<T extends Candle> {
    private final ImmutableMap<String, DynamicIndicatorInstance<T>> instances;

    private Instance(ImmutableMap<String, DynamicIndicatorInstance<T>> instances) {
      this.instances = instances;
    }

    public ImmutableMap<String, DynamicIndicatorInstance<T>> instances() {
      return instances;
    }

    /** Feeds {@code candle} to every indicator and returns their results by id. */
    public ImmutableMap<String, IndicatorResult> next(T candle) {
      return BiStream.from(instances)
          .mapValues(instance -> instance.next(candle))
          .collect(ImmutableMap::toImmutableMap);
    }
  }
}
