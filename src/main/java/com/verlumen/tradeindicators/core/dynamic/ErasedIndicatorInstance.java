package com.verlumen.tradeindicators.core.dynamic;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorInstance;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import java.util.List;

/**
 * Adapter from any {@link IndicatorInstance} to {@link DynamicIndicatorInstance}. Calls delegate
 * directly; they are guarded by this adapter's monitor so the instance may move between threads.
 */
final class ErasedIndicatorInstance<T extends Candle> implements DynamicIndicatorInstance<T> {
  private final IndicatorInstance instance;

  ErasedIndicatorInstance(IndicatorInstance instance) {
    this.instance = checkNotNull(instance);
  }

  @Override
  public synchronized IndicatorResult next(T candle) {
    return instance.next(candle);
  }

  @Override
  public synchronized ImmutableList<IndicatorResult> over(List<? extends T> inputs) {
    return instance.over(inputs);
  }

  @Override
  public synchronized ResultSize size() {
    return instance.size();
  }

  @Override
  public synchronized String name() {
    return instance.name();
  }

  @Override
  public String toString() {
    return "Erased[" + instance.config() + "]";
  }
}
