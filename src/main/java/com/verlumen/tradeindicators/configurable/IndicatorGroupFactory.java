package com.verlumen.tradeindicators.configurable;

import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.dynamic.DynamicIndicatorConfig;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds {@link IndicatorGroup}s from their text description. */
public final class IndicatorGroupFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final IndicatorRegistry registry;

  @Inject
  IndicatorGroupFactory(IndicatorRegistry registry) {
    this.registry = registry;
  }

  /**
   * Creates a group holding one configuration per indicator of {@code spec}.
   *
   * @throws IndicatorException of kind {@link IndicatorException.Kind#INVALID_PARAMETER} if an
   *     indicator has no id, two indicators share an id, or an indicator cannot be built
   */
  public <T extends Candle> IndicatorGroup<T> create(IndicatorGroupSpec spec)
      throws IndicatorException {
    Map<String, DynamicIndicatorConfig<T>> configs = new LinkedHashMap<>();
    if (spec.getIndicators() != null) {
      for (IndicatorSpec indicator : spec.getIndicators()) {
        if (Strings.isNullOrEmpty(indicator.getId())) {
          throw IndicatorException.invalidParameter(
              String.format("Indicator %s in group '%s' has no id", indicator, spec.getName()));
        }
        if (configs.containsKey(indicator.getId())) {
          throw IndicatorException.invalidParameter(
              String.format(
                  "Duplicate indicator id '%s' in group '%s'", indicator.getId(), spec.getName()));
        }
        configs.put(indicator.getId(), registry.create(indicator));
      }
    }

    logger.atInfo().log(
        "Built indicator group '%s' with %d indicators", spec.getName(), configs.size());
    return IndicatorGroup.of(Strings.nullToEmpty(spec.getName()), configs);
  }

  /** Loads a group document from the classpath and builds it. */
  public <T extends Candle> IndicatorGroup<T> createFromResource(String resourcePath)
      throws IndicatorException {
    return create(IndicatorSpecLoader.loadResource(resourcePath));
  }
}
