package com.verlumen.tradeindicators.configurable;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.dynamic.DynamicIndicatorConfig;
import com.verlumen.tradeindicators.core.dynamic.DynamicIndicators;
import com.verlumen.tradeindicators.indicators.DonchianChannel;
import com.verlumen.tradeindicators.indicators.ExponentialMovingAverage;
import com.verlumen.tradeindicators.indicators.MovingAverageConvergenceDivergence;
import com.verlumen.tradeindicators.indicators.RelativeStrengthIndex;
import com.verlumen.tradeindicators.indicators.SimpleMovingAverage;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of indicator factories, mapping type names to configurations. Lets indicators be
 * created from text without knowing their concrete classes.
 */
public final class IndicatorRegistry {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<String, IndicatorFactory> factories = new ConcurrentHashMap<>();

  private IndicatorRegistry() {}

  /** Creates an empty registry. */
  public static IndicatorRegistry emptyRegistry() {
    return new IndicatorRegistry();
  }

  /** Creates a registry holding every indicator shipped with this library. */
  public static IndicatorRegistry defaultRegistry() {
    IndicatorRegistry registry = new IndicatorRegistry();

    // Moving averages
    registry.register(SimpleMovingAverage.NAME, SimpleMovingAverage::new);
    registry.register(ExponentialMovingAverage.NAME, ExponentialMovingAverage::new);

    // Oscillators
    registry.register(RelativeStrengthIndex.NAME, RelativeStrengthIndex::new);
    registry.register(
        MovingAverageConvergenceDivergence.NAME, MovingAverageConvergenceDivergence::new);

    // Channels
    registry.register(DonchianChannel.NAME, DonchianChannel::new);

    return registry;
  }

  public void register(String type, IndicatorFactory factory) {
    checkNotNull(factory, "factory");
    factories.put(Ascii.toUpperCase(type), factory);
  }

  public boolean hasIndicator(String type) {
    return factories.containsKey(Ascii.toUpperCase(type));
  }

  public ImmutableSortedSet<String> types() {
    return ImmutableSortedSet.copyOf(factories.keySet());
  }

  /**
   * Creates a configuration of {@code type} holding its default parameters.
   *
   * @throws IndicatorException of kind {@link IndicatorException.Kind#INVALID_PARAMETER} if the
   *     type is unknown
   */
  public <T extends Candle> DynamicIndicatorConfig<T> create(String type)
      throws IndicatorException {
    IndicatorFactory factory = factories.get(Ascii.toUpperCase(type));
    if (factory == null) {
      throw IndicatorException.invalidParameter(
          String.format("Unknown indicator type '%s', expected one of %s", type, types()));
    }
    return DynamicIndicators.erase(factory.create());
  }

  /**
   * Creates the configuration described by {@code spec}: its type with every listed parameter
   * applied in order.
   *
   * @throws IndicatorException if the type is unknown, a parameter is rejected, or the resulting
   *     configuration does not validate
   */
  public <T extends Candle> DynamicIndicatorConfig<T> create(IndicatorSpec spec)
      throws IndicatorException {
    if (spec.getType() == null) {
      throw IndicatorException.invalidParameter(
          String.format("Indicator '%s' has no type", spec.getId()));
    }
    DynamicIndicatorConfig<T> config = create(spec.getType());
    if (spec.getParams() != null) {
      for (Map.Entry<String, String> param : spec.getParams().entrySet()) {
        config.set(param.getKey(), param.getValue());
      }
    }

    if (!config.validate()) {
      logger.atWarning().log("Rejected indicator spec %s", spec);
      throw IndicatorException.invalidParameter(
          String.format("Indicator '%s' has an invalid configuration %s", spec.getId(), config));
    }
    logger.atFine().log("Created %s for spec '%s'", config, spec.getId());
    return config;
  }
}
