package com.verlumen.tradeindicators.core;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.verlumen.tradeindicators.core.params.ParameterSet;
import java.util.Objects;

/**
 * Base class of concrete indicator configurations.
 *
 * <p>Subclasses declare their parameters once as a {@link ParameterSet} and implement {@link
 * #validate()}, {@link #size()}, {@link #copy()} and {@link #create(Candle)}. This class provides
 * text based {@link #set(String, String)}, the checks that guard {@link #init(Candle)}, and
 * equality over the parameter values.
 *
 * @param <C> the concrete configuration type
 * @param <I> the instance type it produces
 */
public abstract class AbstractIndicatorConfig<
        C extends AbstractIndicatorConfig<C, I>, I extends IndicatorInstance>
    implements IndicatorConfig<I> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String name;
  private final ParameterSet<C> parameters;
  private boolean consumed;

  protected AbstractIndicatorConfig(String name, ParameterSet<C> parameters) {
    this.name = checkNotNull(name);
    this.parameters = checkNotNull(parameters);
  }

  @Override
  public final String name() {
    return name;
  }

  public final ParameterSet<C> parameters() {
    return parameters;
  }

  /** Whether {@link #init(Candle)} has already taken ownership of this configuration. */
  public final boolean isConsumed() {
    return consumed;
  }

  @Override
  public final void set(String name, String value) throws IndicatorException {
    checkNotConsumed();
    parameters.apply(self(), name, value);
    logger.atFine().log("%s: set %s = %s", this.name, name, value);
  }

  @Override
  public final I init(Candle seed) throws IndicatorException {
    checkNotNull(seed, "seed");
    checkNotConsumed();
    if (!validate()) {
      throw IndicatorException.invalidParameter("Invalid configuration " + this);
    }
    if (!seed.isValid()) {
      throw IndicatorException.incompatibleSeed(
          String.format("Cannot seed %s from invalid candle %s", this, seed));
    }

    I instance = create(seed);
    consumed = true;
    logger.atFine().log("Initialized %s", this);
    return instance;
  }

  @Override
  public abstract C copy();

  /** Builds the initial state. Called only for a valid configuration and a valid seed. */
  protected abstract I create(Candle seed) throws IndicatorException;

  /**
   * Reads {@code source} from the seed candle.
   *
   * @throws IndicatorException of kind {@link IndicatorException.Kind#INCOMPATIBLE_SEED} if the
   *     value is not finite
   */
  protected final double seedValue(Source source, Candle seed) throws IndicatorException {
    double value = source.valueOf(seed);
    if (!Double.isFinite(value)) {
      throw IndicatorException.incompatibleSeed(
          String.format("%s of seed %s is not finite for %s", source, seed, this));
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  private C self() {
    return (C) this;
  }

  private ImmutableMap<String, Object> parameterValues() {
    return parameters.valuesOf(self());
  }

  private void checkNotConsumed() {
    checkState(!consumed, "%s has already been consumed by init()", name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    AbstractIndicatorConfig<?, ?> that = (AbstractIndicatorConfig<?, ?>) o;
    return name.equals(that.name) && parameterValues().equals(that.parameterValues());
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameterValues());
  }

  @Override
  public String toString() {
    return name + "(" + Joiner.on(", ").withKeyValueSeparator('=').join(parameterValues()) + ")";
  }
}
