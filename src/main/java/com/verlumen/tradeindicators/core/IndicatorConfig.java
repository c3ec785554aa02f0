package com.verlumen.tradeindicators.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Parameters of one indicator kind, and the factory of its streaming state.
 *
 * <p>A configuration is tuned by the host through {@link #set(String, String)}, checked with
 * {@link #validate()} and then consumed by {@link #init(Candle)}. After a successful {@code init}
 * the configuration belongs to the returned instance and must not be reused; use {@link #copy()}
 * to keep a reusable value.
 *
 * <p>Hosts that need to store configurations of different kinds together should wrap them with
 * {@link com.verlumen.tradeindicators.core.dynamic.DynamicIndicators#erase(IndicatorConfig)}.
 *
 * @param <I> the type of state produced by {@link #init(Candle)}
 */
public interface IndicatorConfig<I extends IndicatorInstance> {
  /** Returns the indicator kind name, e.g. {@code "SMA"}. */
  String name();

  /**
   * Checks whether the current parameters can be used to initialize an indicator. Has no side
   * effects and may be called any number of times.
   */
  boolean validate();

  /**
   * Sets one named parameter from its text form. The value is parsed and range checked before the
   * configuration is touched, so a failed call leaves it unchanged.
   *
   * @throws IndicatorException of kind {@link IndicatorException.Kind#INVALID_PARAMETER} if the
   *     name is unknown or the value does not parse or is out of range
   */
  void set(String name, String value) throws IndicatorException;

  /**
   * Returns the size of every {@link IndicatorResult} produced by instances of this configuration.
   */
  ResultSize size();

  /**
   * Consumes this configuration and builds the initial state from the first known candle.
   *
   * @throws IndicatorException of kind {@link IndicatorException.Kind#INVALID_PARAMETER} if
   *     {@link #validate()} is false, or {@link IndicatorException.Kind#INCOMPATIBLE_SEED} if the
   *     parameters cannot be seeded from {@code seed}
   */
  I init(Candle seed) throws IndicatorException;

  /** Returns an independent, unconsumed configuration equal to this one. */
  IndicatorConfig<I> copy();

  /**
   * Evaluates this configuration over a sequence of candles.
   *
   * <p>An empty sequence yields an empty list without calling {@link #init(Candle)}. Otherwise the
   * first candle seeds the state and the whole sequence, first candle included, is evaluated.
   *
   * @return exactly one result per input candle, in input order
   * @throws IndicatorException if {@link #init(Candle)} fails; no partial result is produced
   */
  default ImmutableList<IndicatorResult> over(List<? extends Candle> inputs)
      throws IndicatorException {
    checkNotNull(inputs, "inputs");
    if (inputs.isEmpty()) {
      return ImmutableList.of();
    }

    I instance = init(inputs.get(0));
    return instance.over(inputs);
  }
}
