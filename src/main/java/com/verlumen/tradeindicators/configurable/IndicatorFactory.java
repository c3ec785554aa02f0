package com.verlumen.tradeindicators.configurable;

import com.verlumen.tradeindicators.core.IndicatorConfig;

/** Functional interface for creating indicator configurations with default parameters. */
@FunctionalInterface
public interface IndicatorFactory {
  /**
   * Creates a fresh configuration holding the indicator's default parameters.
   *
   * @return a new, unconsumed configuration
   */
  IndicatorConfig<?> create();
}
