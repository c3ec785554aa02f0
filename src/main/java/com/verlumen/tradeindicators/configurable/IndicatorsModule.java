package com.verlumen.tradeindicators.configurable;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

public class IndicatorsModule extends AbstractModule {
  public static IndicatorsModule create() {
    return new IndicatorsModule();
  }

  @Override
  protected void configure() {
    bind(IndicatorGroupFactory.class);
  }

  @Provides
  @Singleton
  IndicatorRegistry provideIndicatorRegistry() {
    return IndicatorRegistry.defaultRegistry();
  }

  private IndicatorsModule() {}
}
