package com.verlumen.tradeindicators.indicators;

import com.google.common.collect.Range;
import com.verlumen.tradeindicators.core.AbstractIndicatorConfig;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.IndicatorInstance;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import com.verlumen.tradeindicators.core.Source;
import com.verlumen.tradeindicators.core.params.ParameterDefinition;
import com.verlumen.tradeindicators.core.params.ParameterSet;
import com.verlumen.tradeindicators.methods.Cross;
import com.verlumen.tradeindicators.methods.Ema;

/** Exponential moving average, with a signal on the source crossing it. */
public final class ExponentialMovingAverage
    extends AbstractIndicatorConfig<ExponentialMovingAverage, ExponentialMovingAverage.Instance> {
  public static final String NAME = "EMA";

  private static final Range<Integer> PERIOD_DOMAIN = Periods.from(1);

  private static final ParameterSet<ExponentialMovingAverage> PARAMETERS =
      ParameterSet.<ExponentialMovingAverage>builder()
          .add(
              ParameterDefinition.<ExponentialMovingAverage>ofInteger(
                  "period", PERIOD_DOMAIN, c -> c.period, (c, v) -> c.period = v))
          .add(
              ParameterDefinition.<ExponentialMovingAverage>ofSource(
                  "source", c -> c.source, (c, v) -> c.source = v))
          .build();

  private int period;
  private Source source;

  public ExponentialMovingAverage() {
    this(10, Source.CLOSE);
  }

  public ExponentialMovingAverage(int period, Source source) {
    super(NAME, PARAMETERS);
    this.period = period;
    this.source = source;
  }

  public int getPeriod() {
    return period;
  }

  public Source getSource() {
    return source;
  }

  @Override
  public boolean validate() {
    return PERIOD_DOMAIN.contains(period) && source != null;
  }

  @Override
  public ResultSize size() {
    return ResultSize.of(1, 1);
  }

  @Override
  public ExponentialMovingAverage copy() {
    return new ExponentialMovingAverage(period, source);
  }

  @Override
  protected Instance create(Candle seed) throws IndicatorException {
    return new Instance(this, seedValue(source, seed));
  }

  public static final class Instance implements IndicatorInstance {
    private final ExponentialMovingAverage config;
    private final Ema ema;
    private final Cross cross;

    private Instance(ExponentialMovingAverage config, double seed) {
      this.config = config;
      this.ema = Ema.ofPeriod(config.period, seed);
      this.cross = new Cross(seed, seed);
    }

    @Override
    public ExponentialMovingAverage config() {
      return config;
    }

    @Override
    public IndicatorResult next(Candle candle) {
      double value = config.source.valueOf(candle);
      double average = ema.next(value);
      return IndicatorResult.of(average, cross.next(value, average));
    }
  }
}
