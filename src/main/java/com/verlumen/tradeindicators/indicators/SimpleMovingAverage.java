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
import com.verlumen.tradeindicators.methods.Sma;

/**
 * Simple moving average of a candle {@link Source}.
 *
 * <p>Value: the average. Signal: buy when the source crosses above the average, sell when it
 * crosses below.
 */
public final class SimpleMovingAverage
    extends AbstractIndicatorConfig<SimpleMovingAverage, SimpleMovingAverage.Instance> {
  public static final String NAME = "SMA";

  private static final Range<Integer> PERIOD_DOMAIN = Periods.from(1);

  private static final ParameterSet<SimpleMovingAverage> PARAMETERS =
      ParameterSet.<SimpleMovingAverage>builder()
          .add(
              ParameterDefinition.<SimpleMovingAverage>ofInteger(
                  "period", PERIOD_DOMAIN, c -> c.period, (c, v) -> c.period = v))
          .add(
              ParameterDefinition.<SimpleMovingAverage>ofSource(
                  "source", c -> c.source, (c, v) -> c.source = v))
          .build();

  private int period;
  private Source source;

  public SimpleMovingAverage() {
    this(10, Source.CLOSE);
  }

  public SimpleMovingAverage(int period, Source source) {
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
  public SimpleMovingAverage copy() {
    return new SimpleMovingAverage(period, source);
  }

  @Override
  protected Instance create(Candle seed) throws IndicatorException {
    return new Instance(this, seedValue(source, seed));
  }

  /** Streaming state of {@link SimpleMovingAverage}. */
  public static final class Instance implements IndicatorInstance {
    private final SimpleMovingAverage config;
    private final Sma sma;
    private final Cross cross;

    private Instance(SimpleMovingAverage config, double seed) {
      this.config = config;
      this.sma = new Sma(config.period, seed);
      this.cross = new Cross(seed, seed);
    }

    @Override
    public SimpleMovingAverage config() {
      return config;
    }

    @Override
    public IndicatorResult next(Candle candle) {
      double value = config.source.valueOf(candle);
      double average = sma.next(value);
      return IndicatorResult.of(average, cross.next(value, average));
    }
  }
}
