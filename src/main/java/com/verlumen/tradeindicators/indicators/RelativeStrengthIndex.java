package com.verlumen.tradeindicators.indicators;

import com.google.common.collect.Range;
import com.verlumen.tradeindicators.core.AbstractIndicatorConfig;
import com.verlumen.tradeindicators.core.Action;
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

/**
 * Relative strength index scaled to {@code [0, 1]}, using Wilder's smoothing.
 *
 * <p>The value is {@code NaN} until the source has moved at least once. The signal buys when the
 * index rises out of the lower zone {@code [0, zone]} and sells when it falls out of the upper zone
 * {@code [1 - zone, 1]}.
 */
public final class RelativeStrengthIndex
    extends AbstractIndicatorConfig<RelativeStrengthIndex, RelativeStrengthIndex.Instance> {
  public static final String NAME = "RSI";

  private static final Range<Integer> PERIOD_DOMAIN = Periods.from(2);
  private static final Range<Double> ZONE_DOMAIN = Range.closed(0.0, 0.5);

  private static final ParameterSet<RelativeStrengthIndex> PARAMETERS =
      ParameterSet.<RelativeStrengthIndex>builder()
          .add(
              ParameterDefinition.<RelativeStrengthIndex>ofInteger(
                  "period", PERIOD_DOMAIN, c -> c.period, (c, v) -> c.period = v))
          .add(
              ParameterDefinition.<RelativeStrengthIndex>ofDouble(
                  "zone", ZONE_DOMAIN, c -> c.zone, (c, v) -> c.zone = v))
          .add(
              ParameterDefinition.<RelativeStrengthIndex>ofSource(
                  "source", c -> c.source, (c, v) -> c.source = v))
          .build();

  private int period;
  private double zone;
  private Source source;

  public RelativeStrengthIndex() {
    this(14, 0.3, Source.CLOSE);
  }

  public RelativeStrengthIndex(int period, double zone, Source source) {
    super(NAME, PARAMETERS);
    this.period = period;
    this.zone = zone;
    this.source = source;
  }

  public int getPeriod() {
    return period;
  }

  public double getZone() {
    return zone;
  }

  public Source getSource() {
    return source;
  }

  @Override
  public boolean validate() {
    return PERIOD_DOMAIN.contains(period) && ZONE_DOMAIN.contains(zone) && source != null;
  }

  @Override
  public ResultSize size() {
    return ResultSize.of(1, 1);
  }

  @Override
  public RelativeStrengthIndex copy() {
    return new RelativeStrengthIndex(period, zone, source);
  }

  @Override
  protected Instance create(Candle seed) throws IndicatorException {
    return new Instance(this, seedValue(source, seed));
  }

  public static final class Instance implements IndicatorInstance {
    private final RelativeStrengthIndex config;
    private final Ema gains;
    private final Ema losses;
    private final Cross lowerZone;
    private final Cross upperZone;
    private double previous;

    private Instance(RelativeStrengthIndex config, double seed) {
      this.config = config;
      this.gains = Ema.wilder(config.period, 0.0);
      this.losses = Ema.wilder(config.period, 0.0);
      this.lowerZone = new Cross(Double.NaN, config.zone);
      this.upperZone = new Cross(Double.NaN, 1.0 - config.zone);
      this.previous = seed;
    }

    @Override
    public RelativeStrengthIndex config() {
      return config;
    }

    @Override
    public IndicatorResult next(Candle candle) {
      double value = config.source.valueOf(candle);
      double change = value - previous;
      previous = value;

      double gain = gains.next(Math.max(change, 0.0));
      double loss = losses.next(Math.max(-change, 0.0));
      double total = gain + loss;
      double rsi = total > 0 ? gain / total : Double.NaN;

      Action signal = Action.NONE;
      if (lowerZone.next(rsi, config.zone).sign() > 0) {
        signal = Action.BUY_ALL;
      }
      if (upperZone.next(rsi, 1.0 - config.zone).sign() < 0) {
        signal = Action.SELL_ALL;
      }
      return IndicatorResult.of(rsi, signal);
    }
  }
}
