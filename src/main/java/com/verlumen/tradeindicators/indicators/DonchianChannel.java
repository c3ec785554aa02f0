package com.verlumen.tradeindicators.indicators;

import com.google.common.collect.Range;
import com.verlumen.tradeindicators.core.AbstractIndicatorConfig;
import com.verlumen.tradeindicators.core.Action;
import com.verlumen.tradeindicators.core.Candle;
import com.verlumen.tradeindicators.core.IndicatorInstance;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import com.verlumen.tradeindicators.core.params.ParameterDefinition;
import com.verlumen.tradeindicators.core.params.ParameterSet;
import com.verlumen.tradeindicators.methods.RollingWindow;

/**
 * Highest high and lowest low of the last {@code period} candles.
 *
 * <p>Values: upper band, lower band. Signal: buy when the close breaks above the previous upper
 * band, sell when it breaks below the previous lower band.
 */
public final class DonchianChannel
    extends AbstractIndicatorConfig<DonchianChannel, DonchianChannel.Instance> {
  public static final String NAME = "DONCHIAN";

  private static final Range<Integer> PERIOD_DOMAIN = Periods.from(1);

  private static final ParameterSet<DonchianChannel> PARAMETERS =
      ParameterSet.<DonchianChannel>builder()
          .add(
              ParameterDefinition.<DonchianChannel>ofInteger(
                  "period", PERIOD_DOMAIN, c -> c.period, (c, v) -> c.period = v))
          .build();

  private int period;

  public DonchianChannel() {
    this(20);
  }

  public DonchianChannel(int period) {
    super(NAME, PARAMETERS);
    this.period = period;
  }

  public int getPeriod() {
    return period;
  }

  @Override
  public boolean validate() {
    return PERIOD_DOMAIN.contains(period);
  }

  @Override
  public ResultSize size() {
    return ResultSize.of(2, 1);
  }

  @Override
  public DonchianChannel copy() {
    return new DonchianChannel(period);
  }

  @Override
  protected Instance create(Candle seed) {
    return new Instance(this, seed);
  }

  public static final class Instance implements IndicatorInstance {
    private final DonchianChannel config;
    private final RollingWindow highs;
    private final RollingWindow lows;

    private Instance(DonchianChannel config, Candle seed) {
      this.config = config;
      this.highs = new RollingWindow(config.period, seed.high());
      this.lows = new RollingWindow(config.period, seed.low());
    }

    @Override
    public DonchianChannel config() {
      return config;
    }

    @Override
    public IndicatorResult next(Candle candle) {
      double previousUpper = highs.max();
      double previousLower = lows.min();
      highs.push(candle.high());
      lows.push(candle.low());

      Action signal = Action.NONE;
      if (candle.close() > previousUpper) {
        signal = Action.BUY_ALL;
      } else if (candle.close() < previousLower) {
        signal = Action.SELL_ALL;
      }
      return IndicatorResult.of(new double[] {highs.max(), lows.min()}, signal);
    }
  }
}
