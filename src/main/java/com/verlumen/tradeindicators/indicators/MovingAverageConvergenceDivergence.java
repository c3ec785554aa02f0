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

/**
 * MACD: the difference between a fast and a slow EMA, and an EMA of that difference as signal
 * line.
 *
 * <p>Values: MACD line, signal line. Signal: MACD crossing the signal line.
 */
public final class MovingAverageConvergenceDivergence
    extends AbstractIndicatorConfig<
        MovingAverageConvergenceDivergence, MovingAverageConvergenceDivergence.Instance> {
  public static final String NAME = "MACD";

  private static final Range<Integer> FAST_DOMAIN = Periods.from(1);
  private static final Range<Integer> SLOW_DOMAIN = Periods.from(2);
  private static final Range<Integer> SIGNAL_DOMAIN = Periods.from(1);

  private static final ParameterSet<MovingAverageConvergenceDivergence> PARAMETERS =
      ParameterSet.<MovingAverageConvergenceDivergence>builder()
          .add(
              ParameterDefinition.<MovingAverageConvergenceDivergence>ofInteger(
                  "fast", FAST_DOMAIN, c -> c.fast, (c, v) -> c.fast = v))
          .add(
              ParameterDefinition.<MovingAverageConvergenceDivergence>ofInteger(
                  "slow", SLOW_DOMAIN, c -> c.slow, (c, v) -> c.slow = v))
          .add(
              ParameterDefinition.<MovingAverageConvergenceDivergence>ofInteger(
                  "signal", SIGNAL_DOMAIN, c -> c.signal, (c, v) -> c.signal = v))
          .add(
              ParameterDefinition.<MovingAverageConvergenceDivergence>ofSource(
                  "source", c -> c.source, (c, v) -> c.source = v))
          .build();

  private int fast;
  private int slow;
  private int signal;
  private Source source;

  public MovingAverageConvergenceDivergence() {
    this(12, 26, 9, Source.CLOSE);
  }

  public MovingAverageConvergenceDivergence(int fast, int slow, int signal, Source source) {
    super(NAME, PARAMETERS);
    this.fast = fast;
    this.slow = slow;
    this.signal = signal;
    this.source = source;
  }

  public int getFast() {
    return fast;
  }

  public int getSlow() {
    return slow;
  }

  public int getSignal() {
    return signal;
  }

  public Source getSource() {
    return source;
  }

  /** Requires every period to be within its domain and the fast period to be the shorter one. */
  @Override
  public boolean validate() {
    return FAST_DOMAIN.contains(fast)
        && SLOW_DOMAIN.contains(slow)
        && SIGNAL_DOMAIN.contains(signal)
        && fast < slow
        && source != null;
  }

  @Override
  public ResultSize size() {
    return ResultSize.of(2, 1);
  }

  @Override
  public MovingAverageConvergenceDivergence copy() {
    return new MovingAverageConvergenceDivergence(fast, slow, signal, source);
  }

  @Override
  protected Instance create(Candle seed) throws IndicatorException {
    return new Instance(this, seedValue(source, seed));
  }

  public static final class Instance implements IndicatorInstance {
    private final MovingAverageConvergenceDivergence config;
    private final Ema fastEma;
    private final Ema slowEma;
    private final Ema signalEma;
    private final Cross cross;

    private Instance(MovingAverageConvergenceDivergence config, double seed) {
      this.config = config;
      this.fastEma = Ema.ofPeriod(config.fast, seed);
      this.slowEma = Ema.ofPeriod(config.slow, seed);
      this.signalEma = Ema.ofPeriod(config.signal, 0.0);
      this.cross = new Cross(0.0, 0.0);
    }

    @Override
    public MovingAverageConvergenceDivergence config() {
      return config;
    }

    @Override
    public IndicatorResult next(Candle candle) {
      double value = config.source.valueOf(candle);
      double macd = fastEma.next(value) - slowEma.next(value);
      double signalLine = signalEma.next(macd);
      return IndicatorResult.of(new double[] {macd, signalLine}, cross.next(macd, signalLine));
    }
  }
}
