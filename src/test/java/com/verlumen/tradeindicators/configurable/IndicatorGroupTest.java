package com.verlumen.tradeindicators.configurable;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.tradeindicators.core.BasicCandle;
import com.verlumen.tradeindicators.core.IndicatorException;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import com.verlumen.tradeindicators.core.Source;
import com.verlumen.tradeindicators.core.TestCandles;
import com.verlumen.tradeindicators.core.dynamic.DynamicIndicators;
import com.verlumen.tradeindicators.indicators.DonchianChannel;
import com.verlumen.tradeindicators.indicators.MovingAverageConvergenceDivergence;
import com.verlumen.tradeindicators.indicators.SimpleMovingAverage;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class IndicatorGroupTest {
  private static final ImmutableList<BasicCandle> CANDLES = TestCandles.randomWalk(80, 21L);

  private static IndicatorGroup<BasicCandle> group() {
    return IndicatorGroup.of(
        "mixed",
        ImmutableMap.of(
            "sma", DynamicIndicators.<BasicCandle>erase(new SimpleMovingAverage(5, Source.CLOSE)),
            "macd", DynamicIndicators.<BasicCandle>erase(new MovingAverageConvergenceDivergence()),
            "channel", DynamicIndicators.<BasicCandle>erase(new DonchianChannel(10))));
  }

  @Test
  public void sizes_reportedPerId() {
    assertThat(group().sizes())
        .containsExactly(
            "sma", ResultSize.of(1, 1),
            "macd", ResultSize.of(2, 1),
            "channel", ResultSize.of(2, 1))
        .inOrder();
  }

  @Test
  public void over_matchesEachIndicatorAlone() throws Exception {
    ImmutableMap<String, ImmutableList<IndicatorResult>> results = group().over(CANDLES);

    assertThat(results.keySet()).containsExactly("sma", "macd", "channel").inOrder();
    assertThat(results.get("macd"))
        .isEqualTo(new MovingAverageConvergenceDivergence().over(CANDLES));
    assertThat(results.get("channel")).isEqualTo(new DonchianChannel(10).over(CANDLES));
  }

  @Test
  public void init_thenNext_matchesOver() throws Exception {
    IndicatorGroup<BasicCandle> group = group();
    ImmutableMap<String, ImmutableList<IndicatorResult>> batch = group.over(CANDLES);

    IndicatorGroup.Instance<BasicCandle> instance = group.init(CANDLES.get(0));
    for (int i = 0; i < CANDLES.size(); i++) {
      ImmutableMap<String, IndicatorResult> step = instance.next(CANDLES.get(i));
      for (String id : step.keySet()) {
        assertThat(step.get(id)).isEqualTo(batch.get(id).get(i));
      }
    }
  }

  @Test
  public void init_isRepeatable() throws Exception {
    IndicatorGroup<BasicCandle> group = group();

    group.init(CANDLES.get(0));

    assertThat(group.init(CANDLES.get(0)).instances()).hasSize(3);
  }

  @Test
  public void init_invalidSeed_fails() {
    BasicCandle invalid = BasicCandle.create(10, 5, 1, 7, 0);

    IndicatorException thrown =
        assertThrows(IndicatorException.class, () -> group().init(invalid));

    assertThat(thrown.getKind()).isEqualTo(IndicatorException.Kind.INCOMPATIBLE_SEED);
  }
}
