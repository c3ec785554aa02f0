package com.verlumen.tradeindicators.indicators;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.verlumen.tradeindicators.core.Action;
import com.verlumen.tradeindicators.core.BasicCandle;
import com.verlumen.tradeindicators.core.IndicatorResult;
import com.verlumen.tradeindicators.core.ResultSize;
import com.verlumen.tradeindicators.core.Source;
import com.verlumen.tradeindicators.core.TestCandles;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SimpleMovingAverageTest {
  @Test
  public void over_risingCloses_buysOnFirstCrossAbove() throws Exception {
    ImmutableList<IndicatorResult> results =
        new SimpleMovingAverage(3, Source.CLOSE).over(TestCandles.ofCloses(10, 11, 12, 13));

    assertThat(results.stream().map(r -> r.signal(0)))
        .containsExactly(Action.NONE, Action.BUY_ALL, Action.NONE, Action.NONE)
        .inOrder();
  }

  @Test
  public void over_fallingCloses_sellsOnFirstCrossBelow() throws Exception {
    ImmutableList<IndicatorResult> results =
        new SimpleMovingAverage(2, Source.CLOSE).over(TestCandles.ofCloses(10, 9, 8));

    assertThat(results.get(1).signal(0)).isEqualTo(Action.SELL_ALL);
    assertThat(results.get(1).value(0)).isWithin(1e-12).of(9.5);
    assertThat(results.get(2).signal(0)).isEqualTo(Action.NONE);
  }

  @Test
  public void next_readsConfiguredSource() throws Exception {
    SimpleMovingAverage.Instance instance =
        new SimpleMovingAverage(1, Source.HIGH).init(BasicCandle.create(10, 14, 8, 12, 1));

    assertThat(instance.next(BasicCandle.create(10, 20, 8, 12, 1)).value(0)).isEqualTo(20.0);
  }

  @Test
  public void over_nanCandle_onlyAffectsWindowItFallsIn() throws Exception {
    ImmutableList<IndicatorResult> results =
        new SimpleMovingAverage(2, Source.CLOSE)
            .over(TestCandles.ofCloses(10, 10, Double.NaN, 10, 10, 10, 10));

    assertThat(results.get(2).value(0)).isNaN();
    assertThat(results.get(3).value(0)).isNaN();
    assertThat(results.get(4).value(0)).isEqualTo(10.0);
    assertThat(results.get(6).value(0)).isEqualTo(10.0);
  }

  @Test
  public void size_isOneValueOneSignal() {
    assertThat(new SimpleMovingAverage().size()).isEqualTo(ResultSize.of(1, 1));
  }
}
