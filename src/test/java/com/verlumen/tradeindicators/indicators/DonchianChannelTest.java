package com.verlumen.tradeindicators.indicators;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.verlumen.tradeindicators.core.Action;
import com.verlumen.tradeindicators.core.BasicCandle;
import com.verlumen.tradeindicators.core.IndicatorResult;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DonchianChannelTest {
  @Test
  public void over_breakouts_signalDirection() throws Exception {
    ImmutableList<IndicatorResult> results =
        new DonchianChannel(2)
            .over(
                ImmutableList.of(
                    BasicCandle.ofPrice(10),
                    BasicCandle.create(10, 12, 10, 12, 0),
                    BasicCandle.create(12, 12, 7, 7, 0)));

    assertThat(results.get(0)).isEqualTo(IndicatorResult.of(new double[] {10, 10}, Action.NONE));
    assertThat(results.get(1))
        .isEqualTo(IndicatorResult.of(new double[] {12, 10}, Action.BUY_ALL));
    assertThat(results.get(2))
        .isEqualTo(IndicatorResult.of(new double[] {12, 7}, Action.SELL_ALL));
  }

  @Test
  public void validate_zeroPeriod_isFalse() {
    assertThat(new DonchianChannel(0).validate()).isFalse();
  }
}
